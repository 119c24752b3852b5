package tasktree.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tasktree.api.dto.BatchFailureResponse;
import tasktree.api.dto.NormalizationReportResponse;
import tasktree.service.OrderNormalizer;

/**
 * Operator entry points.
 */
@RestController
@RequestMapping(value = "/api/maintenance", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Maintenance", description = "Operator maintenance runs")
public class MaintenanceController {

    private final OrderNormalizer orderNormalizer;

    public MaintenanceController(final OrderNormalizer orderNormalizer) {
        this.orderNormalizer = orderNormalizer;
    }

    @Operation(summary = "Normalize sibling order across the whole collection")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Run completed",
                    content = @Content(schema = @Schema(implementation = NormalizationReportResponse.class))),
            @ApiResponse(responseCode = "503", description = "Run stopped part way; safe to re-run",
                    content = @Content(schema = @Schema(implementation = BatchFailureResponse.class)))
    })
    @PostMapping("/normalize-order")
    public NormalizationReportResponse normalizeOrder() {
        return NormalizationReportResponse.from(orderNormalizer.normalizeAll());
    }
}
