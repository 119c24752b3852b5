package tasktree.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import tasktree.api.dto.DeleteResponse;
import tasktree.api.dto.DuplicateRequest;
import tasktree.api.dto.DuplicateResponse;
import tasktree.api.dto.ErrorResponse;
import tasktree.api.dto.ForestRowResponse;
import tasktree.api.dto.MoveRequest;
import tasktree.api.dto.MoveResponse;
import tasktree.api.dto.NodeRequest;
import tasktree.api.dto.NodeResponse;
import tasktree.api.dto.NodeUpdateRequest;
import tasktree.api.dto.ReorderRequest;
import tasktree.api.dto.UpdateResponse;
import tasktree.domain.NodeKind;
import tasktree.service.DescendantPolicy;
import tasktree.service.MutationContext;
import tasktree.service.TreeMutator;
import tasktree.view.Audience;
import tasktree.view.ForestService;
import tasktree.view.ViewFilter;

/**
 * REST controller for node mutations and forest reads.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /api/nodes - create (201 Created)</li>
 *   <li>GET /api/nodes/{id} - fetch one node</li>
 *   <li>PATCH /api/nodes/{id} - partial update, optional cascade</li>
 *   <li>POST /api/nodes/{id}/move - re-parent with the whole subtree</li>
 *   <li>POST /api/nodes/{id}/reorder - swap with the previous or next sibling</li>
 *   <li>POST /api/nodes/{id}/duplicate - deep copy (201 Created)</li>
 *   <li>DELETE /api/nodes/{id} - delete, with {@code descendants=delete|orphan}</li>
 *   <li>GET /api/nodes/forest - depth-first rows for a filtered view</li>
 * </ul>
 *
 * <p>The caller's identity and active room arrive in the {@code X-Owner-Id} and
 * {@code X-Active-Room} headers and are passed on as a {@link MutationContext}.
 */
@RestController
@RequestMapping(value = "/api/nodes", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Nodes", description = "Task tree operations")
public class NodeController {

    static final String OWNER_HEADER = "X-Owner-Id";
    static final String ROOM_HEADER = "X-Active-Room";

    private final TreeMutator treeMutator;
    private final ForestService forestService;

    public NodeController(final TreeMutator treeMutator, final ForestService forestService) {
        this.treeMutator = treeMutator;
        this.forestService = forestService;
    }

    @Operation(summary = "Create a node")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Node created",
                    content = @Content(schema = @Schema(implementation = NodeResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing title or class, or invalid parent",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public NodeResponse create(
            @RequestHeader(OWNER_HEADER) final String ownerId,
            @RequestHeader(value = ROOM_HEADER, required = false) final String activeRoom,
            @RequestParam(defaultValue = "false") final boolean autosave,
            @Valid @RequestBody final NodeRequest request) {
        final String id = treeMutator.create(new MutationContext(ownerId, activeRoom), request.toDraft(), autosave);
        return NodeResponse.from(treeMutator.getNode(id));
    }

    @Operation(summary = "Get a node by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Node found",
                    content = @Content(schema = @Schema(implementation = NodeResponse.class))),
            @ApiResponse(responseCode = "404", description = "Node not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{id}")
    public NodeResponse get(@PathVariable final String id) {
        return NodeResponse.from(treeMutator.getNode(id));
    }

    @Operation(summary = "Update a node, optionally cascading schedule, status and classes to its items")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Node saved; a partial cascade is reported as a warning",
                    content = @Content(schema = @Schema(implementation = UpdateResponse.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "Node not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PatchMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public UpdateResponse update(
            @RequestHeader(OWNER_HEADER) final String ownerId,
            @RequestHeader(value = ROOM_HEADER, required = false) final String activeRoom,
            @PathVariable final String id,
            @RequestParam(defaultValue = "false") final boolean cascade,
            @RequestParam(defaultValue = "false") final boolean autosave,
            @Valid @RequestBody final NodeUpdateRequest request) {
        return UpdateResponse.from(treeMutator.update(
                new MutationContext(ownerId, activeRoom), id, request.toUpdate(), cascade, autosave));
    }

    @Operation(summary = "Move a node and its subtree under a new parent")
    @PostMapping(value = "/{id}/move", consumes = MediaType.APPLICATION_JSON_VALUE)
    public MoveResponse move(
            @RequestHeader(OWNER_HEADER) final String ownerId,
            @PathVariable final String id,
            @RequestBody final MoveRequest request) {
        return MoveResponse.from(treeMutator.move(MutationContext.of(ownerId), id, request.newParentId()));
    }

    @Operation(summary = "Move a node one position up or down among its siblings")
    @ApiResponse(responseCode = "200", description = "true if the node moved, false at either end")
    @PostMapping(value = "/{id}/reorder", consumes = MediaType.APPLICATION_JSON_VALUE)
    public boolean reorder(
            @RequestHeader(OWNER_HEADER) final String ownerId,
            @PathVariable final String id,
            @Valid @RequestBody final ReorderRequest request) {
        return treeMutator.reorder(MutationContext.of(ownerId), id, request.direction());
    }

    @Operation(summary = "Duplicate a node, optionally with its subtree")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Copy created",
                    content = @Content(schema = @Schema(implementation = DuplicateResponse.class))),
            @ApiResponse(responseCode = "404", description = "Node not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/{id}/duplicate", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public DuplicateResponse duplicate(
            @RequestHeader(OWNER_HEADER) final String ownerId,
            @PathVariable final String id,
            @Valid @RequestBody final DuplicateRequest request) {
        return DuplicateResponse.from(treeMutator.duplicate(MutationContext.of(ownerId), id, request.toOptions()));
    }

    /**
     * Deletes a node. A node with children needs an explicit {@code descendants} policy:
     * {@code delete} removes the whole subtree, {@code orphan} (alias {@code keep}, matching
     * the "keep them as standalone items" choice) turns the children into roots.
     */
    @Operation(summary = "Delete a node")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Node deleted",
                    content = @Content(schema = @Schema(implementation = DeleteResponse.class))),
            @ApiResponse(responseCode = "409", description = "Node has children and no descendants policy was given",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{id}")
    public DeleteResponse delete(
            @RequestHeader(OWNER_HEADER) final String ownerId,
            @PathVariable final String id,
            @Parameter(description = "What happens to descendants: delete, orphan (alias keep); "
                    + "omitted rejects deleting a node with children")
            @RequestParam(required = false) final String descendants) {
        return DeleteResponse.from(treeMutator.delete(MutationContext.of(ownerId), id, policyOf(descendants)));
    }

    @Operation(summary = "Render the forest for a room, date, text or kind filter")
    @GetMapping("/forest")
    public List<ForestRowResponse> forest(
            @RequestParam(required = false) final String room,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) final LocalDate date,
            @RequestParam(required = false) final String q,
            @RequestParam(required = false) final NodeKind kind,
            @RequestParam(defaultValue = "TEACHER") final Audience audience) {
        return forestService.render(new ViewFilter(room, date, q, kind, audience)).stream()
                .map(ForestRowResponse::from)
                .toList();
    }

    static DescendantPolicy policyOf(final String descendants) {
        if (descendants == null || descendants.isBlank()) {
            return DescendantPolicy.REJECT;
        }
        return switch (descendants.trim().toLowerCase(Locale.ROOT)) {
            case "delete" -> DescendantPolicy.DELETE;
            case "orphan", "keep" -> DescendantPolicy.ORPHAN;
            default -> throw new IllegalArgumentException("descendants must be 'delete', 'orphan' or 'keep'");
        };
    }
}
