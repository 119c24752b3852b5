package tasktree.api.dto;

import jakarta.validation.constraints.NotNull;
import tasktree.service.ReorderDirection;

/**
 * @param direction UP or DOWN
 */
public record ReorderRequest(@NotNull(message = "direction must not be null") ReorderDirection direction) {
}
