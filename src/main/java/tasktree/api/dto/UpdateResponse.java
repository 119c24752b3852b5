package tasktree.api.dto;

import java.util.List;
import java.util.Objects;
import tasktree.service.UpdateResult;

/**
 * Result of a save. A cascade that did not reach every descendant is reported as a
 * warning next to the saved node, never as an error.
 *
 * @param node            saved node
 * @param cascadedCount   descendants updated by the cascade
 * @param warning         cascade warning (null when none)
 * @param pendingIds      descendants the cascade did not reach
 */
public record UpdateResponse(NodeResponse node, int cascadedCount, String warning, List<String> pendingIds) {

    public static UpdateResponse from(final UpdateResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.hasWarning()) {
            return new UpdateResponse(
                    NodeResponse.from(result.node()),
                    result.cascadeWarning().succeededIds().size(),
                    result.cascadeWarning().message(),
                    result.cascadeWarning().pendingIds());
        }
        return new UpdateResponse(
                NodeResponse.from(result.node()),
                result.cascade() == null ? 0 : result.cascade().updatedCount(),
                null,
                List.of());
    }
}
