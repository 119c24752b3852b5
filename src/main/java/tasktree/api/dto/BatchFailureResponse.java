package tasktree.api.dto;

import java.util.List;
import java.util.Objects;
import tasktree.api.exception.PartialBatchFailureException;

/**
 * Error body for a multi-batch write that committed only partly.
 *
 * @param message      summary
 * @param operation    operation that failed
 * @param succeededIds documents already written
 * @param pendingIds   documents not written; re-running the operation targets these
 */
public record BatchFailureResponse(
        String message,
        String operation,
        List<String> succeededIds,
        List<String> pendingIds
) {
    public static BatchFailureResponse from(final PartialBatchFailureException ex) {
        Objects.requireNonNull(ex, "exception must not be null");
        return new BatchFailureResponse(ex.getMessage(), ex.getOperation(), ex.getSucceededIds(), ex.getPendingIds());
    }
}
