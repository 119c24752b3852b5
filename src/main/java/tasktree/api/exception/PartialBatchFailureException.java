package tasktree.api.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when a multi-batch write committed some batches but not all of them.
 *
 * <p>Committed batches stay committed. {@link #getSucceededIds()} and
 * {@link #getPendingIds()} name exactly which documents were and were not written, so a
 * repair pass can target the inconsistent subset instead of re-running everything.
 */
public class PartialBatchFailureException extends RuntimeException {

    private final String operation;
    private final List<String> succeededIds;
    private final List<String> pendingIds;

    public PartialBatchFailureException(
            final String operation,
            final List<String> succeededIds,
            final List<String> pendingIds,
            final Throwable cause) {
        super(operation + " committed " + succeededIds.size() + " of "
                + (succeededIds.size() + pendingIds.size()) + " writes", cause);
        this.operation = operation;
        this.succeededIds = List.copyOf(succeededIds);
        this.pendingIds = List.copyOf(pendingIds);
    }

    public String getOperation() {
        return operation;
    }

    public List<String> getSucceededIds() {
        return succeededIds;
    }

    public List<String> getPendingIds() {
        return pendingIds;
    }

    /**
     * Re-labels the failure and prepends ids committed earlier in the same operation.
     *
     * @param outerOperation name of the enclosing operation
     * @param earlierIds     ids committed before the failing sequence started
     * @return a new exception covering the whole operation
     */
    public PartialBatchFailureException within(final String outerOperation, final List<String> earlierIds) {
        final List<String> all = new ArrayList<>(earlierIds);
        all.addAll(succeededIds);
        return new PartialBatchFailureException(outerOperation, all, pendingIds, getCause());
    }
}
