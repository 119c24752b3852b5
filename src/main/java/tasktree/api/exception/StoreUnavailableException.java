package tasktree.api.exception;

/**
 * Transient failure reported by a node store implementation (connection lost,
 * quota exceeded, commit rejected). Retrying the same write may succeed.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(final String message) {
        super(message);
    }

    public StoreUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
