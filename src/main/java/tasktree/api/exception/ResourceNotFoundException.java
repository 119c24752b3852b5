package tasktree.api.exception;

/**
 * Thrown when a referenced node (or question entry) does not exist.
 *
 * <p>This exception is caught by {@link tasktree.api.GlobalExceptionHandler}
 * and converted to an HTTP 404 Not Found response with a JSON error body.
 */
public class ResourceNotFoundException extends RuntimeException {

    /**
     * Creates a new ResourceNotFoundException with the given message.
     *
     * @param message descriptive message indicating which resource was not found
     */
    public ResourceNotFoundException(final String message) {
        super(message);
    }

    /**
     * @param nodeId id of the missing node
     * @return exception with the standard node message
     */
    public static ResourceNotFoundException node(final String nodeId) {
        return new ResourceNotFoundException("Node not found: " + nodeId);
    }
}
