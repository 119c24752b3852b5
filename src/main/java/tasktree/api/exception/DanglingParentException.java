package tasktree.api.exception;

/**
 * Thrown when a parent reference cannot be used: the parent does not exist, or
 * attaching to it would put a node underneath itself.
 *
 * <p>Operations never fall back to creating an orphan with a partial path.
 */
public class DanglingParentException extends RuntimeException {

    private final String parentId;

    public DanglingParentException(final String parentId, final String message) {
        super(message);
        this.parentId = parentId;
    }

    /**
     * @param parentId id that was referenced but not found
     * @return exception describing the missing parent
     */
    public static DanglingParentException missing(final String parentId) {
        return new DanglingParentException(parentId, "Parent not found: " + parentId);
    }

    public String getParentId() {
        return parentId;
    }
}
