package tasktree.api.exception;

/**
 * Thrown when a delete is requested for a node with children and the caller has not
 * chosen whether the children should be deleted or kept as standalone items.
 */
public class HasChildrenException extends RuntimeException {

    private final String nodeId;
    private final int childCount;

    public HasChildrenException(final String nodeId, final int childCount) {
        super("This item has " + childCount + (childCount == 1 ? " child" : " children")
                + ". Delete them too, or keep them as standalone items?");
        this.nodeId = nodeId;
        this.childCount = childCount;
    }

    public String getNodeId() {
        return nodeId;
    }

    public int getChildCount() {
        return childCount;
    }
}
