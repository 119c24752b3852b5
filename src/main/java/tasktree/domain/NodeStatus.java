package tasktree.domain;

/**
 * Lifecycle status of a node.
 *
 * <p>{@link #DRAFT} marks an autosaved, not yet published item and is never shown to
 * students. {@link #STUCK} is the help-request state raised from the student view.
 */
public enum NodeStatus {
    DRAFT,
    TODO,
    IN_PROGRESS,
    STUCK,
    DONE;

    /**
     * Status a draft is promoted to when a teacher explicitly saves it.
     *
     * @return the first active status
     */
    public static NodeStatus firstActive() {
        return TODO;
    }

    /**
     * @return true if the consuming audience may see nodes in this status
     */
    public boolean isPublished() {
        return this != DRAFT;
    }
}
