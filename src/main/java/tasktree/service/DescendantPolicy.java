package tasktree.service;

/**
 * What a delete does with the node's descendants.
 */
public enum DescendantPolicy {
    /** Refuse when the node has children; the caller has not chosen yet. */
    REJECT,
    /** Delete the node and every transitive descendant. */
    DELETE,
    /** Keep the descendants; direct children become standalone roots. */
    ORPHAN
}
