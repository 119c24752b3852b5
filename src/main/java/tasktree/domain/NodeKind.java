package tasktree.domain;

/**
 * Descriptive kind of a node. Kinds never constrain how deep a node may be nested.
 */
public enum NodeKind {
    PROJECT,
    ASSIGNMENT,
    TASK,
    SUBTASK
}
