package tasktree.service;

/**
 * Direction for swapping a node with its neighbouring sibling.
 */
public enum ReorderDirection {
    UP,
    DOWN
}
