package tasktree.service;

import tasktree.persistence.store.NodeField;

/**
 * Fields an ancestor may push down onto its whole subtree.
 */
public enum CascadeField {
    WINDOW(NodeField.WINDOW),
    STATUS(NodeField.STATUS),
    VISIBILITY(NodeField.VISIBILITY);

    private final NodeField field;

    CascadeField(final NodeField field) {
        this.field = field;
    }

    public NodeField field() {
        return field;
    }
}
