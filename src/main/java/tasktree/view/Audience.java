package tasktree.view;

/**
 * Who a forest view is rendered for. Students never see drafts.
 */
public enum Audience {
    TEACHER,
    STUDENT
}
