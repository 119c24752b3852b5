package tasktree.view;

/**
 * Completion of a parent's direct children within one view.
 *
 * @param completed children in status done
 * @param total     children in the view
 */
public record Progress(int completed, int total) {

    public static final Progress NONE = new Progress(0, 0);

    public boolean isComplete() {
        return total > 0 && completed == total;
    }
}
