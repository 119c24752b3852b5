package tasktree.view;

import tasktree.domain.Node;

/**
 * One emitted row of a reconstructed forest, in depth-first display order.
 *
 * @param node          the node
 * @param depth         recursion depth in this view (0 for effective roots)
 * @param number        dotted position among effective siblings, e.g. {@code "1.2.1"}
 * @param effectiveRoot true when the node is top-level in this view
 * @param breadcrumb    cached ancestor titles joined with arrows
 * @param progress      completion of the node's children in this view
 * @param ongoing       multi-day item that is not due on the viewed day
 */
public record ForestRow(
        Node node,
        int depth,
        String number,
        boolean effectiveRoot,
        String breadcrumb,
        Progress progress,
        boolean ongoing) {
}
