package tasktree.api.dto;

import java.util.Objects;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;
import tasktree.view.ForestRow;

/**
 * One row of a rendered forest.
 *
 * @param id            node id
 * @param parentId      stored parent
 * @param kind          descriptive kind
 * @param title         display title
 * @param status        lifecycle status
 * @param depth         indentation level
 * @param number        dotted position, e.g. "1.2"
 * @param effectiveRoot top-level in this view
 * @param breadcrumb    ancestor titles joined with arrows
 * @param completed     children done
 * @param total         children in the view
 * @param ongoing       multi-day item not due today
 */
public record ForestRowResponse(
        String id,
        String parentId,
        NodeKind kind,
        String title,
        NodeStatus status,
        int depth,
        String number,
        boolean effectiveRoot,
        String breadcrumb,
        int completed,
        int total,
        boolean ongoing
) {
    public static ForestRowResponse from(final ForestRow row) {
        Objects.requireNonNull(row, "row must not be null");
        return new ForestRowResponse(
                row.node().getId(),
                row.node().getParentId(),
                row.node().getKind(),
                row.node().getTitle(),
                row.node().getStatus(),
                row.depth(),
                row.number(),
                row.effectiveRoot(),
                row.breadcrumb(),
                row.progress().completed(),
                row.progress().total(),
                row.ongoing());
    }
}
