package tasktree.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one order normalization pass.
 *
 * @param groupsScanned  sibling groups examined
 * @param nodesRescanned nodes examined across all groups
 * @param updatesApplied order values rewritten
 * @param repairedGroups groups that had duplicate or missing order values
 */
public record NormalizationReport(
        int groupsScanned,
        int nodesRescanned,
        int updatesApplied,
        List<GroupRepair> repairedGroups) {

    public NormalizationReport {
        repairedGroups = List.copyOf(repairedGroups);
    }

    /**
     * One sibling group that needed renumbering.
     *
     * @param parentId     shared parent (null for the root group)
     * @param ordersBefore stored orders in sorted sibling order (null entries are missing values)
     * @param ordersAfter  assigned orders in the same sequence
     * @param duplicates   whether two siblings shared an order value
     * @param missing      whether any sibling had no order value
     */
    public record GroupRepair(
            String parentId,
            List<Integer> ordersBefore,
            List<Integer> ordersAfter,
            boolean duplicates,
            boolean missing) {

        public GroupRepair {
            // ordersBefore may hold nulls, so List.copyOf is not an option
            ordersBefore = Collections.unmodifiableList(new ArrayList<>(ordersBefore));
            ordersAfter = List.copyOf(ordersAfter);
        }
    }
}
