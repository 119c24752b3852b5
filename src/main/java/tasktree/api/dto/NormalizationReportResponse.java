package tasktree.api.dto;

import java.util.List;
import java.util.Objects;
import tasktree.service.NormalizationReport;

/**
 * Operator report of one normalization run.
 *
 * @param groupsScanned  sibling groups examined
 * @param nodesRescanned nodes examined
 * @param updatesApplied order values rewritten
 * @param repairedGroups parents of the groups that were renumbered (null is the root group)
 */
public record NormalizationReportResponse(
        int groupsScanned,
        int nodesRescanned,
        int updatesApplied,
        List<String> repairedGroups
) {
    public static NormalizationReportResponse from(final NormalizationReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return new NormalizationReportResponse(
                report.groupsScanned(),
                report.nodesRescanned(),
                report.updatesApplied(),
                report.repairedGroups().stream()
                        .map(repair -> repair.parentId() == null ? "(root)" : repair.parentId())
                        .toList());
    }
}
