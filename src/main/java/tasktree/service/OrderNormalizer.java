package tasktree.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tasktree.api.exception.PartialBatchFailureException;
import tasktree.domain.Node;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodePatch;
import tasktree.persistence.store.NodeQuery;
import tasktree.persistence.store.NodeStore;
import tasktree.persistence.store.NodeWrite;

/**
 * Assigns and repairs the sibling-scoped {@code order} key.
 *
 * <p>Algorithm, per sibling group (nodes sharing a {@code parentId}; all roots form one
 * group):
 * <ol>
 *   <li>Sort by {@code (order, createdAt)}; a missing order sorts after every present
 *       order, ties fall back to creation time and then id.</li>
 *   <li>If the group holds a duplicate or a missing value, the i-th sibling (1-based)
 *       receives {@code i * gap}.</li>
 *   <li>Only siblings whose value actually changes are written.</li>
 * </ol>
 * Writes go out in sequential bounded batches. A failure leaves earlier batches
 * committed; the pass is idempotent and safe to re-run, and it only ever tightens an
 * already valid order, so it may interleave with live edits.
 *
 * <p>Routine inserts do not renumber. They append with {@link #nextAppendOrder(Collection)}
 * and rely on this pass to compact drift later.
 */
@Service
public class OrderNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(OrderNormalizer.class);

    /** Default spacing between normalized siblings. */
    public static final int DEFAULT_GAP = 10;

    /**
     * Sibling sort order shared by normalization, reordering, and view reconstruction.
     */
    public static final Comparator<Node> SIBLING_ORDER = Comparator
            .comparing(Node::getOrder, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
            .thenComparing(node -> node.getCreatedAt() == null ? Instant.EPOCH : node.getCreatedAt())
            .thenComparing(Node::getId);

    private final NodeStore store;
    private final BatchWriter batchWriter;
    private final Clock clock;
    private final int gap;
    private final int batchSize;
    private final boolean scheduleEnabled;

    @SuppressFBWarnings(
            value = "CT_CONSTRUCTOR_THROW",
            justification = "Gap is validated in the constructor; class has no finalizer")
    public OrderNormalizer(
            final NodeStore store,
            final BatchWriter batchWriter,
            final Clock clock,
            @Value("${tasktree.order.gap:10}") final int gap,
            @Value("${tasktree.store.max-batch-size:500}") final int batchSize,
            @Value("${tasktree.order.normalizer.enabled:false}") final boolean scheduleEnabled) {
        if (gap < 1) {
            throw new IllegalArgumentException("gap must be positive");
        }
        this.store = store;
        this.batchWriter = batchWriter;
        this.clock = clock;
        this.gap = gap;
        this.batchSize = batchSize;
        this.scheduleEnabled = scheduleEnabled;
    }

    /**
     * Order for a node appended at the end of a sibling group.
     *
     * @param siblings current members of the group
     * @return {@code max(existing orders) + 1}, or 1 for an empty group
     */
    public static int nextAppendOrder(final Collection<Node> siblings) {
        return siblings.stream()
                .map(Node::getOrder)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0) + 1;
    }

    /**
     * One-shot normalization over the entire node collection.
     *
     * @return what was scanned and repaired
     * @throws PartialBatchFailureException if some batches committed and a later one failed
     */
    public NormalizationReport normalizeAll() {
        final List<Node> nodes = store.query(NodeQuery.all());
        LOG.info("Order normalization started over {} nodes", nodes.size());
        final NormalizationReport report = apply("normalize order", nodes);
        LOG.info("Order normalization finished: {} groups scanned, {} nodes scanned, {} updates applied",
                report.groupsScanned(), report.nodesRescanned(), report.updatesApplied());
        return report;
    }

    /**
     * Normalizes a single sibling group.
     *
     * @param parentId parent of the group (null for the root group)
     * @return what was scanned and repaired
     */
    public NormalizationReport normalizeGroup(final String parentId) {
        return apply("normalize order of group " + groupLabel(parentId), store.query(NodeQuery.siblingsOf(parentId)));
    }

    /**
     * Computes the repair for a set of nodes without writing anything.
     *
     * @param nodes nodes to examine, possibly spanning many sibling groups
     * @return the plan: affected groups and the writes needed
     */
    public Plan plan(final Collection<Node> nodes) {
        final Map<String, List<Node>> groups = new LinkedHashMap<>();
        for (final Node node : nodes) {
            groups.computeIfAbsent(node.getParentId(), key -> new ArrayList<>()).add(node);
        }

        final List<NormalizationReport.GroupRepair> repairs = new ArrayList<>();
        final List<Assignment> assignments = new ArrayList<>();
        for (final Map.Entry<String, List<Node>> group : groups.entrySet()) {
            final List<Node> siblings = new ArrayList<>(group.getValue());
            siblings.sort(SIBLING_ORDER);

            final List<Integer> before = siblings.stream().map(Node::getOrder).toList();
            final boolean missing = before.stream().anyMatch(Objects::isNull);
            final Set<Integer> distinct = new HashSet<>();
            boolean duplicates = false;
            for (final Integer order : before) {
                if (order != null && !distinct.add(order)) {
                    duplicates = true;
                }
            }
            if (!duplicates && !missing) {
                continue;
            }

            final List<Integer> after = new ArrayList<>(siblings.size());
            for (int i = 0; i < siblings.size(); i++) {
                final int assigned = (i + 1) * gap;
                after.add(assigned);
                final Node sibling = siblings.get(i);
                if (!Objects.equals(sibling.getOrder(), assigned)) {
                    assignments.add(new Assignment(sibling.getId(), assigned));
                }
            }
            repairs.add(new NormalizationReport.GroupRepair(group.getKey(), before, after, duplicates, missing));
        }
        return new Plan(groups.size(), nodes.size(), repairs, assignments);
    }

    /**
     * Scheduled maintenance pass, active only when
     * {@code tasktree.order.normalizer.enabled=true}.
     */
    @Scheduled(cron = "${tasktree.order.normalizer.cron:0 30 3 * * *}")
    public void scheduledNormalization() {
        if (!scheduleEnabled) {
            return;
        }
        try {
            normalizeAll();
        } catch (PartialBatchFailureException ex) {
            LOG.warn("Scheduled order normalization stopped with {} ids pending; next run will resume",
                    ex.getPendingIds().size(), ex);
        }
    }

    private NormalizationReport apply(final String operation, final Collection<Node> nodes) {
        final Plan plan = plan(nodes);
        for (final NormalizationReport.GroupRepair repair : plan.repairs()) {
            LOG.warn("{}: {} siblings with orders {} ({}{}) -> {}",
                    groupLabel(repair.parentId()),
                    repair.ordersBefore().size(),
                    repair.ordersBefore(),
                    repair.duplicates() ? "duplicates" : "",
                    repair.missing() ? (repair.duplicates() ? ", missing" : "missing") : "",
                    repair.ordersAfter());
        }
        if (plan.assignments().isEmpty()) {
            return new NormalizationReport(plan.groupsScanned(), plan.nodesScanned(), 0, plan.repairs());
        }
        final Instant now = clock.instant();
        final List<NodeWrite> writes = plan.assignments().stream()
                .map(assignment -> NodeWrite.update(assignment.nodeId(), NodePatch.create()
                        .set(NodeField.ORDER, assignment.order())
                        .set(NodeField.UPDATED_AT, now)))
                .toList();
        final List<String> written = batchWriter.commit(operation, writes, batchSize);
        return new NormalizationReport(plan.groupsScanned(), plan.nodesScanned(), written.size(), plan.repairs());
    }

    private static String groupLabel(final String parentId) {
        return parentId == null ? "root group" : "children of " + parentId;
    }

    /**
     * Pending normalization.
     *
     * @param groupsScanned sibling groups examined
     * @param nodesScanned  nodes examined
     * @param repairs       groups needing repair
     * @param assignments   order values to write
     */
    public record Plan(
            int groupsScanned,
            int nodesScanned,
            List<NormalizationReport.GroupRepair> repairs,
            List<Assignment> assignments) {
    }

    /**
     * One order value to write.
     *
     * @param nodeId target node
     * @param order  new order value
     */
    public record Assignment(String nodeId, int order) {
    }
}
