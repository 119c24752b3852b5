package tasktree.view;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tasktree.domain.Node;
import tasktree.domain.NodeStatus;
import tasktree.service.OrderNormalizer;

/**
 * Rebuilds a display forest from a flat, filtered node set.
 *
 * <p>A node is an <em>effective root</em> when its parent is null or absent from the
 * set (for example filtered out by date). Groups are sorted by order and emitted
 * root-first, depth-first, so indentation follows from the row depth alone. The pass is
 * linear in the result size apart from sorting each sibling group, so it can run on
 * every snapshot.
 */
@Component
public class ViewSynchronizer {

    private static final Logger LOG = LoggerFactory.getLogger(ViewSynchronizer.class);

    private final Clock clock;

    public ViewSynchronizer(final Clock clock) {
        this.clock = clock;
    }

    /**
     * Filters then rebuilds.
     *
     * @param nodes  flat node set
     * @param filter view selection
     * @return rows in display order
     */
    public List<ForestRow> render(final Collection<Node> nodes, final ViewFilter filter) {
        final ViewFilter effective = filter == null ? ViewFilter.everything() : filter;
        final List<Node> visible = nodes.stream().filter(effective::test).toList();
        final LocalDate day = effective.date() == null ? LocalDate.now(clock) : effective.date();
        return buildForest(visible, day);
    }

    /**
     * Rebuilds the forest of an already filtered node set.
     *
     * @param nodes  nodes in the view
     * @param viewDay day used for the ongoing flag
     * @return rows in display order
     */
    public List<ForestRow> buildForest(final Collection<Node> nodes, final LocalDate viewDay) {
        final Map<String, Node> byId = new LinkedHashMap<>();
        nodes.forEach(node -> byId.put(node.getId(), node));

        final List<Node> roots = new ArrayList<>();
        final Map<String, List<Node>> childrenByParent = new HashMap<>();
        for (final Node node : byId.values()) {
            final String parentId = node.getParentId();
            if (parentId == null || !byId.containsKey(parentId)) {
                roots.add(node);
            } else {
                childrenByParent.computeIfAbsent(parentId, key -> new ArrayList<>()).add(node);
            }
        }
        roots.sort(OrderNormalizer.SIBLING_ORDER);
        childrenByParent.values().forEach(group -> group.sort(OrderNormalizer.SIBLING_ORDER));

        final List<ForestRow> rows = new ArrayList<>(byId.size());
        final Set<String> emitted = new HashSet<>();
        emit(roots, 1, childrenByParent, viewDay, emitted, rows);

        if (emitted.size() < byId.size()) {
            // parent links that loop back on themselves; surface those nodes as roots
            final List<Node> stranded = byId.values().stream()
                    .filter(node -> !emitted.contains(node.getId()))
                    .sorted(OrderNormalizer.SIBLING_ORDER)
                    .toList();
            LOG.warn("{} nodes form a parent cycle and are shown top-level", stranded.size());
            emit(stranded, roots.size() + 1, childrenByParent, viewDay, emitted, rows);
        }
        return rows;
    }

    /**
     * Completion over the direct children present in a view.
     *
     * @param children children of one parent
     * @return completed and total counts
     */
    public static Progress progressOf(final List<Node> children) {
        if (children == null || children.isEmpty()) {
            return Progress.NONE;
        }
        final int done = (int) children.stream().filter(child -> child.getStatus() == NodeStatus.DONE).count();
        return new Progress(done, children.size());
    }

    private static void emit(
            final List<Node> roots,
            final int firstNumber,
            final Map<String, List<Node>> childrenByParent,
            final LocalDate viewDay,
            final Set<String> emitted,
            final List<ForestRow> rows) {
        final Deque<Frame> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(new Frame(roots.get(i), 0, String.valueOf(firstNumber + i), true));
        }
        while (!stack.isEmpty()) {
            final Frame frame = stack.pop();
            final Node node = frame.node();
            if (!emitted.add(node.getId())) {
                continue;
            }
            final List<Node> children = childrenByParent.getOrDefault(node.getId(), List.of());
            rows.add(new ForestRow(
                    node,
                    frame.depth(),
                    frame.number(),
                    frame.root(),
                    node.breadcrumb(),
                    progressOf(children),
                    node.getWindow() != null && node.getWindow().isOngoingOn(viewDay)));
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), frame.depth() + 1, frame.number() + "." + (i + 1), false));
            }
        }
    }

    private record Frame(Node node, int depth, String number, boolean root) {
    }
}
