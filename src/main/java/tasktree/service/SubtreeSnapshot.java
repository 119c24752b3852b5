package tasktree.service;

import java.util.ArrayList;
import java.util.List;
import tasktree.domain.Node;

/**
 * A node together with all of its transitive descendants, shallowest first.
 *
 * @param node        subtree root
 * @param descendants every descendant, sorted by depth then sibling order
 */
public record SubtreeSnapshot(Node node, List<Node> descendants) {

    public SubtreeSnapshot {
        descendants = List.copyOf(descendants);
    }

    /**
     * @return the subtree root followed by its descendants
     */
    public List<Node> allNodes() {
        final List<Node> all = new ArrayList<>(descendants.size() + 1);
        all.add(node);
        all.addAll(descendants);
        return all;
    }

    public boolean hasDescendants() {
        return !descendants.isEmpty();
    }
}
