package tasktree.service;

import java.util.List;
import tasktree.domain.Node;

/**
 * Outcome of an update.
 *
 * <p>The node's own write always succeeded when a result is returned. A failed cascade
 * shows up as {@link #cascadeWarning()} instead of an exception.
 *
 * @param node           node as written
 * @param cascade        cascade outcome (null when no cascade ran)
 * @param cascadeWarning set when the cascade only partially applied (nullable)
 */
public record UpdateResult(Node node, CascadeResult cascade, CascadeWarning cascadeWarning) {

    public boolean hasWarning() {
        return cascadeWarning != null;
    }

    /**
     * Best-effort cascade that did not reach every descendant.
     *
     * @param message      human readable summary
     * @param succeededIds descendants already updated
     * @param pendingIds   descendants still holding their old values
     */
    public record CascadeWarning(String message, List<String> succeededIds, List<String> pendingIds) {

        public CascadeWarning {
            succeededIds = List.copyOf(succeededIds);
            pendingIds = List.copyOf(pendingIds);
        }
    }
}
