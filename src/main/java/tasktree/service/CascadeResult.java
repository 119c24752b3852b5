package tasktree.service;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a cascade from one ancestor.
 *
 * @param ancestorId    node whose values were pushed down
 * @param fields        cascaded fields
 * @param descendantIds descendants written, in commit order
 */
public record CascadeResult(String ancestorId, Set<CascadeField> fields, List<String> descendantIds) {

    public CascadeResult {
        fields = Set.copyOf(fields);
        descendantIds = List.copyOf(descendantIds);
    }

    public static CascadeResult none(final String ancestorId, final Set<CascadeField> fields) {
        return new CascadeResult(ancestorId, fields, List.of());
    }

    public int updatedCount() {
        return descendantIds.size();
    }
}
