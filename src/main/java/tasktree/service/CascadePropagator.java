package tasktree.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tasktree.domain.Node;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodePatch;
import tasktree.persistence.store.NodeQuery;
import tasktree.persistence.store.NodeStore;
import tasktree.persistence.store.NodeWrite;

/**
 * Pushes an ancestor's schedule, status, or visibility onto every transitive descendant.
 *
 * <p>Each descendant receives the ancestor's value verbatim, so replaying a cascade
 * yields the same end state. Cascades are best-effort: a failure after the first batch
 * surfaces as {@link tasktree.api.exception.PartialBatchFailureException} naming the
 * descendants already written, while the ancestor's own write stays committed.
 */
@Service
public class CascadePropagator {

    private static final Logger LOG = LoggerFactory.getLogger(CascadePropagator.class);

    private final NodeStore store;
    private final BatchWriter batchWriter;
    private final Clock clock;

    public CascadePropagator(final NodeStore store, final BatchWriter batchWriter, final Clock clock) {
        this.store = store;
        this.batchWriter = batchWriter;
        this.clock = clock;
    }

    /**
     * Descendants of {@code ancestor}: same tree, and the ancestor appears in their path.
     *
     * @param ancestor subtree root
     * @return every transitive descendant
     */
    public List<Node> findDescendants(final Node ancestor) {
        return store.query(NodeQuery.all()
                .whereEqualTo(NodeField.ROOT_ID, ancestor.effectiveRootId())
                .whereArrayContains(NodeField.PATH, ancestor.getId()));
    }

    /**
     * Copies the selected fields of {@code ancestor} onto all of its descendants.
     *
     * @param ancestor the ancestor as just written
     * @param fields   fields to cascade
     * @return the descendants written
     */
    public CascadeResult propagate(final Node ancestor, final Set<CascadeField> fields) {
        if (ancestor == null) {
            throw new IllegalArgumentException("ancestor must not be null");
        }
        if (fields == null || fields.isEmpty()) {
            return CascadeResult.none(ancestor.getId(), Set.of());
        }
        final List<Node> descendants = findDescendants(ancestor);
        if (descendants.isEmpty()) {
            return CascadeResult.none(ancestor.getId(), fields);
        }

        final Instant now = clock.instant();
        final List<NodeWrite> writes = new ArrayList<>(descendants.size());
        for (final Node descendant : descendants) {
            final NodePatch patch = NodePatch.create();
            for (final CascadeField field : fields) {
                patch.set(field.field(), valueOf(ancestor, field));
            }
            patch.set(NodeField.UPDATED_AT, now);
            writes.add(NodeWrite.update(descendant.getId(), patch));
        }
        final List<String> written = batchWriter.commit("cascade " + fields + " from " + ancestor.getId(), writes);
        LOG.info("Cascaded {} from {} onto {} descendants", fields, ancestor.getId(), written.size());
        return new CascadeResult(ancestor.getId(), fields, written);
    }

    private static Object valueOf(final Node ancestor, final CascadeField field) {
        return switch (field) {
            case WINDOW -> ancestor.getWindow();
            case STATUS -> ancestor.getStatus();
            case VISIBILITY -> new ArrayList<>(ancestor.getVisibility());
        };
    }
}
