package tasktree.view;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tasktree.domain.Node;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodeQuery;
import tasktree.persistence.store.NodeStore;
import tasktree.persistence.store.Subscription;

/**
 * Push-based forest for one displayed view.
 *
 * <p>The view keeps the latest confirmed snapshot from the store plus an optional
 * optimistic overlay of locally edited nodes. Every snapshot and every overlay change
 * re-renders the forest and hands the rows to the listener. An optimistic entry stays
 * until a snapshot carries a newer stored version of that node; {@link #rollback()} drops
 * the whole overlay after a failed write.
 *
 * <p>Instances hold a live store subscription and must be closed when the view goes
 * away.
 */
public final class LiveForestView implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LiveForestView.class);

    private final ViewSynchronizer synchronizer;
    private final ViewFilter filter;
    private final Consumer<List<ForestRow>> listener;
    private final Map<String, Node> optimistic = new LinkedHashMap<>();
    private final Subscription subscription;
    private List<Node> confirmed = List.of();
    private List<ForestRow> rows = List.of();

    /**
     * Opens the view and delivers the first rendering synchronously.
     *
     * @param store        node store to subscribe to
     * @param synchronizer forest builder
     * @param filter       view selection
     * @param listener     receives every re-rendered forest
     */
    public LiveForestView(
            final NodeStore store,
            final ViewSynchronizer synchronizer,
            final ViewFilter filter,
            final Consumer<List<ForestRow>> listener) {
        this.synchronizer = synchronizer;
        this.filter = filter == null ? ViewFilter.everything() : filter;
        this.listener = listener;
        this.subscription = store.subscribe(queryFor(this.filter), this::onSnapshot);
    }

    /**
     * Shows a locally edited node before the store confirms the write.
     *
     * @param node edited node
     */
    public synchronized void applyOptimistic(final Node node) {
        requireOpen();
        optimistic.put(node.getId(), node.copy());
        refresh();
    }

    /**
     * Drops all optimistic edits and returns to the last confirmed snapshot.
     */
    public synchronized void rollback() {
        if (optimistic.isEmpty()) {
            return;
        }
        LOG.debug("Rolling back {} optimistic edits", optimistic.size());
        optimistic.clear();
        refresh();
    }

    public synchronized List<ForestRow> rows() {
        return rows;
    }

    public synchronized boolean hasPendingChanges() {
        return !optimistic.isEmpty();
    }

    public boolean isOpen() {
        return subscription.isActive();
    }

    @Override
    public void close() {
        subscription.close();
    }

    private synchronized void onSnapshot(final List<Node> snapshot) {
        confirmed = List.copyOf(snapshot);
        for (final Node node : confirmed) {
            final Node pending = optimistic.get(node.getId());
            if (pending != null && supersedes(node, pending)) {
                optimistic.remove(node.getId());
            }
        }
        refresh();
    }

    /** A stored version newer than the one the optimistic edit started from confirms it. */
    private static boolean supersedes(final Node stored, final Node pending) {
        return pending.getUpdatedAt() == null
                || (stored.getUpdatedAt() != null && stored.getUpdatedAt().isAfter(pending.getUpdatedAt()));
    }

    private void refresh() {
        final Map<String, Node> merged = new LinkedHashMap<>();
        confirmed.forEach(node -> merged.put(node.getId(), node));
        merged.putAll(optimistic);
        rows = List.copyOf(synchronizer.render(new ArrayList<>(merged.values()), filter));
        listener.accept(rows);
    }

    private void requireOpen() {
        if (!isOpen()) {
            throw new IllegalStateException("view is closed");
        }
    }

    private static NodeQuery queryFor(final ViewFilter filter) {
        return filter.room() == null
                ? NodeQuery.all()
                : NodeQuery.all().whereArrayContains(NodeField.VISIBILITY, filter.room());
    }
}
