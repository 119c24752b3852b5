package tasktree.view;

import java.util.List;
import java.util.function.Consumer;
import org.springframework.stereotype.Service;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodeQuery;
import tasktree.persistence.store.NodeStore;

/**
 * Entry point for reading the forest: one-shot renderings and live views.
 */
@Service
public class ForestService {

    private final NodeStore store;
    private final ViewSynchronizer synchronizer;

    public ForestService(final NodeStore store, final ViewSynchronizer synchronizer) {
        this.store = store;
        this.synchronizer = synchronizer;
    }

    /**
     * @param filter view selection
     * @return rows in depth-first display order
     */
    public List<ForestRow> render(final ViewFilter filter) {
        final ViewFilter effective = filter == null ? ViewFilter.everything() : filter;
        final NodeQuery query = effective.room() == null
                ? NodeQuery.all()
                : NodeQuery.all().whereArrayContains(NodeField.VISIBILITY, effective.room());
        return synchronizer.render(store.query(query), effective);
    }

    /**
     * Opens a live view. The caller owns the returned view and must close it.
     *
     * @param filter   view selection
     * @param listener receives each re-rendered forest
     * @return the open view
     */
    public LiveForestView open(final ViewFilter filter, final Consumer<List<ForestRow>> listener) {
        return new LiveForestView(store, synchronizer, filter, listener);
    }
}
