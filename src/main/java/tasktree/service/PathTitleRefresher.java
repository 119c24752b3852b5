package tasktree.service;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tasktree.api.exception.PartialBatchFailureException;
import tasktree.api.exception.ResourceNotFoundException;
import tasktree.api.exception.StoreUnavailableException;
import tasktree.domain.Node;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodePatch;
import tasktree.persistence.store.NodeQuery;
import tasktree.persistence.store.NodeStore;
import tasktree.persistence.store.NodeWrite;

/**
 * Rewrites the cached breadcrumb titles of a subtree after an ancestor was renamed.
 *
 * <p>{@code pathTitles} is a display cache only, so failures here never fail the
 * rename. Each attempt re-reads the subtree and rewrites only stale entries, which makes
 * retries converge, including after a descendant disappears between the read and the write.
 */
@Component
public class PathTitleRefresher {

    private static final Logger LOG = LoggerFactory.getLogger(PathTitleRefresher.class);

    private final NodeStore store;
    private final BatchWriter batchWriter;
    private final int attempts;

    public PathTitleRefresher(
            final NodeStore store,
            final BatchWriter batchWriter,
            @Value("${tasktree.path-titles.retry-attempts:3}") final int attempts) {
        this.store = store;
        this.batchWriter = batchWriter;
        this.attempts = Math.max(1, attempts);
    }

    /**
     * @param ancestorId renamed node
     * @param title      its new title
     * @return true if every descendant holds the new title afterwards
     */
    public boolean refresh(final String ancestorId, final String title) {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                final int written = refreshOnce(ancestorId, title);
                if (written > 0) {
                    LOG.debug("Refreshed breadcrumb title of {} on {} descendants", ancestorId, written);
                }
                return true;
            } catch (StoreUnavailableException | PartialBatchFailureException | ResourceNotFoundException ex) {
                // a descendant deleted after the query fails the batch; the next attempt re-reads
                LOG.debug("Breadcrumb refresh for {} failed on attempt {}/{}", ancestorId, attempt, attempts, ex);
            }
        }
        LOG.warn("Breadcrumb titles below {} are stale after {} attempts", ancestorId, attempts);
        return false;
    }

    private int refreshOnce(final String ancestorId, final String title) {
        final List<NodeWrite> writes = new ArrayList<>();
        for (final Node descendant : store.query(NodeQuery.descendantsOf(ancestorId))) {
            final int index = descendant.getPath().indexOf(ancestorId);
            final List<String> titles = new ArrayList<>(descendant.getPathTitles());
            while (titles.size() < descendant.getPath().size()) {
                titles.add("");
            }
            if (title.equals(titles.get(index))) {
                continue;
            }
            titles.set(index, title);
            writes.add(NodeWrite.update(descendant.getId(), NodePatch.create().set(NodeField.PATH_TITLES, titles)));
        }
        return batchWriter.commit("refresh titles below " + ancestorId, writes).size();
    }
}
