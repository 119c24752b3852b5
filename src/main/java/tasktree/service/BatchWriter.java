package tasktree.service;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tasktree.api.exception.PartialBatchFailureException;
import tasktree.persistence.store.NodeStore;
import tasktree.persistence.store.NodeWrite;

/**
 * Commits a pre-computed list of writes as a sequence of bounded, atomic batches.
 *
 * <p>Batches are applied in order. When one fails, the batches before it stay committed
 * and a {@link PartialBatchFailureException} reports the committed and pending ids. A
 * failure in the very first batch is rethrown unchanged because nothing was committed.
 */
@Component
public class BatchWriter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchWriter.class);

    private final NodeStore store;

    public BatchWriter(final NodeStore store) {
        this.store = store;
    }

    /**
     * Commits writes using the store's own batch limit.
     *
     * @param operation name used in logs and failure reports
     * @param writes    writes in commit order
     * @return ids written, in commit order
     */
    public List<String> commit(final String operation, final List<NodeWrite> writes) {
        return commit(operation, writes, store.maxBatchSize());
    }

    /**
     * Commits writes in batches of at most {@code batchLimit} (capped at the store limit).
     *
     * @param operation  name used in logs and failure reports
     * @param writes     writes in commit order
     * @param batchLimit requested batch size
     * @return ids written, in commit order
     * @throws PartialBatchFailureException if a later batch fails after earlier ones committed
     */
    public List<String> commit(final String operation, final List<NodeWrite> writes, final int batchLimit) {
        final int size = Math.max(1, Math.min(batchLimit, store.maxBatchSize()));
        final List<String> committed = new ArrayList<>(writes.size());
        final int batches = (writes.size() + size - 1) / size;
        for (int start = 0, batch = 1; start < writes.size(); start += size, batch++) {
            final List<NodeWrite> chunk = writes.subList(start, Math.min(start + size, writes.size()));
            try {
                store.batchWrite(chunk);
            } catch (RuntimeException ex) {
                if (committed.isEmpty()) {
                    throw ex;
                }
                final List<String> pending = writes.subList(start, writes.size()).stream()
                        .map(NodeWrite::id)
                        .toList();
                LOG.warn("{} failed on batch {}/{} after {} committed writes",
                        operation, batch, batches, committed.size(), ex);
                throw new PartialBatchFailureException(operation, committed, pending, ex);
            }
            chunk.forEach(write -> committed.add(write.id()));
            LOG.debug("{}: committed batch {}/{}", operation, batch, batches);
        }
        return committed;
    }
}
