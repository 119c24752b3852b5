package tasktree.persistence.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import tasktree.domain.Node;

/**
 * Persistence contract for the flat node collection.
 *
 * <p>The store guarantees atomicity for a single document write and for one batch of at
 * most {@link #maxBatchSize()} writes. Nothing spans batches: callers that touch more
 * documents decompose the work into several batches and tolerate partial commits.
 *
 * <p>Every returned {@link Node} is an independent copy; mutating it never changes the
 * stored document.
 */
public interface NodeStore {

    /**
     * @return a fresh, collision-resistant document id
     */
    String newId();

    /**
     * @param id document id
     * @return the node if present
     */
    Optional<Node> get(String id);

    /**
     * @param query filter and ordering
     * @return matching nodes in query order
     */
    List<Node> query(NodeQuery query);

    /**
     * Creates or fully replaces one document.
     *
     * @param node node to write
     */
    void set(Node node);

    /**
     * Merges field changes into one existing document.
     *
     * @param id    document id
     * @param patch field changes
     * @throws tasktree.api.exception.ResourceNotFoundException if the document does not exist
     */
    void update(String id, NodePatch patch);

    /**
     * Atomic read-modify-write of one document.
     *
     * @param id        document id
     * @param transform function from the current node to the replacement node
     * @return the written node
     * @throws tasktree.api.exception.ResourceNotFoundException if the document does not exist
     */
    Node transform(String id, UnaryOperator<Node> transform);

    /**
     * Commits all writes atomically: either every write applies or none does.
     *
     * @param writes writes to apply, at most {@link #maxBatchSize()}
     * @throws IllegalArgumentException if the batch is larger than the limit
     * @throws tasktree.api.exception.ResourceNotFoundException if an update targets a missing document
     */
    void batchWrite(List<NodeWrite> writes);

    /**
     * @param id document id
     * @return true if a document was removed
     */
    boolean delete(String id);

    /**
     * Registers a live query. The listener receives the current result set immediately
     * and again after every commit that changes it.
     *
     * @param query    filter and ordering
     * @param listener snapshot consumer
     * @return handle that must be closed when the view goes away
     */
    Subscription subscribe(NodeQuery query, Consumer<List<Node>> listener);

    /**
     * @return the largest number of writes one atomic batch may contain
     */
    int maxBatchSize();

    /**
     * Utility hook for test isolation.
     */
    void deleteAll();
}
