package tasktree.persistence.store;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tasktree.api.exception.ResourceNotFoundException;
import tasktree.domain.Node;
import tasktree.persistence.mapper.NodeDocumentMapper;

/**
 * Document-store backed {@link NodeStore} that keeps every node as a schemaless map.
 *
 * <p>Design:
 * <ul>
 *   <li>Documents live in a {@link ConcurrentHashMap} keyed by id and are replaced
 *       wholesale on every write, so readers never observe a half-applied patch.</li>
 *   <li>All writes (single documents and batches) run under one commit lock; a batch is
 *       validated completely before its first write is applied.</li>
 *   <li>Live queries are re-evaluated after each commit and a snapshot is pushed only
 *       when the result set actually changed.</li>
 * </ul>
 */
@Component
public class InMemoryNodeStore implements NodeStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryNodeStore.class);

    private static final String ID_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int ID_LENGTH = 20;

    private final Map<String, Map<String, Object>> documents = new ConcurrentHashMap<>();
    private final List<LiveQuery> liveQueries = new CopyOnWriteArrayList<>();
    private final Object commitLock = new Object();
    private final SecureRandom random = new SecureRandom();
    private final NodeDocumentMapper mapper;
    private final int maxBatchSize;

    @SuppressFBWarnings(
            value = {"EI_EXPOSE_REP2", "CT_CONSTRUCTOR_THROW"},
            justification = "Spring-managed singleton keeps the shared mapper; batch limit is validated up front")
    public InMemoryNodeStore(
            final NodeDocumentMapper mapper,
            @Value("${tasktree.store.max-batch-size:500}") final int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        this.mapper = mapper;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public String newId() {
        final StringBuilder id = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }

    @Override
    public Optional<Node> get(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        final Map<String, Object> document = documents.get(id);
        return document == null ? Optional.empty() : Optional.of(mapper.toDomain(document));
    }

    @Override
    public List<Node> query(final NodeQuery query) {
        return evaluate(query).stream().map(mapper::toDomain).toList();
    }

    @Override
    public void set(final Node node) {
        batchWrite(List.of(NodeWrite.set(node)));
    }

    @Override
    public void update(final String id, final NodePatch patch) {
        batchWrite(List.of(NodeWrite.update(id, patch)));
    }

    @Override
    public Node transform(final String id, final UnaryOperator<Node> transform) {
        final Node written;
        synchronized (commitLock) {
            final Map<String, Object> current = documents.get(id);
            if (current == null) {
                throw ResourceNotFoundException.node(id);
            }
            written = transform.apply(mapper.toDomain(current));
            if (written == null || !id.equals(written.getId())) {
                throw new IllegalStateException("transform must return a node with id " + id);
            }
            documents.put(id, mapper.toDocument(written));
        }
        publish();
        return written.copy();
    }

    @Override
    public void batchWrite(final List<NodeWrite> writes) {
        if (writes == null || writes.isEmpty()) {
            return;
        }
        if (writes.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                    "batch of " + writes.size() + " writes exceeds the limit of " + maxBatchSize);
        }
        synchronized (commitLock) {
            // Stage every document first so a failing write leaves the collection untouched
            final Map<String, Map<String, Object>> staged = new LinkedHashMap<>();
            for (final NodeWrite write : writes) {
                switch (write.type()) {
                    case SET -> staged.put(write.id(), mapper.toDocument(write.node()));
                    case UPDATE -> {
                        final Map<String, Object> base = staged.containsKey(write.id())
                                ? staged.get(write.id())
                                : documents.get(write.id());
                        if (base == null) {
                            throw ResourceNotFoundException.node(write.id());
                        }
                        staged.put(write.id(), merge(base, write.patch()));
                    }
                    case DELETE -> staged.put(write.id(), null);
                    default -> throw new IllegalStateException("unknown write type " + write.type());
                }
            }
            staged.forEach((id, document) -> {
                if (document == null) {
                    documents.remove(id);
                } else {
                    documents.put(id, document);
                }
            });
        }
        LOG.debug("Committed batch of {} writes", writes.size());
        publish();
    }

    @Override
    public boolean delete(final String id) {
        final boolean removed;
        synchronized (commitLock) {
            removed = documents.remove(id) != null;
        }
        if (removed) {
            publish();
        }
        return removed;
    }

    @Override
    public Subscription subscribe(final NodeQuery query, final Consumer<List<Node>> listener) {
        if (query == null || listener == null) {
            throw new IllegalArgumentException("query and listener must not be null");
        }
        final LiveQuery liveQuery = new LiveQuery(query, listener);
        liveQueries.add(liveQuery);
        liveQuery.deliverIfChanged();
        return liveQuery;
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public void deleteAll() {
        synchronized (commitLock) {
            documents.clear();
        }
        publish();
    }

    /**
     * @return number of live queries that have not been closed
     */
    public int activeSubscriptionCount() {
        return liveQueries.size();
    }

    private Map<String, Object> merge(final Map<String, Object> base, final NodePatch patch) {
        final Map<String, Object> merged = new LinkedHashMap<>(base);
        patch.getSets().forEach((field, value) -> merged.put(field.key(), mapper.toDocumentValue(value)));
        for (final NodeField field : patch.touchedFields()) {
            if (patch.getUnions().containsKey(field) || patch.getRemovals().containsKey(field)) {
                final Object current = merged.get(field.key());
                merged.put(field.key(), patch.applyArrayOps(field, current instanceof List<?> list ? list : null));
            }
        }
        return merged;
    }

    private List<Map<String, Object>> evaluate(final NodeQuery query) {
        final List<Map<String, Object>> matches = new ArrayList<>();
        for (final Map<String, Object> document : documents.values()) {
            if (matchesAll(document, query.getCriteria())) {
                matches.add(document);
            }
        }
        if (query.getOrderBy() != null) {
            final NodeField field = query.getOrderBy();
            Comparator<Map<String, Object>> comparator =
                    (left, right) -> compareValues(field, left.get(field.key()), right.get(field.key()));
            if (query.isDescending()) {
                comparator = comparator.reversed();
            }
            matches.sort(comparator);
        }
        return matches;
    }

    private boolean matchesAll(final Map<String, Object> document, final List<NodeQuery.Criterion> criteria) {
        for (final NodeQuery.Criterion criterion : criteria) {
            final Object actual = document.get(criterion.field().key());
            final boolean matches = switch (criterion.operator()) {
                case IS_NULL -> actual == null;
                case EQUAL_TO -> valuesEqual(actual, mapper.toDocumentValue(criterion.value()));
                case ARRAY_CONTAINS -> actual instanceof List<?> list
                        && list.stream().anyMatch(item -> valuesEqual(item, criterion.value()));
            };
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    private static boolean valuesEqual(final Object left, final Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    /** Nulls sort after every present value, matching a document store's order-by. */
    static int compareValues(final NodeField field, final Object left, final Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : 1) : -1;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        if (field == NodeField.CREATED_AT || field == NodeField.UPDATED_AT) {
            // ISO-8601 text with a variable fraction length does not sort chronologically
            return Instant.parse(String.valueOf(left)).compareTo(Instant.parse(String.valueOf(right)));
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private void publish() {
        for (final LiveQuery liveQuery : liveQueries) {
            try {
                liveQuery.deliverIfChanged();
            } catch (RuntimeException ex) {
                LOG.warn("Snapshot listener for {} failed", liveQuery.query, ex);
            }
        }
    }

    /**
     * Registered live query. Remembers the last delivered result to suppress
     * snapshots that would not change anything for the listener.
     */
    private final class LiveQuery implements Subscription {

        private final NodeQuery query;
        private final Consumer<List<Node>> listener;
        private List<Map<String, Object>> lastDelivered;
        private volatile boolean active = true;

        private LiveQuery(final NodeQuery query, final Consumer<List<Node>> listener) {
            this.query = query;
            this.listener = listener;
        }

        private synchronized void deliverIfChanged() {
            if (!active) {
                return;
            }
            final List<Map<String, Object>> current = evaluate(query);
            if (current.equals(lastDelivered)) {
                return;
            }
            lastDelivered = current;
            listener.accept(current.stream().map(mapper::toDomain).toList());
        }

        @Override
        public void close() {
            if (active) {
                active = false;
                liveQueries.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
