package tasktree.persistence.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable filter plus ordering over the node collection.
 *
 * <p>Mirrors the query shape a document store offers: equality, null checks, and
 * array membership, combined with AND, with one optional order-by field. Each
 * {@code where...} call returns a new query.
 */
public final class NodeQuery {

    /**
     * Comparison applied to a single field.
     */
    public enum Operator {
        EQUAL_TO,
        IS_NULL,
        ARRAY_CONTAINS
    }

    /**
     * One filter term.
     *
     * @param field    document field
     * @param operator comparison
     * @param value    operand (null for {@link Operator#IS_NULL})
     */
    public record Criterion(NodeField field, Operator operator, Object value) {
    }

    private static final NodeQuery ALL = new NodeQuery(List.of(), null, false);

    private final List<Criterion> criteria;
    private final NodeField orderBy;
    private final boolean descending;

    private NodeQuery(final List<Criterion> criteria, final NodeField orderBy, final boolean descending) {
        this.criteria = Collections.unmodifiableList(new ArrayList<>(criteria));
        this.orderBy = orderBy;
        this.descending = descending;
    }

    /**
     * @return a query matching every document, unordered
     */
    public static NodeQuery all() {
        return ALL;
    }

    /**
     * Sibling group query: nodes sharing {@code parentId}, or all roots when null.
     *
     * @param parentId parent id (nullable)
     * @return the sibling query
     */
    public static NodeQuery siblingsOf(final String parentId) {
        return parentId == null ? all().whereNull(NodeField.PARENT_ID) : all().whereEqualTo(NodeField.PARENT_ID, parentId);
    }

    /**
     * All nodes whose ancestor chain contains {@code ancestorId}.
     *
     * @param ancestorId ancestor id
     * @return the descendant query
     */
    public static NodeQuery descendantsOf(final String ancestorId) {
        return all().whereArrayContains(NodeField.PATH, ancestorId);
    }

    public NodeQuery whereEqualTo(final NodeField field, final Object value) {
        if (value == null) {
            return whereNull(field);
        }
        return with(new Criterion(field, Operator.EQUAL_TO, value));
    }

    public NodeQuery whereNull(final NodeField field) {
        return with(new Criterion(field, Operator.IS_NULL, null));
    }

    public NodeQuery whereArrayContains(final NodeField field, final String value) {
        if (!field.isArray()) {
            throw new IllegalArgumentException(field.key() + " is not an array field");
        }
        return with(new Criterion(field, Operator.ARRAY_CONTAINS, value));
    }

    public NodeQuery orderBy(final NodeField field) {
        return new NodeQuery(criteria, field, false);
    }

    public NodeQuery orderByDescending(final NodeField field) {
        return new NodeQuery(criteria, field, true);
    }

    public List<Criterion> getCriteria() {
        return criteria;
    }

    public NodeField getOrderBy() {
        return orderBy;
    }

    public boolean isDescending() {
        return descending;
    }

    @Override
    public String toString() {
        return "NodeQuery{criteria=" + criteria + ", orderBy=" + orderBy + (descending ? " desc" : "") + '}';
    }

    private NodeQuery with(final Criterion criterion) {
        final List<Criterion> next = new ArrayList<>(criteria);
        next.add(criterion);
        return new NodeQuery(next, orderBy, descending);
    }
}
