package tasktree.persistence.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-level change to one node document (a "set with merge").
 *
 * <p>Three kinds of change are supported:
 * <ul>
 *   <li>{@link #set}: replace the field value</li>
 *   <li>{@link #addToArray}: append values not already present (array union)</li>
 *   <li>{@link #removeFromArray}: remove every occurrence of the values</li>
 * </ul>
 * Array union and removal are idempotent, so replaying a patch converges instead of
 * double-applying. Set values are plain domain values (strings, integers, enums, records,
 * collections); the store converts them to its document representation.
 */
public final class NodePatch {

    private final Map<NodeField, Object> sets = new EnumMap<>(NodeField.class);
    private final Map<NodeField, List<String>> unions = new EnumMap<>(NodeField.class);
    private final Map<NodeField, List<String>> removals = new EnumMap<>(NodeField.class);

    private NodePatch() {
    }

    /**
     * @return an empty patch
     */
    public static NodePatch create() {
        return new NodePatch();
    }

    /**
     * Replaces a field value.
     *
     * @param field target field (must not be an identity field)
     * @param value new value (null clears the field)
     * @return this patch
     */
    public NodePatch set(final NodeField field, final Object value) {
        requireMutable(field);
        sets.put(field, value);
        return this;
    }

    /**
     * Appends values to an array field unless already present.
     *
     * @param field  array field
     * @param values values to add
     * @return this patch
     */
    public NodePatch addToArray(final NodeField field, final String... values) {
        requireArray(field);
        final List<String> target = unions.computeIfAbsent(field, f -> new ArrayList<>());
        Collections.addAll(target, values);
        return this;
    }

    /**
     * Removes all occurrences of the values from an array field.
     *
     * @param field  array field
     * @param values values to remove
     * @return this patch
     */
    public NodePatch removeFromArray(final NodeField field, final String... values) {
        requireArray(field);
        final List<String> target = removals.computeIfAbsent(field, f -> new ArrayList<>());
        Collections.addAll(target, values);
        return this;
    }

    public Map<NodeField, Object> getSets() {
        return Collections.unmodifiableMap(sets);
    }

    public Map<NodeField, List<String>> getUnions() {
        return Collections.unmodifiableMap(unions);
    }

    public Map<NodeField, List<String>> getRemovals() {
        return Collections.unmodifiableMap(removals);
    }

    /**
     * @return every field this patch touches
     */
    public Set<NodeField> touchedFields() {
        final Set<NodeField> fields = EnumSet.noneOf(NodeField.class);
        fields.addAll(sets.keySet());
        fields.addAll(unions.keySet());
        fields.addAll(removals.keySet());
        return fields;
    }

    public boolean isEmpty() {
        return sets.isEmpty() && unions.isEmpty() && removals.isEmpty();
    }

    /**
     * Applies the array operations of this patch to an existing list value.
     *
     * @param field   array field
     * @param current current list (nullable)
     * @return the resulting list, removals applied after unions
     */
    public List<Object> applyArrayOps(final NodeField field, final List<?> current) {
        final LinkedHashSet<Object> result = new LinkedHashSet<>();
        final List<Object> ordered = new ArrayList<>();
        if (current != null) {
            ordered.addAll(current);
        }
        for (final String added : unions.getOrDefault(field, List.of())) {
            if (!ordered.contains(added)) {
                ordered.add(added);
            }
        }
        final List<String> removed = removals.getOrDefault(field, List.of());
        for (final Object value : ordered) {
            if (!removed.contains(value)) {
                result.add(value);
            }
        }
        return new ArrayList<>(result);
    }

    @Override
    public String toString() {
        return "NodePatch{sets=" + sets.keySet() + ", unions=" + unions + ", removals=" + removals + '}';
    }

    private static void requireMutable(final NodeField field) {
        if (field == null) {
            throw new IllegalArgumentException("field must not be null");
        }
        if (field.isImmutable()) {
            throw new IllegalArgumentException(field.key() + " is immutable");
        }
    }

    private static void requireArray(final NodeField field) {
        requireMutable(field);
        if (!field.isArray()) {
            throw new IllegalArgumentException(field.key() + " is not an array field");
        }
    }
}
