package tasktree.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tasktree.api.exception.DanglingParentException;
import tasktree.api.exception.HasChildrenException;
import tasktree.api.exception.NodeValidationException;
import tasktree.api.exception.PartialBatchFailureException;
import tasktree.api.exception.ResourceNotFoundException;
import tasktree.api.exception.StoreUnavailableException;
import tasktree.domain.Node;
import tasktree.domain.NodeStatus;
import tasktree.domain.Validation;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodePatch;
import tasktree.persistence.store.NodeQuery;
import tasktree.persistence.store.NodeStore;
import tasktree.persistence.store.NodeWrite;

/**
 * Orchestrates every structural change to the node forest.
 *
 * <p>The store has no transaction spanning an unbounded subtree, so each operation
 * decides its complete list of document writes up front and commits it as the fewest
 * bounded batches possible:
 * <ul>
 *   <li>create: new node and the parent's {@code childIds} union in one batch</li>
 *   <li>move: node, old parent, new parent in the first batch, then every descendant</li>
 *   <li>delete: descendants deepest first, then the node with its parent link</li>
 *   <li>duplicate: top copy with the parent link first, then the copied descendants</li>
 * </ul>
 * Every write is a full set, an idempotent array union/removal, or a field overwrite, so
 * re-running an operation after a {@link PartialBatchFailureException} converges.
 */
@Service
public class TreeMutator {

    private static final Logger LOG = LoggerFactory.getLogger(TreeMutator.class);

    static final String TITLE_REQUIRED = "Please enter a title.";
    static final String VISIBILITY_REQUIRED = "Please assign at least one class.";

    private static final Comparator<Node> SHALLOWEST_FIRST =
            Comparator.comparingInt(Node::depth).thenComparing(OrderNormalizer.SIBLING_ORDER);

    private final NodeStore store;
    private final BatchWriter batchWriter;
    private final PathResolver pathResolver;
    private final OrderNormalizer orderNormalizer;
    private final CascadePropagator cascadePropagator;
    private final PathTitleRefresher pathTitleRefresher;
    private final Clock clock;

    public TreeMutator(
            final NodeStore store,
            final BatchWriter batchWriter,
            final PathResolver pathResolver,
            final OrderNormalizer orderNormalizer,
            final CascadePropagator cascadePropagator,
            final PathTitleRefresher pathTitleRefresher,
            final Clock clock) {
        this.store = store;
        this.batchWriter = batchWriter;
        this.pathResolver = pathResolver;
        this.orderNormalizer = orderNormalizer;
        this.cascadePropagator = cascadePropagator;
        this.pathTitleRefresher = pathTitleRefresher;
        this.clock = clock;
    }

    // ==================== Reads ====================

    /**
     * @param id node id
     * @return the node
     * @throws ResourceNotFoundException if it does not exist
     */
    public Node getNode(final String id) {
        Validation.validateNotBlank(id, "id");
        return store.get(id).orElseThrow(() -> ResourceNotFoundException.node(id));
    }

    /**
     * Loads a node and all of its transitive descendants.
     *
     * @param id subtree root
     * @return the node and its descendants, shallowest first
     * @throws ResourceNotFoundException if the node does not exist
     */
    public SubtreeSnapshot loadWithDescendants(final String id) {
        final Node node = getNode(id);
        final List<Node> descendants = new ArrayList<>(store.query(NodeQuery.descendantsOf(id)));
        descendants.sort(SHALLOWEST_FIRST);
        return new SubtreeSnapshot(node, descendants);
    }

    // ==================== Create ====================

    /**
     * Creates a node, optionally under a parent, appended at the end of its sibling group.
     *
     * @param context  caller context (owner, active room)
     * @param draft    node content
     * @param autosave true for a silent autosave, which may persist an incomplete draft
     * @return the new node id
     * @throws NodeValidationException if an explicit save lacks a title or a room
     * @throws DanglingParentException if the parent does not exist
     */
    public String create(final MutationContext context, final NodeDraft draft, final boolean autosave) {
        Validation.validateNotNull(context, "context");
        Validation.validateNotNull(draft, "draft");

        final Set<String> visibility = new LinkedHashSet<>(draft.visibility());
        if (visibility.isEmpty() && context.activeScope() != null) {
            visibility.add(context.activeScope());
        }
        if (!autosave) {
            requireContent(draft.title(), visibility);
        }
        Validation.validateNoBlankEntries(visibility, "visibility");

        final String parentId = blankToNull(draft.parentId());
        final Node parent = parentId == null ? null : store.get(parentId).orElse(null);
        final String id = store.newId();
        final PathResolver.ResolvedPath resolved = pathResolver.resolve(id, parentId, parent);
        final int order = OrderNormalizer.nextAppendOrder(store.query(NodeQuery.siblingsOf(parentId)));
        final Instant now = clock.instant();

        final Node node = Node.builder(id, context.ownerId(), now)
                .kind(draft.kind())
                .title(draft.title())
                .description(draft.description())
                .parentId(parentId)
                .rootId(resolved.rootId())
                .path(resolved.path())
                .pathTitles(resolved.pathTitles())
                .order(order)
                .window(draft.window())
                .status(initialStatus(draft.status(), autosave))
                .visibility(visibility)
                .attachments(draft.attachments())
                .links(draft.links())
                .build();

        final List<NodeWrite> writes = new ArrayList<>(2);
        writes.add(NodeWrite.set(node));
        if (parentId != null) {
            writes.add(NodeWrite.update(parentId, NodePatch.create().addToArray(NodeField.CHILD_IDS, id)));
        }
        store.batchWrite(writes);
        LOG.info("Created {} {} under {} (order {}{})", node.getKind(), id,
                parentId == null ? "root group" : parentId, order, autosave ? ", autosave" : "");
        return id;
    }

    // ==================== Update ====================

    /**
     * Applies a field-level edit. A parent change is carried out as a {@link #move}.
     *
     * @param context  caller context
     * @param id       node to edit
     * @param update   fields to change
     * @param cascade  push window/status/visibility changes onto every descendant
     * @param autosave true for a silent autosave
     * @return the written node and the cascade outcome
     * @throws NodeValidationException if an explicit save would leave no title or no room
     */
    public UpdateResult update(
            final MutationContext context,
            final String id,
            final NodeUpdate update,
            final boolean cascade,
            final boolean autosave) {
        Validation.validateNotNull(context, "context");
        Validation.validateNotNull(update, "update");
        Node current = getNode(id);
        Node edited = edit(current, update, autosave);

        // content is validated before the move so a rejected save writes nothing
        if (update.has(NodeUpdate.Field.PARENT)
                && !Objects.equals(blankToNull(update.getParentId()), current.getParentId())) {
            move(context, id, update.getParentId());
            current = getNode(id);
            edited = edit(current, update, autosave);
        }

        final NodePatch patch = diff(current, edited);
        if (!patch.isEmpty()) {
            final Instant now = clock.instant();
            patch.set(NodeField.UPDATED_AT, now);
            edited.touch(now);
            store.update(id, patch);
            LOG.info("Updated {} fields {}", id, patch.touchedFields());
        }

        if (!Objects.equals(current.getTitle(), edited.getTitle()) && !edited.getChildIds().isEmpty()) {
            pathTitleRefresher.refresh(id, edited.getTitle());
        }

        if (!cascade) {
            return new UpdateResult(edited, null, null);
        }
        final Set<CascadeField> fields = cascadeFields(update, autosave);
        try {
            return new UpdateResult(edited, cascadePropagator.propagate(edited, fields), null);
        } catch (PartialBatchFailureException ex) {
            LOG.warn("Cascade from {} partially applied: {} updated, {} pending",
                    id, ex.getSucceededIds().size(), ex.getPendingIds().size());
            return new UpdateResult(edited, null, new UpdateResult.CascadeWarning(
                    "Saved, but only some nested items were updated.", ex.getSucceededIds(), ex.getPendingIds()));
        } catch (StoreUnavailableException ex) {
            LOG.warn("Cascade from {} failed before any descendant was updated", id, ex);
            final List<String> pending = cascadePropagator.findDescendants(edited).stream().map(Node::getId).toList();
            return new UpdateResult(edited, null, new UpdateResult.CascadeWarning(
                    "Saved, but nested items were not updated.", List.of(), pending));
        }
    }

    // ==================== Move ====================

    /**
     * Re-parents a node and rewrites the ancestor chain of its whole subtree.
     *
     * @param context     caller context
     * @param id          node to move
     * @param newParentId new parent (null or blank moves it to the root group)
     * @return what moved
     * @throws DanglingParentException if the new parent does not exist or lies inside the subtree
     * @throws PartialBatchFailureException if only part of the subtree was rewritten
     */
    public MoveResult move(final MutationContext context, final String id, final String newParentId) {
        Validation.validateNotNull(context, "context");
        final Node node = getNode(id);
        final String targetId = blankToNull(newParentId);
        final String previousParentId = node.getParentId();
        if (Objects.equals(targetId, previousParentId)) {
            return new MoveResult(id, previousParentId, targetId, List.of());
        }

        final Node newParent = targetId == null ? null : store.get(targetId).orElse(null);
        if (newParent != null && (targetId.equals(id) || newParent.isDescendantOf(id))) {
            throw new DanglingParentException(targetId, "Cannot move an item under itself or one of its own items.");
        }
        final PathResolver.ResolvedPath resolved = pathResolver.resolve(id, targetId, newParent);
        final List<Node> newSiblings = store.query(NodeQuery.siblingsOf(targetId));
        final int order = OrderNormalizer.nextAppendOrder(newSiblings);
        final Instant now = clock.instant();

        final List<NodeWrite> writes = new ArrayList<>();
        writes.add(NodeWrite.update(id, NodePatch.create()
                .set(NodeField.PARENT_ID, targetId)
                .set(NodeField.ROOT_ID, resolved.rootId())
                .set(NodeField.PATH, resolved.path())
                .set(NodeField.PATH_TITLES, resolved.pathTitles())
                .set(NodeField.ORDER, order)
                .set(NodeField.UPDATED_AT, now)));
        if (previousParentId != null && store.get(previousParentId).isPresent()) {
            writes.add(NodeWrite.update(previousParentId,
                    NodePatch.create().removeFromArray(NodeField.CHILD_IDS, id)));
        }
        if (targetId != null) {
            writes.add(NodeWrite.update(targetId, NodePatch.create().addToArray(NodeField.CHILD_IDS, id)));
        }

        final List<Node> descendants = store.query(NodeQuery.descendantsOf(id));
        final Map<String, String> titles = titlesOf(node, descendants);
        final List<String> rebased = new ArrayList<>(descendants.size());
        for (final Node descendant : descendants) {
            final PathResolver.ResolvedPath chain =
                    pathResolver.rebase(descendant, id, resolved, node.getTitle(), titles);
            writes.add(NodeWrite.update(descendant.getId(), NodePatch.create()
                    .set(NodeField.ROOT_ID, chain.rootId())
                    .set(NodeField.PATH, chain.path())
                    .set(NodeField.PATH_TITLES, chain.pathTitles())));
            rebased.add(descendant.getId());
        }

        batchWriter.commit("move " + id, writes);
        LOG.info("Moved {} from {} to {} with {} descendants", id,
                previousParentId == null ? "root group" : previousParentId,
                targetId == null ? "root group" : targetId, rebased.size());
        return new MoveResult(id, previousParentId, targetId, rebased);
    }

    // ==================== Reorder ====================

    /**
     * Swaps a node's order with its neighbour in the sibling group.
     *
     * @param context   caller context
     * @param id        node to shift
     * @param direction towards the first ({@code UP}) or last ({@code DOWN}) sibling
     * @return false if the node is already at that end of its group
     */
    public boolean reorder(final MutationContext context, final String id, final ReorderDirection direction) {
        Validation.validateNotNull(context, "context");
        Validation.validateNotNull(direction, "direction");
        final Node node = getNode(id);
        List<Node> siblings = store.query(NodeQuery.siblingsOf(node.getParentId()));
        if (!orderNormalizer.plan(siblings).assignments().isEmpty()) {
            orderNormalizer.normalizeGroup(node.getParentId());
            siblings = store.query(NodeQuery.siblingsOf(node.getParentId()));
        }
        final List<Node> sorted = new ArrayList<>(siblings);
        sorted.sort(OrderNormalizer.SIBLING_ORDER);

        int index = -1;
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).getId().equals(id)) {
                index = i;
                break;
            }
        }
        final int neighbourIndex = direction == ReorderDirection.UP ? index - 1 : index + 1;
        if (index < 0 || neighbourIndex < 0 || neighbourIndex >= sorted.size()) {
            return false;
        }

        final Node self = sorted.get(index);
        final Node neighbour = sorted.get(neighbourIndex);
        final Instant now = clock.instant();
        store.batchWrite(List.of(
                NodeWrite.update(self.getId(), NodePatch.create()
                        .set(NodeField.ORDER, neighbour.getOrder())
                        .set(NodeField.UPDATED_AT, now)),
                NodeWrite.update(neighbour.getId(), NodePatch.create()
                        .set(NodeField.ORDER, self.getOrder())
                        .set(NodeField.UPDATED_AT, now))));
        LOG.debug("Swapped order of {} and {}", self.getId(), neighbour.getId());
        return true;
    }

    // ==================== Delete ====================

    /**
     * Deletes a node, deleting or detaching its descendants according to the policy.
     *
     * @param context caller context
     * @param id      node to delete
     * @param policy  what happens to the descendants
     * @return what was deleted and which children became roots
     * @throws HasChildrenException if the node has children and the policy is {@code REJECT}
     * @throws PartialBatchFailureException if only part of the writes committed
     */
    public DeleteResult delete(final MutationContext context, final String id, final DescendantPolicy policy) {
        Validation.validateNotNull(context, "context");
        final SubtreeSnapshot subtree = loadWithDescendants(id);
        final Node node = subtree.node();
        final List<Node> descendants = subtree.descendants();
        final DescendantPolicy effective = policy == null ? DescendantPolicy.REJECT : policy;

        if (subtree.hasDescendants() && effective == DescendantPolicy.REJECT) {
            final long children = descendants.stream().filter(d -> id.equals(d.getParentId())).count();
            throw new HasChildrenException(id, (int) Math.max(children, node.getChildIds().size()));
        }

        final List<NodeWrite> unlink = new ArrayList<>(2);
        unlink.add(NodeWrite.delete(id));
        if (node.getParentId() != null && store.get(node.getParentId()).isPresent()) {
            unlink.add(NodeWrite.update(node.getParentId(),
                    NodePatch.create().removeFromArray(NodeField.CHILD_IDS, id)));
        }

        if (effective == DescendantPolicy.DELETE && subtree.hasDescendants()) {
            return deleteSubtree(id, descendants, unlink);
        }
        if (effective == DescendantPolicy.ORPHAN && subtree.hasDescendants()) {
            return orphanChildren(node, descendants, unlink);
        }
        store.batchWrite(unlink);
        LOG.info("Deleted {}", id);
        return new DeleteResult(id, List.of(id), List.of());
    }

    private DeleteResult deleteSubtree(final String id, final List<Node> descendants, final List<NodeWrite> unlink) {
        final List<Node> deepestFirst = new ArrayList<>(descendants);
        deepestFirst.sort(Comparator.comparingInt(Node::depth).reversed());
        final List<NodeWrite> deletes = deepestFirst.stream().map(d -> NodeWrite.delete(d.getId())).toList();

        final String operation = "delete " + id + " with descendants";
        final List<String> deleted = new ArrayList<>(batchWriter.commit(operation, deletes));
        try {
            store.batchWrite(unlink);
        } catch (RuntimeException ex) {
            throw new PartialBatchFailureException(operation, deleted,
                    unlink.stream().map(NodeWrite::id).toList(), ex);
        }
        deleted.add(id);
        LOG.info("Deleted {} and {} descendants", id, descendants.size());
        return new DeleteResult(id, deleted, List.of());
    }

    private DeleteResult orphanChildren(final Node node, final List<Node> descendants, final List<NodeWrite> unlink) {
        final String id = node.getId();
        final Map<String, String> titles = titlesOf(node, descendants);
        final List<Node> children = new ArrayList<>();
        final List<Node> deeper = new ArrayList<>();
        for (final Node descendant : descendants) {
            (id.equals(descendant.getParentId()) ? children : deeper).add(descendant);
        }
        children.sort(OrderNormalizer.SIBLING_ORDER);

        int nextRootOrder = OrderNormalizer.nextAppendOrder(store.query(NodeQuery.siblingsOf(null)));
        final Instant now = clock.instant();
        final List<NodeWrite> writes = new ArrayList<>(unlink);
        final List<String> orphaned = new ArrayList<>(children.size());
        for (final Node child : children) {
            writes.add(NodeWrite.update(child.getId(), NodePatch.create()
                    .set(NodeField.PARENT_ID, null)
                    .set(NodeField.ROOT_ID, child.getId())
                    .set(NodeField.PATH, List.of())
                    .set(NodeField.PATH_TITLES, List.of())
                    .set(NodeField.ORDER, nextRootOrder++)
                    .set(NodeField.UPDATED_AT, now)));
            orphaned.add(child.getId());
        }
        for (final Node descendant : deeper) {
            final PathResolver.ResolvedPath chain = pathResolver.detach(descendant, id, titles);
            writes.add(NodeWrite.update(descendant.getId(), NodePatch.create()
                    .set(NodeField.ROOT_ID, chain.rootId())
                    .set(NodeField.PATH, chain.path())
                    .set(NodeField.PATH_TITLES, chain.pathTitles())));
        }
        batchWriter.commit("delete " + id + " keeping descendants", writes);
        LOG.info("Deleted {}; {} children are now standalone", id, orphaned.size());
        return new DeleteResult(id, List.of(id), orphaned);
    }

    // ==================== Duplicate ====================

    /**
     * Deep-copies a node, optionally with its subtree.
     *
     * <p>Field handling per copy:
     * <ul>
     *   <li>copied: kind, title, description, ownerId, order (descendants), window, status,
     *       attachments, links</li>
     *   <li>recomputed: id, parentId, rootId, path, pathTitles, childIds, order (top copy)</li>
     *   <li>replaced when requested: visibility, title (top copy)</li>
     *   <li>reset: createdAt, updatedAt, questionHistory</li>
     * </ul>
     *
     * @param context caller context
     * @param id      node to copy
     * @param options copy options
     * @return the top copy's id and the full old-to-new id map
     * @throws DanglingParentException if the target parent does not exist
     */
    public DuplicationResult duplicate(final MutationContext context, final String id, final DuplicateOptions options) {
        Validation.validateNotNull(context, "context");
        final DuplicateOptions effective = options == null ? DuplicateOptions.nodeOnly() : options;
        final SubtreeSnapshot subtree = effective.includeDescendants()
                ? loadWithDescendants(id)
                : new SubtreeSnapshot(getNode(id), List.of());
        final Node source = subtree.node();

        final String targetParentId = effective.newParentId() == null
                ? source.getParentId()
                : blankToNull(effective.newParentId());
        final Node targetParent = targetParentId == null ? null : store.get(targetParentId).orElse(null);
        final Instant now = clock.instant();

        final Map<String, String> idMap = new LinkedHashMap<>();
        final Map<String, Node> copies = new LinkedHashMap<>();

        final String topId = store.newId();
        idMap.put(source.getId(), topId);
        final PathResolver.ResolvedPath topPath = pathResolver.resolve(topId, targetParentId, targetParent);
        final String title = effective.newTitle() == null || effective.newTitle().isBlank()
                ? source.getTitle()
                : effective.newTitle();
        final int topOrder = OrderNormalizer.nextAppendOrder(store.query(NodeQuery.siblingsOf(targetParentId)));
        copies.put(topId, copyOf(source, topId, title, targetParentId, topPath, topOrder, effective, now));

        // parents first: each descendant resolves against its parent's copy
        for (final Node descendant : subtree.descendants()) {
            final String copiedParentId = idMap.get(descendant.getParentId());
            if (copiedParentId == null) {
                LOG.warn("Skipping {} while duplicating {}: parent {} is not part of the subtree",
                        descendant.getId(), id, descendant.getParentId());
                continue;
            }
            final String copyId = store.newId();
            idMap.put(descendant.getId(), copyId);
            final PathResolver.ResolvedPath chain =
                    pathResolver.resolve(copyId, copiedParentId, copies.get(copiedParentId));
            copies.put(copyId, copyOf(descendant, copyId, descendant.getTitle(), copiedParentId, chain,
                    descendant.getOrder(), effective, now));
        }

        linkChildren(subtree, idMap, copies);

        final List<NodeWrite> writes = new ArrayList<>(copies.size() + 1);
        final Node top = copies.get(topId);
        writes.add(NodeWrite.set(top));
        if (targetParentId != null) {
            writes.add(NodeWrite.update(targetParentId, NodePatch.create().addToArray(NodeField.CHILD_IDS, topId)));
        }
        copies.values().stream().filter(copy -> copy != top).forEach(copy -> writes.add(NodeWrite.set(copy)));
        batchWriter.commit("duplicate " + id, writes);

        LOG.info("Duplicated {} as {} ({} nodes)", id, topId, copies.size());
        return new DuplicationResult(topId, idMap);
    }

    private Node copyOf(
            final Node source,
            final String copyId,
            final String title,
            final String parentId,
            final PathResolver.ResolvedPath resolved,
            final Integer order,
            final DuplicateOptions options,
            final Instant now) {
        return Node.builder(copyId, source.getOwnerId(), now)
                .updatedAt(now)
                .kind(source.getKind())
                .title(title)
                .description(source.getDescription())
                .parentId(parentId)
                .rootId(resolved.rootId())
                .path(resolved.path())
                .pathTitles(resolved.pathTitles())
                .order(order)
                .window(source.getWindow())
                .status(source.getStatus())
                .visibility(options.newVisibility() == null ? source.getVisibility() : options.newVisibility())
                .attachments(new ArrayList<>(source.getAttachments()))
                .links(new ArrayList<>(source.getLinks()))
                .questionHistory(List.of())
                .build();
    }

    /** Rebuilds childIds of every copy from the copies' parent links, in source order. */
    private static void linkChildren(
            final SubtreeSnapshot subtree,
            final Map<String, String> idMap,
            final Map<String, Node> copies) {
        final Map<String, Node> sources = new HashMap<>();
        subtree.allNodes().forEach(node -> sources.put(idMap.get(node.getId()), node));
        final Map<String, List<String>> childrenByParent = new HashMap<>();
        for (final Node copy : copies.values()) {
            if (copy.getParentId() != null && copies.containsKey(copy.getParentId())) {
                childrenByParent.computeIfAbsent(copy.getParentId(), key -> new ArrayList<>()).add(copy.getId());
            }
        }
        final Map<String, String> sourceIdByCopy = new HashMap<>();
        idMap.forEach((sourceId, copyId) -> sourceIdByCopy.put(copyId, sourceId));
        childrenByParent.forEach((parentCopyId, childCopyIds) -> {
            final List<String> sourceOrder = sources.get(parentCopyId).getChildIds();
            childCopyIds.sort(Comparator.comparingInt(childCopyId -> {
                final int index = sourceOrder.indexOf(sourceIdByCopy.get(childCopyId));
                return index < 0 ? Integer.MAX_VALUE : index;
            }));
            copies.get(parentCopyId).setChildIds(childCopyIds);
        });
    }

    // ==================== Helpers ====================

    private static void requireContent(final String title, final Set<String> visibility) {
        if (title == null || title.isBlank()) {
            throw new NodeValidationException(TITLE_REQUIRED);
        }
        if (visibility == null || visibility.isEmpty()) {
            throw new NodeValidationException(VISIBILITY_REQUIRED);
        }
    }

    private static NodeStatus initialStatus(final NodeStatus requested, final boolean autosave) {
        if (autosave) {
            return NodeStatus.DRAFT;
        }
        return requested == null || requested == NodeStatus.DRAFT ? NodeStatus.firstActive() : requested;
    }

    /**
     * Applies an update to a copy of {@code current} and validates the result without
     * writing anything.
     */
    private static Node edit(final Node current, final NodeUpdate update, final boolean autosave) {
        final Node edited = current.copy();
        applyFields(edited, update);
        if (update.has(NodeUpdate.Field.STATUS) && autosave) {
            // autosave never flips the status of a saved node
            edited.setStatus(current.getStatus());
        }
        if (!autosave) {
            requireContent(edited.getTitle(), edited.getVisibility());
            if (edited.getStatus() == NodeStatus.DRAFT) {
                edited.setStatus(NodeStatus.firstActive());
            }
        }
        Validation.validateNoBlankEntries(edited.getVisibility(), "visibility");
        return edited;
    }

    private static void applyFields(final Node node, final NodeUpdate update) {
        if (update.has(NodeUpdate.Field.KIND)) {
            node.setKind(update.getKind());
        }
        if (update.has(NodeUpdate.Field.TITLE)) {
            node.setTitle(update.getTitle());
        }
        if (update.has(NodeUpdate.Field.DESCRIPTION)) {
            node.setDescription(update.getDescription());
        }
        if (update.has(NodeUpdate.Field.WINDOW)) {
            node.setWindow(update.getWindow());
        }
        if (update.has(NodeUpdate.Field.STATUS)) {
            node.setStatus(update.getStatus());
        }
        if (update.has(NodeUpdate.Field.VISIBILITY)) {
            node.setVisibility(update.getVisibility());
        }
        if (update.has(NodeUpdate.Field.ATTACHMENTS)) {
            node.setAttachments(update.getAttachments());
        }
        if (update.has(NodeUpdate.Field.LINKS)) {
            node.setLinks(update.getLinks());
        }
    }

    private static NodePatch diff(final Node before, final Node after) {
        final NodePatch patch = NodePatch.create();
        if (before.getKind() != after.getKind()) {
            patch.set(NodeField.KIND, after.getKind());
        }
        if (!before.getTitle().equals(after.getTitle())) {
            patch.set(NodeField.TITLE, after.getTitle());
        }
        if (!before.getDescription().equals(after.getDescription())) {
            patch.set(NodeField.DESCRIPTION, after.getDescription());
        }
        if (!Objects.equals(before.getWindow(), after.getWindow())) {
            patch.set(NodeField.WINDOW, after.getWindow());
        }
        if (before.getStatus() != after.getStatus()) {
            patch.set(NodeField.STATUS, after.getStatus());
        }
        if (!before.getVisibility().equals(after.getVisibility())) {
            patch.set(NodeField.VISIBILITY, new ArrayList<>(after.getVisibility()));
        }
        if (!before.getAttachments().equals(after.getAttachments())) {
            patch.set(NodeField.ATTACHMENTS, after.getAttachments());
        }
        if (!before.getLinks().equals(after.getLinks())) {
            patch.set(NodeField.LINKS, after.getLinks());
        }
        return patch;
    }

    /** Fields the caller asked to push down, minus a status the autosave discarded. */
    private static Set<CascadeField> cascadeFields(final NodeUpdate update, final boolean autosave) {
        final Set<CascadeField> fields = EnumSet.noneOf(CascadeField.class);
        if (update.has(NodeUpdate.Field.WINDOW)) {
            fields.add(CascadeField.WINDOW);
        }
        if (update.has(NodeUpdate.Field.STATUS) && !autosave) {
            fields.add(CascadeField.STATUS);
        }
        if (update.has(NodeUpdate.Field.VISIBILITY)) {
            fields.add(CascadeField.VISIBILITY);
        }
        return fields;
    }

    private static Map<String, String> titlesOf(final Node node, final List<Node> descendants) {
        final Map<String, String> titles = new HashMap<>();
        titles.put(node.getId(), node.getTitle());
        descendants.forEach(descendant -> titles.put(descendant.getId(), descendant.getTitle()));
        return titles;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
