package tasktree.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single project, assignment, task, or subtask record.
 *
 * <p>Nodes are persisted as flat, independent documents. The hierarchy is encoded only
 * through the denormalized fields:
 * <ul>
 *   <li>{@code parentId}: direct parent, null for a forest root</li>
 *   <li>{@code rootId}: topmost ancestor, or the node itself when it is a root</li>
 *   <li>{@code path}/{@code pathTitles}: ancestor ids and titles, root first, excluding self</li>
 *   <li>{@code childIds}: direct children, mirrored by each child's {@code parentId}</li>
 *   <li>{@code order}: sort key within the sibling group</li>
 * </ul>
 *
 * <p>The object itself enforces only identity rules (id and owner are required and
 * immutable, list fields never contain nulls). Tree invariants are maintained by
 * {@link tasktree.service.TreeMutator}, which writes all hierarchy fields of a node in
 * the same logical operation.
 *
 * <p>All collection getters return unmodifiable views; setters store defensive copies,
 * so two nodes never share a mutable list.
 */
public final class Node {

    private final String id;
    private final String ownerId;
    private final Instant createdAt;

    private NodeKind kind;
    private String title;
    private String description;
    private String parentId;
    private String rootId;
    private List<String> path;
    private List<String> pathTitles;
    private List<String> childIds;
    private Integer order;
    private DateWindow window;
    private NodeStatus status;
    private Set<String> visibility;
    private List<Attachment> attachments;
    private List<LinkAttachment> links;
    private List<QuestionEntry> questionHistory;
    private Instant updatedAt;

    private Node(final Builder builder) {
        this.id = Validation.validateTrimmed(builder.id, "id");
        this.ownerId = Validation.validateTrimmed(builder.ownerId, "ownerId");
        this.createdAt = Validation.validateNotNull(builder.createdAt, "createdAt");
        this.updatedAt = builder.updatedAt == null ? builder.createdAt : builder.updatedAt;
        this.kind = builder.kind == null ? NodeKind.TASK : builder.kind;
        this.title = normalizeText(builder.title);
        this.description = normalizeText(builder.description);
        this.parentId = builder.parentId;
        this.rootId = builder.rootId;
        this.path = copyIds(builder.path, "path");
        this.pathTitles = copyList(builder.pathTitles);
        this.childIds = copyIds(builder.childIds, "childIds");
        this.order = builder.order;
        this.window = builder.window;
        this.status = builder.status == null ? NodeStatus.TODO : builder.status;
        this.visibility = copyVisibility(builder.visibility);
        this.attachments = copyList(builder.attachments);
        this.links = copyList(builder.links);
        this.questionHistory = copyList(builder.questionHistory);
    }

    /**
     * Starts a builder for a node with the given identity.
     *
     * @param id        node id (required)
     * @param ownerId   creating teacher (required)
     * @param createdAt creation time (required)
     * @return a new builder
     */
    public static Builder builder(final String id, final String ownerId, final Instant createdAt) {
        return new Builder(id, ownerId, createdAt);
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getParentId() {
        return parentId;
    }

    public String getRootId() {
        return rootId;
    }

    /**
     * Root of this node's tree, falling back to the node's own id when {@code rootId}
     * was never written (legacy roots).
     *
     * @return effective root id
     */
    public String effectiveRootId() {
        return rootId == null || rootId.isBlank() ? id : rootId;
    }

    public List<String> getPath() {
        return Collections.unmodifiableList(path);
    }

    public List<String> getPathTitles() {
        return Collections.unmodifiableList(pathTitles);
    }

    public List<String> getChildIds() {
        return Collections.unmodifiableList(childIds);
    }

    public Integer getOrder() {
        return order;
    }

    public DateWindow getWindow() {
        return window;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public Set<String> getVisibility() {
        return Collections.unmodifiableSet(visibility);
    }

    public List<Attachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public List<LinkAttachment> getLinks() {
        return Collections.unmodifiableList(links);
    }

    public List<QuestionEntry> getQuestionHistory() {
        return Collections.unmodifiableList(questionHistory);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * @return number of ancestors, 0 for a root
     */
    public int depth() {
        return path.size();
    }

    /**
     * @param ancestorId candidate ancestor id
     * @return true if {@code ancestorId} appears in this node's ancestor chain
     */
    public boolean isDescendantOf(final String ancestorId) {
        return ancestorId != null && path.contains(ancestorId);
    }

    /**
     * Breadcrumb text rendered from the cached ancestor titles.
     *
     * @return ancestor titles joined with arrows, empty for a root
     */
    public String breadcrumb() {
        return String.join(" → ", pathTitles);
    }

    public void setKind(final NodeKind kind) {
        this.kind = kind == null ? NodeKind.TASK : kind;
    }

    public void setTitle(final String title) {
        this.title = normalizeText(title);
    }

    public void setDescription(final String description) {
        this.description = normalizeText(description);
    }

    /**
     * Replaces every hierarchy pointer at once so they never drift apart on the object.
     *
     * @param newParentId   parent id (null for a root)
     * @param newRootId     root of the tree
     * @param newPath       ancestor ids, root first
     * @param newPathTitles ancestor titles, parallel to {@code newPath}
     */
    public void relocate(
            final String newParentId,
            final String newRootId,
            final List<String> newPath,
            final List<String> newPathTitles) {
        this.parentId = newParentId;
        this.rootId = newRootId;
        this.path = copyIds(newPath, "path");
        this.pathTitles = copyList(newPathTitles);
    }

    public void setPathTitles(final List<String> pathTitles) {
        this.pathTitles = copyList(pathTitles);
    }

    public void setChildIds(final List<String> childIds) {
        this.childIds = copyIds(childIds, "childIds");
    }

    public void setOrder(final Integer order) {
        this.order = order;
    }

    public void setWindow(final DateWindow window) {
        this.window = window;
    }

    public void setStatus(final NodeStatus status) {
        this.status = status == null ? NodeStatus.TODO : status;
    }

    public void setVisibility(final Collection<String> visibility) {
        this.visibility = copyVisibility(visibility);
    }

    public void setAttachments(final List<Attachment> attachments) {
        this.attachments = copyList(attachments);
    }

    public void setLinks(final List<LinkAttachment> links) {
        this.links = copyList(links);
    }

    public void setQuestionHistory(final List<QuestionEntry> questionHistory) {
        this.questionHistory = copyList(questionHistory);
    }

    public void touch(final Instant when) {
        this.updatedAt = Validation.validateNotNull(when, "updatedAt");
    }

    /**
     * Creates an independent copy of this node with the same identity.
     *
     * @return a new Node with equal field values and no shared mutable state
     */
    public Node copy() {
        return toBuilder().build();
    }

    /**
     * @return a builder pre-populated with this node's values
     */
    public Builder toBuilder() {
        return builder(id, ownerId, createdAt)
                .updatedAt(updatedAt)
                .kind(kind)
                .title(title)
                .description(description)
                .parentId(parentId)
                .rootId(rootId)
                .path(path)
                .pathTitles(pathTitles)
                .childIds(childIds)
                .order(order)
                .window(window)
                .status(status)
                .visibility(visibility)
                .attachments(attachments)
                .links(links)
                .questionHistory(questionHistory);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Node node)) {
            return false;
        }
        return id.equals(node.id)
                && ownerId.equals(node.ownerId)
                && createdAt.equals(node.createdAt)
                && Objects.equals(updatedAt, node.updatedAt)
                && kind == node.kind
                && title.equals(node.title)
                && description.equals(node.description)
                && Objects.equals(parentId, node.parentId)
                && Objects.equals(rootId, node.rootId)
                && path.equals(node.path)
                && pathTitles.equals(node.pathTitles)
                && childIds.equals(node.childIds)
                && Objects.equals(order, node.order)
                && Objects.equals(window, node.window)
                && status == node.status
                && visibility.equals(node.visibility)
                && attachments.equals(node.attachments)
                && links.equals(node.links)
                && questionHistory.equals(node.questionHistory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, ownerId, createdAt, parentId, order, status);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', kind=" + kind + ", title='" + title
                + "', parentId=" + parentId + ", order=" + order + '}';
    }

    private static String normalizeText(final String value) {
        return value == null ? "" : value.trim();
    }

    private static List<String> copyIds(final Collection<String> ids, final String label) {
        if (ids == null) {
            return new ArrayList<>();
        }
        Validation.validateNoBlankEntries(ids, label);
        return new ArrayList<>(ids);
    }

    private static <T> List<T> copyList(final Collection<T> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        final List<T> copy = new ArrayList<>(values.size());
        for (final T value : values) {
            copy.add(Objects.requireNonNull(value, "list entries must not be null"));
        }
        return copy;
    }

    private static Set<String> copyVisibility(final Collection<String> rooms) {
        if (rooms == null) {
            return new LinkedHashSet<>();
        }
        Validation.validateNoBlankEntries(rooms, "visibility");
        final Set<String> copy = new LinkedHashSet<>();
        for (final String room : rooms) {
            copy.add(room.trim());
        }
        return copy;
    }

    /**
     * Step builder used for creation, duplication, and reconstitution from documents.
     */
    public static final class Builder {

        private final String id;
        private final String ownerId;
        private final Instant createdAt;
        private Instant updatedAt;
        private NodeKind kind;
        private String title;
        private String description;
        private String parentId;
        private String rootId;
        private Collection<String> path;
        private Collection<String> pathTitles;
        private Collection<String> childIds;
        private Integer order;
        private DateWindow window;
        private NodeStatus status;
        private Collection<String> visibility;
        private Collection<Attachment> attachments;
        private Collection<LinkAttachment> links;
        private Collection<QuestionEntry> questionHistory;

        private Builder(final String id, final String ownerId, final Instant createdAt) {
            this.id = id;
            this.ownerId = ownerId;
            this.createdAt = createdAt;
        }

        public Builder updatedAt(final Instant value) {
            this.updatedAt = value;
            return this;
        }

        public Builder kind(final NodeKind value) {
            this.kind = value;
            return this;
        }

        public Builder title(final String value) {
            this.title = value;
            return this;
        }

        public Builder description(final String value) {
            this.description = value;
            return this;
        }

        public Builder parentId(final String value) {
            this.parentId = value;
            return this;
        }

        public Builder rootId(final String value) {
            this.rootId = value;
            return this;
        }

        public Builder path(final Collection<String> value) {
            this.path = value;
            return this;
        }

        public Builder pathTitles(final Collection<String> value) {
            this.pathTitles = value;
            return this;
        }

        public Builder childIds(final Collection<String> value) {
            this.childIds = value;
            return this;
        }

        public Builder order(final Integer value) {
            this.order = value;
            return this;
        }

        public Builder window(final DateWindow value) {
            this.window = value;
            return this;
        }

        public Builder status(final NodeStatus value) {
            this.status = value;
            return this;
        }

        public Builder visibility(final Collection<String> value) {
            this.visibility = value;
            return this;
        }

        public Builder attachments(final Collection<Attachment> value) {
            this.attachments = value;
            return this;
        }

        public Builder links(final Collection<LinkAttachment> value) {
            this.links = value;
            return this;
        }

        public Builder questionHistory(final Collection<QuestionEntry> value) {
            this.questionHistory = value;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
