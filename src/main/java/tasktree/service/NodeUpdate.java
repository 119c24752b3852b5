package tasktree.service;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import tasktree.domain.Attachment;
import tasktree.domain.DateWindow;
import tasktree.domain.LinkAttachment;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;

/**
 * Field-level edit of an existing node. Only fields that were explicitly set are
 * changed; a set value of {@code null} clears the window.
 */
public final class NodeUpdate {

    private NodeKind kind;
    private String title;
    private String description;
    private DateWindow window;
    private NodeStatus status;
    private Set<String> visibility;
    private List<Attachment> attachments;
    private List<LinkAttachment> links;
    private String parentId;
    private final Set<Field> touched = EnumSet.noneOf(Field.class);

    /** Editable fields. */
    public enum Field {
        KIND, TITLE, DESCRIPTION, WINDOW, STATUS, VISIBILITY, ATTACHMENTS, LINKS, PARENT
    }

    private NodeUpdate() {
    }

    public static NodeUpdate create() {
        return new NodeUpdate();
    }

    public NodeUpdate kind(final NodeKind value) {
        this.kind = value;
        touched.add(Field.KIND);
        return this;
    }

    public NodeUpdate title(final String value) {
        this.title = value;
        touched.add(Field.TITLE);
        return this;
    }

    public NodeUpdate description(final String value) {
        this.description = value;
        touched.add(Field.DESCRIPTION);
        return this;
    }

    public NodeUpdate window(final DateWindow value) {
        this.window = value;
        touched.add(Field.WINDOW);
        return this;
    }

    public NodeUpdate status(final NodeStatus value) {
        this.status = value;
        touched.add(Field.STATUS);
        return this;
    }

    public NodeUpdate visibility(final Set<String> value) {
        this.visibility = value == null ? Set.of() : new LinkedHashSet<>(value);
        touched.add(Field.VISIBILITY);
        return this;
    }

    public NodeUpdate attachments(final List<Attachment> value) {
        this.attachments = value == null ? List.of() : List.copyOf(value);
        touched.add(Field.ATTACHMENTS);
        return this;
    }

    public NodeUpdate links(final List<LinkAttachment> value) {
        this.links = value == null ? List.of() : List.copyOf(value);
        touched.add(Field.LINKS);
        return this;
    }

    /**
     * Re-parents the node as part of the update (null moves it to the root group).
     *
     * @param value new parent id
     * @return this update
     */
    public NodeUpdate parentId(final String value) {
        this.parentId = value;
        touched.add(Field.PARENT);
        return this;
    }

    public boolean has(final Field field) {
        return touched.contains(field);
    }

    public boolean isEmpty() {
        return touched.isEmpty();
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

    public DateWindow getWindow() {
        return window;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public Set<String> getVisibility() {
        return visibility;
    }

    public List<Attachment> getAttachments() {
        return attachments;
    }

    public List<LinkAttachment> getLinks() {
        return links;
    }

    public String getParentId() {
        return parentId;
    }

    @Override
    public String toString() {
        return "NodeUpdate" + touched;
    }
}
