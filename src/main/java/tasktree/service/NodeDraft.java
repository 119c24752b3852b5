package tasktree.service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import tasktree.domain.Attachment;
import tasktree.domain.DateWindow;
import tasktree.domain.LinkAttachment;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;

/**
 * Content of a node that is about to be created.
 *
 * @param kind        descriptive kind (null means task)
 * @param title       display title (may be blank only for autosaved drafts)
 * @param description free text
 * @param parentId    parent to attach to (null creates a root)
 * @param window      visibility window (nullable)
 * @param status      requested status (nullable)
 * @param visibility  rooms the node is shown to
 * @param attachments file attachments
 * @param links       link attachments
 */
public record NodeDraft(
        NodeKind kind,
        String title,
        String description,
        String parentId,
        DateWindow window,
        NodeStatus status,
        Set<String> visibility,
        List<Attachment> attachments,
        List<LinkAttachment> links) {

    public NodeDraft {
        visibility = visibility == null ? Set.of() : new LinkedHashSet<>(visibility);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        links = links == null ? List.of() : List.copyOf(links);
    }

    /**
     * Minimal draft for a task.
     *
     * @param title      title
     * @param parentId   parent id (nullable)
     * @param visibility rooms
     * @return the draft
     */
    public static NodeDraft of(final String title, final String parentId, final Set<String> visibility) {
        return new NodeDraft(NodeKind.TASK, title, null, parentId, null, null, visibility, null, null);
    }
}
