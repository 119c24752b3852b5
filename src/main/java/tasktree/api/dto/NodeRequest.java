package tasktree.api.dto;

import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import tasktree.domain.Attachment;
import tasktree.domain.DateWindow;
import tasktree.domain.LinkAttachment;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;
import tasktree.service.NodeDraft;

/**
 * Request body for creating a node.
 *
 * <p>Title and visibility are not annotated as required: autosaved drafts may be
 * incomplete, and explicit saves are checked by the tree mutator with actionable
 * messages.
 *
 * @param kind        project, assignment, task, or subtask (defaults to task)
 * @param title       display title
 * @param description free text
 * @param parentId    parent to attach to (null creates a root)
 * @param startDate   first visible day (nullable)
 * @param endDate     last visible day (nullable)
 * @param status      requested status
 * @param visibility  rooms the node is shown to
 * @param attachments file attachments
 * @param links       link attachments
 */
public record NodeRequest(
        NodeKind kind,
        @Size(max = 200, message = "title must be at most {max} characters")
        String title,
        @Size(max = 5000, message = "description must be at most {max} characters")
        String description,
        String parentId,
        LocalDate startDate,
        LocalDate endDate,
        NodeStatus status,
        Set<String> visibility,
        List<Attachment> attachments,
        List<LinkAttachment> links
) {
    public NodeDraft toDraft() {
        return new NodeDraft(kind, title, description, parentId, windowOf(startDate, endDate),
                status, visibility, attachments, links);
    }

    static DateWindow windowOf(final LocalDate start, final LocalDate end) {
        return start == null && end == null ? null : new DateWindow(start, end);
    }
}
