package tasktree.api.dto;

import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import tasktree.domain.Attachment;
import tasktree.domain.LinkAttachment;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;
import tasktree.service.NodeUpdate;

/**
 * Request body for a partial update. Absent (null) fields are left unchanged.
 *
 * @param kind        new kind
 * @param title       new title
 * @param description new description
 * @param startDate   new window start (set together with endDate)
 * @param endDate     new window end
 * @param clearWindow true removes the window
 * @param status      new status
 * @param visibility  new rooms
 * @param attachments new attachment list
 * @param links       new link list
 * @param parentId    new parent; moves the node and its subtree
 * @param moveToRoot  true detaches the node to the root group
 */
public record NodeUpdateRequest(
        NodeKind kind,
        @Size(max = 200, message = "title must be at most {max} characters")
        String title,
        @Size(max = 5000, message = "description must be at most {max} characters")
        String description,
        LocalDate startDate,
        LocalDate endDate,
        boolean clearWindow,
        NodeStatus status,
        Set<String> visibility,
        List<Attachment> attachments,
        List<LinkAttachment> links,
        String parentId,
        boolean moveToRoot
) {
    public NodeUpdate toUpdate() {
        final NodeUpdate update = NodeUpdate.create();
        if (kind != null) {
            update.kind(kind);
        }
        if (title != null) {
            update.title(title);
        }
        if (description != null) {
            update.description(description);
        }
        if (clearWindow) {
            update.window(null);
        } else if (startDate != null || endDate != null) {
            update.window(NodeRequest.windowOf(startDate, endDate));
        }
        if (status != null) {
            update.status(status);
        }
        if (visibility != null) {
            update.visibility(visibility);
        }
        if (attachments != null) {
            update.attachments(attachments);
        }
        if (links != null) {
            update.links(links);
        }
        if (moveToRoot) {
            update.parentId(null);
        } else if (parentId != null) {
            update.parentId(parentId);
        }
        return update;
    }
}
