package tasktree.api.dto;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import tasktree.domain.Attachment;
import tasktree.domain.LinkAttachment;
import tasktree.domain.Node;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;

/**
 * Response DTO for a node.
 *
 * <p>Question history is exposed through the question endpoints; only the number of
 * open questions is included here.
 *
 * @param id            node id
 * @param kind          descriptive kind
 * @param ownerId       creating teacher
 * @param title         display title
 * @param description   free text
 * @param parentId      parent (null for a root)
 * @param rootId        topmost ancestor
 * @param path          ancestor ids, root first
 * @param pathTitles    ancestor titles
 * @param childIds      direct children
 * @param order         sibling sort key
 * @param startDate     window start
 * @param endDate       window end
 * @param status        lifecycle status
 * @param visibility    rooms
 * @param attachments   file attachments
 * @param links         link attachments
 * @param openQuestions unresolved help requests
 * @param createdAt     creation time
 * @param updatedAt     last change
 */
public record NodeResponse(
        String id,
        NodeKind kind,
        String ownerId,
        String title,
        String description,
        String parentId,
        String rootId,
        List<String> path,
        List<String> pathTitles,
        List<String> childIds,
        Integer order,
        LocalDate startDate,
        LocalDate endDate,
        NodeStatus status,
        List<String> visibility,
        List<Attachment> attachments,
        List<LinkAttachment> links,
        int openQuestions,
        Instant createdAt,
        Instant updatedAt
) {
    /**
     * @param node the domain object to convert (must not be null)
     * @return a new NodeResponse
     * @throws NullPointerException if node is null
     */
    public static NodeResponse from(final Node node) {
        Objects.requireNonNull(node, "node must not be null");
        return new NodeResponse(
                node.getId(),
                node.getKind(),
                node.getOwnerId(),
                node.getTitle(),
                node.getDescription(),
                node.getParentId(),
                node.effectiveRootId(),
                node.getPath(),
                node.getPathTitles(),
                node.getChildIds(),
                node.getOrder(),
                node.getWindow() == null ? null : node.getWindow().start(),
                node.getWindow() == null ? null : node.getWindow().end(),
                node.getStatus(),
                new ArrayList<>(node.getVisibility()),
                node.getAttachments(),
                node.getLinks(),
                (int) node.getQuestionHistory().stream().filter(entry -> !entry.resolved()).count(),
                node.getCreatedAt(),
                node.getUpdatedAt()
        );
    }
}
