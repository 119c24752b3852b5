package tasktree.persistence.document;

import java.time.Instant;
import java.util.List;
import tasktree.domain.Attachment;
import tasktree.domain.DateWindow;
import tasktree.domain.LinkAttachment;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;
import tasktree.domain.QuestionEntry;

/**
 * Persisted shape of a node: one flat record, no nested tree.
 *
 * <p>The only hierarchy signals on disk are {@code parentId}, {@code rootId},
 * {@code path}, {@code pathTitles}, {@code childIds} and {@code order}.
 */
public record NodeDocument(
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
        DateWindow window,
        NodeStatus status,
        List<String> visibility,
        List<Attachment> attachments,
        List<LinkAttachment> links,
        List<QuestionEntry> questionHistory,
        Instant createdAt,
        Instant updatedAt) {
}
