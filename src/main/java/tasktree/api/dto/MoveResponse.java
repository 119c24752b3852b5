package tasktree.api.dto;

import java.util.List;
import java.util.Objects;
import tasktree.service.MoveResult;

/**
 * @param nodeId             moved node
 * @param previousParentId   former parent
 * @param newParentId        new parent
 * @param rebasedDescendants descendants whose ancestor chain was rewritten
 */
public record MoveResponse(String nodeId, String previousParentId, String newParentId, List<String> rebasedDescendants) {

    public static MoveResponse from(final MoveResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return new MoveResponse(result.nodeId(), result.previousParentId(), result.newParentId(),
                result.rebasedDescendants());
    }
}
