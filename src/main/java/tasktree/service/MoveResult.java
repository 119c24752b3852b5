package tasktree.service;

import java.util.List;
import java.util.Objects;

/**
 * @param nodeId            moved node
 * @param previousParentId  parent before the move (null for a root)
 * @param newParentId       parent after the move (null for a root)
 * @param rebasedDescendants descendants whose ancestor chain was rewritten
 */
public record MoveResult(String nodeId, String previousParentId, String newParentId, List<String> rebasedDescendants) {

    public MoveResult {
        rebasedDescendants = List.copyOf(rebasedDescendants);
    }

    public boolean moved() {
        return !Objects.equals(previousParentId, newParentId);
    }
}
