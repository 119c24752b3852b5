package tasktree.service;

import java.util.List;

/**
 * @param nodeId      deleted node
 * @param deletedIds  every removed document, deepest first, the node itself last
 * @param orphanedIds former direct children that are now roots
 */
public record DeleteResult(String nodeId, List<String> deletedIds, List<String> orphanedIds) {

    public DeleteResult {
        deletedIds = List.copyOf(deletedIds);
        orphanedIds = List.copyOf(orphanedIds);
    }
}
