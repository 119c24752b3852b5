package tasktree.api.dto;

import java.util.List;
import java.util.Objects;
import tasktree.service.DeleteResult;

/**
 * @param deletedIds  removed documents
 * @param orphanedIds former children that are now standalone items
 */
public record DeleteResponse(List<String> deletedIds, List<String> orphanedIds) {

    public static DeleteResponse from(final DeleteResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return new DeleteResponse(result.deletedIds(), result.orphanedIds());
    }
}
