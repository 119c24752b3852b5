package tasktree.api.dto;

import java.util.Map;
import java.util.Objects;
import tasktree.service.DuplicationResult;

/**
 * @param newRootId id of the top copy, for immediate navigation
 * @param idMap     source id to copy id
 */
public record DuplicateResponse(String newRootId, Map<String, String> idMap) {

    public static DuplicateResponse from(final DuplicationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return new DuplicateResponse(result.newRootId(), result.idMap());
    }
}
