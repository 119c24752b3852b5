package tasktree.api.dto;

import jakarta.validation.constraints.Size;
import java.util.Set;
import tasktree.service.DuplicateOptions;

/**
 * @param includeDescendants copy the whole subtree
 * @param newParentId        parent of the copy (null keeps the source's parent)
 * @param newVisibility      rooms of the copies (null keeps the source's rooms)
 * @param newTitle           title of the top copy, e.g. with a "(Copy)" marker
 */
public record DuplicateRequest(
        boolean includeDescendants,
        String newParentId,
        Set<String> newVisibility,
        @Size(max = 200, message = "newTitle must be at most {max} characters")
        String newTitle
) {
    public DuplicateOptions toOptions() {
        return new DuplicateOptions(includeDescendants, newParentId, newVisibility, newTitle);
    }
}
