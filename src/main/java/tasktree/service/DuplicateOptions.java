package tasktree.service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options for duplicating a node.
 *
 * @param includeDescendants copy the whole subtree instead of the node alone
 * @param newParentId        parent of the copy (null keeps the source's parent)
 * @param newVisibility      replaces the copied visibility when not null
 * @param newTitle           replaces the copied title of the top copy when not blank;
 *                           callers use it to append a "(Copy)" marker
 */
public record DuplicateOptions(
        boolean includeDescendants,
        String newParentId,
        Set<String> newVisibility,
        String newTitle) {

    public DuplicateOptions {
        newVisibility = newVisibility == null ? null : new LinkedHashSet<>(newVisibility);
    }

    public static DuplicateOptions nodeOnly() {
        return new DuplicateOptions(false, null, null, null);
    }

    public static DuplicateOptions withDescendants() {
        return new DuplicateOptions(true, null, null, null);
    }
}
