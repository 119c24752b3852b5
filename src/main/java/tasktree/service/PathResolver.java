package tasktree.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import tasktree.api.exception.DanglingParentException;
import tasktree.domain.Node;
import tasktree.domain.Validation;

/**
 * Computes ancestor chains ({@code path}, {@code pathTitles}) and the tree root for a
 * node from its parent.
 *
 * <p>Pure and synchronous: it only computes values, the caller persists them.
 */
@Component
public class PathResolver {

    /**
     * Hierarchy fields derived from a parent.
     *
     * @param path       ancestor ids, root first, excluding the node itself
     * @param pathTitles ancestor titles, parallel to {@code path}
     * @param rootId     topmost ancestor, or the node itself for a root
     */
    public record ResolvedPath(List<String> path, List<String> pathTitles, String rootId) {

        public ResolvedPath {
            path = List.copyOf(path);
            pathTitles = List.copyOf(pathTitles);
        }
    }

    /**
     * Resolves the hierarchy fields of {@code childId} placed under {@code parentId}.
     *
     * @param childId  id of the node being placed
     * @param parentId candidate parent id (null for a root)
     * @param parent   the already loaded parent record (null when absent)
     * @return path, titles and root for the child
     * @throws DanglingParentException if {@code parentId} is set but the parent is missing
     */
    public ResolvedPath resolve(final String childId, final String parentId, final Node parent) {
        Validation.validateNotBlank(childId, "childId");
        if (parentId == null) {
            return new ResolvedPath(List.of(), List.of(), childId);
        }
        if (parent == null) {
            throw DanglingParentException.missing(parentId);
        }
        if (!parentId.equals(parent.getId())) {
            throw new IllegalArgumentException("parent record " + parent.getId() + " does not match parentId " + parentId);
        }
        final List<String> path = new ArrayList<>(parent.getPath());
        path.add(parentId);
        final List<String> titles = new ArrayList<>(parent.getPathTitles());
        titles.add(parent.getTitle());
        return new ResolvedPath(path, titles, parent.effectiveRootId());
    }

    /**
     * Re-derives a descendant's hierarchy after one of its ancestors was placed somewhere
     * else. The part of the chain below {@code anchorId} is kept as is.
     *
     * @param descendant  node below the anchor
     * @param anchorId    ancestor whose position changed
     * @param anchorPath  the anchor's new hierarchy fields
     * @param anchorTitle the anchor's title
     * @param titlesById  current titles of subtree members, used to refresh cached titles
     * @return the descendant's new hierarchy fields
     */
    public ResolvedPath rebase(
            final Node descendant,
            final String anchorId,
            final ResolvedPath anchorPath,
            final String anchorTitle,
            final Map<String, String> titlesById) {
        final int anchorIndex = descendant.getPath().indexOf(anchorId);
        if (anchorIndex < 0) {
            throw new IllegalArgumentException(descendant.getId() + " is not below " + anchorId);
        }
        final List<String> path = new ArrayList<>(anchorPath.path());
        path.add(anchorId);
        final List<String> titles = new ArrayList<>(anchorPath.pathTitles());
        titles.add(anchorTitle);
        appendSuffix(descendant, anchorIndex + 1, titlesById, path, titles);
        return new ResolvedPath(path, titles, anchorPath.rootId());
    }

    /**
     * Hierarchy of a descendant once {@code removedAncestorId} is gone and the subtree
     * below it becomes standalone. Direct children of the removed node become roots.
     *
     * @param descendant        node below the removed ancestor
     * @param removedAncestorId ancestor being removed
     * @param titlesById        current titles of subtree members
     * @return the detached hierarchy fields
     */
    public ResolvedPath detach(
            final Node descendant,
            final String removedAncestorId,
            final Map<String, String> titlesById) {
        final int removedIndex = descendant.getPath().indexOf(removedAncestorId);
        if (removedIndex < 0) {
            throw new IllegalArgumentException(descendant.getId() + " is not below " + removedAncestorId);
        }
        final List<String> path = new ArrayList<>();
        final List<String> titles = new ArrayList<>();
        appendSuffix(descendant, removedIndex + 1, titlesById, path, titles);
        final String rootId = path.isEmpty() ? descendant.getId() : path.get(0);
        return new ResolvedPath(path, titles, rootId);
    }

    /**
     * The parent id implied by a resolved path.
     *
     * @param resolved resolved path
     * @return last ancestor, or null for a root
     */
    public static String parentOf(final ResolvedPath resolved) {
        final List<String> path = resolved.path();
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    private static void appendSuffix(
            final Node descendant,
            final int fromIndex,
            final Map<String, String> titlesById,
            final List<String> path,
            final List<String> titles) {
        final List<String> oldPath = descendant.getPath();
        final List<String> oldTitles = descendant.getPathTitles();
        for (int i = fromIndex; i < oldPath.size(); i++) {
            final String ancestorId = oldPath.get(i);
            path.add(ancestorId);
            String title = titlesById.get(ancestorId);
            if (title == null) {
                title = i < oldTitles.size() ? oldTitles.get(i) : "";
            }
            titles.add(title);
        }
    }
}
