package tasktree.persistence.store;

import tasktree.domain.Node;

/**
 * One document write inside a batch.
 *
 * @param type  kind of write
 * @param id    target document id
 * @param node  full document for {@link Type#SET}, otherwise null
 * @param patch field changes for {@link Type#UPDATE}, otherwise null
 */
public record NodeWrite(Type type, String id, Node node, NodePatch patch) {

    /**
     * Write kinds a batch may contain.
     */
    public enum Type {
        /** Create or fully replace the document. */
        SET,
        /** Merge field changes into an existing document. */
        UPDATE,
        /** Remove the document; deleting a missing document is a no-op. */
        DELETE
    }

    public NodeWrite {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (type == Type.SET && (node == null || !node.getId().equals(id))) {
            throw new IllegalArgumentException("set write requires a node with id " + id);
        }
        if (type == Type.UPDATE && patch == null) {
            throw new IllegalArgumentException("update write requires a patch");
        }
    }

    public static NodeWrite set(final Node node) {
        return new NodeWrite(Type.SET, node.getId(), node, null);
    }

    public static NodeWrite update(final String id, final NodePatch patch) {
        return new NodeWrite(Type.UPDATE, id, null, patch);
    }

    public static NodeWrite delete(final String id) {
        return new NodeWrite(Type.DELETE, id, null, null);
    }
}
