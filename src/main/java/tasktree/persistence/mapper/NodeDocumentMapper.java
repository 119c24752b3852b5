package tasktree.persistence.mapper;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Map;
import org.springframework.stereotype.Component;
import tasktree.domain.Node;
import tasktree.persistence.document.NodeDocument;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Converts between the {@link Node} domain object and its schemaless document form.
 *
 * <p>Documents are plain JSON-like maps (strings, numbers, booleans, lists, nested
 * maps) produced by Jackson, so a stored document never holds a reference to a domain
 * object and every conversion yields independent copies.
 */
@Component
public class NodeDocumentMapper {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final JsonMapper jsonMapper;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "JsonMapper is an immutable, thread-safe Spring singleton")
    public NodeDocumentMapper(final JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * @param node domain node (must not be null)
     * @return the flat document
     */
    public Map<String, Object> toDocument(final Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        final NodeDocument document = new NodeDocument(
                node.getId(),
                node.getKind(),
                node.getOwnerId(),
                node.getTitle(),
                node.getDescription(),
                node.getParentId(),
                node.getRootId(),
                node.getPath(),
                node.getPathTitles(),
                node.getChildIds(),
                node.getOrder(),
                node.getWindow(),
                node.getStatus(),
                new ArrayList<>(node.getVisibility()),
                node.getAttachments(),
                node.getLinks(),
                node.getQuestionHistory(),
                node.getCreatedAt(),
                node.getUpdatedAt());
        return jsonMapper.convertValue(document, DOCUMENT_TYPE);
    }

    /**
     * @param document stored document (must not be null)
     * @return a new domain node
     */
    public Node toDomain(final Map<String, Object> document) {
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        final NodeDocument stored = jsonMapper.convertValue(document, NodeDocument.class);
        return Node.builder(stored.id(), stored.ownerId(), stored.createdAt())
                .updatedAt(stored.updatedAt())
                .kind(stored.kind())
                .title(stored.title())
                .description(stored.description())
                .parentId(stored.parentId())
                .rootId(stored.rootId())
                .path(stored.path())
                .pathTitles(stored.pathTitles())
                .childIds(stored.childIds())
                .order(stored.order())
                .window(stored.window())
                .status(stored.status())
                .visibility(stored.visibility())
                .attachments(stored.attachments())
                .links(stored.links())
                .questionHistory(stored.questionHistory())
                .build();
    }

    /**
     * Converts a single domain value (enum, record, collection, timestamp) into the
     * representation used inside documents, for patches and query operands.
     *
     * @param value domain value (nullable)
     * @return document value
     */
    public Object toDocumentValue(final Object value) {
        if (value == null) {
            return null;
        }
        return jsonMapper.convertValue(value, Object.class);
    }
}
