package tasktree.persistence.store;

/**
 * Document field names of a persisted node.
 *
 * <p>Patches and queries reference fields through this enum so a typo cannot silently
 * create a new document field.
 */
public enum NodeField {
    ID("id"),
    KIND("kind"),
    OWNER_ID("ownerId"),
    TITLE("title"),
    DESCRIPTION("description"),
    PARENT_ID("parentId"),
    ROOT_ID("rootId"),
    PATH("path"),
    PATH_TITLES("pathTitles"),
    CHILD_IDS("childIds"),
    ORDER("order"),
    WINDOW("window"),
    STATUS("status"),
    VISIBILITY("visibility"),
    ATTACHMENTS("attachments"),
    LINKS("links"),
    QUESTION_HISTORY("questionHistory"),
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt");

    private final String key;

    NodeField(final String key) {
        this.key = key;
    }

    /**
     * @return the field name inside the stored document
     */
    public String key() {
        return key;
    }

    /**
     * @return true for fields whose value is an array in the stored document
     */
    public boolean isArray() {
        return switch (this) {
            case PATH, PATH_TITLES, CHILD_IDS, VISIBILITY, ATTACHMENTS, LINKS, QUESTION_HISTORY -> true;
            default -> false;
        };
    }

    /**
     * @return true for fields that identify a document and may never be patched
     */
    public boolean isImmutable() {
        return this == ID || this == OWNER_ID || this == CREATED_AT;
    }
}
