package tasktree.domain;

/**
 * Uploaded file reference carried by a node. Each node owns its own copy.
 *
 * @param id        attachment id
 * @param filename  original file name
 * @param url       download location in blob storage
 * @param mimeType  content type reported at upload
 * @param sizeBytes size of the uploaded file
 */
public record Attachment(String id, String filename, String url, String mimeType, long sizeBytes) {

    public Attachment {
        Validation.validateNotBlank(id, "attachment id");
        Validation.validateNotBlank(url, "attachment url");
    }
}
