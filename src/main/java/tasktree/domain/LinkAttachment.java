package tasktree.domain;

import java.time.Instant;

/**
 * External link attached to a node.
 *
 * @param id      link id
 * @param url     target address
 * @param title   display title (nullable)
 * @param addedAt when the link was attached
 */
public record LinkAttachment(String id, String url, String title, Instant addedAt) {

    public LinkAttachment {
        Validation.validateNotBlank(id, "link id");
        Validation.validateNotBlank(url, "link url");
    }
}
