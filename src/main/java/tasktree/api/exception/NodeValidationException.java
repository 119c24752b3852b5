package tasktree.api.exception;

/**
 * Thrown when a non-draft save is missing required content.
 *
 * <p>Extends {@link IllegalArgumentException} so generic argument handling still
 * applies, while the message stays actionable for the teacher ("Please enter a title.").
 */
public class NodeValidationException extends IllegalArgumentException {

    public NodeValidationException(final String message) {
        super(message);
    }
}
