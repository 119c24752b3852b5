package tasktree.api.dto;

/**
 * Standard error body: {@code {"message": "error description"}}.
 *
 * <p>Used by {@link tasktree.api.GlobalExceptionHandler} for every error except
 * partial batch failures.
 *
 * @param message the error message to display to the client
 */
public record ErrorResponse(String message) {
}
