package tasktree.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tasktree.api.dto.BatchFailureResponse;
import tasktree.api.dto.ErrorResponse;
import tasktree.api.exception.DanglingParentException;
import tasktree.api.exception.HasChildrenException;
import tasktree.api.exception.PartialBatchFailureException;
import tasktree.api.exception.ResourceNotFoundException;
import tasktree.api.exception.StoreUnavailableException;

/**
 * Maps domain and validation exceptions to JSON error responses.
 *
 * <ul>
 *   <li>400: argument/validation errors and invalid parent references</li>
 *   <li>404: missing node or question</li>
 *   <li>409: delete of a node with children and no descendant policy</li>
 *   <li>503: store unavailable, or a write sequence that only partially committed</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(final IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(final MethodArgumentNotValidException ex) {
        final FieldError fieldError = ex.getBindingResult().getFieldError();
        final String message = fieldError == null ? "Validation failed" : fieldError.getDefaultMessage();
        return ResponseEntity.badRequest().body(new ErrorResponse(message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(final MissingRequestHeaderException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getHeaderName() + " header is required"));
    }

    @ExceptionHandler(DanglingParentException.class)
    public ResponseEntity<ErrorResponse> handleDanglingParent(final DanglingParentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(final ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(HasChildrenException.class)
    public ResponseEntity<ErrorResponse> handleHasChildren(final HasChildrenException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(PartialBatchFailureException.class)
    public ResponseEntity<BatchFailureResponse> handlePartialBatch(final PartialBatchFailureException ex) {
        LOG.warn("{}: {} pending ids reported to client", ex.getOperation(), ex.getPendingIds().size());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(BatchFailureResponse.from(ex));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(final StoreUnavailableException ex) {
        LOG.warn("Store unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("The change could not be saved. Please try again."));
    }
}
