package taskapp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import taskapp.api.dto.ErrorResponse;
import taskapp.api.exception.DuplicateResourceException;
import taskapp.api.exception.RelationshipValidationException;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.api.exception.StorageException;

/**
 * Maps exceptions thrown by the services to HTTP responses.
 *
 * <table>
 *   <caption>Exception mapping</caption>
 *   <tr><th>Exception</th><th>Status</th><th>code</th></tr>
 *   <tr><td>IllegalArgumentException, unreadable body, bad parameter type</td><td>400</td><td>BAD_INPUT</td></tr>
 *   <tr><td>RelationshipValidationException</td><td>400</td><td>RELATIONSHIP_INVALID</td></tr>
 *   <tr><td>DuplicateResourceException</td><td>400</td><td>UNIQUE_CONSTRAINT_VIOLATION</td></tr>
 *   <tr><td>ResourceNotFoundException</td><td>404</td><td>NOT_FOUND</td></tr>
 *   <tr><td>StorageException, DataAccessException</td><td>500</td><td>STORAGE_FAILURE</td></tr>
 * </table>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String STORAGE_FAILURE_DETAIL = "The datastore could not complete the request";

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(final IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ErrorResponse.BAD_INPUT);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(final HttpMessageNotReadableException ex) {
        LOG.debug("Rejected unreadable request body", ex);
        return error(HttpStatus.BAD_REQUEST, "Malformed JSON request body", ErrorResponse.BAD_INPUT);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(final MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST,
                "Invalid value for parameter '" + ex.getName() + "'", ErrorResponse.BAD_INPUT);
    }

    @ExceptionHandler(RelationshipValidationException.class)
    public ResponseEntity<ErrorResponse> handleRelationship(final RelationshipValidationException ex) {
        LOG.debug("Rejected relationship payload: {} {}", ex.getReason(), ex.getIdentifiers());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ErrorResponse.RELATIONSHIP_INVALID);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(final DuplicateResourceException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ErrorResponse.UNIQUE_CONSTRAINT_VIOLATION);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(final ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), ErrorResponse.NOT_FOUND);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(final StorageException ex) {
        LOG.error("Storage failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ErrorResponse.STORAGE_FAILURE);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(final DataAccessException ex) {
        LOG.error("Datastore access failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_FAILURE_DETAIL, ErrorResponse.STORAGE_FAILURE);
    }

    private static ResponseEntity<ErrorResponse> error(
            final HttpStatus status, final String detail, final String code) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.getReasonPhrase(), detail, code));
    }
}
