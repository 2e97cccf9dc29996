package taskapp.api.dto;

/**
 * Standard error response format for REST API errors.
 *
 * <p>Returns a consistent JSON structure:
 * {@code {"message": "Bad Request", "data": "error description", "code": "BAD_INPUT"}}
 *
 * <p>Used by {@link taskapp.api.GlobalExceptionHandler} to wrap
 * all error responses in a uniform format.
 *
 * @param message the HTTP reason phrase
 * @param data    the error detail to display to the client
 * @param code    machine-readable error kind
 */
public record ErrorResponse(String message, String data, String code) {

    public static final String BAD_INPUT = "BAD_INPUT";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String RELATIONSHIP_INVALID = "RELATIONSHIP_INVALID";
    public static final String UNIQUE_CONSTRAINT_VIOLATION = "UNIQUE_CONSTRAINT_VIOLATION";
    public static final String STORAGE_FAILURE = "STORAGE_FAILURE";
}
