package taskapp.api.exception;

/**
 * Thrown when a write would violate a uniqueness constraint, such as a second User
 * with the same email.
 *
 * <p>Reported to the caller as bad input, but with its own error code so clients can
 * tell it apart from field validation and from storage failures.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(final String message) {
        super(message);
    }

    public DuplicateResourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
