package taskapp.api.exception;

/**
 * Datastore failure during a read or write. Surfaces as an internal error.
 *
 * <p>The JPA stores throw it when a write breaks an integrity rule other than the unique email,
 * so such failures never pass for a duplicate.
 */
public class StorageException extends RuntimeException {

    public StorageException(final String message) {
        super(message);
    }

    public StorageException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
