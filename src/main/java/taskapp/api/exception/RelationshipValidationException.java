package taskapp.api.exception;

import java.util.List;

/**
 * Thrown when the relationship part of a mutation cannot be accepted: the assignee
 * cannot be resolved, or a pending Task is malformed, missing or already completed.
 *
 * <p>Always raised before anything is written.
 */
public class RelationshipValidationException extends RuntimeException {

    /**
     * Why the relationship payload was rejected.
     */
    public enum Reason {
        /** assignedUser is not a well-formed identifier. */
        INVALID_IDENTIFIER,
        /** No User matches the given id or name. */
        UNKNOWN_USER,
        /** assignedUserName disagrees with the name of the User found by id. */
        NAME_MISMATCH,
        /** More than one User carries the given name. */
        AMBIGUOUS_NAME,
        /** One or more pendingTasks entries are not well-formed identifiers. */
        MALFORMED_IDENTIFIER,
        /** One or more pendingTasks entries reference no Task. */
        TASK_NOT_FOUND,
        /** One or more pendingTasks entries reference a completed Task. */
        TASK_ALREADY_COMPLETED
    }

    private final Reason reason;
    private final List<String> identifiers;

    public RelationshipValidationException(final Reason reason, final String message) {
        this(reason, message, List.of());
    }

    public RelationshipValidationException(
            final Reason reason,
            final String message,
            final List<String> identifiers) {
        super(message);
        this.reason = reason;
        this.identifiers = List.copyOf(identifiers);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the offending identifiers, empty when the failure is not about specific ids
     */
    public List<String> getIdentifiers() {
        return identifiers;
    }
}
