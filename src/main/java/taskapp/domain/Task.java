package taskapp.domain;

import java.time.Instant;

/**
 * Task domain object.
 *
 * <p>Enforces the Task requirements:
 * <ul>
 *   <li>id: required, immutable after construction</li>
 *   <li>name: required, non-blank, stored trimmed</li>
 *   <li>description: optional, defaults to the empty string</li>
 *   <li>deadline: required instant</li>
 *   <li>completed: defaults to {@code false}</li>
 *   <li>assignedUser / assignedUserName: one field pair, either a User id and that
 *       User's name, or {@link #UNASSIGNED_USER} and {@link #UNASSIGNED_NAME}</li>
 *   <li>dateCreated: required, immutable</li>
 * </ul>
 *
 * <p>The assignment pair is only ever written through {@link #assignTo(String, String)}
 * and {@link #unassign()}, so the denormalized name can never drift from the id
 * within one document.
 */
public final class Task {

    /** Sentinel stored in {@code assignedUser} when nobody owns the task. */
    public static final String UNASSIGNED_USER = "";

    /** Sentinel stored in {@code assignedUserName} when nobody owns the task. */
    public static final String UNASSIGNED_NAME = "unassigned";

    private final String id;
    private final Instant dateCreated;
    private String name;
    private String description;
    private Instant deadline;
    private boolean completed;
    private String assignedUser;
    private String assignedUserName;

    /**
     * Creates an unassigned task.
     *
     * @throws IllegalArgumentException if any argument violates the constraints
     */
    public Task(
            final String id,
            final String name,
            final String description,
            final Instant deadline,
            final boolean completed,
            final Instant dateCreated) {
        this(id, name, description, deadline, completed, UNASSIGNED_USER, UNASSIGNED_NAME, dateCreated);
    }

    /**
     * Reconstitutes a task with its assignment pair, e.g. when loading from persistence.
     *
     * @throws IllegalArgumentException if any argument violates the constraints
     */
    public Task(
            final String id,
            final String name,
            final String description,
            final Instant deadline,
            final boolean completed,
            final String assignedUser,
            final String assignedUserName,
            final Instant dateCreated) {
        this.id = Validation.validateNotBlank(id, "Task ID");
        if (dateCreated == null) {
            throw new IllegalArgumentException("dateCreated must not be null");
        }
        this.dateCreated = dateCreated;
        update(name, description, deadline, completed);
        if (Validation.isBlank(assignedUser)) {
            unassign();
        } else {
            assignTo(assignedUser, assignedUserName);
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean isCompleted() {
        return completed;
    }

    public String getAssignedUser() {
        return assignedUser;
    }

    public String getAssignedUserName() {
        return assignedUserName;
    }

    public Instant getDateCreated() {
        return dateCreated;
    }

    public boolean isAssigned() {
        return !UNASSIGNED_USER.equals(assignedUser);
    }

    /**
     * A pending task is assigned and not completed; only those belong in a User's pendingTasks.
     */
    public boolean isPending() {
        return isAssigned() && !completed;
    }

    /**
     * Replaces the non-relationship fields after validating all of them.
     *
     * @throws IllegalArgumentException if any value violates the constraints
     */
    public void update(
            final String newName,
            final String newDescription,
            final Instant newDeadline,
            final boolean newCompleted) {
        final String validatedName = Validation.validateNotBlank(newName, "name");
        if (newDeadline == null) {
            throw new IllegalArgumentException("deadline must not be null");
        }

        this.name = validatedName;
        this.description = newDescription == null ? "" : newDescription;
        this.deadline = newDeadline;
        this.completed = newCompleted;
    }

    public void assignTo(final String userId, final String userName) {
        final String validatedId = Validation.validateNotBlank(userId, "assignedUser");
        final String validatedName = Validation.validateNotBlank(userName, "assignedUserName");
        this.assignedUser = validatedId;
        this.assignedUserName = validatedName;
    }

    public void unassign() {
        this.assignedUser = UNASSIGNED_USER;
        this.assignedUserName = UNASSIGNED_NAME;
    }

    public Task copy() {
        return new Task(id, name, description, deadline, completed, assignedUser, assignedUserName, dateCreated);
    }
}
