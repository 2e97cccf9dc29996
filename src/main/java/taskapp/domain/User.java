package taskapp.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * User domain object.
 *
 * <p>Enforces the User requirements:
 * <ul>
 *   <li>id: required, immutable after construction</li>
 *   <li>name: required, non-blank, stored trimmed</li>
 *   <li>email: required, syntactically valid, stored trimmed</li>
 *   <li>pendingTasks: ordered Task ids, duplicates collapse to the first occurrence</li>
 *   <li>dateCreated: required, immutable</li>
 * </ul>
 *
 * <p>Whether each pending id references an open Task assigned to this User is a
 * cross-document rule. It is checked by {@link taskapp.service.ValidationService}
 * and maintained by {@link taskapp.service.reconcile.ReferenceReconciler}, not here.
 */
public final class User {

    private final String id;
    private final Instant dateCreated;
    private String name;
    private String email;
    private List<String> pendingTasks;

    /**
     * @throws IllegalArgumentException if any argument violates the constraints
     */
    public User(
            final String id,
            final String name,
            final String email,
            final Collection<String> pendingTasks,
            final Instant dateCreated) {
        this.id = Validation.validateNotBlank(id, "User ID");
        if (dateCreated == null) {
            throw new IllegalArgumentException("dateCreated must not be null");
        }
        this.dateCreated = dateCreated;
        update(name, email, pendingTasks);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    /**
     * @return unmodifiable view of the pending Task ids in insertion order
     */
    public List<String> getPendingTasks() {
        return Collections.unmodifiableList(pendingTasks);
    }

    public Instant getDateCreated() {
        return dateCreated;
    }

    /**
     * Replaces every mutable field after validating all of them.
     *
     * <p>If any value is invalid, this method throws and leaves the existing state unchanged.
     *
     * @throws IllegalArgumentException if any value violates the constraints
     */
    public void update(final String newName, final String newEmail, final Collection<String> newPendingTasks) {
        final String validatedName = Validation.validateNotBlank(newName, "name");
        final String validatedEmail = Validation.validateNotBlank(newEmail, "email");
        if (!Validation.isValidEmail(validatedEmail)) {
            throw new IllegalArgumentException("Invalid email format");
        }
        final List<String> validatedPending = normalizePending(newPendingTasks);

        this.name = validatedName;
        this.email = validatedEmail;
        this.pendingTasks = validatedPending;
    }

    /**
     * Appends {@code taskId} unless it is already pending.
     *
     * @return {@code true} if the list changed
     */
    public boolean addPendingTask(final String taskId) {
        final String normalized = Validation.validateNotBlank(taskId, "taskId");
        if (pendingTasks.contains(normalized)) {
            return false;
        }
        pendingTasks.add(normalized);
        return true;
    }

    /**
     * @return {@code true} if at least one id was removed
     */
    public boolean removePendingTasks(final Collection<String> taskIds) {
        return pendingTasks.removeAll(taskIds);
    }

    public boolean hasPendingTask(final String taskId) {
        return pendingTasks.contains(taskId);
    }

    public User copy() {
        return new User(id, name, email, pendingTasks, dateCreated);
    }

    private static List<String> normalizePending(final Collection<String> ids) {
        final LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (ids != null) {
            for (String taskId : ids) {
                unique.add(Validation.validateNotBlank(taskId, "pendingTasks entry"));
            }
        }
        return new ArrayList<>(unique);
    }
}
