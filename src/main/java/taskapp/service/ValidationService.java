package taskapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import taskapp.api.exception.RelationshipValidationException;
import taskapp.api.exception.RelationshipValidationException.Reason;
import taskapp.domain.Task;
import taskapp.domain.User;
import taskapp.domain.Validation;
import taskapp.persistence.store.TaskStore;
import taskapp.persistence.store.UserStore;

/**
 * Checks the relationship part of a mutation against the datastore before anything is written.
 *
 * <p>Holds no state besides the injected stores. Both resolvers hand back the records they
 * read so callers do not need a second lookup.
 */
@Service
public class ValidationService {

    private final UserStore userStore;
    private final TaskStore taskStore;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Stores are shared collaborators, not owned state")
    public ValidationService(final UserStore userStore, final TaskStore taskStore) {
        this.userStore = userStore;
        this.taskStore = taskStore;
    }

    /**
     * Resolves the assignee of a Task from an id, a name, or both.
     *
     * <p>Both values are trimmed, as stored names are. Blank values count as absent, as does
     * the unassigned sentinel name without an id.
     *
     * @param byId   assignee id, optional
     * @param byName assignee name, optional
     * @return the User, or empty if no assignee was requested
     * @throws RelationshipValidationException with {@link Reason#INVALID_IDENTIFIER},
     *         {@link Reason#UNKNOWN_USER}, {@link Reason#NAME_MISMATCH} or {@link Reason#AMBIGUOUS_NAME}
     */
    public Optional<User> resolveAssignee(final String byId, final String byName) {
        final String id = Validation.isBlank(byId) ? null : byId.trim();
        final String trimmedName = Validation.isBlank(byName) ? null : byName.trim();
        final String name = id == null && Task.UNASSIGNED_NAME.equals(trimmedName) ? null : trimmedName;
        if (id == null && name == null) {
            return Optional.empty();
        }

        if (id != null) {
            if (!Validation.isValidIdentifier(id)) {
                throw new RelationshipValidationException(
                        Reason.INVALID_IDENTIFIER, "Invalid assignedUser ID format", List.of(id));
            }
            final User user = userStore.findById(id).orElseThrow(() -> new RelationshipValidationException(
                    Reason.UNKNOWN_USER, "Assigned user does not exist", List.of(id)));
            if (name != null && !name.equals(user.getName())) {
                throw new RelationshipValidationException(
                        Reason.NAME_MISMATCH, "Assigned user name does not match the user", List.of(id));
            }
            return Optional.of(user);
        }

        final List<User> matches = userStore.findByName(name);
        if (matches.isEmpty()) {
            throw new RelationshipValidationException(Reason.UNKNOWN_USER, "Assigned user name does not exist");
        }
        if (matches.size() > 1) {
            throw new RelationshipValidationException(
                    Reason.AMBIGUOUS_NAME,
                    "Multiple users with that name",
                    matches.stream().map(User::getId).toList());
        }
        return Optional.of(matches.get(0));
    }

    /**
     * Checks that every id names an existing, open Task.
     *
     * <p>Checks run in order and each reports every offending id: malformed ids first,
     * then missing Tasks, then completed ones.
     *
     * @param ids requested pending Task ids, optional
     * @return the Tasks in request order (duplicates collapsed), empty for an empty request
     * @throws RelationshipValidationException with {@link Reason#MALFORMED_IDENTIFIER},
     *         {@link Reason#TASK_NOT_FOUND} or {@link Reason#TASK_ALREADY_COMPLETED}
     */
    public List<Task> validatePendingSet(final List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        final List<String> requested = new ArrayList<>(new LinkedHashSet<>(ids));

        final List<String> malformed = requested.stream()
                .filter(id -> !Validation.isValidIdentifier(id))
                .map(String::valueOf)
                .toList();
        if (!malformed.isEmpty()) {
            throw new RelationshipValidationException(
                    Reason.MALFORMED_IDENTIFIER, "Invalid task id(s): " + String.join(", ", malformed), malformed);
        }

        final Map<String, Task> found = taskStore.findAllById(requested).stream()
                .collect(Collectors.toMap(Task::getId, Function.identity()));
        final List<String> missing = requested.stream().filter(id -> !found.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            throw new RelationshipValidationException(
                    Reason.TASK_NOT_FOUND, "Task id(s) not found: " + String.join(", ", missing), missing);
        }

        final List<String> completed = requested.stream().filter(id -> found.get(id).isCompleted()).toList();
        if (!completed.isEmpty()) {
            throw new RelationshipValidationException(
                    Reason.TASK_ALREADY_COMPLETED,
                    "Tasks already completed cannot be pending: " + String.join(", ", completed),
                    completed);
        }
        return requested.stream().map(found::get).toList();
    }
}
