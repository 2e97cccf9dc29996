package taskapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import taskapp.api.dto.TaskRequest;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.domain.Task;
import taskapp.domain.User;
import taskapp.domain.Validation;
import taskapp.persistence.query.ResourceQuery;
import taskapp.persistence.store.TaskStore;
import taskapp.service.reconcile.ReconciliationReport;
import taskapp.service.reconcile.ReferenceReconciler;
import taskapp.service.reconcile.TaskLinks;

/**
 * Service responsible for creating, replacing, and deleting {@link Task}s.
 *
 * <p>Same pipeline as {@link UserService}: validate fields, resolve the assignee, store the
 * Task, then reconcile the affected Users' pending lists.
 */
@Service
public class TaskService {

    private static final Logger LOG = LoggerFactory.getLogger(TaskService.class);

    static final String MISSING_FIELDS = "Task must have name and deadline";
    static final String INVALID_DEADLINE = "Invalid deadline";
    static final String NOT_FOUND = "Task not found";

    private final TaskStore store;
    private final ValidationService validationService;
    private final ReferenceReconciler reconciler;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores references to shared collaborators")
    public TaskService(
            final TaskStore store,
            final ValidationService validationService,
            final ReferenceReconciler reconciler,
            final Clock clock) {
        this.store = store;
        this.validationService = validationService;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    /**
     * Creates a Task, optionally assigned by assignee id or unique name.
     *
     * @return the stored Task
     * @throws IllegalArgumentException if name or deadline is missing or the deadline unreadable
     * @throws taskapp.api.exception.RelationshipValidationException if the assignee cannot be resolved
     */
    public Task createTask(final TaskRequest request) {
        final Instant deadline = validateFields(request);
        final Optional<User> assignee =
                validationService.resolveAssignee(request.assignedUser(), request.assignedUserName());

        final Task task = new Task(
                UUID.randomUUID().toString(),
                request.name(),
                request.description(),
                deadline,
                Boolean.TRUE.equals(request.completed()),
                clock.instant());
        assignee.ifPresent(user -> task.assignTo(user.getId(), user.getName()));
        final Task saved = store.insert(task);
        LOG.info("Created task {} assigned to '{}'", saved.getId(), saved.getAssignedUser());

        report(saved.getId(), reconciler.reconcileTask(TaskLinks.absent(saved.getId()), TaskLinks.of(saved)));
        return saved;
    }

    /**
     * Replaces every field of an existing Task, including its assignment.
     *
     * @return the stored Task
     * @throws ResourceNotFoundException if the id is malformed or unknown
     */
    public Task replaceTask(final String id, final TaskRequest request) {
        final Instant deadline = validateFields(request);
        final Optional<User> assignee =
                validationService.resolveAssignee(request.assignedUser(), request.assignedUserName());

        final Task existing = requireTask(id);
        final TaskLinks before = TaskLinks.of(existing);
        existing.update(request.name(), request.description(), deadline, Boolean.TRUE.equals(request.completed()));
        assignee.ifPresentOrElse(user -> existing.assignTo(user.getId(), user.getName()), existing::unassign);
        final Task saved = store.save(existing);
        LOG.debug("Replaced task {}", saved.getId());

        report(saved.getId(), reconciler.reconcileTask(before, TaskLinks.of(saved)));
        return saved;
    }

    /**
     * Deletes a Task and removes it from its assignee's pending list.
     *
     * @throws ResourceNotFoundException if the id is malformed or unknown
     */
    public void deleteTask(final String id) {
        final Task existing = requireTask(id);
        if (!store.deleteById(existing.getId())) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        LOG.info("Deleted task {}", existing.getId());

        report(existing.getId(), reconciler.reconcileTask(TaskLinks.of(existing), TaskLinks.absent(existing.getId())));
    }

    /**
     * @throws ResourceNotFoundException if the id is malformed or unknown
     */
    public Task getTask(final String id) {
        return requireTask(id);
    }

    public List<Task> findTasks(final ResourceQuery query) {
        return store.findAll(query);
    }

    public long countTasks(final ResourceQuery query) {
        return store.count(query);
    }

    private Task requireTask(final String id) {
        if (!Validation.isValidIdentifier(id)) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return store.findById(id).orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
    }

    private static Instant validateFields(final TaskRequest request) {
        if (request == null || Validation.isBlank(request.name()) || isMissing(request.deadline())) {
            throw new IllegalArgumentException(MISSING_FIELDS);
        }
        return Validation.parseTimestamp(request.deadline())
                .orElseThrow(() -> new IllegalArgumentException(INVALID_DEADLINE));
    }

    private static boolean isMissing(final Object deadline) {
        return deadline == null || (deadline instanceof String text && text.isBlank());
    }

    private static void report(final String taskId, final ReconciliationReport report) {
        if (!report.clean()) {
            LOG.warn("Task {} stored, but {} reconciliation step(s) failed", taskId, report.failed().size());
        }
    }
}
