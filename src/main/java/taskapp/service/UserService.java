package taskapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import taskapp.api.dto.UserRequest;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.domain.Task;
import taskapp.domain.User;
import taskapp.domain.Validation;
import taskapp.persistence.query.ResourceQuery;
import taskapp.persistence.store.UserStore;
import taskapp.service.reconcile.ReconciliationReport;
import taskapp.service.reconcile.ReferenceReconciler;
import taskapp.service.reconcile.UserLinks;

/**
 * Service responsible for creating, replacing, and deleting {@link User}s.
 *
 * <p>Every mutation runs the same pipeline, each stage starting only after the previous one
 * returned: validate fields, validate pending Tasks, store the User, then let the
 * {@link ReferenceReconciler} bring the affected Tasks in line. Anything rejected before the
 * store call leaves no trace; reconciliation trouble after it is logged and does not fail
 * the request.
 */
@Service
public class UserService {

    private static final Logger LOG = LoggerFactory.getLogger(UserService.class);

    static final String MISSING_FIELDS = "User must have name and email";
    static final String INVALID_EMAIL = "Invalid email format";
    static final String NOT_FOUND = "User not found";

    private final UserStore store;
    private final ValidationService validationService;
    private final ReferenceReconciler reconciler;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores references to shared collaborators")
    public UserService(
            final UserStore store,
            final ValidationService validationService,
            final ReferenceReconciler reconciler,
            final Clock clock) {
        this.store = store;
        this.validationService = validationService;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    /**
     * Creates a User. Listed pending Tasks are taken over from whichever User held them.
     *
     * @return the stored User
     * @throws IllegalArgumentException if name or email is missing or the email is malformed
     * @throws taskapp.api.exception.RelationshipValidationException if a pending Task is
     *         malformed, missing or completed
     * @throws taskapp.api.exception.DuplicateResourceException if the email is taken
     */
    public User createUser(final UserRequest request) {
        validateFields(request);
        final List<String> pending = pendingIds(validationService.validatePendingSet(request.pendingTasks()));

        final User user = new User(UUID.randomUUID().toString(), request.name(), request.email(), pending,
                clock.instant());
        final User saved = store.insert(user);
        LOG.info("Created user {} with {} pending task(s)", saved.getId(), saved.getPendingTasks().size());

        report(saved.getId(), reconciler.reconcileUser(UserLinks.absent(saved.getId()), UserLinks.of(saved)));
        return saved;
    }

    /**
     * Replaces every field of an existing User.
     *
     * @return the stored User
     * @throws ResourceNotFoundException if the id is malformed or unknown
     */
    public User replaceUser(final String id, final UserRequest request) {
        validateFields(request);
        final List<String> pending = pendingIds(validationService.validatePendingSet(request.pendingTasks()));

        final User existing = requireUser(id);
        final UserLinks before = UserLinks.of(existing);
        existing.update(request.name(), request.email(), pending);
        final User saved = store.save(existing);
        LOG.debug("Replaced user {}", saved.getId());

        report(saved.getId(), reconciler.reconcileUser(before, UserLinks.of(saved)));
        return saved;
    }

    /**
     * Deletes a User and unassigns the Tasks it was pending on.
     *
     * @throws ResourceNotFoundException if the id is malformed or unknown
     */
    public void deleteUser(final String id) {
        final User existing = requireUser(id);
        if (!store.deleteById(existing.getId())) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        LOG.info("Deleted user {}", existing.getId());

        report(existing.getId(), reconciler.reconcileUser(UserLinks.of(existing), UserLinks.absent(existing.getId())));
    }

    /**
     * @throws ResourceNotFoundException if the id is malformed or unknown
     */
    public User getUser(final String id) {
        return requireUser(id);
    }

    public List<User> findUsers(final ResourceQuery query) {
        return store.findAll(query);
    }

    public long countUsers(final ResourceQuery query) {
        return store.count(query);
    }

    private User requireUser(final String id) {
        if (!Validation.isValidIdentifier(id)) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return store.findById(id).orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND));
    }

    private static void validateFields(final UserRequest request) {
        if (request == null || Validation.isBlank(request.name()) || Validation.isBlank(request.email())) {
            throw new IllegalArgumentException(MISSING_FIELDS);
        }
        if (!Validation.isValidEmail(request.email().trim())) {
            throw new IllegalArgumentException(INVALID_EMAIL);
        }
    }

    private static List<String> pendingIds(final List<Task> tasks) {
        return tasks.stream().map(Task::getId).toList();
    }

    private static void report(final String userId, final ReconciliationReport report) {
        if (!report.clean()) {
            LOG.warn("User {} stored, but {} reconciliation step(s) failed", userId, report.failed().size());
        }
    }
}
