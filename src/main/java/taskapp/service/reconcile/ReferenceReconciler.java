package taskapp.service.reconcile;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import taskapp.config.AppProperties;
import taskapp.persistence.store.TaskStore;
import taskapp.persistence.store.UserStore;
import taskapp.service.reconcile.ReconciliationStep.AddPendingTask;
import taskapp.service.reconcile.ReconciliationStep.AssignTasks;
import taskapp.service.reconcile.ReconciliationStep.PullFromOtherUsers;
import taskapp.service.reconcile.ReconciliationStep.RemovePendingTask;
import taskapp.service.reconcile.ReconciliationStep.UnassignTasks;

/**
 * Keeps User.pendingTasks and Task.assignedUser pointing at each other.
 *
 * <p>Planning is a pure function of the before/after link states of the one entity that
 * changed. Applying runs the steps strictly in order, one at a time, because consecutive
 * steps can target the same User document.
 *
 * <h2>Failure handling</h2>
 * <p>Reconciliation runs after the primary document is already stored. A step that keeps
 * failing after {@code app.reconciliation.max-attempts} tries is logged and recorded in the
 * returned {@link ReconciliationReport}; the remaining steps still run and the caller still
 * reports success. Nothing repairs the skipped update later.
 */
@Component
public class ReferenceReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceReconciler.class);

    private final UserStore userStore;
    private final TaskStore taskStore;
    private final int maxAttempts;

    @Autowired
    public ReferenceReconciler(
            final UserStore userStore,
            final TaskStore taskStore,
            final AppProperties properties) {
        this(userStore, taskStore, properties.getReconciliation().getMaxAttempts());
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Stores are shared collaborators, not owned state")
    public ReferenceReconciler(final UserStore userStore, final TaskStore taskStore, final int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.userStore = userStore;
        this.taskStore = taskStore;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Plans the Task-side updates for a change to one User's pending list.
     *
     * <ol>
     *   <li>Tasks dropped from the list are unassigned.</li>
     *   <li>Tasks added to the list are assigned to the User, then pulled out of every
     *       other User's list.</li>
     *   <li>If the User was renamed, the Tasks it kept get the new name.</li>
     * </ol>
     *
     * @param before state before the mutation, {@link UserLinks#absent} for a create
     * @param after  state after the mutation, {@link UserLinks#absent} for a delete
     * @return steps in application order; empty if nothing changed
     */
    public List<ReconciliationStep> planUserChange(final UserLinks before, final UserLinks after) {
        final Set<String> previous = new LinkedHashSet<>(before.pendingTasks());
        final Set<String> current = new LinkedHashSet<>(after.pendingTasks());
        final List<String> toRemove = previous.stream().filter(id -> !current.contains(id)).toList();
        final List<String> toAdd = current.stream().filter(id -> !previous.contains(id)).toList();
        final List<String> retained = current.stream().filter(previous::contains).toList();

        final List<ReconciliationStep> steps = new ArrayList<>();
        if (!toRemove.isEmpty()) {
            steps.add(new UnassignTasks(toRemove, before.userId()));
        }
        if (!toAdd.isEmpty()) {
            steps.add(new AssignTasks(toAdd, after.userId(), after.userName()));
            steps.add(new PullFromOtherUsers(toAdd, after.userId()));
        }
        if (!retained.isEmpty() && renamed(before, after)) {
            steps.add(new AssignTasks(retained, after.userId(), after.userName()));
        }
        return steps;
    }

    /**
     * Plans the User-side updates for a change to one Task's assignment or completion.
     *
     * <ol>
     *   <li>If the Task had an assignee and either moved away from it or is now completed,
     *       it leaves that assignee's list.</li>
     *   <li>If the Task has an assignee and is open, it joins that assignee's list.</li>
     * </ol>
     *
     * @param before state before the mutation, {@link TaskLinks#absent} for a create
     * @param after  state after the mutation, {@link TaskLinks#absent} for a delete
     * @return steps in application order
     */
    public List<ReconciliationStep> planTaskChange(final TaskLinks before, final TaskLinks after) {
        final List<ReconciliationStep> steps = new ArrayList<>();
        final boolean reassigned = !Objects.equals(before.assignedUser(), after.assignedUser());
        if (before.assigned() && (reassigned || after.completed())) {
            steps.add(new RemovePendingTask(before.assignedUser(), before.taskId()));
        }
        if (after.assigned() && !after.completed()) {
            steps.add(new AddPendingTask(after.assignedUser(), after.taskId()));
        }
        return steps;
    }

    public ReconciliationReport reconcileUser(final UserLinks before, final UserLinks after) {
        return apply(planUserChange(before, after));
    }

    public ReconciliationReport reconcileTask(final TaskLinks before, final TaskLinks after) {
        return apply(planTaskChange(before, after));
    }

    /**
     * Applies the steps in order. Never throws for a failing step.
     */
    public ReconciliationReport apply(final List<ReconciliationStep> steps) {
        if (steps.isEmpty()) {
            return ReconciliationReport.empty();
        }
        final List<ReconciliationStep> applied = new ArrayList<>();
        final List<ReconciliationReport.Failure> failed = new ArrayList<>();
        for (ReconciliationStep step : steps) {
            RuntimeException lastError = null;
            int attempt = 0;
            while (attempt < maxAttempts) {
                attempt++;
                try {
                    final int changed = step.apply(userStore, taskStore);
                    LOG.debug("Applied {} ({} document(s) changed)", step, changed);
                    lastError = null;
                    break;
                } catch (RuntimeException e) {
                    lastError = e;
                    LOG.debug("Attempt {} of {} failed for {}", attempt, maxAttempts, step, e);
                }
            }
            if (lastError == null) {
                applied.add(step);
            } else {
                LOG.warn("Reconciliation step {} failed after {} attempt(s); cross references left inconsistent",
                        step, attempt, lastError);
                failed.add(new ReconciliationReport.Failure(step, attempt, String.valueOf(lastError.getMessage())));
            }
        }
        return new ReconciliationReport(applied, failed);
    }

    private static boolean renamed(final UserLinks before, final UserLinks after) {
        return before.userName() != null
                && after.userName() != null
                && !before.userName().equals(after.userName());
    }
}
