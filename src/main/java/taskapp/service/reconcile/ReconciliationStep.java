package taskapp.service.reconcile;

import java.util.List;
import taskapp.persistence.store.TaskStore;
import taskapp.persistence.store.UserStore;

/**
 * One cross-entity update produced by the {@link ReferenceReconciler}.
 *
 * <p>Every step is idempotent: applying it twice leaves the same state as applying it once.
 */
public interface ReconciliationStep {

    /**
     * @return number of documents changed
     */
    int apply(UserStore users, TaskStore tasks);

    /**
     * Sets the listed Tasks to unassigned, skipping any no longer assigned to {@code fromUserId}.
     */
    record UnassignTasks(List<String> taskIds, String fromUserId) implements ReconciliationStep {

        public UnassignTasks {
            taskIds = List.copyOf(taskIds);
        }

        @Override
        public int apply(final UserStore users, final TaskStore tasks) {
            return tasks.unassignAll(taskIds, fromUserId);
        }
    }

    /**
     * Assigns the listed Tasks to one User, writing id and name together.
     */
    record AssignTasks(List<String> taskIds, String userId, String userName) implements ReconciliationStep {

        public AssignTasks {
            taskIds = List.copyOf(taskIds);
        }

        @Override
        public int apply(final UserStore users, final TaskStore tasks) {
            return tasks.assignAll(taskIds, userId, userName);
        }
    }

    /**
     * Removes the listed Task ids from every User's pending list except {@code keepUserId}'s.
     */
    record PullFromOtherUsers(List<String> taskIds, String keepUserId) implements ReconciliationStep {

        public PullFromOtherUsers {
            taskIds = List.copyOf(taskIds);
        }

        @Override
        public int apply(final UserStore users, final TaskStore tasks) {
            return users.pullFromOthers(taskIds, keepUserId);
        }
    }

    /**
     * Removes one Task id from one User's pending list.
     */
    record RemovePendingTask(String userId, String taskId) implements ReconciliationStep {

        @Override
        public int apply(final UserStore users, final TaskStore tasks) {
            return users.removePendingTask(userId, taskId) ? 1 : 0;
        }
    }

    /**
     * Appends one Task id to one User's pending list unless already there.
     */
    record AddPendingTask(String userId, String taskId) implements ReconciliationStep {

        @Override
        public int apply(final UserStore users, final TaskStore tasks) {
            return users.addPendingTask(userId, taskId) ? 1 : 0;
        }
    }
}
