package taskapp.service.reconcile;

import taskapp.domain.Task;

/**
 * The relationship-bearing state of one Task at a point in time.
 *
 * @param taskId       the Task's id
 * @param assignedUser assignee id, or {@link Task#UNASSIGNED_USER}
 * @param completed    whether the Task is completed
 */
public record TaskLinks(String taskId, String assignedUser, boolean completed) {

    public TaskLinks {
        assignedUser = assignedUser == null ? Task.UNASSIGNED_USER : assignedUser;
    }

    public static TaskLinks of(final Task task) {
        return new TaskLinks(task.getId(), task.getAssignedUser(), task.isCompleted());
    }

    /**
     * State of a Task that does not exist: before creation, or after deletion.
     */
    public static TaskLinks absent(final String taskId) {
        return new TaskLinks(taskId, Task.UNASSIGNED_USER, false);
    }

    public boolean assigned() {
        return !Task.UNASSIGNED_USER.equals(assignedUser);
    }
}
