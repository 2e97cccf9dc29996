package taskapp.api.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import taskapp.domain.Task;

/**
 * Response DTO for Task data returned by the API.
 *
 * <p>Provides a clean separation between the domain object and the API contract.
 * Uses a factory method to convert from the domain object.
 *
 * @param id               the task's unique identifier
 * @param name             the task name
 * @param description      the task description
 * @param deadline         ISO-8601 deadline instant
 * @param completed        whether the task is done
 * @param assignedUser     assignee id, empty when unassigned
 * @param assignedUserName assignee name, {@code "unassigned"} when unassigned
 * @param dateCreated      ISO-8601 creation instant
 */
public record TaskResponse(
        String id,
        String name,
        String description,
        String deadline,
        boolean completed,
        String assignedUser,
        String assignedUserName,
        String dateCreated
) {
    /**
     * Creates a TaskResponse from a Task domain object.
     *
     * @param task the domain object to convert (must not be null)
     * @return a new TaskResponse with the task's data
     * @throws NullPointerException if task is null
     */
    public static TaskResponse from(final Task task) {
        Objects.requireNonNull(task, "task must not be null");
        return new TaskResponse(
                task.getId(),
                task.getName(),
                task.getDescription(),
                task.getDeadline().toString(),
                task.isCompleted(),
                task.getAssignedUser(),
                task.getAssignedUserName(),
                task.getDateCreated().toString()
        );
    }

    /**
     * @return the fields in display order, for projection
     */
    public Map<String, Object> toFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("name", name);
        fields.put("description", description);
        fields.put("deadline", deadline);
        fields.put("completed", completed);
        fields.put("assignedUser", assignedUser);
        fields.put("assignedUserName", assignedUserName);
        fields.put("dateCreated", dateCreated);
        return fields;
    }
}
