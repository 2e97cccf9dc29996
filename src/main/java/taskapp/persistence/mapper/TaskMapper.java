package taskapp.persistence.mapper;

import org.springframework.stereotype.Component;
import taskapp.domain.Task;
import taskapp.persistence.entity.TaskEntity;

/**
 * Converts between {@link Task} and {@link TaskEntity}.
 */
@Component
public class TaskMapper {

    public TaskEntity toEntity(final Task task) {
        final TaskEntity entity = new TaskEntity(task.getId(), task.getDateCreated());
        updateEntity(entity, task);
        return entity;
    }

    public Task toDomain(final TaskEntity entity) {
        return new Task(
                entity.getId(),
                entity.getName(),
                entity.getDescription(),
                entity.getDeadline(),
                entity.isCompleted(),
                entity.getAssignedUser(),
                entity.getAssignedUserName(),
                entity.getDateCreated());
    }

    public void updateEntity(final TaskEntity entity, final Task task) {
        entity.setName(task.getName());
        entity.setDescription(task.getDescription());
        entity.setDeadline(task.getDeadline());
        entity.setCompleted(task.isCompleted());
        entity.setAssignment(task.getAssignedUser(), task.getAssignedUserName());
    }
}
