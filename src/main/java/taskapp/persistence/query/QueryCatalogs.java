package taskapp.persistence.query;

import java.time.Instant;
import java.util.List;
import taskapp.domain.Task;
import taskapp.domain.User;

/**
 * Queryable fields of Users and Tasks.
 */
public final class QueryCatalogs {

    private static final List<String> TIE_BREAKERS = List.of("dateCreated", "id");

    public static final QueryFieldCatalog<User> USERS = QueryFieldCatalog.of(
            TIE_BREAKERS,
            QueryField.scalar("id", String.class, User::getId),
            QueryField.scalar("name", String.class, User::getName),
            QueryField.scalar("email", String.class, User::getEmail),
            QueryField.multi("pendingTasks", String.class, User::getPendingTasks),
            QueryField.scalar("dateCreated", Instant.class, User::getDateCreated));

    public static final QueryFieldCatalog<Task> TASKS = QueryFieldCatalog.of(
            TIE_BREAKERS,
            QueryField.scalar("id", String.class, Task::getId),
            QueryField.scalar("name", String.class, Task::getName),
            QueryField.scalar("description", String.class, Task::getDescription),
            QueryField.scalar("deadline", Instant.class, Task::getDeadline),
            QueryField.scalar("completed", Boolean.class, Task::isCompleted),
            QueryField.scalar("assignedUser", String.class, Task::getAssignedUser),
            QueryField.scalar("assignedUserName", String.class, Task::getAssignedUserName),
            QueryField.scalar("dateCreated", Instant.class, Task::getDateCreated));

    private QueryCatalogs() {
    }
}
