package taskapp.persistence.store;

import java.util.Collection;
import java.util.List;
import taskapp.domain.Task;

/**
 * Datastore for {@link Task}s, with the batch assignment updates reconciliation needs.
 */
public interface TaskStore extends DomainDataStore<Task> {

    /**
     * @return the Tasks that exist among {@code ids}, in no particular order
     */
    List<Task> findAllById(Collection<String> ids);

    /**
     * Sets {@code assignedUser} and {@code assignedUserName} on every listed Task.
     *
     * @return number of Tasks updated
     */
    int assignAll(Collection<String> taskIds, String userId, String userName);

    /**
     * Resets the assignment pair to the unassigned sentinels on every listed Task that is
     * still assigned to {@code fromUserId}. Tasks already handed to someone else are left alone.
     *
     * @return number of Tasks updated
     */
    int unassignAll(Collection<String> taskIds, String fromUserId);
}
