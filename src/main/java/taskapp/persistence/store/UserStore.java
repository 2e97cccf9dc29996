package taskapp.persistence.store;

import java.util.Collection;
import java.util.List;
import taskapp.domain.User;

/**
 * Datastore for {@link User}s, with the pending-list updates reconciliation needs.
 */
public interface UserStore extends DomainDataStore<User> {

    /**
     * @param name exact name to match
     * @return every User carrying that name
     */
    List<User> findByName(String name);

    /**
     * Removes {@code taskIds} from the pending list of every User except {@code keepUserId}.
     * Each affected User is updated atomically on its own.
     *
     * @return number of Users changed
     */
    int pullFromOthers(Collection<String> taskIds, String keepUserId);

    /**
     * Appends {@code taskId} to the User's pending list unless already present.
     *
     * @return {@code true} if the list changed, {@code false} if already present or no such User
     */
    boolean addPendingTask(String userId, String taskId);

    /**
     * @return {@code true} if the id was present and removed
     */
    boolean removePendingTask(String userId, String taskId);
}
