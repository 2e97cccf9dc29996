package taskapp.persistence.repository;

import java.util.Collection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import taskapp.persistence.entity.TaskEntity;

/**
 * Spring Data repository for {@link TaskEntity}.
 */
@Repository
public interface TaskRepository extends JpaRepository<TaskEntity, String> {

    /**
     * Sets the assignment pair on every listed Task in one statement.
     *
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TaskEntity t set t.assignedUser = :userId, t.assignedUserName = :userName "
            + "where t.id in :ids")
    int updateAssignment(
            @Param("ids") Collection<String> ids,
            @Param("userId") String userId,
            @Param("userName") String userName);

    /**
     * Resets the assignment pair on the listed Tasks still assigned to {@code fromUserId}.
     *
     * @return number of rows updated
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TaskEntity t set t.assignedUser = :userId, t.assignedUserName = :userName "
            + "where t.id in :ids and t.assignedUser = :fromUserId")
    int clearAssignment(
            @Param("ids") Collection<String> ids,
            @Param("fromUserId") String fromUserId,
            @Param("userId") String userId,
            @Param("userName") String userName);
}
