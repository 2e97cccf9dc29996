package taskapp.persistence.repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import taskapp.persistence.entity.UserEntity;

/**
 * Spring Data repository for {@link UserEntity}.
 */
@Repository
public interface UserRepository extends JpaRepository<UserEntity, String> {

    List<UserEntity> findByName(String name);

    boolean existsByEmail(String email);

    boolean existsByEmailAndIdNot(String email, String id);

    /**
     * Loads a User row under a write lock so a read-modify-write of its pending list is atomic.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from UserEntity u where u.id = :id")
    Optional<UserEntity> findForUpdate(@Param("id") String id);

    /**
     * @return ids of Users other than {@code userId} whose pending list holds any of {@code taskIds}
     */
    @Query("select distinct u.id from UserEntity u join u.pendingTasks t "
            + "where t in :taskIds and u.id <> :userId")
    List<String> findHoldersOfAny(@Param("taskIds") Collection<String> taskIds, @Param("userId") String userId);
}
