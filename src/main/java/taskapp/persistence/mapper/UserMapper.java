package taskapp.persistence.mapper;

import org.springframework.stereotype.Component;
import taskapp.domain.User;
import taskapp.persistence.entity.UserEntity;

/**
 * Converts between {@link User} and {@link UserEntity}.
 */
@Component
public class UserMapper {

    public UserEntity toEntity(final User user) {
        return new UserEntity(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getPendingTasks(),
                user.getDateCreated());
    }

    public User toDomain(final UserEntity entity) {
        return new User(
                entity.getId(),
                entity.getName(),
                entity.getEmail(),
                entity.getPendingTasks(),
                entity.getDateCreated());
    }

    /**
     * Copies the mutable fields onto a managed entity, replacing the pending list in place.
     */
    public void updateEntity(final UserEntity entity, final User user) {
        entity.setName(user.getName());
        entity.setEmail(user.getEmail());
        entity.getPendingTasks().clear();
        entity.getPendingTasks().addAll(user.getPendingTasks());
    }
}
