package taskapp.service.reconcile;

import java.util.List;
import taskapp.domain.User;

/**
 * The relationship-bearing state of one User at a point in time.
 *
 * @param userId       the User's id
 * @param userName     the User's name, {@code null} when the User does not exist in this state
 * @param pendingTasks the User's pending Task ids
 */
public record UserLinks(String userId, String userName, List<String> pendingTasks) {

    public UserLinks {
        pendingTasks = List.copyOf(pendingTasks);
    }

    public static UserLinks of(final User user) {
        return new UserLinks(user.getId(), user.getName(), user.getPendingTasks());
    }

    /**
     * State of a User that does not exist: before creation, or after deletion.
     */
    public static UserLinks absent(final String userId) {
        return new UserLinks(userId, null, List.of());
    }
}
