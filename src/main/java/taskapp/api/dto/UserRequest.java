package taskapp.api.dto;

import java.util.List;

/**
 * Request body for creating or replacing a User.
 *
 * @param name         required
 * @param email        required, must be a valid address and unique
 * @param pendingTasks optional Task ids; each must exist and be open
 */
public record UserRequest(
        String name,
        String email,
        List<String> pendingTasks
) {
}
