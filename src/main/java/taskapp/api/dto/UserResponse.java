package taskapp.api.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import taskapp.domain.User;

/**
 * Response DTO for User data returned by the API.
 *
 * <p>Provides a clean separation between the domain object and the API contract.
 * Uses a factory method to convert from the domain object.
 *
 * @param id           the user's unique identifier
 * @param name         the user's name
 * @param email        the user's email
 * @param pendingTasks ids of the open Tasks assigned to the user
 * @param dateCreated  ISO-8601 creation instant
 */
public record UserResponse(
        String id,
        String name,
        String email,
        List<String> pendingTasks,
        String dateCreated
) {
    /**
     * Creates a UserResponse from a User domain object.
     *
     * @param user the domain object to convert (must not be null)
     * @return a new UserResponse with the user's data
     * @throws NullPointerException if user is null
     */
    public static UserResponse from(final User user) {
        Objects.requireNonNull(user, "user must not be null");
        return new UserResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                List.copyOf(user.getPendingTasks()),
                user.getDateCreated().toString()
        );
    }

    /**
     * @return the fields in display order, for projection
     */
    public Map<String, Object> toFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("name", name);
        fields.put("email", email);
        fields.put("pendingTasks", pendingTasks);
        fields.put("dateCreated", dateCreated);
        return fields;
    }
}
