package taskapp.api.dto;

/**
 * Request body for creating or replacing a Task.
 *
 * <p>{@code deadline} is untyped so both epoch-millisecond numbers and date strings can be
 * sent; it is parsed by {@link taskapp.domain.Validation#parseTimestamp(Object)}.
 *
 * @param name             required
 * @param description      optional, defaults to empty
 * @param deadline         required date/time value
 * @param completed        optional, defaults to {@code false}
 * @param assignedUser     optional assignee id
 * @param assignedUserName optional assignee name; alone it selects the User by name,
 *                         with {@code assignedUser} it must match that User's name
 */
public record TaskRequest(
        String name,
        String description,
        Object deadline,
        Boolean completed,
        String assignedUser,
        String assignedUserName
) {
}
