package taskapp.api.dto;

/**
 * Success body wrapping every non-empty API response.
 *
 * @param message the HTTP reason phrase
 * @param data    the payload: an entity, a list of entities, or a count
 * @param <T>     payload type
 */
public record ResponseEnvelope<T>(String message, T data) {

    public static <T> ResponseEnvelope<T> ok(final T data) {
        return new ResponseEnvelope<>("OK", data);
    }

    public static <T> ResponseEnvelope<T> created(final T data) {
        return new ResponseEnvelope<>("Created", data);
    }
}
