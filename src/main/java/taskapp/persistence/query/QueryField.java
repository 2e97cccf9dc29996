package taskapp.persistence.query;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;
import taskapp.domain.Validation;

/**
 * One queryable field of an aggregate.
 *
 * <p>The name doubles as the JPA attribute name of the backing entity, so the same catalog
 * drives both the in-memory evaluator and the Criteria API translation.
 *
 * @param name       field name as exposed to clients and as mapped on the entity
 * @param type       value type: {@link String}, {@link Boolean} or {@link Instant}
 * @param collection whether the field holds many values (matched by membership)
 * @param accessor   reads the field from a domain object
 * @param ordering   orders domain objects by this field, nulls first; collection fields cannot be ordered
 * @param <T>        domain aggregate type
 */
public record QueryField<T>(
        String name,
        Class<?> type,
        boolean collection,
        Function<T, Object> accessor,
        Comparator<T> ordering
) {

    public static <T, V extends Comparable<? super V>> QueryField<T> scalar(
            final String name,
            final Class<V> type,
            final Function<T, V> accessor) {
        final Comparator<T> ordering = Comparator.comparing(accessor, Comparator.nullsFirst(Comparator.<V>naturalOrder()));
        return new QueryField<>(name, type, false, accessor::apply, ordering);
    }

    public static <T> QueryField<T> multi(final String name, final Class<?> type, final Function<T, Object> accessor) {
        final Comparator<T> unordered = (left, right) -> {
            throw new IllegalStateException("Cannot order by collection field " + name);
        };
        return new QueryField<>(name, type, true, accessor, unordered);
    }

    /**
     * Converts a decoded JSON value into this field's type.
     *
     * @throws IllegalArgumentException if the value cannot represent this field
     */
    public Object convert(final Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Filter value for '" + name + "' must not be null");
        }
        if (type == String.class) {
            if (raw instanceof String text) {
                return text;
            }
        } else if (type == Boolean.class) {
            if (raw instanceof Boolean flag) {
                return flag;
            }
            if (raw instanceof String text) {
                final String normalized = text.trim().toLowerCase(Locale.ROOT);
                if ("true".equals(normalized) || "false".equals(normalized)) {
                    return Boolean.valueOf(normalized);
                }
            }
        } else if (type == Instant.class) {
            return Validation.parseTimestamp(raw).orElseThrow(() -> new IllegalArgumentException(
                    "Filter value for '" + name + "' is not a valid date"));
        } else {
            throw new IllegalStateException("Unsupported field type " + type.getName());
        }
        throw new IllegalArgumentException(
                "Filter value for '" + name + "' must be a " + type.getSimpleName().toLowerCase(Locale.ROOT));
    }
}
