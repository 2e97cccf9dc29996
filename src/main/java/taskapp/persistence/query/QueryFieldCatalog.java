package taskapp.persistence.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The queryable fields of one aggregate type, and the translation of raw filter and sort
 * maps into resolved {@link FilterCondition}s and {@link SortOrder}s.
 *
 * @param <T> domain aggregate type
 */
public final class QueryFieldCatalog<T> {

    private final Map<String, QueryField<T>> fields;
    private final List<QueryField<T>> tieBreakers;

    private QueryFieldCatalog(final Map<String, QueryField<T>> fields, final List<String> tieBreakers) {
        this.fields = Collections.unmodifiableMap(fields);
        this.tieBreakers = tieBreakers.stream().map(this::field).toList();
    }

    /**
     * @param tieBreakers field names appended to every sort so results come back in a stable order
     * @param fields      the queryable fields
     */
    @SafeVarargs
    public static <T> QueryFieldCatalog<T> of(final List<String> tieBreakers, final QueryField<T>... fields) {
        final Map<String, QueryField<T>> byName = new LinkedHashMap<>();
        for (QueryField<T> field : fields) {
            byName.put(field.name(), field);
        }
        return new QueryFieldCatalog<>(byName, tieBreakers);
    }

    /**
     * @throws IllegalArgumentException if no such field exists
     */
    public QueryField<T> field(final String name) {
        final QueryField<T> field = fields.get(name);
        if (field == null) {
            throw new IllegalArgumentException("Unknown field: " + name);
        }
        return field;
    }

    public Set<String> names() {
        return fields.keySet();
    }

    public List<QueryField<T>> tieBreakers() {
        return tieBreakers;
    }

    /**
     * Resolves a raw filter map. Plain values mean equality; a nested map holds operators.
     *
     * @throws IllegalArgumentException on unknown fields, operators or unconvertible values
     */
    public List<FilterCondition<T>> conditions(final Map<String, Object> filter) {
        final List<FilterCondition<T>> conditions = new ArrayList<>();
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            final QueryField<T> field = field(entry.getKey());
            if (entry.getValue() instanceof Map<?, ?> operators) {
                for (Map.Entry<?, ?> clause : operators.entrySet()) {
                    final FilterCondition.Operator operator =
                            FilterCondition.Operator.fromToken(String.valueOf(clause.getKey()));
                    conditions.add(new FilterCondition<>(field, operator, operands(field, operator, clause.getValue())));
                }
            } else {
                conditions.add(new FilterCondition<>(
                        field, FilterCondition.Operator.EQ, List.of(field.convert(entry.getValue()))));
            }
        }
        return conditions;
    }

    /**
     * Resolves a raw sort map, preserving its order.
     *
     * @throws IllegalArgumentException on unknown or multi-valued fields and bad directions
     */
    public List<SortOrder<T>> orders(final Map<String, Object> sort) {
        final List<SortOrder<T>> orders = new ArrayList<>();
        for (Map.Entry<String, Object> entry : sort.entrySet()) {
            final QueryField<T> field = field(entry.getKey());
            if (field.collection()) {
                throw new IllegalArgumentException("Cannot sort on field: " + field.name());
            }
            orders.add(new SortOrder<>(field, ascending(field.name(), entry.getValue())));
        }
        return orders;
    }

    private static <T> List<Object> operands(
            final QueryField<T> field,
            final FilterCondition.Operator operator,
            final Object raw) {
        if (!operator.takesList()) {
            return List.of(field.convert(raw));
        }
        if (!(raw instanceof List<?> items)) {
            throw new IllegalArgumentException(operator.token() + " on '" + field.name() + "' requires an array");
        }
        final List<Object> converted = new ArrayList<>(items.size());
        for (Object item : items) {
            converted.add(field.convert(item));
        }
        return converted;
    }

    private static boolean ascending(final String name, final Object direction) {
        if (direction instanceof Number number) {
            if (number.intValue() == 1) {
                return true;
            }
            if (number.intValue() == -1) {
                return false;
            }
        } else if (direction instanceof String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "1", "asc", "ascending":
                    return true;
                case "-1", "desc", "descending":
                    return false;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Invalid sort direction for '" + name + "': " + direction);
    }
}
