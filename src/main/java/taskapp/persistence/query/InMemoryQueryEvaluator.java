package taskapp.persistence.query;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Runs a {@link ResourceQuery} over domain objects held in memory.
 *
 * <p>Mirrors {@link CriteriaQuerySupport} so both datastores answer the same query the same way.
 */
public final class InMemoryQueryEvaluator {

    private InMemoryQueryEvaluator() {
    }

    public static <T> List<T> select(
            final Collection<T> items,
            final QueryFieldCatalog<T> catalog,
            final ResourceQuery query) {
        Stream<T> matches = filtered(items, catalog, query)
                .sorted(comparator(catalog, query))
                .skip(query.skip());
        if (query.limit() > 0) {
            matches = matches.limit(query.limit());
        }
        return matches.toList();
    }

    public static <T> long count(
            final Collection<T> items,
            final QueryFieldCatalog<T> catalog,
            final ResourceQuery query) {
        return query.window(filtered(items, catalog, query).count());
    }

    private static <T> Stream<T> filtered(
            final Collection<T> items,
            final QueryFieldCatalog<T> catalog,
            final ResourceQuery query) {
        final List<FilterCondition<T>> conditions = catalog.conditions(query.filter());
        return items.stream().filter(item -> conditions.stream().allMatch(condition -> matches(condition, item)));
    }

    private static <T> boolean matches(final FilterCondition<T> condition, final T item) {
        final Object actual = condition.field().accessor().apply(item);
        final boolean hit;
        if (condition.field().collection()) {
            final Collection<?> held = actual == null ? List.of() : (Collection<?>) actual;
            hit = condition.values().stream().anyMatch(held::contains);
        } else {
            hit = condition.values().stream().anyMatch(value -> Objects.equals(value, actual));
        }
        return condition.operator().negated() != hit;
    }

    private static <T> Comparator<T> comparator(final QueryFieldCatalog<T> catalog, final ResourceQuery query) {
        Comparator<T> comparator = (left, right) -> 0;
        for (SortOrder<T> order : catalog.orders(query.sort())) {
            final Comparator<T> byField = order.field().ordering();
            comparator = comparator.thenComparing(order.ascending() ? byField : byField.reversed());
        }
        for (QueryField<T> tieBreaker : catalog.tieBreakers()) {
            comparator = comparator.thenComparing(tieBreaker.ordering());
        }
        return comparator;
    }
}
