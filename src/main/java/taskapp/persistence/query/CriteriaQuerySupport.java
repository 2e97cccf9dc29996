package taskapp.persistence.query;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Translates a {@link ResourceQuery} into a JPA Criteria query against an entity whose attribute
 * names match the {@link QueryFieldCatalog} field names.
 */
public final class CriteriaQuerySupport {

    private CriteriaQuerySupport() {
    }

    public static <E, T> List<E> findAll(
            final EntityManager entityManager,
            final Class<E> entityClass,
            final QueryFieldCatalog<T> catalog,
            final ResourceQuery query) {
        final CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        final CriteriaQuery<E> criteria = cb.createQuery(entityClass);
        final Root<E> root = criteria.from(entityClass);
        criteria.select(root)
                .where(predicates(cb, root, catalog.conditions(query.filter())))
                .orderBy(orders(cb, root, catalog, query));

        final TypedQuery<E> typed = entityManager.createQuery(criteria);
        if (query.skip() > 0) {
            typed.setFirstResult(query.skip());
        }
        if (query.limit() > 0) {
            typed.setMaxResults(query.limit());
        }
        return typed.getResultList();
    }

    public static <E, T> long count(
            final EntityManager entityManager,
            final Class<E> entityClass,
            final QueryFieldCatalog<T> catalog,
            final ResourceQuery query) {
        final CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        final CriteriaQuery<Long> criteria = cb.createQuery(Long.class);
        final Root<E> root = criteria.from(entityClass);
        criteria.select(cb.count(root)).where(predicates(cb, root, catalog.conditions(query.filter())));
        return query.window(entityManager.createQuery(criteria).getSingleResult());
    }

    private static <E, T> Predicate[] predicates(
            final CriteriaBuilder cb,
            final Root<E> root,
            final List<FilterCondition<T>> conditions) {
        return conditions.stream()
                .map(condition -> predicate(cb, root, condition))
                .toArray(Predicate[]::new);
    }

    private static <E, T> Predicate predicate(
            final CriteriaBuilder cb,
            final Root<E> root,
            final FilterCondition<T> condition) {
        final String attribute = condition.field().name();
        final Predicate hit;
        if (condition.field().collection()) {
            final Expression<Collection<Object>> members = root.get(attribute);
            hit = cb.or(condition.values().stream()
                    .map(value -> cb.isMember(value, members))
                    .toArray(Predicate[]::new));
        } else {
            final Path<Object> path = root.get(attribute);
            hit = condition.values().isEmpty() ? cb.disjunction() : path.in(condition.values());
        }
        return condition.operator().negated() ? cb.not(hit) : hit;
    }

    private static <E, T> List<Order> orders(
            final CriteriaBuilder cb,
            final Root<E> root,
            final QueryFieldCatalog<T> catalog,
            final ResourceQuery query) {
        final List<Order> orders = new ArrayList<>();
        for (SortOrder<T> order : catalog.orders(query.sort())) {
            final Path<Object> path = root.get(order.field().name());
            orders.add(order.ascending() ? cb.asc(path) : cb.desc(path));
        }
        for (QueryField<T> tieBreaker : catalog.tieBreakers()) {
            orders.add(cb.asc(root.get(tieBreaker.name())));
        }
        return orders;
    }
}
