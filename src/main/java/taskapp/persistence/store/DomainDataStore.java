package taskapp.persistence.store;

import java.util.List;
import java.util.Optional;
import taskapp.persistence.query.ResourceQuery;

/**
 * Generic persistence contract for domain aggregates.
 *
 * <p>Services depend on this interface rather than Spring Data directly so we can
 * provide multiple implementations (JPA-backed for normal operation and in-memory
 * for tests and embedded use).
 *
 * <p>Every method is atomic for the one document it touches and for nothing else.
 * Callers that change several documents get no transaction spanning them.
 *
 * @param <T> domain aggregate type (User or Task)
 */
public interface DomainDataStore<T> {

    /**
     * @param id identifier to look up
     * @return a detached copy of the aggregate if found
     */
    Optional<T> findById(String id);

    /**
     * @param query filter, sort order and window; the projection is ignored here
     * @return matching aggregates
     * @throws IllegalArgumentException if the query names unknown fields or has bad values
     */
    List<T> findAll(ResourceQuery query);

    /**
     * @return number of matches after the query's skip/limit window
     * @throws IllegalArgumentException if the query names unknown fields or has bad values
     */
    long count(ResourceQuery query);

    /**
     * Stores a new aggregate.
     *
     * @param aggregate fully validated aggregate
     * @return the stored copy
     * @throws taskapp.api.exception.DuplicateResourceException if a uniqueness constraint is violated
     */
    T insert(T aggregate);

    /**
     * Overwrites an existing aggregate (last write wins).
     *
     * @param aggregate fully validated aggregate
     * @return the stored copy
     * @throws taskapp.api.exception.DuplicateResourceException if a uniqueness constraint is violated
     */
    T save(T aggregate);

    /**
     * Deletes by id if present.
     *
     * @param id identifier to delete
     * @return {@code true} if something was removed
     */
    boolean deleteById(String id);

    /**
     * Utility hook for test isolation.
     */
    void deleteAll();
}
