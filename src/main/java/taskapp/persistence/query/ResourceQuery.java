package taskapp.persistence.query;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A list query against one collection: filter, sort order, projection, and a skip/limit window.
 *
 * <p>The filter and sort maps are kept in their raw decoded-JSON form and resolved against a
 * {@link QueryFieldCatalog} by the datastore that runs the query, so unknown fields surface
 * as {@link IllegalArgumentException}s there. The projection is applied by the caller to the
 * rendered documents.
 *
 * @param filter     field to expected value, or to an operator object ({@code $in}, {@code $nin},
 *                   {@code $ne}, {@code $eq})
 * @param sort       field to direction ({@code 1}/{@code -1} or {@code asc}/{@code desc}), in order
 * @param projection fields to include or exclude
 * @param skip       number of leading matches to drop
 * @param limit      maximum number of results, {@code 0} for no limit
 * @param countOnly  whether the caller wants the number of matches instead of the matches
 */
public record ResourceQuery(
        Map<String, Object> filter,
        Map<String, Object> sort,
        Projection projection,
        int skip,
        int limit,
        boolean countOnly
) {

    public ResourceQuery {
        filter = filter == null ? Map.of() : new LinkedHashMap<>(filter);
        sort = sort == null ? Map.of() : new LinkedHashMap<>(sort);
        projection = projection == null ? Projection.none() : projection;
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    /**
     * @return a query matching every document, unsorted beyond the default order, unbounded
     */
    public static ResourceQuery all() {
        return new ResourceQuery(Map.of(), Map.of(), Projection.none(), 0, 0, false);
    }

    public static ResourceQuery where(final Map<String, Object> filter) {
        return new ResourceQuery(filter, Map.of(), Projection.none(), 0, 0, false);
    }

    /**
     * Applies the skip/limit window to a total match count.
     *
     * @param total number of documents matching the filter
     * @return number of documents the window would return
     */
    public long window(final long total) {
        final long afterSkip = Math.max(0L, total - skip);
        return limit > 0 ? Math.min(afterSkip, limit) : afterSkip;
    }
}
