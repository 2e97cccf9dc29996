package taskapp.api;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import taskapp.persistence.query.Projection;
import taskapp.persistence.query.QueryFieldCatalog;
import taskapp.persistence.query.ResourceQuery;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

/**
 * Turns the JSON-valued list parameters ({@code where}, {@code sort}, {@code select}) into a
 * {@link ResourceQuery}.
 *
 * <p>Malformed JSON and JSON that is not an object are rejected with
 * {@link IllegalArgumentException}, which the API reports as 400.
 */
@Component
public class QueryParameterParser {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {
    };

    private final JsonMapper mapper;

    public QueryParameterParser(final JsonMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param limit        requested limit, or {@code null} to use {@code defaultLimit}
     * @param defaultLimit per-collection default, {@code 0} for unlimited
     */
    public ResourceQuery parse(
            final String where,
            final String sort,
            final String select,
            final Integer skip,
            final Integer limit,
            final boolean count,
            final int defaultLimit,
            final QueryFieldCatalog<?> catalog) {
        final Map<String, Object> filter = object("where", where);
        final Map<String, Object> order = object("sort", sort);
        final Projection projection = projection(select, catalog);
        return new ResourceQuery(
                filter,
                order,
                projection,
                skip == null ? 0 : skip,
                limit == null ? defaultLimit : limit,
                count);
    }

    public Projection projection(final String select, final QueryFieldCatalog<?> catalog) {
        return Projection.parse(object("select", select), catalog.names());
    }

    private Map<String, Object> object(final String parameter, final String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            final Map<String, Object> value = mapper.readValue(json, OBJECT);
            if (value == null) {
                throw new IllegalArgumentException("'" + parameter + "' must be a JSON object");
            }
            return value;
        } catch (JacksonException e) {
            throw new IllegalArgumentException("'" + parameter + "' must be a JSON object", e);
        }
    }
}
