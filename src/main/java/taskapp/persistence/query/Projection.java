package taskapp.persistence.query;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field inclusion or exclusion applied to rendered documents.
 *
 * <p>An inclusion projection keeps {@code id} unless it is explicitly excluded. Mixing
 * inclusion and exclusion of other fields is rejected.
 */
public final class Projection {

    private static final String ID = "id";
    private static final Projection NONE = new Projection(Map.of(), false);

    private final Map<String, Boolean> fields;
    private final boolean inclusive;

    private Projection(final Map<String, Boolean> fields, final boolean inclusive) {
        this.fields = fields;
        this.inclusive = inclusive;
    }

    public static Projection none() {
        return NONE;
    }

    /**
     * @param select      decoded {@code select} parameter: field to {@code 1}/{@code 0} or boolean
     * @param knownFields fields that may be named
     * @throws IllegalArgumentException on unknown fields, bad values, or mixed modes
     */
    public static Projection parse(final Map<String, Object> select, final Collection<String> knownFields) {
        if (select == null || select.isEmpty()) {
            return NONE;
        }
        final Map<String, Boolean> fields = new LinkedHashMap<>();
        Boolean mode = null;
        for (Map.Entry<String, Object> entry : select.entrySet()) {
            final String name = entry.getKey();
            if (!knownFields.contains(name)) {
                throw new IllegalArgumentException("Unknown field: " + name);
            }
            final boolean include = flag(name, entry.getValue());
            fields.put(name, include);
            if (ID.equals(name)) {
                continue;
            }
            if (mode != null && mode != include) {
                throw new IllegalArgumentException("Projection cannot mix inclusion and exclusion");
            }
            mode = include;
        }
        // {"id": 0} alone is an exclusion; {"id": 1} alone keeps only the id
        final boolean inclusive = mode != null ? mode : fields.get(ID);
        return new Projection(Map.copyOf(fields), inclusive);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * @param document rendered fields of one aggregate, in display order
     * @return the projected copy, in the same order
     */
    public Map<String, Object> apply(final Map<String, Object> document) {
        if (isEmpty()) {
            return document;
        }
        final Map<String, Object> projected = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (keeps(entry.getKey())) {
                projected.put(entry.getKey(), entry.getValue());
            }
        }
        return projected;
    }

    private boolean keeps(final String name) {
        final Boolean explicit = fields.get(name);
        if (inclusive) {
            return ID.equals(name) ? !Boolean.FALSE.equals(explicit) : Boolean.TRUE.equals(explicit);
        }
        return !Boolean.FALSE.equals(explicit);
    }

    private static boolean flag(final String name, final Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number && (number.intValue() == 0 || number.intValue() == 1)) {
            return number.intValue() == 1;
        }
        throw new IllegalArgumentException("Projection value for '" + name + "' must be 0 or 1");
    }
}
