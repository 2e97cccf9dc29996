package taskapp.persistence.query;

/**
 * @param <T> domain aggregate type
 */
public record SortOrder<T>(QueryField<T> field, boolean ascending) {
}
