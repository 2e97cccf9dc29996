package taskapp.persistence.query;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import taskapp.domain.Task;
import taskapp.domain.User;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests filtering, ordering and windowing of {@link InMemoryQueryEvaluator}.
 */
class InMemoryQueryEvaluatorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final List<Task> tasks = List.of(
            new Task("a", "alpha", "", T0.plusSeconds(300), false, "u-1", "Alice", T0.plusSeconds(3)),
            new Task("b", "bravo", "", T0.plusSeconds(100), true, "u-1", "Alice", T0.plusSeconds(1)),
            new Task("c", "charlie", "", T0.plusSeconds(200), false, T0.plusSeconds(2)),
            new Task("d", "delta", "", T0.plusSeconds(200), false, "u-2", "Bob", T0.plusSeconds(2)));

    private final List<User> users = List.of(
            new User("u-1", "Alice", "alice@example.com", List.of("a"), T0),
            new User("u-2", "Bob", "bob@example.com", List.of("d"), T0.plusSeconds(1)));

    private List<String> ids(final ResourceQuery query) {
        return InMemoryQueryEvaluator.select(tasks, QueryCatalogs.TASKS, query).stream().map(Task::getId).toList();
    }

    private static ResourceQuery query(final Map<String, Object> filter, final Map<String, Object> sort,
            final int skip, final int limit) {
        return new ResourceQuery(filter, sort, Projection.none(), skip, limit, false);
    }

    @Test
    void defaultOrderIsDateCreatedThenId() {
        assertThat(ids(ResourceQuery.all())).containsExactly("b", "c", "d", "a");
    }

    @Test
    void equalityFilterOnBoolean() {
        assertThat(ids(ResourceQuery.where(Map.of("completed", false)))).containsExactly("c", "d", "a");
        assertThat(ids(ResourceQuery.where(Map.of("completed", "true")))).containsExactly("b");
    }

    @Test
    void unassignedSentinelIsFilterable() {
        assertThat(ids(ResourceQuery.where(Map.of("assignedUser", "")))).containsExactly("c");
    }

    @Test
    void operatorFilters() {
        assertThat(ids(ResourceQuery.where(Map.of("assignedUser", Map.of("$in", List.of("u-1", "u-2"))))))
                .containsExactly("b", "d", "a");
        assertThat(ids(ResourceQuery.where(Map.of("assignedUser", Map.of("$nin", List.of("u-1"))))))
                .containsExactly("c", "d");
        assertThat(ids(ResourceQuery.where(Map.of("name", Map.of("$ne", "alpha")))))
                .containsExactly("b", "c", "d");
    }

    @Test
    void dateFilterAcceptsAnyTimestampForm() {
        final long millis = T0.plusSeconds(100).toEpochMilli();
        assertThat(ids(ResourceQuery.where(Map.of("deadline", millis)))).containsExactly("b");
        assertThat(ids(ResourceQuery.where(Map.of("deadline", "2025-01-01T00:01:40Z")))).containsExactly("b");
    }

    @Test
    void sortDescendingFallsBackToTieBreakers() {
        assertThat(ids(query(Map.of(), Map.of("deadline", -1), 0, 0))).containsExactly("a", "c", "d", "b");
        assertThat(ids(query(Map.of(), Map.of("deadline", "asc"), 0, 0))).containsExactly("b", "c", "d", "a");
    }

    @Test
    void skipAndLimitWindowTheSortedMatches() {
        assertThat(ids(query(Map.of(), Map.of("name", 1), 1, 2))).containsExactly("b", "c");
    }

    @Test
    void countHonoursWindow() {
        assertThat(InMemoryQueryEvaluator.count(tasks, QueryCatalogs.TASKS, ResourceQuery.all())).isEqualTo(4);
        assertThat(InMemoryQueryEvaluator.count(tasks, QueryCatalogs.TASKS, query(Map.of(), Map.of(), 3, 0)))
                .isEqualTo(1);
        assertThat(InMemoryQueryEvaluator.count(tasks, QueryCatalogs.TASKS, query(Map.of(), Map.of(), 1, 2)))
                .isEqualTo(2);
    }

    @Test
    void pendingTasksFilterMeansMembership() {
        final List<User> matches = InMemoryQueryEvaluator.select(
                users, QueryCatalogs.USERS, ResourceQuery.where(Map.of("pendingTasks", "d")));

        assertThat(matches).extracting(User::getId).containsExactly("u-2");
    }

    @Test
    void rejectsUnknownFieldsAndOperators() {
        assertThatThrownBy(() -> ids(ResourceQuery.where(Map.of("owner", "u-1"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown field: owner");
        assertThatThrownBy(() -> ids(ResourceQuery.where(Map.of("name", Map.of("$regex", "a.*")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported filter operator");
    }

    @Test
    void rejectsBadValues() {
        assertThatThrownBy(() -> ids(ResourceQuery.where(Map.of("completed", "maybe"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ids(ResourceQuery.where(Map.of("name", Map.of("$in", "alpha")))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires an array");
        assertThatThrownBy(() -> ids(query(Map.of(), Map.of("name", 2), 0, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid sort direction");
    }

    @Test
    void cannotSortOnPendingTasks() {
        assertThatThrownBy(() -> InMemoryQueryEvaluator.select(users, QueryCatalogs.USERS,
                query(Map.of(), Map.of("pendingTasks", 1), 0, 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot sort on field: pendingTasks");
    }

    @Test
    void negativeWindowIsRejected() {
        assertThatThrownBy(() -> query(Map.of(), Map.of(), -1, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("skip must not be negative");
    }
}
