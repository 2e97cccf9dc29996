package taskapp.persistence.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectionTest {

    private static Map<String, Object> document() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", "u-1");
        fields.put("name", "Alice");
        fields.put("email", "alice@example.com");
        fields.put("pendingTasks", List.of());
        fields.put("dateCreated", "2025-01-01T00:00:00Z");
        return fields;
    }

    private static Projection parse(final Map<String, Object> select) {
        return Projection.parse(select, QueryCatalogs.USERS.names());
    }

    @Test
    void emptySelectKeepsEverything() {
        assertThat(parse(Map.of()).isEmpty()).isTrue();
        assertThat(parse(null).apply(document())).isEqualTo(document());
    }

    @Test
    void inclusionKeepsIdByDefault() {
        final Map<String, Object> projected = parse(Map.of("name", 1)).apply(document());

        assertThat(projected).containsOnlyKeys("id", "name");
    }

    @Test
    void inclusionCanDropId() {
        final Map<String, Object> select = new LinkedHashMap<>();
        select.put("name", 1);
        select.put("id", 0);

        assertThat(parse(select).apply(document())).containsOnlyKeys("name");
    }

    @Test
    void exclusionDropsNamedFields() {
        final Map<String, Object> projected = parse(Map.of("email", 0, "pendingTasks", false)).apply(document());

        assertThat(projected).containsOnlyKeys("id", "name", "dateCreated");
    }

    @Test
    void idAloneSelectsOnlyId() {
        assertThat(parse(Map.of("id", 1)).apply(document())).containsOnlyKeys("id");
        assertThat(parse(Map.of("id", 0)).apply(document())).doesNotContainKey("id").containsKey("name");
    }

    @Test
    void keepsDocumentOrder() {
        final Map<String, Object> projected = parse(Map.of("email", 1, "name", 1)).apply(document());

        assertThat(projected.keySet()).containsExactly("id", "name", "email");
    }

    @Test
    void rejectsMixedModes() {
        assertThatThrownBy(() -> parse(Map.of("name", 1, "email", 0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Projection cannot mix inclusion and exclusion");
    }

    @Test
    void rejectsUnknownFieldsAndBadFlags() {
        assertThatThrownBy(() -> parse(Map.of("password", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown field: password");
        assertThatThrownBy(() -> parse(Map.of("name", 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be 0 or 1");
    }
}
