package taskapp.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import taskapp.api.dto.TaskRequest;
import taskapp.config.AppProperties;
import taskapp.domain.Task;
import taskapp.domain.User;
import taskapp.support.ServiceFixture;
import tools.jackson.databind.json.JsonMapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasKey;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web-layer tests for {@link UserController} using standalone MockMvc over in-memory stores.
 */
class UserControllerTest {

    private ServiceFixture fixture;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture();
        final UserController controller = new UserController(
                fixture.userService, new QueryParameterParser(JsonMapper.builder().build()), new AppProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createReturns201WithEnvelope() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Alice", "email": "alice@example.com"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Created"))
                .andExpect(jsonPath("$.data.name").value("Alice"))
                .andExpect(jsonPath("$.data.pendingTasks", hasSize(0)))
                .andExpect(jsonPath("$.data.dateCreated").value(ServiceFixture.NOW.toString()));
    }

    @Test
    void createWithInvalidEmailIsBadInput() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Alice", "email": "alice"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Bad Request"))
                .andExpect(jsonPath("$.data").value("Invalid email format"))
                .andExpect(jsonPath("$.code").value("BAD_INPUT"));
    }

    @Test
    void createWithTakenEmailIsUniqueConstraintViolation() throws Exception {
        fixture.user("Alice", "alice@example.com");

        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Alice Two", "email": "alice@example.com"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNIQUE_CONSTRAINT_VIOLATION"));
    }

    @Test
    void createWithCompletedPendingTaskIsRelationshipInvalid() throws Exception {
        final Task done = fixture.taskService.createTask(
                new TaskRequest("done", "", ServiceFixture.DEADLINE, true, null, null));

        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Alice\", \"email\": \"alice@example.com\", \"pendingTasks\": [\""
                                + done.getId() + "\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("RELATIONSHIP_INVALID"));
    }

    @Test
    void malformedBodyIsBadInput() throws Exception {
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_INPUT"));
    }

    @Test
    void listFiltersSortsAndProjects() throws Exception {
        fixture.user("Bob", "bob@example.com");
        fixture.user("Alice", "alice@example.com");
        fixture.user("Carol", "carol@example.com");

        mockMvc.perform(get("/api/users")
                        .param("where", "{\"name\": {\"$ne\": \"Carol\"}}")
                        .param("sort", "{\"name\": 1}")
                        .param("select", "{\"name\": 1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("OK"))
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].name").value("Alice"))
                .andExpect(jsonPath("$.data[1].name").value("Bob"))
                .andExpect(jsonPath("$.data[0]", hasKey("id")))
                .andExpect(jsonPath("$.data[0]", not(hasKey("email"))));
    }

    @Test
    void countReturnsNumberOfMatches() throws Exception {
        fixture.user("Alice", "alice@example.com");
        fixture.user("Bob", "bob@example.com");

        mockMvc.perform(get("/api/users").param("count", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(2));
        mockMvc.perform(get("/api/users").param("count", "true").param("skip", "1"))
                .andExpect(jsonPath("$.data").value(1));
    }

    @Test
    void malformedQueryParametersAreBadInput() throws Exception {
        mockMvc.perform(get("/api/users").param("where", "{name: Alice"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_INPUT"));
        mockMvc.perform(get("/api/users").param("where", "[1, 2]"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/users").param("sort", "{\"password\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data").value("Unknown field: password"));
        mockMvc.perform(get("/api/users").param("skip", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_INPUT"));
        mockMvc.perform(get("/api/users").param("limit", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getByIdSupportsSelect() throws Exception {
        final User alice = fixture.user("Alice", "alice@example.com");

        mockMvc.perform(get("/api/users/{id}", alice.getId()).param("select", "{\"email\": 1, \"id\": 0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.email").value("alice@example.com"))
                .andExpect(jsonPath("$.data", not(hasKey("id"))));
    }

    @Test
    void unknownOrMalformedIdIsNotFound() throws Exception {
        mockMvc.perform(get("/api/users/{id}", "0f8fad5b-d9cb-469f-a165-70867728950e"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Not Found"))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        mockMvc.perform(get("/api/users/{id}", "not-an-id"))
                .andExpect(status().isNotFound());
    }

    @Test
    void replaceReturns200() throws Exception {
        final User alice = fixture.user("Alice", "alice@example.com");

        mockMvc.perform(put("/api/users/{id}", alice.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Alicia", "email": "alicia@example.com", "pendingTasks": []}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("OK"))
                .andExpect(jsonPath("$.data.id").value(alice.getId()))
                .andExpect(jsonPath("$.data.name").value("Alicia"));
    }

    /**
     * Deleting a User with two pending Tasks answers 204 and leaves both Tasks unassigned.
     */
    @Test
    void deleteReturns204AndUnassignsTasks() throws Exception {
        final User alice = fixture.user("Alice", "alice@example.com");
        final Task first = fixture.taskFor("first", alice);
        final Task second = fixture.taskFor("second", alice);

        mockMvc.perform(delete("/api/users/{id}", alice.getId()))
                .andExpect(status().isNoContent());

        assertThat(fixture.reload(first).isAssigned()).isFalse();
        assertThat(fixture.reload(second).isAssigned()).isFalse();
        mockMvc.perform(delete("/api/users/{id}", alice.getId()))
                .andExpect(status().isNotFound());
    }
}
