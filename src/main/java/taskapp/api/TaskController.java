package taskapp.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import taskapp.api.dto.ErrorResponse;
import taskapp.api.dto.ResponseEnvelope;
import taskapp.api.dto.TaskRequest;
import taskapp.api.dto.TaskResponse;
import taskapp.config.AppProperties;
import taskapp.persistence.query.Projection;
import taskapp.persistence.query.QueryCatalogs;
import taskapp.persistence.query.ResourceQuery;
import taskapp.service.TaskService;

/**
 * REST controller for Task CRUD and list queries.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>GET /api/tasks - List tasks, or count them with {@code count=true} (200 OK)</li>
 *   <li>POST /api/tasks - Create a task (201 Created)</li>
 *   <li>GET /api/tasks/{id} - Get one task (200 OK)</li>
 *   <li>PUT /api/tasks/{id} - Replace a task (200 OK)</li>
 *   <li>DELETE /api/tasks/{id} - Delete a task and drop it from its assignee's pending list (204 No Content)</li>
 * </ul>
 *
 * <p>{@code where}, {@code sort} and {@code select} are JSON objects, for example
 * {@code where={"completed":false}&sort={"deadline":1}&select={"name":1,"deadline":1}}.
 * Without {@code limit}, at most {@code app.query.task-default-limit} tasks are returned.
 *
 * @see TaskService
 */
@RestController
@RequestMapping(value = "/api/tasks", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Tasks", description = "Task operations")
public class TaskController {

    private final TaskService taskService;
    private final QueryParameterParser queryParser;
    private final AppProperties properties;

    public TaskController(
            final TaskService taskService,
            final QueryParameterParser queryParser,
            final AppProperties properties) {
        this.taskService = taskService;
        this.queryParser = queryParser;
        this.properties = properties;
    }

    @Operation(summary = "List or count tasks")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching tasks, or their number"),
            @ApiResponse(responseCode = "400", description = "Malformed query parameter",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping
    public ResponseEnvelope<Object> list(
            @Parameter(description = "Filter as a JSON object") @RequestParam(required = false) final String where,
            @Parameter(description = "Sort as a JSON object") @RequestParam(required = false) final String sort,
            @Parameter(description = "Projection as a JSON object") @RequestParam(required = false) final String select,
            @RequestParam(required = false) final Integer skip,
            @RequestParam(required = false) final Integer limit,
            @RequestParam(defaultValue = "false") final boolean count) {
        final ResourceQuery query = queryParser.parse(
                where, sort, select, skip, limit, count,
                properties.getQuery().getTaskDefaultLimit(), QueryCatalogs.TASKS);
        if (query.countOnly()) {
            return ResponseEnvelope.ok(taskService.countTasks(query));
        }
        final List<Map<String, Object>> tasks = taskService.findTasks(query).stream()
                .map(task -> query.projection().apply(TaskResponse.from(task).toFields()))
                .toList();
        return ResponseEnvelope.ok(tasks);
    }

    @Operation(summary = "Create a task")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Task created"),
            @ApiResponse(responseCode = "400", description = "Invalid fields or unresolvable assignee",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseEnvelope<TaskResponse>> create(@RequestBody final TaskRequest request) {
        final TaskResponse created = TaskResponse.from(taskService.createTask(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ResponseEnvelope.created(created));
    }

    @Operation(summary = "Get a task by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "404", description = "Task not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{id}")
    public ResponseEnvelope<Map<String, Object>> get(
            @PathVariable final String id,
            @RequestParam(required = false) final String select) {
        final Projection projection = queryParser.projection(select, QueryCatalogs.TASKS);
        return ResponseEnvelope.ok(projection.apply(TaskResponse.from(taskService.getTask(id)).toFields()));
    }

    @Operation(summary = "Replace a task")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task replaced"),
            @ApiResponse(responseCode = "400", description = "Invalid fields or unresolvable assignee",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "Task not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEnvelope<TaskResponse> replace(
            @PathVariable final String id,
            @RequestBody final TaskRequest request) {
        return ResponseEnvelope.ok(TaskResponse.from(taskService.replaceTask(id, request)));
    }

    @Operation(summary = "Delete a task")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Task deleted"),
            @ApiResponse(responseCode = "404", description = "Task not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable final String id) {
        taskService.deleteTask(id);
        return ResponseEntity.noContent().build();
    }
}
