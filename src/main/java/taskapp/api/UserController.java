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
import taskapp.api.dto.UserRequest;
import taskapp.api.dto.UserResponse;
import taskapp.config.AppProperties;
import taskapp.persistence.query.Projection;
import taskapp.persistence.query.QueryCatalogs;
import taskapp.persistence.query.ResourceQuery;
import taskapp.service.UserService;

/**
 * REST controller for User CRUD and list queries.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>GET /api/users - List users, or count them with {@code count=true} (200 OK)</li>
 *   <li>POST /api/users - Create a user (201 Created)</li>
 *   <li>GET /api/users/{id} - Get one user (200 OK)</li>
 *   <li>PUT /api/users/{id} - Replace a user (200 OK)</li>
 *   <li>DELETE /api/users/{id} - Delete a user and unassign its pending tasks (204 No Content)</li>
 * </ul>
 *
 * <p>{@code where}, {@code sort} and {@code select} are JSON objects, for example
 * {@code where={"name":"Alice"}&sort={"dateCreated":-1}&select={"email":1}}.
 *
 * @see UserService
 */
@RestController
@RequestMapping(value = "/api/users", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Users", description = "User operations")
public class UserController {

    private final UserService userService;
    private final QueryParameterParser queryParser;
    private final AppProperties properties;

    public UserController(
            final UserService userService,
            final QueryParameterParser queryParser,
            final AppProperties properties) {
        this.userService = userService;
        this.queryParser = queryParser;
        this.properties = properties;
    }

    @Operation(summary = "List or count users")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching users, or their number"),
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
                properties.getQuery().getUserDefaultLimit(), QueryCatalogs.USERS);
        if (query.countOnly()) {
            return ResponseEnvelope.ok(userService.countUsers(query));
        }
        final List<Map<String, Object>> users = userService.findUsers(query).stream()
                .map(user -> query.projection().apply(UserResponse.from(user).toFields()))
                .toList();
        return ResponseEnvelope.ok(users);
    }

    @Operation(summary = "Create a user")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created"),
            @ApiResponse(responseCode = "400", description = "Invalid fields, pending tasks, or duplicate email",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseEnvelope<UserResponse>> create(@RequestBody final UserRequest request) {
        final UserResponse created = UserResponse.from(userService.createUser(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ResponseEnvelope.created(created));
    }

    @Operation(summary = "Get a user by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User found"),
            @ApiResponse(responseCode = "404", description = "User not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{id}")
    public ResponseEnvelope<Map<String, Object>> get(
            @PathVariable final String id,
            @RequestParam(required = false) final String select) {
        final Projection projection = queryParser.projection(select, QueryCatalogs.USERS);
        return ResponseEnvelope.ok(projection.apply(UserResponse.from(userService.getUser(id)).toFields()));
    }

    @Operation(summary = "Replace a user")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User replaced"),
            @ApiResponse(responseCode = "400", description = "Invalid fields, pending tasks, or duplicate email",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "404", description = "User not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEnvelope<UserResponse> replace(
            @PathVariable final String id,
            @RequestBody final UserRequest request) {
        return ResponseEnvelope.ok(UserResponse.from(userService.replaceUser(id, request)));
    }

    @Operation(summary = "Delete a user")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "User deleted"),
            @ApiResponse(responseCode = "404", description = "User not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable final String id) {
        userService.deleteUser(id);
        return ResponseEntity.noContent().build();
    }
}
