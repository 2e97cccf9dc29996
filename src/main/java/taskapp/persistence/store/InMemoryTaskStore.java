package taskapp.persistence.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;
import taskapp.api.exception.DuplicateResourceException;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.domain.Task;
import taskapp.persistence.query.InMemoryQueryEvaluator;
import taskapp.persistence.query.QueryCatalogs;
import taskapp.persistence.query.ResourceQuery;

/**
 * In-memory {@link TaskStore} keyed by task id.
 *
 * <p>Like {@link InMemoryUserStore}, entries are replaced with updated copies rather than
 * mutated, one document at a time.
 */
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, Task> database = new ConcurrentHashMap<>();

    @Override
    public Optional<Task> findById(final String id) {
        return Optional.ofNullable(database.get(id)).map(Task::copy);
    }

    @Override
    public List<Task> findAllById(final Collection<String> ids) {
        return ids.stream()
                .distinct()
                .map(database::get)
                .filter(Objects::nonNull)
                .map(Task::copy)
                .toList();
    }

    @Override
    public List<Task> findAll(final ResourceQuery query) {
        return InMemoryQueryEvaluator.select(database.values(), QueryCatalogs.TASKS, query).stream()
                .map(Task::copy)
                .toList();
    }

    @Override
    public long count(final ResourceQuery query) {
        return InMemoryQueryEvaluator.count(database.values(), QueryCatalogs.TASKS, query);
    }

    @Override
    public Task insert(final Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task aggregate must not be null");
        }
        if (database.putIfAbsent(task.getId(), task.copy()) != null) {
            throw new DuplicateResourceException("Task with id '" + task.getId() + "' already exists");
        }
        return task.copy();
    }

    @Override
    public Task save(final Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task aggregate must not be null");
        }
        if (database.computeIfPresent(task.getId(), (id, existing) -> task.copy()) == null) {
            throw new ResourceNotFoundException("Task not found");
        }
        return task.copy();
    }

    @Override
    public boolean deleteById(final String id) {
        return database.remove(id) != null;
    }

    @Override
    public void deleteAll() {
        database.clear();
    }

    @Override
    public int assignAll(final Collection<String> taskIds, final String userId, final String userName) {
        return updateEach(taskIds, task -> true, task -> task.assignTo(userId, userName));
    }

    @Override
    public int unassignAll(final Collection<String> taskIds, final String fromUserId) {
        return updateEach(taskIds, task -> fromUserId.equals(task.getAssignedUser()), Task::unassign);
    }

    private int updateEach(
            final Collection<String> taskIds,
            final Predicate<Task> guard,
            final Consumer<Task> change) {
        final AtomicInteger updated = new AtomicInteger();
        for (String taskId : taskIds) {
            database.computeIfPresent(taskId, (id, existing) -> {
                if (!guard.test(existing)) {
                    return existing;
                }
                final Task next = existing.copy();
                change.accept(next);
                updated.incrementAndGet();
                return next;
            });
        }
        return updated.get();
    }
}
