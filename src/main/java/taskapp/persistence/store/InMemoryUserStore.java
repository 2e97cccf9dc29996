package taskapp.persistence.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import taskapp.api.exception.DuplicateResourceException;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.domain.User;
import taskapp.persistence.query.InMemoryQueryEvaluator;
import taskapp.persistence.query.QueryCatalogs;
import taskapp.persistence.query.ResourceQuery;

/**
 * In-memory {@link UserStore} keyed by user id.
 *
 * <p>Stored Users are never mutated in place: every change replaces the map entry with an
 * updated copy inside {@link ConcurrentHashMap#computeIfPresent}, which makes each update
 * atomic for its document and lets readers copy an entry without locking. Inserts and full
 * saves are synchronized so the email uniqueness check and the write happen together.
 */
public class InMemoryUserStore implements UserStore {

    private final Map<String, User> database = new ConcurrentHashMap<>();

    @Override
    public Optional<User> findById(final String id) {
        return Optional.ofNullable(database.get(id)).map(User::copy);
    }

    @Override
    public List<User> findAll(final ResourceQuery query) {
        return InMemoryQueryEvaluator.select(database.values(), QueryCatalogs.USERS, query).stream()
                .map(User::copy)
                .toList();
    }

    @Override
    public long count(final ResourceQuery query) {
        return InMemoryQueryEvaluator.count(database.values(), QueryCatalogs.USERS, query);
    }

    @Override
    public List<User> findByName(final String name) {
        return database.values().stream()
                .filter(user -> user.getName().equals(name))
                .map(User::copy)
                .toList();
    }

    @Override
    public synchronized User insert(final User user) {
        if (user == null) {
            throw new IllegalArgumentException("user aggregate must not be null");
        }
        if (database.containsKey(user.getId())) {
            throw new DuplicateResourceException("User with id '" + user.getId() + "' already exists");
        }
        requireEmailAvailable(user);
        database.put(user.getId(), user.copy());
        return user.copy();
    }

    @Override
    public synchronized User save(final User user) {
        if (user == null) {
            throw new IllegalArgumentException("user aggregate must not be null");
        }
        requireEmailAvailable(user);
        if (database.computeIfPresent(user.getId(), (id, existing) -> user.copy()) == null) {
            throw new ResourceNotFoundException("User not found");
        }
        return user.copy();
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
    public int pullFromOthers(final Collection<String> taskIds, final String keepUserId) {
        if (taskIds.isEmpty()) {
            return 0;
        }
        final AtomicInteger changed = new AtomicInteger();
        for (String userId : database.keySet()) {
            if (userId.equals(keepUserId)) {
                continue;
            }
            database.computeIfPresent(userId, (id, existing) -> {
                final User next = existing.copy();
                if (!next.removePendingTasks(taskIds)) {
                    return existing;
                }
                changed.incrementAndGet();
                return next;
            });
        }
        return changed.get();
    }

    @Override
    public boolean addPendingTask(final String userId, final String taskId) {
        final AtomicBoolean added = new AtomicBoolean();
        database.computeIfPresent(userId, (id, existing) -> {
            final User next = existing.copy();
            added.set(next.addPendingTask(taskId));
            return next;
        });
        return added.get();
    }

    @Override
    public boolean removePendingTask(final String userId, final String taskId) {
        final AtomicBoolean removed = new AtomicBoolean();
        database.computeIfPresent(userId, (id, existing) -> {
            final User next = existing.copy();
            removed.set(next.removePendingTasks(List.of(taskId)));
            return next;
        });
        return removed.get();
    }

    private void requireEmailAvailable(final User user) {
        final boolean taken = database.values().stream()
                .anyMatch(other -> other.getEmail().equals(user.getEmail()) && !other.getId().equals(user.getId()));
        if (taken) {
            throw new DuplicateResourceException(JpaUserStore.DUPLICATE_EMAIL);
        }
    }
}
