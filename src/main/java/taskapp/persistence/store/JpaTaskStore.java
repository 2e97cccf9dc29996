package taskapp.persistence.store;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.persistence.EntityManager;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import taskapp.api.exception.DuplicateResourceException;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.api.exception.StorageException;
import taskapp.domain.Task;
import taskapp.persistence.entity.TaskEntity;
import taskapp.persistence.mapper.TaskMapper;
import taskapp.persistence.query.CriteriaQuerySupport;
import taskapp.persistence.query.QueryCatalogs;
import taskapp.persistence.query.ResourceQuery;
import taskapp.persistence.repository.TaskRepository;

/**
 * JPA-backed {@link TaskStore}.
 *
 * <p>Batch assignment changes run as a single bulk update statement. Each row changes
 * atomically; the statement as a whole is not a unit any caller can rely on beyond that.
 */
@Component
public class JpaTaskStore implements TaskStore {

    private static final Logger LOG = LoggerFactory.getLogger(JpaTaskStore.class);

    private final TaskRepository repository;
    private final TaskMapper mapper;
    private final EntityManager entityManager;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores repository, mapper and entity manager references; "
                    + "these are framework-managed beans with controlled lifecycle")
    public JpaTaskStore(
            final TaskRepository repository,
            final TaskMapper mapper,
            final EntityManager entityManager) {
        this.repository = repository;
        this.mapper = mapper;
        this.entityManager = entityManager;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Task> findById(final String id) {
        return repository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> findAllById(final Collection<String> ids) {
        return repository.findAllById(ids).stream().map(mapper::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> findAll(final ResourceQuery query) {
        return CriteriaQuerySupport.findAll(entityManager, TaskEntity.class, QueryCatalogs.TASKS, query)
                .stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long count(final ResourceQuery query) {
        return CriteriaQuerySupport.count(entityManager, TaskEntity.class, QueryCatalogs.TASKS, query);
    }

    @Override
    @Transactional
    public Task insert(final Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task aggregate must not be null");
        }
        if (repository.existsById(task.getId())) {
            throw new DuplicateResourceException("Task with id '" + task.getId() + "' already exists");
        }
        try {
            return mapper.toDomain(repository.saveAndFlush(mapper.toEntity(task)));
        } catch (DataIntegrityViolationException e) {
            throw storageFailure(e, task);
        }
    }

    @Override
    @Transactional
    public Task save(final Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task aggregate must not be null");
        }
        final TaskEntity entity = repository.findById(task.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Task not found"));
        mapper.updateEntity(entity, task);
        try {
            return mapper.toDomain(repository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            throw storageFailure(e, task);
        }
    }

    private static StorageException storageFailure(final DataIntegrityViolationException e, final Task task) {
        LOG.error("Integrity violation storing task {}", task.getId(), e);
        return new StorageException("Could not store task", e);
    }

    @Override
    @Transactional
    public boolean deleteById(final String id) {
        if (!repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        return true;
    }

    @Override
    @Transactional
    public void deleteAll() {
        repository.deleteAll();
    }

    @Override
    @Transactional
    public int assignAll(final Collection<String> taskIds, final String userId, final String userName) {
        if (taskIds.isEmpty()) {
            return 0;
        }
        return repository.updateAssignment(taskIds, userId, userName);
    }

    @Override
    @Transactional
    public int unassignAll(final Collection<String> taskIds, final String fromUserId) {
        if (taskIds.isEmpty()) {
            return 0;
        }
        return repository.clearAssignment(taskIds, fromUserId, Task.UNASSIGNED_USER, Task.UNASSIGNED_NAME);
    }
}
