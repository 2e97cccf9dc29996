package taskapp.persistence.store;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.persistence.EntityManager;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import taskapp.api.exception.DuplicateResourceException;
import taskapp.api.exception.ResourceNotFoundException;
import taskapp.api.exception.StorageException;
import taskapp.domain.User;
import taskapp.persistence.entity.UserEntity;
import taskapp.persistence.mapper.UserMapper;
import taskapp.persistence.query.CriteriaQuerySupport;
import taskapp.persistence.query.QueryCatalogs;
import taskapp.persistence.query.ResourceQuery;
import taskapp.persistence.repository.UserRepository;

/**
 * JPA-backed {@link UserStore}.
 *
 * <p>Pending-list updates lock the User row for the read-modify-write, so concurrent pushes
 * and pulls on one User never lose each other's changes. {@link #pullFromOthers} runs one
 * transaction per affected User.
 *
 * <p>Only a violation of {@link UserEntity#EMAIL_CONSTRAINT} is reported as a duplicate email.
 * Any other integrity failure on write is wrapped in a {@link StorageException}.
 */
@Component
public class JpaUserStore implements UserStore {

    static final String DUPLICATE_EMAIL = "A user with that email already exists";

    private static final Logger LOG = LoggerFactory.getLogger(JpaUserStore.class);

    private final UserRepository repository;
    private final UserMapper mapper;
    private final EntityManager entityManager;
    private final TransactionTemplate perUserTransaction;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores repository, mapper and entity manager references; "
                    + "these are framework-managed beans with controlled lifecycle")
    public JpaUserStore(
            final UserRepository repository,
            final UserMapper mapper,
            final EntityManager entityManager,
            final PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.mapper = mapper;
        this.entityManager = entityManager;
        this.perUserTransaction = new TransactionTemplate(transactionManager);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(final String id) {
        return repository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<User> findAll(final ResourceQuery query) {
        return CriteriaQuerySupport.findAll(entityManager, UserEntity.class, QueryCatalogs.USERS, query)
                .stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long count(final ResourceQuery query) {
        return CriteriaQuerySupport.count(entityManager, UserEntity.class, QueryCatalogs.USERS, query);
    }

    @Override
    @Transactional(readOnly = true)
    public List<User> findByName(final String name) {
        return repository.findByName(name).stream().map(mapper::toDomain).toList();
    }

    @Override
    @Transactional
    public User insert(final User user) {
        if (user == null) {
            throw new IllegalArgumentException("user aggregate must not be null");
        }
        if (repository.existsById(user.getId())) {
            throw new DuplicateResourceException("User with id '" + user.getId() + "' already exists");
        }
        if (repository.existsByEmail(user.getEmail())) {
            throw new DuplicateResourceException(DUPLICATE_EMAIL);
        }
        try {
            return mapper.toDomain(repository.saveAndFlush(mapper.toEntity(user)));
        } catch (DataIntegrityViolationException e) {
            throw translate(e, user);
        }
    }

    @Override
    @Transactional
    public User save(final User user) {
        if (user == null) {
            throw new IllegalArgumentException("user aggregate must not be null");
        }
        final UserEntity entity = repository.findForUpdate(user.getId())
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
        if (repository.existsByEmailAndIdNot(user.getEmail(), user.getId())) {
            throw new DuplicateResourceException(DUPLICATE_EMAIL);
        }
        mapper.updateEntity(entity, user);
        try {
            return mapper.toDomain(repository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            throw translate(e, user);
        }
    }

    private static RuntimeException translate(final DataIntegrityViolationException e, final User user) {
        if (violatesEmailConstraint(e)) {
            return new DuplicateResourceException(DUPLICATE_EMAIL, e);
        }
        LOG.error("Integrity violation storing user {}", user.getId(), e);
        return new StorageException("Could not store user", e);
    }

    /**
     * Walks the cause chain for the email constraint, by the name Hibernate extracted or,
     * failing that, by the name in the driver message.
     */
    static boolean violatesEmailConstraint(final Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && mentionsEmailConstraint(violation.getConstraintName())) {
                return true;
            }
            if (mentionsEmailConstraint(cause.getMessage())) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsEmailConstraint(final String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(UserEntity.EMAIL_CONSTRAINT);
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
    public int pullFromOthers(final Collection<String> taskIds, final String keepUserId) {
        if (taskIds.isEmpty()) {
            return 0;
        }
        int changed = 0;
        for (String holderId : repository.findHoldersOfAny(taskIds, keepUserId)) {
            final Boolean removed = perUserTransaction.execute(status -> repository.findForUpdate(holderId)
                    .map(entity -> entity.getPendingTasks().removeAll(taskIds))
                    .orElse(false));
            if (Boolean.TRUE.equals(removed)) {
                LOG.debug("Pulled tasks {} from pending list of user {}", taskIds, holderId);
                changed++;
            }
        }
        return changed;
    }

    @Override
    @Transactional
    public boolean addPendingTask(final String userId, final String taskId) {
        return repository.findForUpdate(userId)
                .map(entity -> {
                    if (entity.getPendingTasks().contains(taskId)) {
                        return false;
                    }
                    return entity.getPendingTasks().add(taskId);
                })
                .orElse(false);
    }

    @Override
    @Transactional
    public boolean removePendingTask(final String userId, final String taskId) {
        return repository.findForUpdate(userId)
                .map(entity -> entity.getPendingTasks().remove(taskId))
                .orElse(false);
    }
}
