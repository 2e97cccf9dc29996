package taskapp.persistence.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.hibernate.Length;

/**
 * JPA entity for a User row and its ordered pending Task ids.
 */
@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = UserEntity.EMAIL_CONSTRAINT, columnNames = "email"))
public class UserEntity {

    /** Name of the unique constraint on {@code email}. */
    public static final String EMAIL_CONSTRAINT = "uk_users_email";

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = Length.LONG32)
    private String name;

    @Column(name = "email", nullable = false, length = Length.LONG32)
    private String email;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_pending_tasks", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "position")
    @Column(name = "task_id", nullable = false, length = 36)
    private List<String> pendingTasks = new ArrayList<>();

    @Column(name = "date_created", nullable = false, updatable = false)
    private Instant dateCreated;

    protected UserEntity() {
        // JPA only
    }

    public UserEntity(
            final String id,
            final String name,
            final String email,
            final List<String> pendingTasks,
            final Instant dateCreated) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.pendingTasks = new ArrayList<>(pendingTasks);
        this.dateCreated = dateCreated;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(final String email) {
        this.email = email;
    }

    /**
     * @return the managed list; callers mutate it in place so Hibernate can diff the rows
     */
    public List<String> getPendingTasks() {
        return pendingTasks;
    }

    public Instant getDateCreated() {
        return dateCreated;
    }
}
