package taskapp.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.Length;

/**
 * JPA entity for a Task row.
 *
 * <p>Text columns carry no length limit; the domain places none on names or descriptions.
 */
@Entity
@Table(name = "tasks", indexes = @Index(name = "idx_tasks_assigned_user", columnList = "assigned_user"))
public class TaskEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = Length.LONG32)
    private String name;

    @Column(name = "description", nullable = false, length = Length.LONG32)
    private String description;

    @Column(name = "deadline", nullable = false)
    private Instant deadline;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    @Column(name = "assigned_user", nullable = false, length = 36)
    private String assignedUser;

    @Column(name = "assigned_user_name", nullable = false, length = Length.LONG32)
    private String assignedUserName;

    @Column(name = "date_created", nullable = false, updatable = false)
    private Instant dateCreated;

    protected TaskEntity() {
        // JPA only
    }

    public TaskEntity(final String id, final Instant dateCreated) {
        this.id = id;
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

    public String getDescription() {
        return description;
    }

    public void setDescription(final String description) {
        this.description = description;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public void setDeadline(final Instant deadline) {
        this.deadline = deadline;
    }

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(final boolean completed) {
        this.completed = completed;
    }

    public String getAssignedUser() {
        return assignedUser;
    }

    public String getAssignedUserName() {
        return assignedUserName;
    }

    /**
     * Writes the assignment pair together; there is no setter for either half alone.
     */
    public void setAssignment(final String assignedUser, final String assignedUserName) {
        this.assignedUser = assignedUser;
        this.assignedUserName = assignedUserName;
    }

    public Instant getDateCreated() {
        return dateCreated;
    }
}
