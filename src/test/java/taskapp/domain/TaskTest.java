package taskapp.domain;

import java.time.Instant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Task}.
 *
 * <p>Covers:
 * <ul>
 *   <li>Defaults for description, completion and assignment</li>
 *   <li>Update semantics and required fields</li>
 *   <li>The assignment pair always moving together</li>
 * </ul>
 */
class TaskTest {

    private static final Instant DEADLINE = Instant.parse("2025-06-30T17:00:00Z");
    private static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void newTaskIsUnassignedWithEmptyDescription() {
        final Task task = new Task("t-1", " draft proposal ", null, DEADLINE, false, CREATED);

        assertThat(task.getName()).isEqualTo("draft proposal");
        assertThat(task.getDescription()).isEmpty();
        assertThat(task.isCompleted()).isFalse();
        assertThat(task.getAssignedUser()).isEqualTo(Task.UNASSIGNED_USER);
        assertThat(task.getAssignedUserName()).isEqualTo(Task.UNASSIGNED_NAME);
        assertThat(task.isAssigned()).isFalse();
        assertThat(task.isPending()).isFalse();
    }

    @Test
    void blankAssigneeIsReadAsUnassigned() {
        final Task task = new Task("t-1", "draft proposal", "", DEADLINE, false, "  ", "Alice", CREATED);

        assertThat(task.isAssigned()).isFalse();
        assertThat(task.getAssignedUserName()).isEqualTo(Task.UNASSIGNED_NAME);
    }

    @Test
    void deadlineIsRequired() {
        assertThatThrownBy(() -> new Task("t-1", "draft proposal", "", null, false, CREATED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("deadline must not be null");
    }

    @Test
    void nameIsRequired() {
        assertThatThrownBy(() -> new Task("t-1", " ", "", DEADLINE, false, CREATED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("name must not be null or blank");
    }

    @Test
    void assignToWritesIdAndNameTogether() {
        final Task task = new Task("t-1", "draft proposal", "", DEADLINE, false, CREATED);

        task.assignTo("u-1", "Alice");

        assertThat(task.getAssignedUser()).isEqualTo("u-1");
        assertThat(task.getAssignedUserName()).isEqualTo("Alice");
        assertThat(task.isPending()).isTrue();
    }

    @Test
    void assignToRejectsBlankNameWithoutTouchingState() {
        final Task task = new Task("t-1", "draft proposal", "", DEADLINE, false, "u-1", "Alice", CREATED);

        assertThatThrownBy(() -> task.assignTo("u-2", " "))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(task.getAssignedUser()).isEqualTo("u-1");
        assertThat(task.getAssignedUserName()).isEqualTo("Alice");
    }

    @Test
    void unassignRestoresBothSentinels() {
        final Task task = new Task("t-1", "draft proposal", "", DEADLINE, false, "u-1", "Alice", CREATED);

        task.unassign();

        assertThat(task.getAssignedUser()).isEmpty();
        assertThat(task.getAssignedUserName()).isEqualTo("unassigned");
    }

    @Test
    void completedAssignedTaskIsNotPending() {
        final Task task = new Task("t-1", "draft proposal", "", DEADLINE, true, "u-1", "Alice", CREATED);

        assertThat(task.isAssigned()).isTrue();
        assertThat(task.isPending()).isFalse();
    }

    @Test
    void updateKeepsAssignment() {
        final Task task = new Task("t-1", "draft proposal", "", DEADLINE, false, "u-1", "Alice", CREATED);

        task.update("review proposal", "second pass", DEADLINE.plusSeconds(3600), true);

        assertThat(task.getName()).isEqualTo("review proposal");
        assertThat(task.getDescription()).isEqualTo("second pass");
        assertThat(task.getDeadline()).isEqualTo(DEADLINE.plusSeconds(3600));
        assertThat(task.isCompleted()).isTrue();
        assertThat(task.getAssignedUser()).isEqualTo("u-1");
    }
}
