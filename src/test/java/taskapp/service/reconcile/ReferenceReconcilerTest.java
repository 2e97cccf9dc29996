package taskapp.service.reconcile;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import taskapp.api.exception.StorageException;
import taskapp.domain.Task;
import taskapp.persistence.store.TaskStore;
import taskapp.persistence.store.UserStore;
import taskapp.service.reconcile.ReconciliationStep.AddPendingTask;
import taskapp.service.reconcile.ReconciliationStep.AssignTasks;
import taskapp.service.reconcile.ReconciliationStep.PullFromOtherUsers;
import taskapp.service.reconcile.ReconciliationStep.RemovePendingTask;
import taskapp.service.reconcile.ReconciliationStep.UnassignTasks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests planning and failure-tolerant application in {@link ReferenceReconciler}.
 */
class ReferenceReconcilerTest {

    private UserStore users;
    private TaskStore tasks;
    private ReferenceReconciler reconciler;

    @BeforeEach
    void setUp() {
        users = mock(UserStore.class);
        tasks = mock(TaskStore.class);
        reconciler = new ReferenceReconciler(users, tasks, 2);
    }

    // ==================== User plans ====================

    @Test
    void unchangedUserNeedsNoSteps() {
        final UserLinks state = new UserLinks("u-1", "Alice", List.of("t-1", "t-2"));

        assertThat(reconciler.planUserChange(state, state)).isEmpty();
        assertThat(reconciler.reconcileUser(state, state).applied()).isEmpty();
    }

    @Test
    void reorderingPendingTasksNeedsNoSteps() {
        assertThat(reconciler.planUserChange(
                new UserLinks("u-1", "Alice", List.of("t-1", "t-2")),
                new UserLinks("u-1", "Alice", List.of("t-2", "t-1")))).isEmpty();
    }

    @Test
    void userChangeRemovesThenAddsThenPulls() {
        final List<ReconciliationStep> plan = reconciler.planUserChange(
                new UserLinks("u-1", "Alice", List.of("t-1", "t-2")),
                new UserLinks("u-1", "Alice", List.of("t-2", "t-3")));

        assertThat(plan).containsExactly(
                new UnassignTasks(List.of("t-1"), "u-1"),
                new AssignTasks(List.of("t-3"), "u-1", "Alice"),
                new PullFromOtherUsers(List.of("t-3"), "u-1"));
    }

    @Test
    void renameRefreshesCachedNameOnRetainedTasks() {
        final List<ReconciliationStep> plan = reconciler.planUserChange(
                new UserLinks("u-1", "Alice", List.of("t-1")),
                new UserLinks("u-1", "Alicia", List.of("t-1")));

        assertThat(plan).containsExactly(new AssignTasks(List.of("t-1"), "u-1", "Alicia"));
    }

    @Test
    void createdUserTakesOverItsTasks() {
        final List<ReconciliationStep> plan = reconciler.planUserChange(
                UserLinks.absent("u-1"), new UserLinks("u-1", "Alice", List.of("t-1")));

        assertThat(plan).containsExactly(
                new AssignTasks(List.of("t-1"), "u-1", "Alice"),
                new PullFromOtherUsers(List.of("t-1"), "u-1"));
    }

    @Test
    void deletedUserReleasesItsTasks() {
        final List<ReconciliationStep> plan = reconciler.planUserChange(
                new UserLinks("u-1", "Alice", List.of("t-1", "t-2")), UserLinks.absent("u-1"));

        assertThat(plan).containsExactly(new UnassignTasks(List.of("t-1", "t-2"), "u-1"));
    }

    // ==================== Task plans ====================

    @Test
    void unchangedTaskOnlyReaddsIdempotently() {
        final TaskLinks state = new TaskLinks("t-1", "u-1", false);

        assertThat(reconciler.planTaskChange(state, state)).containsExactly(new AddPendingTask("u-1", "t-1"));
        assertThat(reconciler.planTaskChange(
                new TaskLinks("t-1", Task.UNASSIGNED_USER, false),
                new TaskLinks("t-1", Task.UNASSIGNED_USER, true))).isEmpty();
    }

    @Test
    void reassignmentMovesTheTaskBetweenLists() {
        assertThat(reconciler.planTaskChange(new TaskLinks("t-1", "u-1", false), new TaskLinks("t-1", "u-2", false)))
                .containsExactly(new RemovePendingTask("u-1", "t-1"), new AddPendingTask("u-2", "t-1"));
    }

    @Test
    void completingTheTaskRemovesItFromTheSameAssignee() {
        assertThat(reconciler.planTaskChange(new TaskLinks("t-1", "u-1", false), new TaskLinks("t-1", "u-1", true)))
                .containsExactly(new RemovePendingTask("u-1", "t-1"));
    }

    @Test
    void reopeningTheTaskAddsItBack() {
        assertThat(reconciler.planTaskChange(new TaskLinks("t-1", "u-1", true), new TaskLinks("t-1", "u-1", false)))
                .containsExactly(new AddPendingTask("u-1", "t-1"));
    }

    @Test
    void createdCompletedTaskIsNeverPending() {
        assertThat(reconciler.planTaskChange(TaskLinks.absent("t-1"), new TaskLinks("t-1", "u-1", true))).isEmpty();
    }

    @Test
    void deletedTaskLeavesItsAssigneesList() {
        assertThat(reconciler.planTaskChange(new TaskLinks("t-1", "u-1", false), TaskLinks.absent("t-1")))
                .containsExactly(new RemovePendingTask("u-1", "t-1"));
    }

    // ==================== Application ====================

    @Test
    void appliesStepsInOrder() {
        final List<ReconciliationStep> plan = List.of(
                new UnassignTasks(List.of("t-1"), "u-1"),
                new AssignTasks(List.of("t-2"), "u-1", "Alice"),
                new PullFromOtherUsers(List.of("t-2"), "u-1"));

        final ReconciliationReport report = reconciler.apply(plan);

        assertThat(report.clean()).isTrue();
        assertThat(report.applied()).containsExactlyElementsOf(plan);
        final InOrder order = inOrder(tasks, users);
        order.verify(tasks).unassignAll(List.of("t-1"), "u-1");
        order.verify(tasks).assignAll(List.of("t-2"), "u-1", "Alice");
        order.verify(users).pullFromOthers(List.of("t-2"), "u-1");
    }

    /**
     * A step that keeps failing is reported but never stops the steps after it.
     */
    @Test
    void failingStepIsRetriedRecordedAndSkipped() {
        when(users.removePendingTask("u-1", "t-1")).thenThrow(new StorageException("connection reset"));
        when(users.addPendingTask("u-2", "t-1")).thenReturn(true);

        final ReconciliationReport report = reconciler.reconcileTask(
                new TaskLinks("t-1", "u-1", false), new TaskLinks("t-1", "u-2", false));

        assertThat(report.clean()).isFalse();
        assertThat(report.failed()).singleElement().satisfies(failure -> {
            assertThat(failure.step()).isEqualTo(new RemovePendingTask("u-1", "t-1"));
            assertThat(failure.attempts()).isEqualTo(2);
            assertThat(failure.error()).isEqualTo("connection reset");
        });
        assertThat(report.applied()).containsExactly(new AddPendingTask("u-2", "t-1"));
        verify(users, times(2)).removePendingTask("u-1", "t-1");
        verify(users).addPendingTask("u-2", "t-1");
    }

    @Test
    void transientFailureSucceedsOnRetry() {
        when(tasks.assignAll(List.of("t-1"), "u-1", "Alice"))
                .thenThrow(new StorageException("timeout"))
                .thenReturn(1);

        final ReconciliationReport report = reconciler.apply(List.of(new AssignTasks(List.of("t-1"), "u-1", "Alice")));

        assertThat(report.clean()).isTrue();
        assertThat(report.applied()).hasSize(1);
        verify(tasks, times(2)).assignAll(List.of("t-1"), "u-1", "Alice");
    }

    @Test
    void singleAttemptDoesNotRetry() {
        final ReferenceReconciler once = new ReferenceReconciler(users, tasks, 1);
        when(users.pullFromOthers(List.of("t-1"), "u-1")).thenThrow(new IllegalStateException("boom"));

        final ReconciliationReport report = once.apply(List.of(new PullFromOtherUsers(List.of("t-1"), "u-1")));

        assertThat(report.failed()).singleElement().extracting(ReconciliationReport.Failure::attempts).isEqualTo(1);
        verify(users, times(1)).pullFromOthers(List.of("t-1"), "u-1");
    }

    @Test
    void rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> new ReferenceReconciler(users, tasks, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
