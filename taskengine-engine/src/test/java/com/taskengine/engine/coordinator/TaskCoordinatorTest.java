package com.taskengine.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskengine.core.exception.InvalidStateTransitionException;
import com.taskengine.core.exception.NotFoundException;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.test.TimeController;
import com.taskengine.engine.persistence.InMemoryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskCoordinatorTest {

    private TimeController time;
    private InMemoryTaskStore store;
    private TaskCoordinator coordinator;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        store = new InMemoryTaskStore();
        coordinator = new TaskCoordinator(store, time, 4);
    }

    @Test
    void enqueue_withDefaults_shouldCreateDuePendingTask() {
        UUID id = coordinator.enqueue("email.send", JsonNodeFactory.instance.objectNode(), null);

        Task task = coordinator.getTask(id);
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.priority()).isEqualTo(TaskPriority.NORMAL);
        assertThat(task.maxAttempts()).isEqualTo(4);
        assertThat(task.scheduledFor()).isEqualTo(time.now());
    }

    @Test
    void enqueue_withOptions_shouldApplyThem() {
        UUID id = coordinator.enqueue("email.send", null, TaskPriority.HIGH, 1,
            time.now().plusSeconds(600), "digest:2024-03-01");

        Task task = coordinator.getTask(id);
        assertThat(task.maxAttempts()).isEqualTo(1);
        assertThat(task.scheduledFor()).isEqualTo(time.now().plusSeconds(600));
        assertThat(task.dedupeKey()).isEqualTo("digest:2024-03-01");
    }

    @Test
    @DisplayName("Enqueueing the same dedupe key twice yields one task")
    void enqueue_twiceWithSameKey_shouldReturnSameId() {
        UUID first = coordinator.enqueue("email.send", null, TaskPriority.NORMAL, null, null, "k1");
        UUID second = coordinator.enqueue("email.send", null, TaskPriority.NORMAL, null, null, "k1");

        assertThat(second).isEqualTo(first);
        assertThat(coordinator.stats().total()).isEqualTo(1);
    }

    @Test
    void getTask_withUnknownId_shouldThrowNotFound() {
        assertThatThrownBy(() -> coordinator.getTask(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void cancel_pendingTask_shouldFailItPermanently() {
        UUID id = coordinator.enqueue("email.send", null, TaskPriority.NORMAL);

        Task cancelled = coordinator.cancel(id);

        assertThat(cancelled.status()).isEqualTo(TaskStatus.FAILED_PERMANENT);
        assertThat(cancelled.lastError().code()).isEqualTo(Task.CANCELLED_CODE);
    }

    @Test
    void cancel_runningTask_shouldBeRejected() {
        UUID id = coordinator.enqueue("email.send", null, TaskPriority.NORMAL);
        store.claimDue(1, Set.of(), time.now(), time.now().plusSeconds(300));

        assertThatThrownBy(() -> coordinator.cancel(id))
            .isInstanceOf(InvalidStateTransitionException.class)
            .hasMessageContaining("RUNNING");
    }

    @Test
    void retry_deadLetteredTask_shouldResetBudgets() {
        UUID id = coordinator.enqueue("email.send", null, TaskPriority.NORMAL);
        Task claimed = store.claimDue(1, Set.of(), time.now(), time.now().plusSeconds(300)).get(0);
        store.markDeadLetter(id, claimed.attempts(), TaskError.transientError("TIMEOUT", "slow", time.now()), time.now());
        time.advanceMinutes(30);

        Task retried = coordinator.retry(id);

        assertThat(retried.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(retried.attempts()).isZero();
        assertThat(retried.reviewCount()).isZero();
        assertThat(retried.scheduledFor()).isEqualTo(time.now());
        assertThat(coordinator.listDeadLetters(10)).isEmpty();
    }

    @Test
    void retry_pendingTask_shouldBeRejected() {
        UUID id = coordinator.enqueue("email.send", null, TaskPriority.NORMAL);

        assertThatThrownBy(() -> coordinator.retry(id))
            .isInstanceOf(InvalidStateTransitionException.class);
    }
}
