package com.taskengine.engine.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTaskStoreTest {

    private TimeController time;
    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        store = new InMemoryTaskStore();
    }

    private Task task(String type, TaskPriority priority) {
        return Task.create(type, JsonNodeFactory.instance.objectNode(), priority, 3, null, time.now());
    }

    private Instant lease() {
        return time.now().plus(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Enqueue with an existing dedupe key returns the existing id")
    void enqueue_withDuplicateKey_shouldReturnExistingId() {
        UUID first = store.enqueue(task("email.send", TaskPriority.NORMAL).withDedupeKey("welcome:42"));
        UUID second = store.enqueue(task("email.send", TaskPriority.NORMAL).withDedupeKey("welcome:42"));

        assertThat(second).isEqualTo(first);
        assertThat(store.stats().total()).isEqualTo(1);
    }

    @Test
    @DisplayName("A duplicate with higher priority upgrades the waiting task")
    void enqueue_withDuplicateKeyAndHigherPriority_shouldUpgrade() {
        UUID id = store.enqueue(task("email.send", TaskPriority.LOW).withDedupeKey("welcome:42"));

        store.enqueue(task("email.send", TaskPriority.HIGH).withDedupeKey("welcome:42"));
        store.enqueue(task("email.send", TaskPriority.NORMAL).withDedupeKey("welcome:42"));

        assertThat(store.findById(id)).get().extracting(Task::priority).isEqualTo(TaskPriority.HIGH);
    }

    @Test
    @DisplayName("Concurrent duplicates insert one row and never lose a priority upgrade")
    void enqueue_concurrentDuplicates_shouldInsertOnceAndUpgrade() throws Exception {
        int producers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<UUID> returnedIds = new ConcurrentLinkedQueue<>();
        try {
            for (int p = 0; p < producers; p++) {
                TaskPriority priority = p == producers - 1 ? TaskPriority.HIGH : TaskPriority.LOW;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        returnedIds.add(store.enqueue(task("email.send", priority).withDedupeKey("welcome:42")));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(new HashSet<>(returnedIds)).hasSize(1);
        assertThat(store.stats().total()).isEqualTo(1);
        UUID id = returnedIds.peek();
        assertThat(store.findById(id)).get().extracting(Task::priority).isEqualTo(TaskPriority.HIGH);
    }

    @Test
    void claimDue_shouldOrderByPriorityThenScheduledTime() {
        UUID low = store.enqueue(task("a", TaskPriority.LOW));
        time.advanceSeconds(1);
        UUID high = store.enqueue(task("a", TaskPriority.HIGH));
        time.advanceSeconds(1);
        UUID normalEarly = store.enqueue(task("a", TaskPriority.NORMAL));
        time.advanceSeconds(1);
        UUID normalLate = store.enqueue(task("a", TaskPriority.NORMAL));

        List<Task> claimed = store.claimDue(10, Set.of(), time.now(), lease());

        assertThat(claimed).extracting(Task::id).containsExactly(high, normalEarly, normalLate, low);
        assertThat(claimed).allSatisfy(t -> {
            assertThat(t.status()).isEqualTo(TaskStatus.RUNNING);
            assertThat(t.attempts()).isEqualTo(1);
            assertThat(t.claimExpiresAt()).isEqualTo(lease());
        });
    }

    @Test
    void claimDue_shouldSkipFutureTasksAndOtherTypes() {
        store.enqueue(Task.create("a", null, TaskPriority.NORMAL, 3, time.now().plusSeconds(60), time.now()));
        store.enqueue(task("b", TaskPriority.NORMAL));
        UUID due = store.enqueue(task("a", TaskPriority.NORMAL));

        List<Task> claimed = store.claimDue(10, Set.of("a"), time.now(), lease());

        assertThat(claimed).extracting(Task::id).containsExactly(due);
    }

    @Test
    void claimDue_shouldNotReturnAlreadyClaimedTasks() {
        store.enqueue(task("a", TaskPriority.NORMAL));

        assertThat(store.claimDue(10, Set.of(), time.now(), lease())).hasSize(1);
        assertThat(store.claimDue(10, Set.of(), time.now(), lease())).isEmpty();
    }

    @Test
    @DisplayName("Concurrent claimers never receive the same task")
    void claimDue_concurrently_shouldReturnDisjointSets() throws Exception {
        for (int i = 0; i < 200; i++) {
            store.enqueue(task("a", TaskPriority.NORMAL));
        }
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<UUID> claimedIds = new ConcurrentLinkedQueue<>();
        Instant now = time.now();
        try {
            for (int w = 0; w < workers; w++) {
                pool.submit(() -> {
                    start.await();
                    List<Task> batch;
                    while (!(batch = store.claimDue(7, Set.of(), now, now.plusSeconds(300))).isEmpty()) {
                        batch.forEach(t -> claimedIds.add(t.id()));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        List<UUID> all = new ArrayList<>(claimedIds);
        assertThat(all).hasSize(200);
        assertThat(new HashSet<>(all)).hasSize(200);
    }

    @Test
    @DisplayName("Outcome writes only apply to the attempt that was claimed")
    void complete_withStaleAttempt_shouldBeRejected() {
        UUID id = store.enqueue(task("a", TaskPriority.NORMAL));
        Task claimed = store.claimDue(1, Set.of(), time.now(), lease()).get(0);

        assertThat(store.complete(id, claimed.attempts() + 1, time.now())).isFalse();
        assertThat(store.complete(id, claimed.attempts(), time.now())).isTrue();
        assertThat(store.complete(id, claimed.attempts(), time.now())).isFalse();
        assertThat(store.findById(id)).get().extracting(Task::status).isEqualTo(TaskStatus.SUCCEEDED);
    }

    @Test
    void scheduleRetry_shouldRecordErrorAndNextTime() {
        UUID id = store.enqueue(task("a", TaskPriority.NORMAL));
        store.claimDue(1, Set.of(), time.now(), lease());
        TaskError error = TaskError.transientError("TIMEOUT", "slow", time.now());
        Instant next = time.now().plus(Duration.ofMinutes(1));

        assertThat(store.scheduleRetry(id, 1, next, error, time.now())).isTrue();

        Task stored = store.findById(id).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.RETRY_SCHEDULED);
        assertThat(stored.scheduledFor()).isEqualTo(next);
        assertThat(stored.lastError()).isEqualTo(error);
        assertThat(stored.claimExpiresAt()).isNull();
        assertThat(store.claimDue(1, Set.of(), time.now(), lease())).isEmpty();
    }

    @Test
    void requeueDeadLetter_withStaleReviewCount_shouldBeRejected() {
        UUID id = store.enqueue(task("a", TaskPriority.NORMAL));
        store.claimDue(1, Set.of(), time.now(), lease());
        store.markDeadLetter(id, 1, TaskError.transientError("TIMEOUT", "slow", time.now()), time.now());

        assertThat(store.requeueDeadLetter(id, 0, time.now())).isTrue();
        assertThat(store.requeueDeadLetter(id, 0, time.now())).isFalse();

        Task stored = store.findById(id).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.attempts()).isZero();
        assertThat(stored.reviewCount()).isEqualTo(1);
    }

    @Test
    void listDeadLetter_shouldPageById() {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            UUID id = store.enqueue(task("a", TaskPriority.NORMAL));
            ids.add(id);
        }
        for (Task t : store.claimDue(5, Set.of(), time.now(), lease())) {
            store.markDeadLetter(t.id(), 1, TaskError.transientError("X", "x", time.now()), time.now());
        }
        ids.sort(null);

        List<Task> firstPage = store.listDeadLetter(null, 3);
        List<Task> secondPage = store.listDeadLetter(firstPage.get(2).id(), 3);

        assertThat(firstPage).extracting(Task::id).containsExactlyElementsOf(ids.subList(0, 3));
        assertThat(secondPage).extracting(Task::id).containsExactlyElementsOf(ids.subList(3, 5));
    }

    @Test
    void findExpiredClaims_shouldReturnLapsedRunningTasks() {
        UUID id = store.enqueue(task("a", TaskPriority.NORMAL));
        store.claimDue(1, Set.of(), time.now(), lease());

        assertThat(store.findExpiredClaims(time.now(), 10)).isEmpty();
        time.advanceMinutes(6);
        assertThat(store.findExpiredClaims(time.now(), 10)).extracting(Task::id).containsExactly(id);
    }

    @Test
    void cancel_shouldOnlyApplyToWaitingTasks() {
        UUID waiting = store.enqueue(task("a", TaskPriority.NORMAL));
        UUID running = store.enqueue(task("b", TaskPriority.NORMAL));
        store.claimDue(1, Set.of("b"), time.now(), lease());

        assertThat(store.cancel(waiting, time.now())).isTrue();
        assertThat(store.cancel(running, time.now())).isFalse();

        Task cancelled = store.findById(waiting).orElseThrow();
        assertThat(cancelled.status()).isEqualTo(TaskStatus.FAILED_PERMANENT);
        assertThat(cancelled.lastError().code()).isEqualTo(Task.CANCELLED_CODE);
    }

    @Test
    @DisplayName("Cancelling by workflow also cancels its dead letters but leaves running and other tasks")
    void cancelByWorkflow_shouldCancelWaitingAndDeadLetteredTasks() {
        UUID workflowId = UUID.randomUUID();
        UUID waiting = store.enqueue(task("a", TaskPriority.NORMAL).withWorkflowId(workflowId));
        UUID parked = store.enqueue(task("b", TaskPriority.NORMAL).withWorkflowId(workflowId));
        UUID running = store.enqueue(task("c", TaskPriority.NORMAL).withWorkflowId(workflowId));
        UUID unrelated = store.enqueue(task("a", TaskPriority.NORMAL));
        store.claimDue(1, Set.of("b"), time.now(), lease());
        store.markDeadLetter(parked, 1, TaskError.transientError("TIMEOUT", "slow", time.now()), time.now());
        store.claimDue(1, Set.of("c"), time.now(), lease());

        int cancelled = store.cancelByWorkflow(workflowId, time.now());

        assertThat(cancelled).isEqualTo(2);
        for (UUID id : List.of(waiting, parked)) {
            Task task = store.findById(id).orElseThrow();
            assertThat(task.status()).isEqualTo(TaskStatus.FAILED_PERMANENT);
            assertThat(task.lastError().code()).isEqualTo(Task.CANCELLED_CODE);
        }
        assertThat(store.findById(running).orElseThrow().status()).isEqualTo(TaskStatus.RUNNING);
        assertThat(store.findById(unrelated).orElseThrow().status()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void cancelDeadLetter_withStaleReviewCount_shouldBeRejected() {
        UUID id = store.enqueue(task("a", TaskPriority.NORMAL));
        store.claimDue(1, Set.of(), time.now(), lease());
        store.markDeadLetter(id, 1, TaskError.transientError("TIMEOUT", "slow", time.now()), time.now());

        assertThat(store.cancelDeadLetter(id, 1, time.now())).isFalse();
        assertThat(store.cancelDeadLetter(id, 0, time.now())).isTrue();
        assertThat(store.cancelDeadLetter(id, 0, time.now())).isFalse();
        assertThat(store.findById(id).orElseThrow().lastError().code()).isEqualTo(Task.CANCELLED_CODE);
    }

    @Test
    void deleteByWorkflow_shouldKeepDeadLetters() {
        UUID workflowId = UUID.randomUUID();
        UUID done = store.enqueue(task("a", TaskPriority.NORMAL).withWorkflowId(workflowId));
        UUID parked = store.enqueue(task("b", TaskPriority.NORMAL).withWorkflowId(workflowId));
        store.claimDue(1, Set.of("a"), time.now(), lease());
        store.complete(done, 1, time.now());
        store.claimDue(1, Set.of("b"), time.now(), lease());
        store.markDeadLetter(parked, 1, TaskError.transientError("TIMEOUT", "slow", time.now()), time.now());

        assertThat(store.deleteByWorkflow(workflowId)).isEqualTo(1);
        assertThat(store.findById(done)).isEmpty();
        assertThat(store.findById(parked)).isPresent();
    }

    @Test
    void stats_shouldCountByStatusPriorityAndType() {
        store.enqueue(task("a", TaskPriority.HIGH));
        store.enqueue(task("a", TaskPriority.LOW));
        store.enqueue(task("b", TaskPriority.LOW));
        store.claimDue(1, Set.of("b"), time.now(), lease());

        QueueStats stats = store.stats();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.count(TaskStatus.PENDING)).isEqualTo(2);
        assertThat(stats.count(TaskStatus.RUNNING)).isEqualTo(1);
        assertThat(stats.waitingByPriority()).containsEntry(TaskPriority.HIGH, 1L).containsEntry(TaskPriority.LOW, 1L);
        assertThat(stats.waitingByType()).containsOnlyKeys("a");
    }

    @Test
    void purgeTerminal_shouldKeepWorkflowTasksAndRecentTasks() {
        UUID standalone = store.enqueue(task("a", TaskPriority.NORMAL));
        UUID owned = store.enqueue(task("a", TaskPriority.NORMAL).withWorkflowId(UUID.randomUUID()));
        for (Task t : store.claimDue(2, Set.of(), time.now(), lease())) {
            store.complete(t.id(), t.attempts(), time.now());
        }
        time.advance(Duration.ofDays(31));
        UUID recent = store.enqueue(task("a", TaskPriority.NORMAL));

        int purged = store.purgeTerminal(time.now().minus(Duration.ofDays(30)), 100);

        assertThat(purged).isEqualTo(1);
        assertThat(store.findById(standalone)).isEmpty();
        assertThat(store.findById(owned)).isPresent();
        assertThat(store.findById(recent)).isPresent();
    }
}
