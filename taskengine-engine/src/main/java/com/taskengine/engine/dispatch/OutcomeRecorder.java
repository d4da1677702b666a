package com.taskengine.engine.dispatch;

import com.taskengine.core.model.BackoffDecision;
import com.taskengine.core.model.BackoffPolicy;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Writes the result of a task attempt back to the store.
 *
 * Failures go through the {@link BackoffPolicy}. Every write is conditional on the task
 * still running the attempt that was claimed, so an attempt is recorded at most once even
 * when a late handler and claim recovery race each other.
 */
public class OutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(OutcomeRecorder.class);

    private final TaskStore taskStore;
    private final BackoffPolicy backoffPolicy;
    private final EngineMetrics metrics;

    public OutcomeRecorder(TaskStore taskStore, BackoffPolicy backoffPolicy, EngineMetrics metrics) {
        this.taskStore = taskStore;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
    }

    public TaskOutcome recordSuccess(Task task, Instant now) {
        if (!taskStore.complete(task.id(), task.attempts(), now)) {
            return conflict(task, "complete");
        }
        log.info("Task succeeded on attempt {}", task.attempts());
        metrics.taskOutcome(task.type(), "succeeded");
        return TaskOutcome.SUCCEEDED;
    }

    public TaskOutcome recordFailure(Task task, TaskError error, Instant now) {
        BackoffDecision decision = backoffPolicy.decide(task, error.errorClass());

        return switch (decision.outcome()) {
            case RETRY -> scheduleRetry(task, error, now.plus(decision.delay()), now);
            case DEAD_LETTER -> deadLetter(task, error, now);
            case FAILED_PERMANENT -> failPermanently(task, error, now);
        };
    }

    private TaskOutcome scheduleRetry(Task task, TaskError error, Instant nextTime, Instant now) {
        if (!taskStore.scheduleRetry(task.id(), task.attempts(), nextTime, error, now)) {
            return conflict(task, "scheduleRetry");
        }
        log.info("Task failed with {} ({}), attempt {} of {} scheduled for {}",
            error.code(), error.errorClass(), task.attempts() + 1, task.maxAttempts(), nextTime);
        metrics.taskOutcome(task.type(), "retried");
        return TaskOutcome.RETRIED;
    }

    private TaskOutcome deadLetter(Task task, TaskError error, Instant now) {
        if (!taskStore.markDeadLetter(task.id(), task.attempts(), error, now)) {
            return conflict(task, "markDeadLetter");
        }
        log.warn("Task dead-lettered after {} attempts: {} - {}", task.attempts(), error.code(), error.message());
        metrics.taskOutcome(task.type(), "dead_lettered");
        return TaskOutcome.DEAD_LETTERED;
    }

    private TaskOutcome failPermanently(Task task, TaskError error, Instant now) {
        if (!taskStore.markPermanentFailure(task.id(), task.attempts(), error, now)) {
            return conflict(task, "markPermanentFailure");
        }
        log.warn("Task failed permanently: {} - {}", error.code(), error.message());
        metrics.taskOutcome(task.type(), "failed_permanent");
        return TaskOutcome.FAILED_PERMANENTLY;
    }

    private TaskOutcome conflict(Task task, String operation) {
        log.warn("Task {} no longer running attempt {}; {} skipped", task.id(), task.attempts(), operation);
        metrics.taskConflict(operation);
        return TaskOutcome.CONFLICT;
    }
}
