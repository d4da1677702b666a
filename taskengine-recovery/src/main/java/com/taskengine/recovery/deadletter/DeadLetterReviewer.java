package com.taskengine.recovery.deadletter;

import com.taskengine.core.model.ErrorClass;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.core.repository.WorkflowStore;
import com.taskengine.engine.config.EngineProperties;
import com.taskengine.engine.dispatch.OutcomeRecorder;
import com.taskengine.engine.dispatch.PassBudget;
import com.taskengine.engine.dispatch.TaskOutcome;
import com.taskengine.engine.logging.LoggingContext;
import com.taskengine.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Periodic review of the dead letter queue.
 *
 * Responsibilities:
 * - Fail back RUNNING tasks whose claim lapsed (the invocation that claimed them died)
 * - Requeue dead-lettered tasks the {@link DeadLetterPolicy} still considers transient
 * - Cancel dead-lettered tasks whose workflow already finished or was cancelled
 *
 * All writes are conditional, so overlapping reviews and late completions never apply twice.
 */
public class DeadLetterReviewer {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterReviewer.class);

    public static final String CLAIM_EXPIRED = "CLAIM_EXPIRED";

    private final TaskStore taskStore;
    private final WorkflowStore workflowStore;
    private final DeadLetterPolicy policy;
    private final OutcomeRecorder recorder;
    private final EngineMetrics metrics;
    private final int batchSize;
    private final Duration safetyMargin;

    public DeadLetterReviewer(
            TaskStore taskStore,
            WorkflowStore workflowStore,
            DeadLetterPolicy policy,
            OutcomeRecorder recorder,
            EngineMetrics metrics,
            EngineProperties properties) {
        this.taskStore = taskStore;
        this.workflowStore = workflowStore;
        this.policy = policy;
        this.recorder = recorder;
        this.metrics = metrics;
        this.batchSize = properties.getDeadLetter().getBatchSize();
        this.safetyMargin = properties.getSafetyMargin();
    }

    public ReviewSummary review(Instant now, PassBudget budget) {
        Tally tally = new Tally();

        // Abandoned claims first, so tasks they dead-letter are reviewed in the same pass
        recoverExpiredClaims(now, budget, tally);
        if (!tally.budgetExhausted) {
            reviewDeadLetters(now, budget, tally);
        }

        ReviewSummary summary = tally.toSummary();
        log.info("Dead-letter review finished: {}", summary);
        return summary;
    }

    private void recoverExpiredClaims(Instant now, PassBudget budget, Tally tally) {
        while (true) {
            List<Task> expired = taskStore.findExpiredClaims(now.plus(budget.elapsed()), batchSize);
            if (expired.isEmpty()) {
                return;
            }
            int progress = 0;
            for (Task task : expired) {
                if (!budget.hasMoreThan(safetyMargin)) {
                    tally.budgetExhausted = true;
                    return;
                }
                if (recoverClaim(task, now.plus(budget.elapsed()))) {
                    tally.recovered++;
                    progress++;
                } else {
                    tally.conflicts++;
                }
            }
            if (progress == 0) {
                return;
            }
        }
    }

    private void reviewDeadLetters(Instant now, PassBudget budget, Tally tally) {
        UUID after = null;
        Map<UUID, Boolean> workflowFinished = new HashMap<>();
        while (true) {
            List<Task> page = taskStore.listDeadLetter(after, batchSize);
            if (page.isEmpty()) {
                return;
            }
            for (Task task : page) {
                after = task.id();
                if (!budget.hasMoreThan(safetyMargin)) {
                    tally.budgetExhausted = true;
                    return;
                }
                tally.reviewed++;
                Instant reviewTime = now.plus(budget.elapsed());
                if (task.workflowId() != null
                        && workflowFinished.computeIfAbsent(task.workflowId(), this::isWorkflowFinished)) {
                    cancelOrphan(task, reviewTime, tally);
                    continue;
                }
                if (policy.reclassify(task, reviewTime) != ErrorClass.TRANSIENT) {
                    tally.parked++;
                    continue;
                }
                try (var ctx = LoggingContext.forTask(task.id(), task.type(), task.attempts())) {
                    if (taskStore.requeueDeadLetter(task.id(), task.reviewCount(), reviewTime)) {
                        log.info("Requeued dead-lettered task (review {}), last error {}",
                            task.reviewCount() + 1, task.lastError().code());
                        metrics.deadLetterRequeued(task.type());
                        tally.requeued++;
                    } else {
                        log.debug("Dead-lettered task changed concurrently, not requeued");
                        metrics.taskConflict("requeueDeadLetter");
                        tally.conflicts++;
                    }
                }
            }
        }
    }

    private boolean isWorkflowFinished(UUID workflowId) {
        return workflowStore.findById(workflowId)
            .map(workflow -> workflow.status().isTerminal())
            .orElse(true);
    }

    private void cancelOrphan(Task task, Instant reviewTime, Tally tally) {
        try (var ctx = LoggingContext.forTask(task.id(), task.type(), task.attempts())) {
            if (taskStore.cancelDeadLetter(task.id(), task.reviewCount(), reviewTime)) {
                log.info("Cancelled dead-lettered task of finished workflow {}", task.workflowId());
                metrics.taskOutcome(task.type(), "cancelled");
                tally.cancelled++;
            } else {
                log.debug("Dead-lettered task changed concurrently, not cancelled");
                metrics.taskConflict("cancelDeadLetter");
                tally.conflicts++;
            }
        }
    }

    private boolean recoverClaim(Task task, Instant now) {
        try (var ctx = LoggingContext.forTask(task.id(), task.type(), task.attempts())) {
            log.warn("Claim expired at {}, failing attempt {} back", task.claimExpiresAt(), task.attempts());
            TaskError error = TaskError.transientError(CLAIM_EXPIRED,
                "Claim expired at " + task.claimExpiresAt() + " before the attempt finished", now);
            TaskOutcome outcome = recorder.recordFailure(task, error, now);
            if (outcome == TaskOutcome.CONFLICT) {
                return false;
            }
            metrics.claimRecovered(task.type());
            return true;
        }
    }

    private static final class Tally {
        int reviewed;
        int requeued;
        int cancelled;
        int parked;
        int recovered;
        int conflicts;
        boolean budgetExhausted;

        ReviewSummary toSummary() {
            return new ReviewSummary(reviewed, requeued, cancelled, parked, recovered, conflicts, budgetExhausted);
        }
    }
}
