package com.taskengine.recovery.retention;

import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.core.repository.WorkflowStore;
import com.taskengine.engine.config.EngineProperties;
import com.taskengine.engine.dispatch.PassBudget;
import com.taskengine.engine.logging.LoggingContext;
import com.taskengine.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Deletes finished rows older than the retention period, in bounded batches.
 * Dead-lettered tasks are never touched, and neither is a workflow that is unfinished or still owns one.
 */
public class RetentionPurger {

    private static final Logger log = LoggerFactory.getLogger(RetentionPurger.class);

    private final TaskStore taskStore;
    private final WorkflowStore workflowStore;
    private final EngineMetrics metrics;
    private final EngineProperties.Retention settings;
    private final Duration safetyMargin;

    public RetentionPurger(
            TaskStore taskStore,
            WorkflowStore workflowStore,
            EngineMetrics metrics,
            EngineProperties properties) {
        this.taskStore = taskStore;
        this.workflowStore = workflowStore;
        this.metrics = metrics;
        this.settings = properties.getRetention();
        this.safetyMargin = properties.getSafetyMargin();
    }

    public PurgeSummary purge(Instant now, PassBudget budget) {
        Instant cutoff = now.minus(settings.getPeriod());
        Tally tally = new Tally();

        purgeWorkflows(cutoff, budget, tally);
        if (!tally.budgetExhausted) {
            purgeStandaloneTasks(cutoff, budget, tally);
        }

        metrics.purged("workflows", tally.workflows);
        metrics.purged("tasks", tally.tasks);
        PurgeSummary summary = new PurgeSummary(
            tally.workflows, tally.workflowsKept, tally.tasks, tally.budgetExhausted);
        log.info("Retention purge finished (cutoff {}): {}", cutoff, summary);
        return summary;
    }

    private void purgeWorkflows(Instant cutoff, PassBudget budget, Tally tally) {
        UUID after = null;
        while (true) {
            List<WorkflowInstance> expired = workflowStore.findTerminalBefore(cutoff, after, settings.getBatchSize());
            if (expired.isEmpty()) {
                return;
            }
            for (WorkflowInstance workflow : expired) {
                if (!budget.hasMoreThan(safetyMargin)) {
                    tally.budgetExhausted = true;
                    return;
                }
                after = workflow.id();
                try (var ctx = LoggingContext.forWorkflow(workflow.id())) {
                    purgeWorkflow(workflow, tally);
                }
            }
        }
    }

    private void purgeWorkflow(WorkflowInstance workflow, Tally tally) {
        int deadLettered = countDeadLettered(workflow);
        if (deadLettered > 0) {
            tally.workflowsKept++;
            log.warn("Keeping {} workflow {}: {} tasks still in the dead letter queue",
                workflow.status(), workflow.name(), deadLettered);
            return;
        }
        int owned = taskStore.deleteByWorkflow(workflow.id());
        if (workflowStore.delete(workflow.id())) {
            tally.workflows++;
        }
        tally.tasks += owned;
        log.debug("Purged {} workflow {} with {} tasks", workflow.status(), workflow.name(), owned);
    }

    private int countDeadLettered(WorkflowInstance workflow) {
        List<UUID> taskIds = workflow.steps().stream()
            .flatMap(step -> step.taskIds().stream())
            .collect(Collectors.toList());
        if (taskIds.isEmpty()) {
            return 0;
        }
        return (int) taskStore.findByIds(taskIds).stream()
            .filter(task -> task.status() == TaskStatus.DEAD_LETTER)
            .count();
    }

    private void purgeStandaloneTasks(Instant cutoff, PassBudget budget, Tally tally) {
        while (true) {
            if (!budget.hasMoreThan(safetyMargin)) {
                tally.budgetExhausted = true;
                return;
            }
            int deleted = taskStore.purgeTerminal(cutoff, settings.getBatchSize());
            tally.tasks += deleted;
            if (deleted < settings.getBatchSize()) {
                return;
            }
        }
    }

    private static final class Tally {
        int workflows;
        int workflowsKept;
        int tasks;
        boolean budgetExhausted;
    }
}
