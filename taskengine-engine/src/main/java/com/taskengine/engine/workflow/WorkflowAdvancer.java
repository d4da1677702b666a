package com.taskengine.engine.workflow;

import com.taskengine.core.exception.OptimisticLockException;
import com.taskengine.core.model.StepTask;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStatus;
import com.taskengine.core.model.WorkflowStep;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Moves workflows forward from the state of their tasks.
 *
 * The advancer never runs or retries tasks itself. It activates due workflows, fans out
 * each step's tasks, advances the step pointer once every task of the current step
 * succeeded, and marks workflows STALLED when they stop making progress.
 */
public class WorkflowAdvancer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAdvancer.class);

    private final WorkflowStore workflowStore;
    private final TaskStore taskStore;
    private final EngineMetrics metrics;
    private final EngineProperties.Workflow settings;
    private final Duration safetyMargin;

    public WorkflowAdvancer(
            WorkflowStore workflowStore,
            TaskStore taskStore,
            EngineMetrics metrics,
            EngineProperties properties) {
        this.workflowStore = workflowStore;
        this.taskStore = taskStore;
        this.metrics = metrics;
        this.settings = properties.getWorkflow();
        this.safetyMargin = properties.getSafetyMargin();
    }

    /**
     * Build the dedupe key of the task created for one template of one step.
     * Repeating a fan-out with the same key returns the existing task.
     */
    public static String fanOutKey(UUID workflowId, int stepIndex, int taskIndex) {
        return "workflow:" + workflowId + ":" + stepIndex + ":" + taskIndex;
    }

    public AdvanceSummary advance(Instant now, PassBudget budget) {
        Tally tally = new Tally();

        // Activate due workflows
        for (WorkflowInstance scheduled : workflowStore.findDueScheduled(now, settings.getBatchSize())) {
            if (!budget.hasMoreThan(safetyMargin)) {
                tally.budgetExhausted = true;
                break;
            }
            try (var ctx = LoggingContext.forWorkflow(scheduled.id())) {
                Tally local = new Tally();
                local.activated++;
                WorkflowInstance active = scheduled.activated(now);
                log.info("Activating workflow {} with {} steps", active.name(), active.steps().size());
                commit(progress(active, now, local), local, tally);
            }
        }

        // Advance active workflows
        UUID after = null;
        while (!tally.budgetExhausted) {
            List<WorkflowInstance> page = workflowStore.findByStatus(WorkflowStatus.ACTIVE, after, settings.getBatchSize());
            if (page.isEmpty()) {
                break;
            }
            for (WorkflowInstance workflow : page) {
                after = workflow.id();
                if (!budget.hasMoreThan(safetyMargin)) {
                    tally.budgetExhausted = true;
                    break;
                }
                try (var ctx = LoggingContext.forWorkflow(workflow.id())) {
                    Tally local = new Tally();
                    WorkflowInstance updated = progress(workflow, now, local);
                    if (updated == workflow && workflow.isStale(now, settings.getStaleThreshold())) {
                        updated = markStalled(workflow, now, local);
                    }
                    if (updated != workflow) {
                        commit(updated, local, tally);
                    } else {
                        tally.blocked += local.blocked;
                    }
                }
            }
        }

        AdvanceSummary summary = tally.toSummary();
        log.info("Workflow pass finished: {}", summary);
        return summary;
    }

    /**
     * Fan out and advance as far as the current task states allow.
     * Returns the same instance when nothing changed.
     */
    private WorkflowInstance progress(WorkflowInstance workflow, Instant now, Tally local) {
        WorkflowInstance current = workflow;
        while (true) {
            if (!current.hasCurrentStep()) {
                log.info("Workflow {} completed", current.name());
                local.completed++;
                return current.completed(now);
            }

            if (!current.currentStep().isFannedOut()) {
                current = fanOut(current, now);
            }

            StepState state = inspect(current.currentStep());
            if (state == StepState.BLOCKED) {
                local.blocked++;
                return current;
            }
            if (state == StepState.IN_PROGRESS) {
                return current;
            }

            log.info("Step {} ({}) complete, advancing", current.currentStepIndex(), current.currentStep().name());
            local.advanced++;
            current = current.advanced(now);
        }
    }

    private WorkflowInstance fanOut(WorkflowInstance workflow, Instant now) {
        int stepIndex = workflow.currentStepIndex();
        WorkflowStep step = workflow.currentStep();
        List<UUID> taskIds = new ArrayList<>(step.tasks().size());
        for (int i = 0; i < step.tasks().size(); i++) {
            StepTask template = step.tasks().get(i);
            Task task = Task.create(
                    template.type(), template.payload(), template.priority(), template.maxAttempts(), now, now)
                .withDedupeKey(fanOutKey(workflow.id(), stepIndex, i))
                .withWorkflowId(workflow.id());
            taskIds.add(taskStore.enqueue(task));
        }
        log.info("Fanned out {} tasks for step {} ({})", taskIds.size(), stepIndex, step.name());
        return workflow.withStepTaskIds(stepIndex, taskIds, now);
    }

    private StepState inspect(WorkflowStep step) {
        List<Task> tasks = taskStore.findByIds(step.taskIds());
        for (Task task : tasks) {
            if (task.status().isBlocking()) {
                log.warn("Step {} blocked by task {} in {}", step.name(), task.id(), task.status());
                return StepState.BLOCKED;
            }
        }
        if (tasks.size() < step.taskIds().size()) {
            log.warn("Step {} references {} tasks but only {} exist", step.name(), step.taskIds().size(), tasks.size());
            return StepState.IN_PROGRESS;
        }
        boolean allSucceeded = tasks.stream().allMatch(t -> t.status() == TaskStatus.SUCCEEDED);
        return allSucceeded ? StepState.COMPLETE : StepState.IN_PROGRESS;
    }

    private WorkflowInstance markStalled(WorkflowInstance workflow, Instant now, Tally local) {
        String reason = String.format("No progress since %s at step %d (%s)",
            workflow.lastProgressAt(), workflow.currentStepIndex(), workflow.currentStep().name());
        log.warn("Workflow {} stalled: {}", workflow.name(), reason);
        local.stalled++;
        return workflow.stalled(reason, now);
    }

    private void commit(WorkflowInstance updated, Tally local, Tally total) {
        try {
            workflowStore.update(updated);
        } catch (OptimisticLockException e) {
            log.warn("Workflow {} changed concurrently, skipping this pass: {}", updated.id(), e.getMessage());
            total.conflicts++;
            return;
        }
        total.add(local);
        if (local.activated > 0) {
            metrics.workflowTransition(updated.name(), WorkflowStatus.ACTIVE.name());
        }
        if (updated.status() != WorkflowStatus.ACTIVE) {
            metrics.workflowTransition(updated.name(), updated.status().name());
        }
    }

    private enum StepState {
        IN_PROGRESS,
        COMPLETE,
        BLOCKED
    }

    private static final class Tally {
        int activated;
        int advanced;
        int completed;
        int stalled;
        int blocked;
        int conflicts;
        boolean budgetExhausted;

        void add(Tally other) {
            activated += other.activated;
            advanced += other.advanced;
            completed += other.completed;
            stalled += other.stalled;
            blocked += other.blocked;
        }

        AdvanceSummary toSummary() {
            return new AdvanceSummary(activated, advanced, completed, stalled, blocked, conflicts, budgetExhausted);
        }
    }
}
