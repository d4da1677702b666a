package com.taskengine.engine.coordinator;

import com.taskengine.core.exception.InvalidStateTransitionException;
import com.taskengine.core.exception.NotFoundException;
import com.taskengine.core.exception.WorkflowValidationException;
import com.taskengine.core.model.StepTask;
import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStatus;
import com.taskengine.core.model.WorkflowStep;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.core.repository.WorkflowStore;
import com.taskengine.engine.logging.LoggingContext;
import com.taskengine.engine.metrics.EngineMetrics;
import com.taskengine.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Coordinator for workflow scheduling and operator interventions.
 * Progression itself belongs to the {@link com.taskengine.engine.workflow.WorkflowAdvancer}.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private final WorkflowStore workflowStore;
    private final TaskStore taskStore;
    private final EngineMetrics metrics;
    private final Clock clock;

    public WorkflowCoordinator(WorkflowStore workflowStore, TaskStore taskStore, EngineMetrics metrics, Clock clock) {
        this.workflowStore = workflowStore;
        this.taskStore = taskStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public UUID schedule(String name, List<WorkflowStep> steps, Instant activateAt) {
        validate(name, steps);

        WorkflowInstance instance = WorkflowInstance.create(name, steps, activateAt, clock.instant());
        workflowStore.save(instance);

        try (var ctx = LoggingContext.forWorkflow(instance.id())) {
            log.info("Scheduled workflow {} with {} steps, activating at {}",
                name, steps.size(), instance.activateAt());
        }
        metrics.workflowTransition(name, WorkflowStatus.SCHEDULED.name());
        return instance.id();
    }

    @Override
    public WorkflowInstance getWorkflow(UUID workflowId) {
        return workflowStore.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId.toString()));
    }

    @Override
    public WorkflowInstance resume(UUID workflowId) {
        WorkflowInstance instance = getWorkflow(workflowId);
        WorkflowInstance resumed = workflowStore.update(instance.resumed(clock.instant()));

        try (var ctx = LoggingContext.forWorkflow(workflowId)) {
            log.info("Workflow {} resumed at step {}", resumed.name(), resumed.currentStepIndex());
        }
        metrics.workflowTransition(resumed.name(), WorkflowStatus.ACTIVE.name());
        return resumed;
    }

    @Override
    public WorkflowInstance cancel(UUID workflowId, String reason) {
        WorkflowInstance instance = getWorkflow(workflowId);
        if (instance.status().isTerminal()) {
            throw new InvalidStateTransitionException(instance.status(), WorkflowStatus.CANCELLED);
        }
        Instant now = clock.instant();
        WorkflowInstance cancelled = workflowStore.update(
            instance.cancelled(reason != null ? reason : "Cancelled by operator", now));

        try (var ctx = LoggingContext.forWorkflow(workflowId)) {
            // Dead letters go too, so the reviewer never requeues work for a cancelled workflow.
            int cancelledTasks = taskStore.cancelByWorkflow(workflowId, now);
            log.info("Workflow {} cancelled ({} waiting or dead-lettered tasks cancelled): {}",
                cancelled.name(), cancelledTasks, cancelled.statusReason());
        }
        metrics.workflowTransition(cancelled.name(), WorkflowStatus.CANCELLED.name());
        return cancelled;
    }

    private void validate(String name, List<WorkflowStep> steps) {
        if (name == null || name.isBlank()) {
            throw new WorkflowValidationException("name", "is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("steps", "at least one step is required");
        }
        Set<String> stepNames = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!stepNames.add(step.name())) {
                throw new WorkflowValidationException("steps", "duplicate step name '" + step.name() + "'");
            }
            if (!step.taskIds().isEmpty()) {
                throw new WorkflowValidationException("steps", "step '" + step.name() + "' is already fanned out");
            }
            for (StepTask task : step.tasks()) {
                if (task.maxAttempts() < 1) {
                    throw new WorkflowValidationException("steps",
                        "task '" + task.type() + "' in step '" + step.name() + "' needs maxAttempts >= 1");
                }
            }
        }
    }
}
