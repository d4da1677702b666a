package com.taskengine.core.model;

import com.taskengine.core.exception.InvalidStateTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An ordered progression of steps, each backed by zero or more tasks.
 *
 * Primary Key: id
 *
 * Invariants:
 * - currentStepIndex only moves forward
 * - status == COMPLETED only when every step's tasks succeeded
 * - version is bumped by the store on every successful update (optimistic locking)
 */
public record WorkflowInstance(
    UUID id,
    String name,

    // State
    WorkflowStatus status,
    List<WorkflowStep> steps,
    int currentStepIndex,
    String statusReason,

    // Timing
    Instant activateAt,
    Instant lastProgressAt,
    Instant createdAt,
    Instant updatedAt,

    // Versioning (optimistic locking)
    long version
) {
    public WorkflowInstance {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Create a new workflow in SCHEDULED state.
     */
    public static WorkflowInstance create(String name, List<WorkflowStep> steps, Instant activateAt, Instant now) {
        return new WorkflowInstance(
            UUID.randomUUID(),
            name,
            WorkflowStatus.SCHEDULED,
            steps,
            0,
            null,
            activateAt != null ? activateAt : now,
            null,
            now,
            now,
            0L
        );
    }

    public boolean isDue(Instant now) {
        return status == WorkflowStatus.SCHEDULED && !activateAt.isAfter(now);
    }

    public boolean hasCurrentStep() {
        return currentStepIndex < steps.size();
    }

    public WorkflowStep currentStep() {
        if (!hasCurrentStep()) {
            throw new IllegalStateException("Workflow " + id + " has no step at index " + currentStepIndex);
        }
        return steps.get(currentStepIndex);
    }

    /**
     * Check if the workflow has gone without progress for longer than the threshold.
     */
    public boolean isStale(Instant now, Duration threshold) {
        return status == WorkflowStatus.ACTIVE
            && lastProgressAt != null
            && Duration.between(lastProgressAt, now).compareTo(threshold) > 0;
    }

    /**
     * Create a copy with the task ids of the given step recorded.
     */
    public WorkflowInstance withStepTaskIds(int stepIndex, List<UUID> taskIds, Instant now) {
        List<WorkflowStep> updated = new ArrayList<>(steps);
        updated.set(stepIndex, steps.get(stepIndex).withTaskIds(taskIds));
        return new WorkflowInstance(
            id, name, status, updated, currentStepIndex, statusReason,
            activateAt, lastProgressAt, createdAt, now, version
        );
    }

    public WorkflowInstance activated(Instant now) {
        return transition(WorkflowStatus.ACTIVE, null, now, now);
    }

    /**
     * Create a copy with the step pointer moved to the next step.
     */
    public WorkflowInstance advanced(Instant now) {
        if (status != WorkflowStatus.ACTIVE) {
            throw new InvalidStateTransitionException("Workflow", status.name(), "advance");
        }
        if (!hasCurrentStep()) {
            throw new IllegalStateException("Workflow " + id + " is already past its last step");
        }
        return new WorkflowInstance(
            id, name, status, steps, currentStepIndex + 1, statusReason,
            activateAt, now, createdAt, now, version
        );
    }

    public WorkflowInstance completed(Instant now) {
        if (hasCurrentStep()) {
            throw new IllegalStateException(
                "Workflow " + id + " cannot complete at step " + currentStepIndex + " of " + steps.size());
        }
        return transition(WorkflowStatus.COMPLETED, null, lastProgressAt, now);
    }

    public WorkflowInstance stalled(String reason, Instant now) {
        return transition(WorkflowStatus.STALLED, reason, lastProgressAt, now);
    }

    /**
     * Create a copy resumed by an operator. The staleness clock restarts.
     */
    public WorkflowInstance resumed(Instant now) {
        if (status != WorkflowStatus.STALLED) {
            throw new InvalidStateTransitionException(status, WorkflowStatus.ACTIVE);
        }
        return transition(WorkflowStatus.ACTIVE, null, now, now);
    }

    public WorkflowInstance cancelled(String reason, Instant now) {
        return transition(WorkflowStatus.CANCELLED, reason, lastProgressAt, now);
    }

    private WorkflowInstance transition(WorkflowStatus target, String reason, Instant progressAt, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
        return new WorkflowInstance(
            id, name, target, steps, currentStepIndex, reason,
            activateAt, progressAt, createdAt, now, version
        );
    }
}
