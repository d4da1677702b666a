package com.taskengine.core.model;

/**
 * Lifecycle states for a workflow instance.
 */
public enum WorkflowStatus {
    /**
     * Created with a future activateAt.
     * Transitions: -> ACTIVE, CANCELLED
     */
    SCHEDULED,

    /**
     * Steps are being fanned out and advanced.
     * Transitions: -> COMPLETED, STALLED, CANCELLED
     */
    ACTIVE,

    /**
     * Every step's tasks succeeded. Terminal state.
     */
    COMPLETED,

    /**
     * No progress within the staleness threshold. Requires external intervention.
     * Transitions: -> ACTIVE (resume), CANCELLED
     */
    STALLED,

    /**
     * Cancelled by an operator. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Check if this state requires manual intervention.
     */
    public boolean requiresIntervention() {
        return this == STALLED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return switch (this) {
            case SCHEDULED -> target == ACTIVE || target == CANCELLED;
            case ACTIVE -> target == COMPLETED || target == STALLED || target == CANCELLED;
            case STALLED -> target == ACTIVE || target == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
