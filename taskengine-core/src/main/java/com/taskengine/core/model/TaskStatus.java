package com.taskengine.core.model;

/**
 * Lifecycle states for a task.
 * Transitions follow a strict state machine, see {@link #canTransitionTo(TaskStatus)}.
 */
public enum TaskStatus {
    /**
     * Waiting for its first attempt.
     * Transitions: -> RUNNING, FAILED_PERMANENT (cancel)
     */
    PENDING,

    /**
     * Claimed by a dispatcher pass and currently executing.
     * Transitions: -> SUCCEEDED, RETRY_SCHEDULED, DEAD_LETTER, FAILED_PERMANENT
     */
    RUNNING,

    /**
     * Handler finished successfully. Terminal state.
     */
    SUCCEEDED,

    /**
     * Failed transiently, waiting for its next attempt at scheduledFor.
     * Transitions: -> RUNNING, FAILED_PERMANENT (cancel)
     */
    RETRY_SCHEDULED,

    /**
     * Exhausted its attempts on transient failures.
     * Reopened only by the dead-letter reviewer or an operator retry.
     * Transitions: -> PENDING, FAILED_PERMANENT (owning workflow cancelled)
     */
    DEAD_LETTER,

    /**
     * Failed with a permanent error or was cancelled.
     * Transitions: -> PENDING (operator retry only)
     */
    FAILED_PERMANENT;

    /**
     * Check if the dispatcher may pick up a task in this state once it is due.
     */
    public boolean isClaimable() {
        return this == PENDING || this == RETRY_SCHEDULED;
    }

    /**
     * Check if this state is final as far as the dispatcher is concerned.
     */
    public boolean isTerminalForDispatcher() {
        return this == SUCCEEDED || this == DEAD_LETTER || this == FAILED_PERMANENT;
    }

    /**
     * Check if this state blocks a workflow step from ever completing on its own.
     */
    public boolean isBlocking() {
        return this == DEAD_LETTER || this == FAILED_PERMANENT;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING, RETRY_SCHEDULED -> target == RUNNING || target == FAILED_PERMANENT;
            case RUNNING -> target == SUCCEEDED || target == RETRY_SCHEDULED ||
                            target == DEAD_LETTER || target == FAILED_PERMANENT;
            case SUCCEEDED -> false;
            case DEAD_LETTER -> target == PENDING || target == FAILED_PERMANENT;
            case FAILED_PERMANENT -> target == PENDING;
        };
    }
}
