package com.taskengine.core.exception;

import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.model.WorkflowStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends EngineException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(TaskStatus currentStatus, TaskStatus targetStatus) {
        this("Task", currentStatus.name(), targetStatus.name());
    }

    public InvalidStateTransitionException(WorkflowStatus currentStatus, WorkflowStatus targetStatus) {
        this("Workflow", currentStatus.name(), targetStatus.name());
    }

    public InvalidStateTransitionException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
