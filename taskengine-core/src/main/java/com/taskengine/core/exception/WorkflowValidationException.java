package com.taskengine.core.exception;

/**
 * Thrown when a workflow definition submitted for scheduling is invalid.
 */
public class WorkflowValidationException extends EngineException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkflowValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow: %s - %s", field, reason));
    }
}
