package com.taskengine.core.exception;

/**
 * Infrastructure failure that aborts a whole pass, as opposed to a task failure
 * that stays inside its per-task boundary. The next scheduled invocation retries.
 */
public class OrchestrationException extends EngineException {

    public static final String ERROR_CODE = "ORCHESTRATION_FAILED";

    public OrchestrationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    protected OrchestrationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
