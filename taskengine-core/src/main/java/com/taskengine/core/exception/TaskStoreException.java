package com.taskengine.core.exception;

/**
 * Thrown when the task or workflow store cannot be read or written.
 */
public class TaskStoreException extends OrchestrationException {

    public static final String ERROR_CODE = "STORE_UNAVAILABLE";

    public TaskStoreException(String operation, Throwable cause) {
        super(ERROR_CODE, "Store operation failed: " + operation, cause);
    }
}
