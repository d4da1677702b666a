package com.taskengine.engine.handler;

import com.taskengine.core.model.ErrorClass;

/**
 * Exception thrown by task handlers to report a classified failure.
 */
public class TaskHandlerException extends Exception {

    private final String errorCode;
    private final ErrorClass errorClass;

    public TaskHandlerException(ErrorClass errorClass, String errorCode, String message) {
        super(message);
        this.errorClass = errorClass;
        this.errorCode = errorCode;
    }

    public TaskHandlerException(ErrorClass errorClass, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }

    /**
     * Create a failure that will be retried with backoff (network blip, rate limit, 5xx).
     */
    public static TaskHandlerException transientFailure(String errorCode, String message) {
        return new TaskHandlerException(ErrorClass.TRANSIENT, errorCode, message);
    }

    /**
     * Create a failure that must not be retried (bad payload, rejected by downstream).
     */
    public static TaskHandlerException permanentFailure(String errorCode, String message) {
        return new TaskHandlerException(ErrorClass.PERMANENT, errorCode, message);
    }
}
