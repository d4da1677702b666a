package com.taskengine.core.exception;

/**
 * Base exception for all task engine errors.
 */
public class EngineException extends RuntimeException {

    private final String errorCode;

    public EngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
