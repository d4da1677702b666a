package com.taskengine.core.exception;

/**
 * Thrown when a task or workflow is not found.
 */
public class NotFoundException extends EngineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
    }
}
