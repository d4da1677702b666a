package com.taskengine.core.model;

import java.time.Instant;

/**
 * Last classified error recorded on a task.
 *
 * @param errorClass transient or permanent
 * @param code short machine readable code, e.g. TIMEOUT or INVALID_PAYLOAD
 * @param message human readable detail, truncated to {@link #MAX_MESSAGE_LENGTH}
 * @param occurredAt when the failure was observed
 */
public record TaskError(
    ErrorClass errorClass,
    String code,
    String message,
    Instant occurredAt
) {
    public static final int MAX_MESSAGE_LENGTH = 2000;

    public TaskError {
        if (errorClass == null) {
            throw new IllegalArgumentException("errorClass is required");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code is required");
        }
        if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
    }

    public static TaskError transientError(String code, String message, Instant occurredAt) {
        return new TaskError(ErrorClass.TRANSIENT, code, message, occurredAt);
    }

    public static TaskError permanentError(String code, String message, Instant occurredAt) {
        return new TaskError(ErrorClass.PERMANENT, code, message, occurredAt);
    }

    public boolean isTransient() {
        return errorClass == ErrorClass.TRANSIENT;
    }
}
