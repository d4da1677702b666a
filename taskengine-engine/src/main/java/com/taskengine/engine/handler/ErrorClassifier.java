package com.taskengine.engine.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.taskengine.core.model.ErrorClass;
import com.taskengine.core.model.TaskError;
import org.springframework.dao.TransientDataAccessException;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions escaping a task handler onto the transient / permanent taxonomy.
 *
 * A {@link TaskHandlerException} anywhere in the cause chain wins. Otherwise the first
 * recognised exception type in the chain decides. Unrecognised failures are treated as
 * transient: the attempt ceiling still bounds them.
 */
public class ErrorClassifier {

    public static final String NO_HANDLER = "NO_HANDLER";
    public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";
    public static final String UNSUPPORTED = "UNSUPPORTED";
    public static final String IO_ERROR = "IO_ERROR";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String DOWNSTREAM_UNAVAILABLE = "DOWNSTREAM_UNAVAILABLE";
    public static final String UNEXPECTED = "UNEXPECTED";

    private static final int MAX_CAUSE_DEPTH = 16;

    public TaskError classify(Throwable failure, Instant now) {
        TaskHandlerException handlerException = findHandlerException(failure);
        if (handlerException != null) {
            return new TaskError(
                handlerException.getErrorClass(),
                handlerException.getErrorCode(),
                handlerException.getMessage(),
                now);
        }

        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            TaskError known = classifyKnown(current, now);
            if (known != null) {
                return known;
            }
            current = current.getCause();
        }
        return TaskError.transientError(UNEXPECTED, describe(failure), now);
    }

    public TaskError noHandler(String type, Instant now) {
        return TaskError.permanentError(NO_HANDLER, "No handler registered for task type '" + type + "'", now);
    }

    private TaskError classifyKnown(Throwable t, Instant now) {
        // JsonProcessingException is an IOException, so it must be checked first
        if (t instanceof JsonProcessingException || t instanceof IllegalArgumentException) {
            return new TaskError(ErrorClass.PERMANENT, INVALID_PAYLOAD, describe(t), now);
        }
        if (t instanceof UnsupportedOperationException) {
            return new TaskError(ErrorClass.PERMANENT, UNSUPPORTED, describe(t), now);
        }
        if (t instanceof TimeoutException) {
            return new TaskError(ErrorClass.TRANSIENT, TIMEOUT, describe(t), now);
        }
        if (t instanceof IOException) {
            return new TaskError(ErrorClass.TRANSIENT, IO_ERROR, describe(t), now);
        }
        if (t instanceof TransientDataAccessException) {
            return new TaskError(ErrorClass.TRANSIENT, DOWNSTREAM_UNAVAILABLE, describe(t), now);
        }
        return null;
    }

    private TaskHandlerException findHandlerException(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TaskHandlerException) {
                return (TaskHandlerException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null ? t.getClass().getSimpleName() + ": " + message : t.getClass().getSimpleName();
    }
}
