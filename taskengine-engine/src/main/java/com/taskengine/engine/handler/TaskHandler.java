package com.taskengine.engine.handler;

/**
 * Host-supplied implementation of one task type.
 *
 * Handlers may run more than once for the same task (at-least-once delivery), so their
 * side effects must be idempotent. {@link TaskContext#getIdempotencyKey()} is stable
 * across attempts and can be passed to downstream systems.
 */
public interface TaskHandler {

    /**
     * The task type this handler executes.
     */
    String type();

    /**
     * Execute one attempt of the task.
     *
     * Returning normally marks the task SUCCEEDED. Throw {@link TaskHandlerException}
     * to choose the error class explicitly; any other exception is classified by
     * {@link ErrorClassifier}.
     *
     * @param context execution context providing the payload and attempt details
     */
    void handle(TaskContext context) throws Exception;
}
