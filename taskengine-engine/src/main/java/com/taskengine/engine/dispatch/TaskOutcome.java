package com.taskengine.engine.dispatch;

/**
 * What happened to a claimed task once its attempt was recorded.
 */
public enum TaskOutcome {
    SUCCEEDED,
    RETRIED,
    DEAD_LETTERED,
    FAILED_PERMANENTLY,

    /**
     * The task was no longer RUNNING the attempt we claimed; nothing was written.
     */
    CONFLICT
}
