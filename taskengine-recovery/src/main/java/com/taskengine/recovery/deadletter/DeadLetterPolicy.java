package com.taskengine.recovery.deadletter;

import com.taskengine.core.model.ErrorClass;
import com.taskengine.core.model.Task;

import java.time.Instant;

/**
 * Decides, at review time, whether a dead-lettered task's last error still looks transient.
 * A TRANSIENT verdict re-enqueues the task; PERMANENT leaves it parked for an operator.
 */
public interface DeadLetterPolicy {

    ErrorClass reclassify(Task task, Instant now);
}
