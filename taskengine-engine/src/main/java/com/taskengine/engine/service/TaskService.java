package com.taskengine.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskPriority;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Host-facing operations on individual tasks.
 */
public interface TaskService {

    /**
     * Enqueue a task that is due immediately, with the default attempt ceiling.
     *
     * @return the new task's id
     */
    UUID enqueue(String type, JsonNode payload, TaskPriority priority);

    /**
     * Enqueue a task.
     *
     * @param type task type, routed to the handler registered for it
     * @param payload opaque payload handed to the handler
     * @param priority dispatch priority
     * @param maxAttempts attempt ceiling, or null for the configured default
     * @param scheduledFor earliest execution time, or null for now
     * @param dedupeKey optional key; a second enqueue with the same key returns the first task's id
     * @return the id of the new task, or of the existing task holding the dedupe key
     */
    UUID enqueue(String type, JsonNode payload, TaskPriority priority,
                 Integer maxAttempts, Instant scheduledFor, String dedupeKey);

    /**
     * Get a task by id.
     *
     * @throws com.taskengine.core.exception.NotFoundException if no such task exists
     */
    Task getTask(UUID taskId);

    List<Task> listDeadLetters(int limit);

    /**
     * Cancel a task that has not started its next attempt yet.
     *
     * @return the cancelled task, now FAILED_PERMANENT with code CANCELLED
     * @throws com.taskengine.core.exception.InvalidStateTransitionException if the task is not waiting
     */
    Task cancel(UUID taskId);

    /**
     * Operator retry of a DEAD_LETTER or FAILED_PERMANENT task with a fresh attempt budget.
     *
     * @throws com.taskengine.core.exception.InvalidStateTransitionException if the task is in another state
     */
    Task retry(UUID taskId);

    QueueStats stats();
}
