package com.taskengine.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.model.Task;

import java.time.Instant;
import java.util.UUID;

/**
 * Context provided to task handlers during execution.
 */
public class TaskContext {

    private final Task task;
    private final ObjectMapper objectMapper;
    private final Instant startedAt;

    public TaskContext(Task task, ObjectMapper objectMapper, Instant startedAt) {
        this.task = task;
        this.objectMapper = objectMapper;
        this.startedAt = startedAt;
    }

    public Task getTask() {
        return task;
    }

    public UUID getTaskId() {
        return task.id();
    }

    public String getType() {
        return task.type();
    }

    public JsonNode getPayload() {
        return task.payload();
    }

    /**
     * Get the payload bound to a specific type.
     *
     * @throws IllegalArgumentException if the payload does not fit the type
     */
    public <T> T getPayload(Class<T> type) {
        return objectMapper.convertValue(task.payload(), type);
    }

    /**
     * Get the 1-indexed number of the attempt being executed.
     */
    public int getAttempt() {
        return task.attempts();
    }

    public boolean isLastAttempt() {
        return task.attempts() >= task.maxAttempts();
    }

    /**
     * Get the workflow that owns this task, or null for a standalone task.
     */
    public UUID getWorkflowId() {
        return task.workflowId();
    }

    /**
     * Get a key that is identical for every attempt of this task.
     * Pass it to downstream systems to deduplicate side effects.
     */
    public String getIdempotencyKey() {
        return task.dedupeKey() != null ? task.dedupeKey() : "task:" + task.id();
    }

    /**
     * Get the pass time at which this attempt started.
     */
    public Instant getStartedAt() {
        return startedAt;
    }
}
