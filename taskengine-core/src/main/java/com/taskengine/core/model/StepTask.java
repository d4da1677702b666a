package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Template for a task created when a workflow step is fanned out.
 */
public record StepTask(
    String type,
    JsonNode payload,
    TaskPriority priority,
    int maxAttempts
) {
    public StepTask {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Step task type is required");
        }
        if (priority == null) {
            priority = TaskPriority.NORMAL;
        }
    }

    public static StepTask of(String type, JsonNode payload) {
        return new StepTask(type, payload, TaskPriority.NORMAL, BackoffPolicy.DEFAULT_MAX_ATTEMPTS);
    }
}
