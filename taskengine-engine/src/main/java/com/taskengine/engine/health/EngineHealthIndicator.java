package com.taskengine.engine.health;

import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.model.WorkflowStatus;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.core.repository.WorkflowStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the task engine.
 * Reports DOWN when the store cannot be read, otherwise UP with:
 * - task counts by status
 * - workflow counts by status
 * - a warning when dead letters or stalled workflows await an operator
 */
public class EngineHealthIndicator implements HealthIndicator {

    private final TaskStore taskStore;
    private final WorkflowStore workflowStore;

    public EngineHealthIndicator(TaskStore taskStore, WorkflowStore workflowStore) {
        this.taskStore = taskStore;
        this.workflowStore = workflowStore;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            QueueStats stats = taskStore.stats();
            Map<WorkflowStatus, Long> workflows = workflowStore.countByStatus();

            details.put("store", "connected");
            details.put("tasks", stats.byStatus());
            details.put("workflows", workflows);

            long deadLetters = stats.count(TaskStatus.DEAD_LETTER);
            long stalled = workflows.getOrDefault(WorkflowStatus.STALLED, 0L);
            if (deadLetters > 0 || stalled > 0) {
                details.put("attention", String.format(
                    "%d dead-lettered tasks, %d stalled workflows", deadLetters, stalled));
            }
            return Health.up().withDetails(details).build();
        } catch (Exception e) {
            details.put("store", "disconnected");
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
