package com.taskengine.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One step of a workflow: the task templates it fans out and, once fanned out,
 * the ids of the tasks that back it.
 */
public record WorkflowStep(
    String name,
    List<StepTask> tasks,
    List<UUID> taskIds
) {
    public WorkflowStep {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
    }

    public static WorkflowStep of(String name, StepTask... tasks) {
        return new WorkflowStep(name, List.of(tasks), List.of());
    }

    @JsonIgnore
    public boolean isFannedOut() {
        return taskIds.size() == tasks.size();
    }

    public WorkflowStep withTaskIds(List<UUID> ids) {
        return new WorkflowStep(name, tasks, new ArrayList<>(ids));
    }
}
