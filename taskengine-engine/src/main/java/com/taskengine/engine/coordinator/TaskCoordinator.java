package com.taskengine.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.exception.InvalidStateTransitionException;
import com.taskengine.core.exception.NotFoundException;
import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Coordinator for the task lifecycle outside of dispatch passes:
 * enqueue, operator cancel and retry, inspection.
 */
public class TaskCoordinator implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskCoordinator.class);

    private final TaskStore taskStore;
    private final Clock clock;
    private final int defaultMaxAttempts;

    public TaskCoordinator(TaskStore taskStore, Clock clock, int defaultMaxAttempts) {
        this.taskStore = taskStore;
        this.clock = clock;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    @Override
    public UUID enqueue(String type, JsonNode payload, TaskPriority priority) {
        return enqueue(type, payload, priority, null, null, null);
    }

    @Override
    public UUID enqueue(String type, JsonNode payload, TaskPriority priority,
                        Integer maxAttempts, Instant scheduledFor, String dedupeKey) {
        Instant now = clock.instant();
        Task task = Task.create(
            type,
            payload,
            priority,
            maxAttempts != null ? maxAttempts : defaultMaxAttempts,
            scheduledFor,
            now
        ).withDedupeKey(dedupeKey);

        UUID id = taskStore.enqueue(task);
        if (id.equals(task.id())) {
            log.info("Enqueued task {} of type {} with priority {}", id, type, task.priority());
        } else {
            log.info("Task with dedupe key {} already exists: {}", dedupeKey, id);
        }
        return id;
    }

    @Override
    public Task getTask(UUID taskId) {
        return taskStore.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    @Override
    public List<Task> listDeadLetters(int limit) {
        return taskStore.listDeadLetter(limit);
    }

    @Override
    public Task cancel(UUID taskId) {
        Task task = getTask(taskId);
        if (!taskStore.cancel(taskId, clock.instant())) {
            throw new InvalidStateTransitionException("Task", currentStatus(taskId, task), "CANCELLED");
        }
        log.info("Task {} cancelled", taskId);
        return getTask(taskId);
    }

    @Override
    public Task retry(UUID taskId) {
        Task task = getTask(taskId);
        if (!taskStore.retryManually(taskId, clock.instant())) {
            throw new InvalidStateTransitionException("Task", currentStatus(taskId, task), TaskStatus.PENDING.name());
        }
        log.info("Task {} manually re-enqueued from {}", taskId, task.status());
        return getTask(taskId);
    }

    @Override
    public QueueStats stats() {
        return taskStore.stats();
    }

    private String currentStatus(UUID taskId, Task previouslyRead) {
        return taskStore.findById(taskId).map(Task::status).orElse(previouslyRead.status()).name();
    }
}
