package com.taskengine.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.model.ErrorClass;
import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.engine.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for task administration.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    static final int MAX_DEAD_LETTER_PAGE = 500;

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    /**
     * Enqueue a task.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> enqueue(@RequestBody EnqueueRequest request) {
        TaskPriority priority = request.priority() != null ? request.priority() : TaskPriority.NORMAL;
        UUID id = taskService.enqueue(
            request.type(),
            request.payload(),
            priority,
            request.maxAttempts(),
            request.scheduledFor(),
            request.dedupeKey()
        );

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TaskResponse.from(taskService.getTask(id)));
    }

    /**
     * Get task by ID.
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.getTask(taskId)));
    }

    /**
     * List dead-lettered tasks, oldest first.
     */
    @GetMapping("/dead-letters")
    public ResponseEntity<List<TaskResponse>> listDeadLetters(
            @RequestParam(name = "limit", defaultValue = "50") int limit) {

        if (limit < 1 || limit > MAX_DEAD_LETTER_PAGE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_DEAD_LETTER_PAGE);
        }
        List<TaskResponse> responses = taskService.listDeadLetters(limit).stream()
            .map(TaskResponse::from)
            .toList();

        return ResponseEntity.ok(responses);
    }

    /**
     * Queue counts by status, priority and type.
     */
    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(StatsResponse.from(taskService.stats()));
    }

    /**
     * Retry a dead-lettered or permanently failed task with a fresh attempt budget.
     */
    @PostMapping("/{taskId}/retry")
    public ResponseEntity<TaskResponse> retry(@PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.retry(taskId)));
    }

    /**
     * Cancel a waiting task.
     */
    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<TaskResponse> cancel(@PathVariable UUID taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskService.cancel(taskId)));
    }

    // ========== DTOs ==========

    public record EnqueueRequest(
        String type,
        JsonNode payload,
        TaskPriority priority,
        Integer maxAttempts,
        Instant scheduledFor,
        String dedupeKey
    ) {}

    /**
     * Error messages stay out of the API; they may carry handler internals.
     */
    public record TaskResponse(
        UUID id,
        String type,
        TaskPriority priority,
        TaskStatus status,
        int attempts,
        int maxAttempts,
        Instant scheduledFor,
        Instant lastAttemptAt,
        ErrorClass errorClass,
        String errorCode,
        Instant errorAt,
        int reviewCount,
        String dedupeKey,
        UUID workflowId,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static TaskResponse from(Task task) {
            return new TaskResponse(
                task.id(),
                task.type(),
                task.priority(),
                task.status(),
                task.attempts(),
                task.maxAttempts(),
                task.scheduledFor(),
                task.lastAttemptAt(),
                task.lastError() != null ? task.lastError().errorClass() : null,
                task.lastError() != null ? task.lastError().code() : null,
                task.lastError() != null ? task.lastError().occurredAt() : null,
                task.reviewCount(),
                task.dedupeKey(),
                task.workflowId(),
                task.createdAt(),
                task.updatedAt()
            );
        }
    }

    public record StatsResponse(
        long total,
        Map<TaskStatus, Long> byStatus,
        Map<TaskPriority, Long> waitingByPriority,
        Map<String, Long> waitingByType
    ) {
        public static StatsResponse from(QueueStats stats) {
            return new StatsResponse(
                stats.total(),
                stats.byStatus(),
                stats.waitingByPriority(),
                stats.waitingByType()
            );
        }
    }
}
