package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.UUID;

/**
 * An opaque, independently schedulable unit of background work.
 *
 * Primary Key: id
 * Unique Constraint: dedupeKey (when present)
 *
 * Invariants:
 * - attempts <= maxAttempts unless status == DEAD_LETTER
 * - attempts counts dispatched attempts; the claim increments it
 * - claimExpiresAt set iff status == RUNNING
 * - lastError set after the first failure, cleared on requeue
 */
public record Task(
    // Primary key
    UUID id,

    // Routing
    String type,
    JsonNode payload,
    TaskPriority priority,

    // State
    TaskStatus status,
    int attempts,
    int maxAttempts,

    // Timing
    Instant scheduledFor,
    Instant lastAttemptAt,
    Instant claimExpiresAt,

    // Failure tracking
    TaskError lastError,
    int reviewCount,

    // Ownership
    String dedupeKey,
    UUID workflowId,

    Instant createdAt,
    Instant updatedAt
) {
    public static final String CANCELLED_CODE = "CANCELLED";

    public Task {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Task type is required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (priority == null) {
            priority = TaskPriority.NORMAL;
        }
    }

    /**
     * Create a new task in PENDING state.
     */
    public static Task create(
            String type,
            JsonNode payload,
            TaskPriority priority,
            int maxAttempts,
            Instant scheduledFor,
            Instant now) {
        return new Task(
            UUID.randomUUID(),
            type,
            payload,
            priority,
            TaskStatus.PENDING,
            0,
            maxAttempts,
            scheduledFor != null ? scheduledFor : now,
            null,
            null,
            null,
            0,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Check if the task may be claimed at the given time.
     */
    public boolean isDue(Instant now) {
        return status.isClaimable() && !scheduledFor.isAfter(now);
    }

    /**
     * Check if a RUNNING task's claim has lapsed.
     */
    public boolean isClaimExpired(Instant now) {
        return status == TaskStatus.RUNNING && claimExpiresAt != null && claimExpiresAt.isBefore(now);
    }

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    public Task withDedupeKey(String key) {
        return new Task(
            id, type, payload, priority, status, attempts, maxAttempts,
            scheduledFor, lastAttemptAt, claimExpiresAt, lastError, reviewCount,
            key, workflowId, createdAt, updatedAt
        );
    }

    public Task withWorkflowId(UUID owner) {
        return new Task(
            id, type, payload, priority, status, attempts, maxAttempts,
            scheduledFor, lastAttemptAt, claimExpiresAt, lastError, reviewCount,
            dedupeKey, owner, createdAt, updatedAt
        );
    }

    public Task withPriority(TaskPriority newPriority, Instant now) {
        return new Task(
            id, type, payload, newPriority, status, attempts, maxAttempts,
            scheduledFor, lastAttemptAt, claimExpiresAt, lastError, reviewCount,
            dedupeKey, workflowId, createdAt, now
        );
    }

    /**
     * Create a copy claimed for execution: RUNNING with the attempt counted.
     */
    public Task claimed(Instant now, Instant expiresAt) {
        checkTransition(TaskStatus.RUNNING);
        return new Task(
            id, type, payload, priority, TaskStatus.RUNNING, attempts + 1, maxAttempts,
            scheduledFor, now, expiresAt, lastError, reviewCount,
            dedupeKey, workflowId, createdAt, now
        );
    }

    public Task succeeded(Instant now) {
        checkTransition(TaskStatus.SUCCEEDED);
        return new Task(
            id, type, payload, priority, TaskStatus.SUCCEEDED, attempts, maxAttempts,
            scheduledFor, lastAttemptAt, null, lastError, reviewCount,
            dedupeKey, workflowId, createdAt, now
        );
    }

    public Task retryScheduled(Instant nextTime, TaskError error, Instant now) {
        checkTransition(TaskStatus.RETRY_SCHEDULED);
        return new Task(
            id, type, payload, priority, TaskStatus.RETRY_SCHEDULED, attempts, maxAttempts,
            nextTime, lastAttemptAt, null, error, reviewCount,
            dedupeKey, workflowId, createdAt, now
        );
    }

    public Task deadLettered(TaskError error, Instant now) {
        checkTransition(TaskStatus.DEAD_LETTER);
        return new Task(
            id, type, payload, priority, TaskStatus.DEAD_LETTER, attempts, maxAttempts,
            scheduledFor, lastAttemptAt, null, error, reviewCount,
            dedupeKey, workflowId, createdAt, now
        );
    }

    public Task failedPermanently(TaskError error, Instant now) {
        checkTransition(TaskStatus.FAILED_PERMANENT);
        return new Task(
            id, type, payload, priority, TaskStatus.FAILED_PERMANENT, attempts, maxAttempts,
            scheduledFor, lastAttemptAt, null, error, reviewCount,
            dedupeKey, workflowId, createdAt, now
        );
    }

    /**
     * Create a copy cancelled before it ran again. Recorded as a permanent failure.
     */
    public Task cancelled(Instant now) {
        return failedPermanently(TaskError.permanentError(CANCELLED_CODE, "Cancelled by operator", now), now);
    }

    /**
     * Create a copy re-enqueued by the dead-letter reviewer.
     * The attempt budget starts over and the review is counted.
     */
    public Task requeuedFromDeadLetter(Instant now) {
        if (status != TaskStatus.DEAD_LETTER) {
            throw new InvalidStateTransitionException(status, TaskStatus.PENDING);
        }
        return new Task(
            id, type, payload, priority, TaskStatus.PENDING, 0, maxAttempts,
            now, lastAttemptAt, null, lastError, reviewCount + 1,
            dedupeKey, workflowId, createdAt, now
        );
    }

    /**
     * Create a copy reopened by an operator. Both the attempt and review budgets start over.
     */
    public Task retriedManually(Instant now) {
        checkTransition(TaskStatus.PENDING);
        return new Task(
            id, type, payload, priority, TaskStatus.PENDING, 0, maxAttempts,
            now, lastAttemptAt, null, lastError, 0,
            dedupeKey, workflowId, createdAt, now
        );
    }

    private void checkTransition(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
    }
}
