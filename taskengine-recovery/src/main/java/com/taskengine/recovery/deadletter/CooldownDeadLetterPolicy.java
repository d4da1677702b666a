package com.taskengine.recovery.deadletter;

import com.taskengine.core.model.ErrorClass;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Default dead-letter policy.
 *
 * A task is requeued only when all of the following hold:
 * - its last error was classified TRANSIENT
 * - the error code is not one of the parked codes
 * - at least {@code cooldown} has passed since its last attempt
 * - it has been requeued by a review fewer than {@code maxReviews} times
 */
public class CooldownDeadLetterPolicy implements DeadLetterPolicy {

    private final Duration cooldown;
    private final int maxReviews;
    private final Set<String> parkedCodes;

    public CooldownDeadLetterPolicy(Duration cooldown, int maxReviews, Set<String> parkedCodes) {
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
        this.cooldown = cooldown;
        this.maxReviews = maxReviews;
        this.parkedCodes = parkedCodes != null ? Set.copyOf(parkedCodes) : Set.of();
    }

    @Override
    public ErrorClass reclassify(Task task, Instant now) {
        TaskError error = task.lastError();
        if (error == null || !error.isTransient()) {
            return ErrorClass.PERMANENT;
        }
        if (parkedCodes.contains(error.code())) {
            return ErrorClass.PERMANENT;
        }
        if (task.reviewCount() >= maxReviews) {
            return ErrorClass.PERMANENT;
        }
        Instant lastAttempt = task.lastAttemptAt() != null ? task.lastAttemptAt() : task.updatedAt();
        if (Duration.between(lastAttempt, now).compareTo(cooldown) < 0) {
            // Too early; a later review may still requeue it
            return ErrorClass.PERMANENT;
        }
        return ErrorClass.TRANSIENT;
    }
}
