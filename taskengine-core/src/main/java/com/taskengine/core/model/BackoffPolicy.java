package com.taskengine.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Retry delay policy: a short fixed ladder indexed by attempt number with a hard
 * ceiling at maxAttempts. Immutable and side-effect free.
 *
 * Invariants:
 * - ladder is non-empty and non-decreasing
 * - attempts past the end of the ladder reuse its last entry
 * - a PERMANENT error never retries, whatever the attempt count
 */
public record BackoffPolicy(List<Duration> ladder) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final List<Duration> DEFAULT_LADDER = List.of(
        Duration.ofMinutes(1),
        Duration.ofMinutes(5),
        Duration.ofMinutes(15)
    );

    public BackoffPolicy {
        if (ladder == null || ladder.isEmpty()) {
            throw new IllegalArgumentException("Backoff ladder must have at least one entry");
        }
        for (int i = 1; i < ladder.size(); i++) {
            if (ladder.get(i).compareTo(ladder.get(i - 1)) < 0) {
                throw new IllegalArgumentException("Backoff ladder must be non-decreasing: " + ladder);
            }
        }
        ladder = List.copyOf(ladder);
    }

    /**
     * Default ladder: 1 minute, 5 minutes, 15 minutes.
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(DEFAULT_LADDER);
    }

    /**
     * Delay before the attempt that follows the given one.
     *
     * @param attempt 1-indexed number of the attempt that just failed
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        return ladder.get(Math.min(attempt, ladder.size()) - 1);
    }

    /**
     * Decide what happens after a failed attempt.
     *
     * @param attempt 1-indexed number of the attempt that just failed
     * @param maxAttempts the task's attempt ceiling
     * @param errorClass classification of the failure
     */
    public BackoffDecision nextDelay(int attempt, int maxAttempts, ErrorClass errorClass) {
        return switch (errorClass) {
            case PERMANENT -> BackoffDecision.failedPermanent();
            case TRANSIENT -> attempt >= maxAttempts
                ? BackoffDecision.deadLetter()
                : BackoffDecision.retryAfter(delayAfter(attempt));
        };
    }

    /**
     * Decide what happens after the task's current attempt failed.
     */
    public BackoffDecision decide(Task task, ErrorClass errorClass) {
        return nextDelay(task.attempts(), task.maxAttempts(), errorClass);
    }
}
