package com.taskengine.core.model;

import java.time.Duration;

/**
 * Outcome of consulting the {@link BackoffPolicy} after a failed attempt.
 *
 * @param outcome what to do with the task
 * @param delay wait before the next attempt; zero unless outcome == RETRY
 */
public record BackoffDecision(Outcome outcome, Duration delay) {

    public enum Outcome {
        RETRY,
        DEAD_LETTER,
        FAILED_PERMANENT
    }

    public static BackoffDecision retryAfter(Duration delay) {
        return new BackoffDecision(Outcome.RETRY, delay);
    }

    public static BackoffDecision deadLetter() {
        return new BackoffDecision(Outcome.DEAD_LETTER, Duration.ZERO);
    }

    public static BackoffDecision failedPermanent() {
        return new BackoffDecision(Outcome.FAILED_PERMANENT, Duration.ZERO);
    }

    public boolean isTerminal() {
        return outcome != Outcome.RETRY;
    }
}
