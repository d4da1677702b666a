package com.taskengine.engine.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock allowance of one harness pass.
 *
 * The budget only decides whether more work may be started. Work already started is
 * never interrupted.
 */
public final class PassBudget {

    private final Clock clock;
    private final Instant startedAt;
    private final Duration budget;

    private PassBudget(Clock clock, Duration budget) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.budget = budget;
    }

    public static PassBudget start(Clock clock, Duration budget) {
        return new PassBudget(clock, budget);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public Duration remaining() {
        Duration remaining = budget.minus(elapsed());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Check if more than {@code margin} of the budget is left.
     */
    public boolean hasMoreThan(Duration margin) {
        return remaining().compareTo(margin) > 0;
    }

    public Duration budget() {
        return budget;
    }
}
