package com.taskengine.engine.dispatch;

/**
 * Counts reported by one dispatcher pass.
 *
 * @param processed tasks claimed and executed in this pass
 * @param succeeded tasks marked SUCCEEDED
 * @param retried tasks moved to RETRY_SCHEDULED
 * @param deadLettered tasks moved to DEAD_LETTER
 * @param permanentlyFailed tasks moved to FAILED_PERMANENT
 * @param conflicts outcomes discarded because the task changed underneath the pass
 * @param budgetExhausted whether claiming stopped because the time budget ran low
 */
public record DispatchSummary(
    int processed,
    int succeeded,
    int retried,
    int deadLettered,
    int permanentlyFailed,
    int conflicts,
    boolean budgetExhausted
) implements PassSummary {
    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0, 0, 0, 0, 0, false);
    }
}
