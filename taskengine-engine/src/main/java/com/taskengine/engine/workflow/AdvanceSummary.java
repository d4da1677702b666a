package com.taskengine.engine.workflow;

import com.taskengine.engine.dispatch.PassSummary;

/**
 * Counts reported by one workflow advancer pass.
 *
 * @param activated SCHEDULED workflows that became ACTIVE
 * @param advanced step pointer moves
 * @param completed workflows that reached COMPLETED
 * @param stalled workflows marked STALLED
 * @param blocked workflows whose current step holds a dead-lettered or permanently failed task
 * @param conflicts workflows skipped because a concurrent pass updated them first
 * @param budgetExhausted whether the pass stopped because the time budget ran low
 */
public record AdvanceSummary(
    int activated,
    int advanced,
    int completed,
    int stalled,
    int blocked,
    int conflicts,
    boolean budgetExhausted
) implements PassSummary {
}
