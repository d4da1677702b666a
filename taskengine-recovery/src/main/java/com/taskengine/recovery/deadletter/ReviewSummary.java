package com.taskengine.recovery.deadletter;

import com.taskengine.engine.dispatch.PassSummary;

/**
 * Counts reported by one dead-letter review pass.
 *
 * @param reviewed dead-lettered tasks examined
 * @param requeued tasks moved back to PENDING
 * @param cancelled tasks cancelled because their workflow had already finished
 * @param leftParked tasks left in the dead letter queue
 * @param recoveredClaims RUNNING tasks whose claim had lapsed and were failed back through the backoff policy
 * @param conflicts rows changed by a concurrent pass before this one could write them
 * @param budgetExhausted whether the pass stopped because the time budget ran low
 */
public record ReviewSummary(
    int reviewed,
    int requeued,
    int cancelled,
    int leftParked,
    int recoveredClaims,
    int conflicts,
    boolean budgetExhausted
) implements PassSummary {
}
