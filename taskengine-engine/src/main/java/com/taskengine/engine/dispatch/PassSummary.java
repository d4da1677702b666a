package com.taskengine.engine.dispatch;

/**
 * Result of one budgeted pass.
 */
public interface PassSummary {

    /**
     * Whether the pass stopped starting new work because its budget ran low.
     */
    boolean budgetExhausted();
}
