package com.taskengine.recovery.retention;

import com.taskengine.engine.dispatch.PassSummary;

/**
 * Counts reported by one retention pass.
 *
 * @param workflowsPurged finished workflows deleted
 * @param workflowsKept finished workflows past the cutoff kept because they still own dead-lettered tasks
 * @param tasksPurged tasks deleted, including those owned by purged workflows
 * @param budgetExhausted whether the pass stopped because the time budget ran low
 */
public record PurgeSummary(
    int workflowsPurged,
    int workflowsKept,
    int tasksPurged,
    boolean budgetExhausted
) implements PassSummary {
}
