package com.taskengine.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void isClaimable_shouldOnlyIncludeWaitingStates() {
        assertTrue(TaskStatus.PENDING.isClaimable());
        assertTrue(TaskStatus.RETRY_SCHEDULED.isClaimable());

        assertFalse(TaskStatus.RUNNING.isClaimable());
        assertFalse(TaskStatus.SUCCEEDED.isClaimable());
        assertFalse(TaskStatus.DEAD_LETTER.isClaimable());
        assertFalse(TaskStatus.FAILED_PERMANENT.isClaimable());
    }

    @Test
    void isTerminalForDispatcher_shouldIdentifyFinalStates() {
        assertTrue(TaskStatus.SUCCEEDED.isTerminalForDispatcher());
        assertTrue(TaskStatus.DEAD_LETTER.isTerminalForDispatcher());
        assertTrue(TaskStatus.FAILED_PERMANENT.isTerminalForDispatcher());

        assertFalse(TaskStatus.PENDING.isTerminalForDispatcher());
        assertFalse(TaskStatus.RUNNING.isTerminalForDispatcher());
        assertFalse(TaskStatus.RETRY_SCHEDULED.isTerminalForDispatcher());
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowAllOutcomes() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.SUCCEEDED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RETRY_SCHEDULED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.DEAD_LETTER));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED_PERMANENT));

        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromPending_shouldNotSkipRunning() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));

        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.SUCCEEDED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.DEAD_LETTER));
    }

    @Test
    void canTransitionTo_fromDeadLetter_shouldOnlyAllowRequeueOrCancel() {
        assertTrue(TaskStatus.DEAD_LETTER.canTransitionTo(TaskStatus.PENDING));
        assertTrue(TaskStatus.DEAD_LETTER.canTransitionTo(TaskStatus.FAILED_PERMANENT));

        assertFalse(TaskStatus.DEAD_LETTER.canTransitionTo(TaskStatus.RUNNING));
        assertFalse(TaskStatus.DEAD_LETTER.canTransitionTo(TaskStatus.RETRY_SCHEDULED));
    }

    @Test
    void canTransitionTo_fromSucceeded_shouldAllowNothing() {
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(TaskStatus.SUCCEEDED.canTransitionTo(target), "SUCCEEDED -> " + target);
        }
    }
}
