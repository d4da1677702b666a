package com.taskengine.core.repository;

import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable task persistence with an atomic claim primitive.
 *
 * Every state-changing operation is conditional on the state the caller last observed
 * and reports {@code false} when that state no longer holds. Callers treat this as a
 * lost race, never as an error. Time is always passed in explicitly.
 */
public interface TaskStore {

    /**
     * Insert a new task.
     *
     * If the task carries a dedupe key that is already taken, nothing is inserted and the
     * id of the existing task is returned. The existing task's priority is raised when the
     * new request is higher and the existing task has not run yet.
     *
     * @param task the task to insert, in PENDING state
     * @return id of the inserted or already existing task
     */
    UUID enqueue(Task task);

    /**
     * Atomically claim up to {@code limit} due tasks.
     *
     * Claimed tasks move from PENDING or RETRY_SCHEDULED to RUNNING with attempts
     * incremented. A task is returned to at most one caller even when passes overlap.
     * Candidates are ordered by priority (highest first), then scheduledFor, then createdAt.
     *
     * @param limit maximum number of tasks to claim
     * @param types task types to restrict the claim to; null or empty for all types
     * @param now current time; only tasks with scheduledFor <= now are due
     * @param claimExpiresAt when the claim is considered abandoned
     * @return the claimed tasks, as stored after the claim
     */
    List<Task> claimDue(int limit, Set<String> types, Instant now, Instant claimExpiresAt);

    /**
     * RUNNING -> SUCCEEDED, if the task is still RUNNING the given attempt.
     */
    boolean complete(UUID id, int attempt, Instant now);

    /**
     * RUNNING -> RETRY_SCHEDULED with scheduledFor = nextTime.
     */
    boolean scheduleRetry(UUID id, int attempt, Instant nextTime, TaskError error, Instant now);

    /**
     * RUNNING -> DEAD_LETTER.
     */
    boolean markDeadLetter(UUID id, int attempt, TaskError error, Instant now);

    /**
     * RUNNING -> FAILED_PERMANENT.
     */
    boolean markPermanentFailure(UUID id, int attempt, TaskError error, Instant now);

    /**
     * List dead-lettered tasks in id order, starting after the given id.
     *
     * @param after exclusive lower bound, or null to start from the beginning
     * @param limit maximum number of results
     */
    List<Task> listDeadLetter(UUID after, int limit);

    default List<Task> listDeadLetter(int limit) {
        return listDeadLetter(null, limit);
    }

    /**
     * DEAD_LETTER -> PENDING with attempts reset, scheduledFor = now and reviewCount incremented.
     * Conditional on the task still being dead-lettered with the expected review count.
     */
    boolean requeueDeadLetter(UUID id, int expectedReviewCount, Instant now);

    Optional<Task> findById(UUID id);

    List<Task> findByIds(Collection<UUID> ids);

    /**
     * Find RUNNING tasks whose claim expired before {@code now}.
     */
    List<Task> findExpiredClaims(Instant now, int limit);

    /**
     * PENDING or RETRY_SCHEDULED -> FAILED_PERMANENT with a CANCELLED error.
     */
    boolean cancel(UUID id, Instant now);

    /**
     * PENDING, RETRY_SCHEDULED or DEAD_LETTER tasks owned by the workflow -> FAILED_PERMANENT
     * with a CANCELLED error. RUNNING and finished tasks are left alone.
     *
     * @return number of cancelled tasks
     */
    int cancelByWorkflow(UUID workflowId, Instant now);

    /**
     * DEAD_LETTER -> FAILED_PERMANENT with a CANCELLED error, only while the task is still
     * dead-lettered with the review count the caller saw.
     */
    boolean cancelDeadLetter(UUID id, int expectedReviewCount, Instant now);

    /**
     * DEAD_LETTER or FAILED_PERMANENT -> PENDING with attempts and reviewCount reset.
     */
    boolean retryManually(UUID id, Instant now);

    QueueStats stats();

    /**
     * Delete SUCCEEDED and FAILED_PERMANENT tasks not owned by a workflow and last
     * updated before the cutoff. DEAD_LETTER tasks are never deleted.
     *
     * @return number of deleted tasks
     */
    int purgeTerminal(Instant updatedBefore, int limit);

    /**
     * Delete the SUCCEEDED and FAILED_PERMANENT tasks owned by the workflow.
     * DEAD_LETTER tasks are never deleted.
     *
     * @return number of deleted tasks
     */
    int deleteByWorkflow(UUID workflowId);
}
