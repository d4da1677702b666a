package com.taskengine.core.repository;

import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for workflow instances.
 * Supports optimistic locking via the version column.
 */
public interface WorkflowStore {

    void save(WorkflowInstance instance);

    /**
     * Update an existing workflow with optimistic locking.
     *
     * @param instance the new state, carrying the version it was read at
     * @return the stored instance with its version incremented
     * @throws com.taskengine.core.exception.OptimisticLockException if the stored version moved on
     */
    WorkflowInstance update(WorkflowInstance instance);

    Optional<WorkflowInstance> findById(UUID id);

    /**
     * Find SCHEDULED workflows with activateAt <= now.
     */
    List<WorkflowInstance> findDueScheduled(Instant now, int limit);

    /**
     * Find workflows in the given status in id order, starting after the given id.
     *
     * @param after exclusive lower bound, or null to start from the beginning
     */
    List<WorkflowInstance> findByStatus(WorkflowStatus status, UUID after, int limit);

    /**
     * Find COMPLETED or CANCELLED workflows last updated before the cutoff, in id order.
     *
     * @param after exclusive lower bound, or null to start from the beginning
     */
    List<WorkflowInstance> findTerminalBefore(Instant updatedBefore, UUID after, int limit);

    boolean delete(UUID id);

    Map<WorkflowStatus, Long> countByStatus();
}
