package com.taskengine.engine.service;

import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStep;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Host-facing operations on workflows.
 */
public interface WorkflowService {

    /**
     * Schedule a new workflow.
     *
     * @param name workflow name, used for logs and metrics
     * @param steps ordered steps; none may already carry task ids
     * @param activateAt when the advancer may activate it, or null for now
     * @return the new workflow's id
     * @throws com.taskengine.core.exception.WorkflowValidationException if the definition is invalid
     */
    UUID schedule(String name, List<WorkflowStep> steps, Instant activateAt);

    WorkflowInstance getWorkflow(UUID workflowId);

    /**
     * Resume a STALLED workflow. The staleness clock restarts from now.
     */
    WorkflowInstance resume(UUID workflowId);

    /**
     * Cancel a workflow that has not finished. Waiting tasks of its current step are cancelled too.
     */
    WorkflowInstance cancel(UUID workflowId, String reason);
}
