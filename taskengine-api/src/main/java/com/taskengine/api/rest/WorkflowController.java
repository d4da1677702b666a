package com.taskengine.api.rest;

import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStatus;
import com.taskengine.core.model.WorkflowStep;
import com.taskengine.engine.service.WorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for workflow administration.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Schedule a new workflow. The workflows trigger activates it once it is due.
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> schedule(@RequestBody ScheduleRequest request) {
        UUID id = workflowService.schedule(request.name(), request.steps(), request.activateAt());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WorkflowResponse.from(workflowService.getWorkflow(id)));
    }

    /**
     * Get workflow by ID.
     */
    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.getWorkflow(workflowId)));
    }

    /**
     * Resume a stalled workflow.
     */
    @PostMapping("/{workflowId}/resume")
    public ResponseEntity<WorkflowResponse> resume(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.resume(workflowId)));
    }

    /**
     * Cancel a workflow.
     */
    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<WorkflowResponse> cancel(
            @PathVariable UUID workflowId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null && request.reason() != null ? request.reason() : "Cancelled by operator";
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.cancel(workflowId, reason)));
    }

    // ========== DTOs ==========

    public record ScheduleRequest(
        String name,
        List<WorkflowStep> steps,
        Instant activateAt
    ) {}

    public record CancelRequest(String reason) {}

    public record WorkflowResponse(
        UUID id,
        String name,
        WorkflowStatus status,
        int currentStepIndex,
        String currentStep,
        String statusReason,
        List<WorkflowStep> steps,
        Instant activateAt,
        Instant lastProgressAt,
        Instant createdAt,
        Instant updatedAt,
        long version
    ) {
        public static WorkflowResponse from(WorkflowInstance instance) {
            return new WorkflowResponse(
                instance.id(),
                instance.name(),
                instance.status(),
                instance.currentStepIndex(),
                instance.hasCurrentStep() ? instance.currentStep().name() : null,
                instance.statusReason(),
                instance.steps(),
                instance.activateAt(),
                instance.lastProgressAt(),
                instance.createdAt(),
                instance.updatedAt(),
                instance.version()
            );
        }
    }
}
