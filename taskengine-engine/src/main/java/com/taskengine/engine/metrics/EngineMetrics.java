package com.taskengine.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for the task engine.
 *
 * Metrics exposed:
 * - Task attempt outcomes by type
 * - Dead-letter requeues and recovered claims
 * - Workflow transitions
 * - Pass durations by pass name
 */
public class EngineMetrics {

    public static final String TASK_OUTCOMES = "taskengine.tasks.outcomes";
    public static final String TASK_CONFLICTS = "taskengine.tasks.conflicts";
    public static final String DEAD_LETTER_REQUEUED = "taskengine.dead_letter.requeued";
    public static final String CLAIMS_RECOVERED = "taskengine.claims.recovered";
    public static final String WORKFLOW_TRANSITIONS = "taskengine.workflows.transitions";
    public static final String PASS_DURATION = "taskengine.pass.duration";
    public static final String TASKS_PURGED = "taskengine.retention.purged";

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Task Metrics ==========

    public void taskOutcome(String taskType, String outcome) {
        Counter.builder(TASK_OUTCOMES)
            .tag("type", taskType)
            .tag("outcome", outcome)
            .description("Task attempts by outcome")
            .register(registry)
            .increment();
    }

    public void taskConflict(String operation) {
        Counter.builder(TASK_CONFLICTS)
            .tag("operation", operation)
            .description("Conditional writes that lost a race with a concurrent pass")
            .register(registry)
            .increment();
    }

    // ========== Recovery Metrics ==========

    public void deadLetterRequeued(String taskType) {
        Counter.builder(DEAD_LETTER_REQUEUED)
            .tag("type", taskType)
            .description("Dead-lettered tasks re-enqueued by review")
            .register(registry)
            .increment();
    }

    public void claimRecovered(String taskType) {
        Counter.builder(CLAIMS_RECOVERED)
            .tag("type", taskType)
            .description("Abandoned claims returned to the retry cycle")
            .register(registry)
            .increment();
    }

    public void purged(String kind, int count) {
        Counter.builder(TASKS_PURGED)
            .tag("kind", kind)
            .description("Rows removed by the retention purge")
            .register(registry)
            .increment(count);
    }

    // ========== Workflow Metrics ==========

    public void workflowTransition(String workflowName, String status) {
        Counter.builder(WORKFLOW_TRANSITIONS)
            .tag("workflow", workflowName)
            .tag("status", status)
            .description("Workflow status transitions")
            .register(registry)
            .increment();
    }

    // ========== Pass Metrics ==========

    public void passCompleted(String pass, Duration duration, boolean budgetExhausted) {
        Timer.builder(PASS_DURATION)
            .tag("pass", pass)
            .tag("budget_exhausted", String.valueOf(budgetExhausted))
            .description("Harness pass duration")
            .register(registry)
            .record(duration);
    }
}
