package com.taskengine.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures pass, task and workflow logs carry the ids needed to correlate them.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(task.id(), task.type(), task.attempts())) {
 *     log.info("Running handler"); // Automatically includes taskId, taskType, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-03-01 09:00:01.123 [http-nio-8080-exec-1] INFO  c.t.e.d.Dispatcher - Task succeeded
 *   pass=dispatch taskId=6f1c... taskType=email.send attempt=2 traceId=1a2b3c4d
 */
public final class LoggingContext implements AutoCloseable {

    public static final String PASS = "pass";
    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";
    public static final String ATTEMPT = "attempt";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String TRACE_ID = "traceId";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Create a logging context for one harness pass. Starts a fresh trace id.
     */
    public static LoggingContext forPass(String pass) {
        MDC.put(PASS, pass);
        MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        return new LoggingContext(PASS, TRACE_ID);
    }

    /**
     * Create a logging context for a single task attempt.
     */
    public static LoggingContext forTask(UUID taskId, String taskType, int attempt) {
        MDC.put(TASK_ID, taskId.toString());
        if (taskType != null) {
            MDC.put(TASK_TYPE, taskType);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return new LoggingContext(TASK_ID, TASK_TYPE, ATTEMPT);
    }

    /**
     * Create a logging context for workflow-level operations.
     */
    public static LoggingContext forWorkflow(UUID workflowId) {
        MDC.put(WORKFLOW_ID, workflowId.toString());
        return new LoggingContext(WORKFLOW_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
    }
}
