package com.taskengine.api.trigger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.engine.config.EngineProperties;
import com.taskengine.engine.dispatch.Dispatcher;
import com.taskengine.engine.dispatch.PassBudget;
import com.taskengine.engine.dispatch.PassSummary;
import com.taskengine.engine.logging.LoggingContext;
import com.taskengine.engine.metrics.EngineMetrics;
import com.taskengine.engine.workflow.WorkflowAdvancer;
import com.taskengine.recovery.deadletter.DeadLetterReviewer;
import com.taskengine.recovery.retention.RetentionPurger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Runs one pass per trigger call.
 *
 * Reads the clock once at the start of the pass, gives the pass its budget and turns the
 * summary into the response body. The passes themselves never read the clock.
 */
@Component
public class InvocationHarness {

    private static final Logger log = LoggerFactory.getLogger(InvocationHarness.class);

    private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE = new TypeReference<>() {};

    public static final String DISPATCH = "dispatch";
    public static final String DEAD_LETTERS = "dead-letters";
    public static final String WORKFLOWS = "workflows";
    public static final String CLEANUP = "cleanup";

    private final Dispatcher dispatcher;
    private final DeadLetterReviewer deadLetterReviewer;
    private final WorkflowAdvancer workflowAdvancer;
    private final RetentionPurger retentionPurger;
    private final EngineMetrics metrics;
    private final EngineProperties.Trigger settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InvocationHarness(
            Dispatcher dispatcher,
            DeadLetterReviewer deadLetterReviewer,
            WorkflowAdvancer workflowAdvancer,
            RetentionPurger retentionPurger,
            EngineMetrics metrics,
            EngineProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.dispatcher = dispatcher;
        this.deadLetterReviewer = deadLetterReviewer;
        this.workflowAdvancer = workflowAdvancer;
        this.retentionPurger = retentionPurger;
        this.metrics = metrics;
        this.settings = properties.getTrigger();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Map<String, Object> dispatch(Set<String> types) {
        Set<String> filter = types != null ? types : Set.of();
        return run(DISPATCH, settings.getDispatchBudget(), (now, budget) -> dispatcher.runPass(now, budget, filter));
    }

    public Map<String, Object> reviewDeadLetters() {
        return run(DEAD_LETTERS, settings.getDeadLetterBudget(), deadLetterReviewer::review);
    }

    public Map<String, Object> advanceWorkflows() {
        return run(WORKFLOWS, settings.getWorkflowBudget(), workflowAdvancer::advance);
    }

    public Map<String, Object> cleanup() {
        return run(CLEANUP, settings.getCleanupBudget(), retentionPurger::purge);
    }

    private <S extends PassSummary> Map<String, Object> run(
            String pass, Duration budgetLength, BiFunction<Instant, PassBudget, S> body) {
        try (var ctx = LoggingContext.forPass(pass)) {
            Instant now = clock.instant();
            PassBudget budget = PassBudget.start(clock, budgetLength);
            log.debug("Starting {} pass with a budget of {}", pass, budgetLength);

            S summary;
            try {
                summary = body.apply(now, budget);
            } catch (RuntimeException e) {
                log.error("{} pass failed after {}", pass, budget.elapsed(), e);
                metrics.passCompleted(pass, budget.elapsed(), false);
                throw e;
            }

            Duration elapsed = budget.elapsed();
            metrics.passCompleted(pass, elapsed, summary.budgetExhausted());

            Map<String, Object> response = objectMapper.convertValue(summary, BODY_TYPE);
            response.put("pass", pass);
            response.put("timestamp", now.toString());
            response.put("durationMs", elapsed.toMillis());
            return response;
        }
    }
}
