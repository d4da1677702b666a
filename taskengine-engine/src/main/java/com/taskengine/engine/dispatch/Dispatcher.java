package com.taskengine.engine.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.exception.OrchestrationException;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.engine.config.EngineProperties;
import com.taskengine.engine.handler.ErrorClassifier;
import com.taskengine.engine.handler.HandlerRegistry;
import com.taskengine.engine.handler.TaskContext;
import com.taskengine.engine.handler.TaskHandler;
import com.taskengine.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Claims due tasks and runs their handlers within a pass budget.
 *
 * Each task runs inside its own failure boundary: a handler exception is classified and
 * recorded on that task only. Store failures are orchestration failures and abort the pass.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final TaskStore taskStore;
    private final HandlerRegistry handlers;
    private final ErrorClassifier classifier;
    private final OutcomeRecorder recorder;
    private final ObjectMapper objectMapper;
    private final EngineProperties.Dispatch settings;
    private final Duration safetyMargin;

    public Dispatcher(
            TaskStore taskStore,
            HandlerRegistry handlers,
            ErrorClassifier classifier,
            OutcomeRecorder recorder,
            ObjectMapper objectMapper,
            EngineProperties properties) {
        this.taskStore = taskStore;
        this.handlers = handlers;
        this.classifier = classifier;
        this.recorder = recorder;
        this.objectMapper = objectMapper;
        this.settings = properties.getDispatch();
        this.safetyMargin = properties.getSafetyMargin();
    }

    public DispatchSummary runPass(Instant now, PassBudget budget) {
        return runPass(now, budget, Set.of());
    }

    /**
     * Run one dispatch pass.
     *
     * @param now pass start time; later timestamps are derived from it plus elapsed budget
     * @param budget wall-clock allowance of the pass
     * @param types task types to restrict the pass to; empty for all
     */
    public DispatchSummary runPass(Instant now, PassBudget budget, Set<String> types) {
        Map<TaskOutcome, Integer> tally = new EnumMap<>(TaskOutcome.class);
        int processed = 0;
        boolean budgetExhausted = false;

        ExecutorService pool = settings.getConcurrency() > 1
            ? Executors.newFixedThreadPool(settings.getConcurrency())
            : null;
        try {
            while (processed < settings.getMaxTasksPerPass()) {
                if (!budget.hasMoreThan(safetyMargin)) {
                    budgetExhausted = true;
                    log.info("Pass budget nearly spent after {}; no further claims", budget.elapsed());
                    break;
                }

                Instant claimTime = now.plus(budget.elapsed());
                int limit = Math.min(settings.getBatchSize(), settings.getMaxTasksPerPass() - processed);
                List<Task> batch = taskStore.claimDue(
                    limit, types, claimTime, claimTime.plus(settings.getClaimLease()));
                if (batch.isEmpty()) {
                    break;
                }
                log.debug("Claimed {} tasks", batch.size());

                for (TaskOutcome outcome : execute(batch, now, budget, pool)) {
                    tally.merge(outcome, 1, Integer::sum);
                }
                processed += batch.size();
            }
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }

        DispatchSummary summary = new DispatchSummary(
            processed,
            tally.getOrDefault(TaskOutcome.SUCCEEDED, 0),
            tally.getOrDefault(TaskOutcome.RETRIED, 0),
            tally.getOrDefault(TaskOutcome.DEAD_LETTERED, 0),
            tally.getOrDefault(TaskOutcome.FAILED_PERMANENTLY, 0),
            tally.getOrDefault(TaskOutcome.CONFLICT, 0),
            budgetExhausted
        );
        log.info("Dispatch pass finished: {}", summary);
        return summary;
    }

    private List<TaskOutcome> execute(List<Task> batch, Instant now, PassBudget budget, ExecutorService pool) {
        List<TaskOutcome> outcomes = new ArrayList<>(batch.size());
        if (pool == null) {
            for (Task task : batch) {
                outcomes.add(runTask(task, now, budget));
            }
            return outcomes;
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Callable<TaskOutcome>> calls = new ArrayList<>(batch.size());
        for (Task task : batch) {
            calls.add(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return runTask(task, now, budget);
                } finally {
                    MDC.clear();
                }
            });
        }

        try {
            for (Future<TaskOutcome> future : pool.invokeAll(calls)) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Dispatch pass interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new OrchestrationException("Task execution failed outside its boundary", e.getCause());
        }
        return outcomes;
    }

    private TaskOutcome runTask(Task task, Instant now, PassBudget budget) {
        try (var ctx = LoggingContext.forTask(task.id(), task.type(), task.attempts())) {
            Instant startedAt = now.plus(budget.elapsed());

            Optional<TaskHandler> handler = handlers.find(task.type());
            if (handler.isEmpty()) {
                log.warn("No handler registered for task type {}", task.type());
                return recorder.recordFailure(task, classifier.noHandler(task.type(), startedAt), startedAt);
            }

            try {
                handler.get().handle(new TaskContext(task, objectMapper, startedAt));
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                Instant failedAt = now.plus(budget.elapsed());
                TaskError error = classifier.classify(e, failedAt);
                log.debug("Handler failed on attempt {}", task.attempts(), e);
                return recorder.recordFailure(task, error, failedAt);
            }
            return recorder.recordSuccess(task, now.plus(budget.elapsed()));
        }
    }
}
