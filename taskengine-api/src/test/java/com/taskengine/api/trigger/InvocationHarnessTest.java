package com.taskengine.api.trigger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskengine.core.model.BackoffPolicy;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.test.TimeController;
import com.taskengine.engine.config.EngineProperties;
import com.taskengine.engine.dispatch.Dispatcher;
import com.taskengine.engine.dispatch.OutcomeRecorder;
import com.taskengine.engine.handler.ErrorClassifier;
import com.taskengine.engine.handler.HandlerRegistry;
import com.taskengine.engine.handler.TaskContext;
import com.taskengine.engine.handler.TaskHandler;
import com.taskengine.engine.metrics.EngineMetrics;
import com.taskengine.engine.persistence.InMemoryTaskStore;
import com.taskengine.engine.persistence.InMemoryWorkflowStore;
import com.taskengine.engine.workflow.WorkflowAdvancer;
import com.taskengine.recovery.deadletter.CooldownDeadLetterPolicy;
import com.taskengine.recovery.deadletter.DeadLetterReviewer;
import com.taskengine.recovery.retention.RetentionPurger;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvocationHarnessTest {

    private TimeController time;
    private InMemoryTaskStore taskStore;
    private InMemoryWorkflowStore workflowStore;
    private SimpleMeterRegistry registry;
    private List<String> handled;
    private InvocationHarness harness;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        taskStore = new InMemoryTaskStore();
        workflowStore = new InMemoryWorkflowStore();
        registry = new SimpleMeterRegistry();
        handled = new ArrayList<>();
        harness = harness(new RecordingHandler("email.send"), new RecordingHandler("report.build"));
    }

    private InvocationHarness harness(TaskHandler... handlers) {
        EngineProperties properties = new EngineProperties();
        EngineMetrics metrics = new EngineMetrics(registry);
        ObjectMapper objectMapper = new ObjectMapper();
        OutcomeRecorder recorder = new OutcomeRecorder(taskStore, BackoffPolicy.defaultPolicy(), metrics);
        Dispatcher dispatcher = new Dispatcher(
            taskStore, new HandlerRegistry(List.of(handlers)), new ErrorClassifier(), recorder, objectMapper, properties);
        DeadLetterReviewer reviewer = new DeadLetterReviewer(
            taskStore, workflowStore, new CooldownDeadLetterPolicy(Duration.ofMinutes(15), 3, Set.of()), recorder, metrics, properties);
        WorkflowAdvancer advancer = new WorkflowAdvancer(workflowStore, taskStore, metrics, properties);
        RetentionPurger purger = new RetentionPurger(taskStore, workflowStore, metrics, properties);
        return new InvocationHarness(dispatcher, reviewer, advancer, purger, metrics, properties, objectMapper, time);
    }

    private Task enqueue(String type) {
        Task task = Task.create(type, JsonNodeFactory.instance.objectNode(), TaskPriority.NORMAL, 3, null, time.now());
        taskStore.enqueue(task);
        return task;
    }

    @Test
    @DisplayName("Dispatch response carries the summary counts plus timestamp and duration")
    void dispatch_shouldReturnSummaryAsResponseBody() {
        enqueue("email.send");
        enqueue("email.send");

        Map<String, Object> response = harness.dispatch(null);

        assertThat(response)
            .containsEntry("pass", InvocationHarness.DISPATCH)
            .containsEntry("processed", 2)
            .containsEntry("succeeded", 2)
            .containsEntry("budgetExhausted", false)
            .containsEntry("timestamp", time.now().toString())
            .containsEntry("durationMs", 0L);
        assertThat(handled).containsExactly("email.send", "email.send");
    }

    @Test
    void dispatch_withTypes_shouldOnlyRunMatchingTasks() {
        Task email = enqueue("email.send");
        Task report = enqueue("report.build");

        harness.dispatch(Set.of("report.build"));

        assertThat(taskStore.findById(report.id()).orElseThrow().status()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(taskStore.findById(email.id()).orElseThrow().status()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void everyPass_shouldRecordPassDuration() {
        harness.dispatch(Set.of());
        harness.reviewDeadLetters();
        harness.advanceWorkflows();
        harness.cleanup();

        for (String pass : List.of(InvocationHarness.DISPATCH, InvocationHarness.DEAD_LETTERS,
                InvocationHarness.WORKFLOWS, InvocationHarness.CLEANUP)) {
            Timer timer = registry.find(EngineMetrics.PASS_DURATION).tag("pass", pass).timer();
            assertThat(timer).as(pass).isNotNull();
            assertThat(timer.count()).isEqualTo(1);
        }
    }

    @Test
    void emptyPasses_shouldReturnZeroCounts() {
        assertThat(harness.reviewDeadLetters()).containsEntry("reviewed", 0).containsEntry("requeued", 0);
        assertThat(harness.advanceWorkflows()).containsEntry("activated", 0).containsEntry("completed", 0);
        assertThat(harness.cleanup()).containsEntry("workflowsPurged", 0).containsEntry("tasksPurged", 0);
    }

    @Test
    @DisplayName("A failing pass is rethrown and leaves no pass context behind")
    void dispatch_whenStoreFails_shouldRethrowAndClearContext() {
        taskStore = new InMemoryTaskStore() {
            @Override
            public List<Task> claimDue(int limit, Set<String> types, Instant now, Instant expiresAt) {
                throw new IllegalStateException("store down");
            }
        };
        harness = harness(new RecordingHandler("email.send"));

        assertThatThrownBy(() -> harness.dispatch(null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("store down");
        assertThat(MDC.get("pass")).isNull();
        assertThat(registry.find(EngineMetrics.PASS_DURATION).tag("pass", "dispatch").timer()).isNotNull();
    }

    private class RecordingHandler implements TaskHandler {
        private final String type;

        RecordingHandler(String type) {
            this.type = type;
        }

        @Override
        public String type() {
            return type;
        }

        @Override
        public void handle(TaskContext context) {
            handled.add(context.getType());
        }
    }
}
