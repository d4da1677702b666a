package com.taskengine.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.model.BackoffPolicy;
import com.taskengine.core.repository.TaskStore;
import com.taskengine.core.repository.WorkflowStore;
import com.taskengine.engine.coordinator.TaskCoordinator;
import com.taskengine.engine.coordinator.WorkflowCoordinator;
import com.taskengine.engine.dispatch.Dispatcher;
import com.taskengine.engine.dispatch.OutcomeRecorder;
import com.taskengine.engine.handler.ErrorClassifier;
import com.taskengine.engine.handler.HandlerRegistry;
import com.taskengine.engine.handler.TaskHandler;
import com.taskengine.engine.health.EngineHealthIndicator;
import com.taskengine.engine.metrics.EngineMetrics;
import com.taskengine.engine.persistence.InMemoryTaskStore;
import com.taskengine.engine.persistence.InMemoryWorkflowStore;
import com.taskengine.engine.persistence.jdbc.JdbcTaskStore;
import com.taskengine.engine.persistence.jdbc.JdbcWorkflowStore;
import com.taskengine.engine.service.TaskService;
import com.taskengine.engine.service.WorkflowService;
import com.taskengine.engine.workflow.WorkflowAdvancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Wires the engine's components. The store is JDBC unless {@code taskengine.store=memory}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========== Stores ==========

    @Bean
    @ConditionalOnProperty(prefix = "taskengine", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public TaskStore jdbcTaskStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        log.info("Using JDBC task store");
        return new JdbcTaskStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskengine", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public WorkflowStore jdbcWorkflowStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcWorkflowStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskengine", name = "store", havingValue = "memory")
    public TaskStore inMemoryTaskStore() {
        log.warn("Using in-memory task store; tasks do not survive a restart");
        return new InMemoryTaskStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskengine", name = "store", havingValue = "memory")
    public WorkflowStore inMemoryWorkflowStore() {
        return new InMemoryWorkflowStore();
    }

    // ========== Engine ==========

    @Bean
    public BackoffPolicy backoffPolicy(EngineProperties properties) {
        return new BackoffPolicy(properties.getDispatch().getRetryLadder());
    }

    @Bean
    public HandlerRegistry handlerRegistry(ObjectProvider<TaskHandler> handlers) {
        return new HandlerRegistry(handlers.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public OutcomeRecorder outcomeRecorder(TaskStore taskStore, BackoffPolicy backoffPolicy, EngineMetrics metrics) {
        return new OutcomeRecorder(taskStore, backoffPolicy, metrics);
    }

    @Bean
    public Dispatcher dispatcher(
            TaskStore taskStore,
            HandlerRegistry handlerRegistry,
            ErrorClassifier errorClassifier,
            OutcomeRecorder outcomeRecorder,
            ObjectMapper objectMapper,
            EngineProperties properties) {
        return new Dispatcher(taskStore, handlerRegistry, errorClassifier, outcomeRecorder, objectMapper, properties);
    }

    @Bean
    public WorkflowAdvancer workflowAdvancer(
            WorkflowStore workflowStore,
            TaskStore taskStore,
            EngineMetrics metrics,
            EngineProperties properties) {
        return new WorkflowAdvancer(workflowStore, taskStore, metrics, properties);
    }

    // ========== Services ==========

    @Bean
    public TaskService taskService(TaskStore taskStore, Clock clock, EngineProperties properties) {
        return new TaskCoordinator(taskStore, clock, properties.getDispatch().getDefaultMaxAttempts());
    }

    @Bean
    public WorkflowService workflowService(
            WorkflowStore workflowStore,
            TaskStore taskStore,
            EngineMetrics metrics,
            Clock clock) {
        return new WorkflowCoordinator(workflowStore, taskStore, metrics, clock);
    }

    @Bean
    public EngineHealthIndicator engineHealthIndicator(TaskStore taskStore, WorkflowStore workflowStore) {
        return new EngineHealthIndicator(taskStore, workflowStore);
    }
}
