package com.taskengine.recovery.config;

import com.taskengine.core.repository.TaskStore;
import com.taskengine.core.repository.WorkflowStore;
import com.taskengine.engine.config.EngineProperties;
import com.taskengine.engine.dispatch.OutcomeRecorder;
import com.taskengine.engine.metrics.EngineMetrics;
import com.taskengine.recovery.deadletter.CooldownDeadLetterPolicy;
import com.taskengine.recovery.deadletter.DeadLetterPolicy;
import com.taskengine.recovery.deadletter.DeadLetterReviewer;
import com.taskengine.recovery.retention.RetentionPurger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires dead-letter review and retention. Declare another {@link DeadLetterPolicy} bean to replace the default.
 */
@Configuration
public class RecoveryConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterPolicy deadLetterPolicy(EngineProperties properties) {
        EngineProperties.DeadLetter settings = properties.getDeadLetter();
        return new CooldownDeadLetterPolicy(settings.getCooldown(), settings.getMaxReviews(), settings.getParkedCodes());
    }

    @Bean
    public DeadLetterReviewer deadLetterReviewer(
            TaskStore taskStore,
            WorkflowStore workflowStore,
            DeadLetterPolicy policy,
            OutcomeRecorder outcomeRecorder,
            EngineMetrics metrics,
            EngineProperties properties) {
        return new DeadLetterReviewer(taskStore, workflowStore, policy, outcomeRecorder, metrics, properties);
    }

    @Bean
    public RetentionPurger retentionPurger(
            TaskStore taskStore,
            WorkflowStore workflowStore,
            EngineMetrics metrics,
            EngineProperties properties) {
        return new RetentionPurger(taskStore, workflowStore, metrics, properties);
    }
}
