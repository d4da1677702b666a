package com.taskengine.engine.config;

import com.taskengine.core.model.BackoffPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the task engine.
 *
 * @see EngineConfiguration
 */
@ConfigurationProperties(prefix = "taskengine")
public class EngineProperties {

    /**
     * Backing store for tasks and workflows.
     */
    private StoreType store = StoreType.JDBC;

    /**
     * A pass stops starting new work once less than this much of its budget is left.
     */
    private Duration safetyMargin = Duration.ofSeconds(10);

    private final Dispatch dispatch = new Dispatch();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Workflow workflow = new Workflow();
    private final Retention retention = new Retention();
    private final Trigger trigger = new Trigger();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Duration getSafetyMargin() {
        return safetyMargin;
    }

    public void setSafetyMargin(Duration safetyMargin) {
        this.safetyMargin = safetyMargin;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public Retention getRetention() {
        return retention;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public enum StoreType {
        JDBC,
        MEMORY
    }

    public static class Dispatch {
        private int batchSize = 10;
        private int maxTasksPerPass = 100;
        private int concurrency = 1;
        private Duration claimLease = Duration.ofMinutes(5);
        private int defaultMaxAttempts = BackoffPolicy.DEFAULT_MAX_ATTEMPTS;
        private List<Duration> retryLadder = new ArrayList<>(List.of(
            Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(15)));

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            this.batchSize = batchSize;
        }

        public int getMaxTasksPerPass() {
            return maxTasksPerPass;
        }

        public void setMaxTasksPerPass(int maxTasksPerPass) {
            this.maxTasksPerPass = maxTasksPerPass;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1");
            }
            this.concurrency = concurrency;
        }

        public Duration getClaimLease() {
            return claimLease;
        }

        public void setClaimLease(Duration claimLease) {
            this.claimLease = claimLease;
        }

        public int getDefaultMaxAttempts() {
            return defaultMaxAttempts;
        }

        public void setDefaultMaxAttempts(int defaultMaxAttempts) {
            this.defaultMaxAttempts = defaultMaxAttempts;
        }

        public List<Duration> getRetryLadder() {
            return retryLadder;
        }

        public void setRetryLadder(List<Duration> retryLadder) {
            this.retryLadder = retryLadder;
        }
    }

    public static class DeadLetter {
        private Duration cooldown = Duration.ofMinutes(15);
        private int maxReviews = 3;
        private Set<String> parkedCodes = Set.of();
        private int batchSize = 50;

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public int getMaxReviews() {
            return maxReviews;
        }

        public void setMaxReviews(int maxReviews) {
            this.maxReviews = maxReviews;
        }

        public Set<String> getParkedCodes() {
            return parkedCodes;
        }

        public void setParkedCodes(Set<String> parkedCodes) {
            this.parkedCodes = parkedCodes;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Workflow {
        private Duration staleThreshold = Duration.ofHours(24);
        private int batchSize = 50;

        public Duration getStaleThreshold() {
            return staleThreshold;
        }

        public void setStaleThreshold(Duration staleThreshold) {
            this.staleThreshold = staleThreshold;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Retention {
        private Duration period = Duration.ofDays(30);
        private int batchSize = 500;

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Trigger {
        /**
         * Shared secret expected from the scheduler. Every trigger call is rejected while unset.
         */
        private String secret;
        private Duration dispatchBudget = Duration.ofSeconds(60);
        private Duration deadLetterBudget = Duration.ofSeconds(60);
        private Duration workflowBudget = Duration.ofSeconds(60);
        private Duration cleanupBudget = Duration.ofSeconds(300);

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Duration getDispatchBudget() {
            return dispatchBudget;
        }

        public void setDispatchBudget(Duration dispatchBudget) {
            this.dispatchBudget = dispatchBudget;
        }

        public Duration getDeadLetterBudget() {
            return deadLetterBudget;
        }

        public void setDeadLetterBudget(Duration deadLetterBudget) {
            this.deadLetterBudget = deadLetterBudget;
        }

        public Duration getWorkflowBudget() {
            return workflowBudget;
        }

        public void setWorkflowBudget(Duration workflowBudget) {
            this.workflowBudget = workflowBudget;
        }

        public Duration getCleanupBudget() {
            return cleanupBudget;
        }

        public void setCleanupBudget(Duration cleanupBudget) {
            this.cleanupBudget = cleanupBudget;
        }
    }
}
