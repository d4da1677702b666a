package com.taskengine.core.model;

import java.util.Map;

/**
 * Snapshot of the task store.
 *
 * @param byStatus task counts per status
 * @param waitingByPriority PENDING and RETRY_SCHEDULED counts per priority
 * @param waitingByType PENDING and RETRY_SCHEDULED counts per task type
 */
public record QueueStats(
    Map<TaskStatus, Long> byStatus,
    Map<TaskPriority, Long> waitingByPriority,
    Map<String, Long> waitingByType
) {
    public QueueStats {
        byStatus = Map.copyOf(byStatus);
        waitingByPriority = Map.copyOf(waitingByPriority);
        waitingByType = Map.copyOf(waitingByType);
    }

    public long total() {
        return byStatus.values().stream().mapToLong(Long::longValue).sum();
    }

    public long count(TaskStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}
