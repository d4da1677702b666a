package com.taskengine.engine.persistence;

import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.repository.TaskStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskStore.
 * Every conditional write is a compare-and-replace on the row, which gives the same
 * claim guarantees as the conditional UPDATE of the JDBC store within one JVM.
 */
public class InMemoryTaskStore implements TaskStore {

    static final Comparator<Task> CLAIM_ORDER = Comparator
        .comparingInt((Task t) -> t.priority().weight()).reversed()
        .thenComparing(Task::scheduledFor)
        .thenComparing(Task::createdAt);

    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, UUID> byDedupeKey = new ConcurrentHashMap<>();
    // Guards byDedupeKey together with the insert, so a key never points at a missing row.
    private final Object dedupeLock = new Object();

    @Override
    public UUID enqueue(Task task) {
        if (task.dedupeKey() == null) {
            tasks.put(task.id(), task);
            return task.id();
        }
        synchronized (dedupeLock) {
            UUID existingId = byDedupeKey.get(task.dedupeKey());
            if (existingId != null) {
                upgradePriority(existingId, task.priority(), task.createdAt());
                return existingId;
            }
            tasks.put(task.id(), task);
            byDedupeKey.put(task.dedupeKey(), task.id());
            return task.id();
        }
    }

    private void upgradePriority(UUID id, TaskPriority requested, Instant now) {
        compareAndUpdate(id,
            t -> t.status().isClaimable() && requested.isHigherThan(t.priority()),
            t -> t.withPriority(requested, now));
    }

    @Override
    public List<Task> claimDue(int limit, Set<String> types, Instant now, Instant claimExpiresAt) {
        List<Task> candidates = tasks.values().stream()
            .filter(t -> t.isDue(now))
            .filter(t -> types == null || types.isEmpty() || types.contains(t.type()))
            .sorted(CLAIM_ORDER)
            .collect(Collectors.toList());

        List<Task> claimed = new ArrayList<>();
        for (Task candidate : candidates) {
            if (claimed.size() >= limit) {
                break;
            }
            Task running = candidate.claimed(now, claimExpiresAt);
            if (tasks.replace(candidate.id(), candidate, running)) {
                claimed.add(running);
            }
        }
        return claimed;
    }

    @Override
    public boolean complete(UUID id, int attempt, Instant now) {
        return compareAndUpdate(id, runningAttempt(attempt), t -> t.succeeded(now));
    }

    @Override
    public boolean scheduleRetry(UUID id, int attempt, Instant nextTime, TaskError error, Instant now) {
        return compareAndUpdate(id, runningAttempt(attempt), t -> t.retryScheduled(nextTime, error, now));
    }

    @Override
    public boolean markDeadLetter(UUID id, int attempt, TaskError error, Instant now) {
        return compareAndUpdate(id, runningAttempt(attempt), t -> t.deadLettered(error, now));
    }

    @Override
    public boolean markPermanentFailure(UUID id, int attempt, TaskError error, Instant now) {
        return compareAndUpdate(id, runningAttempt(attempt), t -> t.failedPermanently(error, now));
    }

    @Override
    public List<Task> listDeadLetter(UUID after, int limit) {
        return tasks.values().stream()
            .filter(t -> t.status() == TaskStatus.DEAD_LETTER)
            .filter(t -> after == null || t.id().compareTo(after) > 0)
            .sorted(Comparator.comparing(Task::id))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean requeueDeadLetter(UUID id, int expectedReviewCount, Instant now) {
        return compareAndUpdate(id,
            t -> t.status() == TaskStatus.DEAD_LETTER && t.reviewCount() == expectedReviewCount,
            t -> t.requeuedFromDeadLetter(now));
    }

    @Override
    public Optional<Task> findById(UUID id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public List<Task> findByIds(Collection<UUID> ids) {
        return ids.stream()
            .map(tasks::get)
            .filter(t -> t != null)
            .collect(Collectors.toList());
    }

    @Override
    public List<Task> findExpiredClaims(Instant now, int limit) {
        return tasks.values().stream()
            .filter(t -> t.isClaimExpired(now))
            .sorted(Comparator.comparing(Task::claimExpiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean cancel(UUID id, Instant now) {
        return compareAndUpdate(id, t -> t.status().isClaimable(), t -> t.cancelled(now));
    }

    @Override
    public int cancelByWorkflow(UUID workflowId, Instant now) {
        List<UUID> owned = tasks.values().stream()
            .filter(t -> workflowId.equals(t.workflowId()))
            .map(Task::id)
            .collect(Collectors.toList());
        int cancelled = 0;
        for (UUID id : owned) {
            if (compareAndUpdate(id, InMemoryTaskStore::isCancellable, t -> t.cancelled(now))) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public boolean cancelDeadLetter(UUID id, int expectedReviewCount, Instant now) {
        return compareAndUpdate(id,
            t -> t.status() == TaskStatus.DEAD_LETTER && t.reviewCount() == expectedReviewCount,
            t -> t.cancelled(now));
    }

    @Override
    public boolean retryManually(UUID id, Instant now) {
        return compareAndUpdate(id, t -> t.status().isBlocking(), t -> t.retriedManually(now));
    }

    @Override
    public QueueStats stats() {
        Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
        Map<TaskPriority, Long> byPriority = new EnumMap<>(TaskPriority.class);
        Map<String, Long> byType = new HashMap<>();
        for (Task task : tasks.values()) {
            byStatus.merge(task.status(), 1L, Long::sum);
            if (task.status().isClaimable()) {
                byPriority.merge(task.priority(), 1L, Long::sum);
                byType.merge(task.type(), 1L, Long::sum);
            }
        }
        return new QueueStats(byStatus, byPriority, byType);
    }

    @Override
    public int purgeTerminal(Instant updatedBefore, int limit) {
        List<Task> expired = tasks.values().stream()
            .filter(t -> t.status() == TaskStatus.SUCCEEDED || t.status() == TaskStatus.FAILED_PERMANENT)
            .filter(t -> t.workflowId() == null)
            .filter(t -> t.updatedAt().isBefore(updatedBefore))
            .sorted(Comparator.comparing(Task::updatedAt))
            .limit(limit)
            .collect(Collectors.toList());
        int deleted = 0;
        for (Task task : expired) {
            if (tasks.remove(task.id(), task)) {
                forgetDedupeKey(task);
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public int deleteByWorkflow(UUID workflowId) {
        List<Task> owned = tasks.values().stream()
            .filter(t -> workflowId.equals(t.workflowId()))
            .filter(t -> t.status() == TaskStatus.SUCCEEDED || t.status() == TaskStatus.FAILED_PERMANENT)
            .collect(Collectors.toList());
        int deleted = 0;
        for (Task task : owned) {
            if (tasks.remove(task.id(), task)) {
                forgetDedupeKey(task);
                deleted++;
            }
        }
        return deleted;
    }

    /**
     * Clear all data (for testing).
     */
    public void clear() {
        synchronized (dedupeLock) {
            tasks.clear();
            byDedupeKey.clear();
        }
    }

    private void forgetDedupeKey(Task task) {
        if (task.dedupeKey() != null) {
            synchronized (dedupeLock) {
                byDedupeKey.remove(task.dedupeKey(), task.id());
            }
        }
    }

    private static boolean isCancellable(Task task) {
        return task.status().isClaimable() || task.status() == TaskStatus.DEAD_LETTER;
    }

    private static Predicate<Task> runningAttempt(int attempt) {
        return t -> t.status() == TaskStatus.RUNNING && t.attempts() == attempt;
    }

    private boolean compareAndUpdate(UUID id, Predicate<Task> expected, UnaryOperator<Task> change) {
        while (true) {
            Task current = tasks.get(id);
            if (current == null || !expected.test(current)) {
                return false;
            }
            if (tasks.replace(id, current, change.apply(current))) {
                return true;
            }
        }
    }
}
