package com.taskengine.engine.persistence;

import com.taskengine.core.exception.OptimisticLockException;
import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStatus;
import com.taskengine.core.repository.WorkflowStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowStore.
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private final Map<UUID, WorkflowInstance> workflows = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowInstance instance) {
        workflows.put(instance.id(), instance);
    }

    @Override
    public WorkflowInstance update(WorkflowInstance instance) {
        WorkflowInstance[] stored = new WorkflowInstance[1];
        workflows.computeIfPresent(instance.id(), (id, current) -> {
            if (current.version() != instance.version()) {
                return current;
            }
            stored[0] = new WorkflowInstance(
                instance.id(), instance.name(), instance.status(), instance.steps(),
                instance.currentStepIndex(), instance.statusReason(), instance.activateAt(),
                instance.lastProgressAt(), instance.createdAt(), instance.updatedAt(),
                instance.version() + 1);
            return stored[0];
        });
        if (stored[0] == null) {
            throw new OptimisticLockException("Workflow", instance.id().toString(), instance.version());
        }
        return stored[0];
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID id) {
        return Optional.ofNullable(workflows.get(id));
    }

    @Override
    public List<WorkflowInstance> findDueScheduled(Instant now, int limit) {
        return workflows.values().stream()
            .filter(w -> w.isDue(now))
            .sorted(Comparator.comparing(WorkflowInstance::activateAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findByStatus(WorkflowStatus status, UUID after, int limit) {
        return workflows.values().stream()
            .filter(w -> w.status() == status)
            .filter(w -> after == null || w.id().compareTo(after) > 0)
            .sorted(Comparator.comparing(WorkflowInstance::id))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowInstance> findTerminalBefore(Instant updatedBefore, UUID after, int limit) {
        return workflows.values().stream()
            .filter(w -> w.status().isTerminal())
            .filter(w -> w.updatedAt().isBefore(updatedBefore))
            .filter(w -> after == null || w.id().compareTo(after) > 0)
            .sorted(Comparator.comparing(WorkflowInstance::id))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(UUID id) {
        return workflows.remove(id) != null;
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        workflows.values().forEach(w -> counts.merge(w.status(), 1L, Long::sum));
        return counts;
    }

    /**
     * Clear all data (for testing).
     */
    public void clear() {
        workflows.clear();
    }
}
