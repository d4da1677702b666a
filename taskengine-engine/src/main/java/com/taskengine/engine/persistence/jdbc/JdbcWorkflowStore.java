package com.taskengine.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.taskengine.core.exception.OptimisticLockException;
import com.taskengine.core.exception.TaskStoreException;
import com.taskengine.core.model.WorkflowInstance;
import com.taskengine.core.model.WorkflowStatus;
import com.taskengine.core.model.WorkflowStep;
import com.taskengine.core.repository.WorkflowStore;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Relational implementation of WorkflowStore.
 * Supports optimistic locking via the version column for concurrent advancer passes.
 */
public class JdbcWorkflowStore implements WorkflowStore {

    private static final TypeReference<List<WorkflowStep>> STEPS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ObjectReader stepsReader;
    private final WorkflowRowMapper rowMapper;

    public JdbcWorkflowStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.stepsReader = objectMapper.readerFor(STEPS_TYPE)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.rowMapper = new WorkflowRowMapper();
    }

    @Override
    public void save(WorkflowInstance instance) {
        String sql = """
            INSERT INTO engine_workflows (
                id, name, status, steps_json, current_step_index, status_reason,
                activate_at, last_progress_at, created_at, updated_at, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        guard("saveWorkflow", () -> jdbcTemplate.update(sql,
            instance.id(),
            instance.name(),
            instance.status().name(),
            toJson(instance.steps()),
            instance.currentStepIndex(),
            instance.statusReason(),
            toTimestamp(instance.activateAt()),
            toTimestamp(instance.lastProgressAt()),
            toTimestamp(instance.createdAt()),
            toTimestamp(instance.updatedAt()),
            instance.version()
        ));
    }

    @Override
    public WorkflowInstance update(WorkflowInstance instance) {
        String sql = """
            UPDATE engine_workflows SET
                status = ?,
                steps_json = ?,
                current_step_index = ?,
                status_reason = ?,
                last_progress_at = ?,
                updated_at = ?,
                version = version + 1
            WHERE id = ? AND version = ?
            """;

        int rows = guard("updateWorkflow", () -> jdbcTemplate.update(sql,
            instance.status().name(),
            toJson(instance.steps()),
            instance.currentStepIndex(),
            instance.statusReason(),
            toTimestamp(instance.lastProgressAt()),
            toTimestamp(instance.updatedAt()),
            instance.id(),
            instance.version()
        ));

        if (rows == 0) {
            throw new OptimisticLockException("Workflow", instance.id().toString(), instance.version());
        }
        return new WorkflowInstance(
            instance.id(), instance.name(), instance.status(), instance.steps(),
            instance.currentStepIndex(), instance.statusReason(), instance.activateAt(),
            instance.lastProgressAt(), instance.createdAt(), instance.updatedAt(),
            instance.version() + 1);
    }

    @Override
    public Optional<WorkflowInstance> findById(UUID id) {
        List<WorkflowInstance> results = guard("findWorkflow",
            () -> jdbcTemplate.query("SELECT * FROM engine_workflows WHERE id = ?", rowMapper, id));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowInstance> findDueScheduled(Instant now, int limit) {
        return guard("findDueScheduled", () -> jdbcTemplate.query("""
            SELECT * FROM engine_workflows
            WHERE status = 'SCHEDULED' AND activate_at <= ?
            ORDER BY activate_at
            LIMIT ?
            """, rowMapper, toTimestamp(now), limit));
    }

    @Override
    public List<WorkflowInstance> findByStatus(WorkflowStatus status, UUID after, int limit) {
        return guard("findWorkflowsByStatus", () -> {
            if (after == null) {
                return jdbcTemplate.query(
                    "SELECT * FROM engine_workflows WHERE status = ? ORDER BY id LIMIT ?",
                    rowMapper, status.name(), limit);
            }
            return jdbcTemplate.query(
                "SELECT * FROM engine_workflows WHERE status = ? AND id > ? ORDER BY id LIMIT ?",
                rowMapper, status.name(), after, limit);
        });
    }

    @Override
    public List<WorkflowInstance> findTerminalBefore(Instant updatedBefore, UUID after, int limit) {
        return guard("findTerminalWorkflows", () -> {
            if (after == null) {
                return jdbcTemplate.query("""
                    SELECT * FROM engine_workflows
                    WHERE status IN ('COMPLETED', 'CANCELLED') AND updated_at < ?
                    ORDER BY id
                    LIMIT ?
                    """, rowMapper, toTimestamp(updatedBefore), limit);
            }
            return jdbcTemplate.query("""
                SELECT * FROM engine_workflows
                WHERE status IN ('COMPLETED', 'CANCELLED') AND updated_at < ? AND id > ?
                ORDER BY id
                LIMIT ?
                """, rowMapper, toTimestamp(updatedBefore), after, limit);
        });
    }

    @Override
    public boolean delete(UUID id) {
        return guard("deleteWorkflow",
            () -> jdbcTemplate.update("DELETE FROM engine_workflows WHERE id = ?", id) == 1);
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        guard("countWorkflows", () -> {
            jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM engine_workflows GROUP BY status", rs -> {
                counts.put(WorkflowStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
            });
            return counts;
        });
        return counts;
    }

    // ========== Helper Methods ==========

    private <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TaskStoreException(operation, e);
        }
    }

    private String toJson(List<WorkflowStep> steps) {
        try {
            return objectMapper.writeValueAsString(steps);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow steps are not serialisable", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class WorkflowRowMapper implements RowMapper<WorkflowInstance> {
        @Override
        public WorkflowInstance mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                List<WorkflowStep> steps = stepsReader.readValue(rs.getString("steps_json"));
                return new WorkflowInstance(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("name"),
                    WorkflowStatus.valueOf(rs.getString("status")),
                    steps,
                    rs.getInt("current_step_index"),
                    rs.getString("status_reason"),
                    toInstant(rs.getTimestamp("activate_at")),
                    toInstant(rs.getTimestamp("last_progress_at")),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    rs.getLong("version")
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map workflow row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
