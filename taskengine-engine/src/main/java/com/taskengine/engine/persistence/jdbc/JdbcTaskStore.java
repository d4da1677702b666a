package com.taskengine.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.exception.TaskStoreException;
import com.taskengine.core.model.ErrorClass;
import com.taskengine.core.model.QueueStats;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskError;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.repository.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Relational implementation of TaskStore (PostgreSQL in production, H2 in tests).
 *
 * The claim is a plain SELECT of candidates followed by one conditional UPDATE per
 * candidate. The database serialises concurrent UPDATEs of the same row, so exactly one
 * pass sees an update count of 1 for it. No explicit transaction or row lock is needed.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final String WAITING = "('PENDING', 'RETRY_SCHEDULED')";
    private static final int MAX_CLAIM_ROUNDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRowMapper rowMapper;

    public JdbcTaskStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRowMapper();
    }

    @Override
    public UUID enqueue(Task task) {
        String sql = """
            INSERT INTO engine_tasks (
                id, type, payload, priority, status, attempts, max_attempts,
                scheduled_for, last_attempt_at, claim_expires_at,
                error_class, error_code, error_message, error_at,
                review_count, dedupe_key, workflow_id, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        TaskError error = task.lastError();
        try {
            jdbcTemplate.update(sql,
                task.id(),
                task.type(),
                toJson(task.payload()),
                task.priority().weight(),
                task.status().name(),
                task.attempts(),
                task.maxAttempts(),
                toTimestamp(task.scheduledFor()),
                toTimestamp(task.lastAttemptAt()),
                toTimestamp(task.claimExpiresAt()),
                error != null ? error.errorClass().name() : null,
                error != null ? error.code() : null,
                error != null ? error.message() : null,
                error != null ? toTimestamp(error.occurredAt()) : null,
                task.reviewCount(),
                task.dedupeKey(),
                task.workflowId(),
                toTimestamp(task.createdAt()),
                toTimestamp(task.updatedAt())
            );
            return task.id();
        } catch (DuplicateKeyException e) {
            if (task.dedupeKey() == null) {
                throw new TaskStoreException("enqueue", e);
            }
            return resolveDuplicate(task);
        } catch (DataAccessException e) {
            throw new TaskStoreException("enqueue", e);
        }
    }

    private UUID resolveDuplicate(Task task) {
        return guard("enqueue", () -> {
            List<String> ids = jdbcTemplate.queryForList(
                "SELECT id FROM engine_tasks WHERE dedupe_key = ?", String.class, task.dedupeKey());
            if (ids.isEmpty()) {
                // The holder of the key was purged between our insert and this lookup
                throw new TaskStoreException("enqueue",
                    new IllegalStateException("Dedupe key vanished: " + task.dedupeKey()));
            }
            UUID existingId = UUID.fromString(ids.get(0));
            int upgraded = jdbcTemplate.update("""
                UPDATE engine_tasks SET priority = ?, updated_at = ?
                WHERE id = ? AND status IN %s AND priority < ?
                """.formatted(WAITING),
                task.priority().weight(),
                toTimestamp(task.createdAt()),
                existingId,
                task.priority().weight());
            log.debug("Dedupe key {} already taken by task {} (priority upgraded: {})",
                task.dedupeKey(), existingId, upgraded > 0);
            return existingId;
        });
    }

    @Override
    public List<Task> claimDue(int limit, Set<String> types, Instant now, Instant claimExpiresAt) {
        return guard("claimDue", () -> {
            List<UUID> claimedIds = new ArrayList<>();
            for (int round = 0; round < MAX_CLAIM_ROUNDS && claimedIds.size() < limit; round++) {
                List<UUID> candidates = findCandidates(limit - claimedIds.size(), types, now);
                if (candidates.isEmpty()) {
                    break;
                }
                for (UUID id : candidates) {
                    if (tryClaim(id, now, claimExpiresAt)) {
                        claimedIds.add(id);
                    }
                }
            }
            if (claimedIds.isEmpty()) {
                return List.of();
            }
            List<Task> claimed = new ArrayList<>(findByIds(claimedIds));
            claimed.sort(Comparator
                .comparingInt((Task t) -> t.priority().weight()).reversed()
                .thenComparing(Task::scheduledFor)
                .thenComparing(Task::createdAt));
            return claimed;
        });
    }

    private List<UUID> findCandidates(int limit, Set<String> types, Instant now) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
            SELECT id FROM engine_tasks
            WHERE status IN %s AND scheduled_for <= ?
            """.formatted(WAITING));
        params.add(toTimestamp(now));
        if (types != null && !types.isEmpty()) {
            sql.append(" AND type IN (")
                .append(String.join(", ", Collections.nCopies(types.size(), "?")))
                .append(")");
            params.addAll(types);
        }
        sql.append(" ORDER BY priority DESC, scheduled_for, created_at LIMIT ?");
        params.add(limit);
        return jdbcTemplate.query(sql.toString(),
            (rs, rowNum) -> UUID.fromString(rs.getString("id")), params.toArray());
    }

    private boolean tryClaim(UUID id, Instant now, Instant claimExpiresAt) {
        String sql = """
            UPDATE engine_tasks SET
                status = 'RUNNING',
                attempts = attempts + 1,
                last_attempt_at = ?,
                claim_expires_at = ?,
                updated_at = ?
            WHERE id = ? AND status IN %s AND scheduled_for <= ?
            """.formatted(WAITING);
        int rows = jdbcTemplate.update(sql,
            toTimestamp(now), toTimestamp(claimExpiresAt), toTimestamp(now), id, toTimestamp(now));
        if (rows == 0) {
            log.debug("Task {} was claimed by a concurrent pass", id);
        }
        return rows == 1;
    }

    @Override
    public boolean complete(UUID id, int attempt, Instant now) {
        return guard("complete", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET status = 'SUCCEEDED', claim_expires_at = NULL, updated_at = ?
            WHERE id = ? AND status = 'RUNNING' AND attempts = ?
            """, toTimestamp(now), id, attempt) == 1);
    }

    @Override
    public boolean scheduleRetry(UUID id, int attempt, Instant nextTime, TaskError error, Instant now) {
        return guard("scheduleRetry", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = 'RETRY_SCHEDULED',
                scheduled_for = ?,
                claim_expires_at = NULL,
                error_class = ?, error_code = ?, error_message = ?, error_at = ?,
                updated_at = ?
            WHERE id = ? AND status = 'RUNNING' AND attempts = ?
            """,
            toTimestamp(nextTime),
            error.errorClass().name(), error.code(), error.message(), toTimestamp(error.occurredAt()),
            toTimestamp(now), id, attempt) == 1);
    }

    @Override
    public boolean markDeadLetter(UUID id, int attempt, TaskError error, Instant now) {
        return guard("markDeadLetter", () -> finishWithError(TaskStatus.DEAD_LETTER, id, attempt, error, now));
    }

    @Override
    public boolean markPermanentFailure(UUID id, int attempt, TaskError error, Instant now) {
        return guard("markPermanentFailure",
            () -> finishWithError(TaskStatus.FAILED_PERMANENT, id, attempt, error, now));
    }

    private boolean finishWithError(TaskStatus target, UUID id, int attempt, TaskError error, Instant now) {
        return jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = ?,
                claim_expires_at = NULL,
                error_class = ?, error_code = ?, error_message = ?, error_at = ?,
                updated_at = ?
            WHERE id = ? AND status = 'RUNNING' AND attempts = ?
            """,
            target.name(),
            error.errorClass().name(), error.code(), error.message(), toTimestamp(error.occurredAt()),
            toTimestamp(now), id, attempt) == 1;
    }

    @Override
    public List<Task> listDeadLetter(UUID after, int limit) {
        return guard("listDeadLetter", () -> {
            if (after == null) {
                return jdbcTemplate.query(
                    "SELECT * FROM engine_tasks WHERE status = 'DEAD_LETTER' ORDER BY id LIMIT ?",
                    rowMapper, limit);
            }
            return jdbcTemplate.query(
                "SELECT * FROM engine_tasks WHERE status = 'DEAD_LETTER' AND id > ? ORDER BY id LIMIT ?",
                rowMapper, after, limit);
        });
    }

    @Override
    public boolean requeueDeadLetter(UUID id, int expectedReviewCount, Instant now) {
        return guard("requeueDeadLetter", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = 'PENDING',
                attempts = 0,
                scheduled_for = ?,
                claim_expires_at = NULL,
                review_count = review_count + 1,
                updated_at = ?
            WHERE id = ? AND status = 'DEAD_LETTER' AND review_count = ?
            """, toTimestamp(now), toTimestamp(now), id, expectedReviewCount) == 1);
    }

    @Override
    public Optional<Task> findById(UUID id) {
        return guard("findById", () -> {
            List<Task> results = jdbcTemplate.query("SELECT * FROM engine_tasks WHERE id = ?", rowMapper, id);
            return results.isEmpty() ? Optional.<Task>empty() : Optional.of(results.get(0));
        });
    }

    @Override
    public List<Task> findByIds(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return guard("findByIds", () -> jdbcTemplate.query(
            "SELECT * FROM engine_tasks WHERE id IN (" + placeholders(ids.size()) + ")",
            rowMapper, ids.toArray()));
    }

    @Override
    public List<Task> findExpiredClaims(Instant now, int limit) {
        return guard("findExpiredClaims", () -> jdbcTemplate.query("""
            SELECT * FROM engine_tasks
            WHERE status = 'RUNNING' AND claim_expires_at < ?
            ORDER BY claim_expires_at
            LIMIT ?
            """, rowMapper, toTimestamp(now), limit));
    }

    @Override
    public boolean cancel(UUID id, Instant now) {
        return guard("cancel", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = 'FAILED_PERMANENT',
                error_class = 'PERMANENT', error_code = ?, error_message = ?, error_at = ?,
                updated_at = ?
            WHERE id = ? AND status IN %s
            """.formatted(WAITING),
            Task.CANCELLED_CODE, "Cancelled by operator", toTimestamp(now), toTimestamp(now), id) == 1);
    }

    @Override
    public int cancelByWorkflow(UUID workflowId, Instant now) {
        return guard("cancelByWorkflow", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = 'FAILED_PERMANENT',
                error_class = 'PERMANENT', error_code = ?, error_message = ?, error_at = ?,
                updated_at = ?
            WHERE workflow_id = ? AND status IN ('PENDING', 'RETRY_SCHEDULED', 'DEAD_LETTER')
            """,
            Task.CANCELLED_CODE, "Cancelled by operator", toTimestamp(now), toTimestamp(now), workflowId));
    }

    @Override
    public boolean cancelDeadLetter(UUID id, int expectedReviewCount, Instant now) {
        return guard("cancelDeadLetter", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = 'FAILED_PERMANENT',
                error_class = 'PERMANENT', error_code = ?, error_message = ?, error_at = ?,
                updated_at = ?
            WHERE id = ? AND status = 'DEAD_LETTER' AND review_count = ?
            """,
            Task.CANCELLED_CODE, "Cancelled by operator", toTimestamp(now), toTimestamp(now),
            id, expectedReviewCount) == 1);
    }

    @Override
    public boolean retryManually(UUID id, Instant now) {
        return guard("retryManually", () -> jdbcTemplate.update("""
            UPDATE engine_tasks SET
                status = 'PENDING',
                attempts = 0,
                review_count = 0,
                scheduled_for = ?,
                claim_expires_at = NULL,
                updated_at = ?
            WHERE id = ? AND status IN ('DEAD_LETTER', 'FAILED_PERMANENT')
            """, toTimestamp(now), toTimestamp(now), id) == 1);
    }

    @Override
    public QueueStats stats() {
        return guard("stats", () -> {
            Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
            jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM engine_tasks GROUP BY status", rs -> {
                byStatus.put(TaskStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
            });

            Map<TaskPriority, Long> byPriority = new EnumMap<>(TaskPriority.class);
            jdbcTemplate.query(
                "SELECT priority, COUNT(*) AS cnt FROM engine_tasks WHERE status IN " + WAITING + " GROUP BY priority",
                rs -> {
                    byPriority.put(TaskPriority.fromWeight(rs.getInt("priority")), rs.getLong("cnt"));
                });

            Map<String, Long> byType = new HashMap<>();
            jdbcTemplate.query(
                "SELECT type, COUNT(*) AS cnt FROM engine_tasks WHERE status IN " + WAITING + " GROUP BY type",
                rs -> {
                    byType.put(rs.getString("type"), rs.getLong("cnt"));
                });
            return new QueueStats(byStatus, byPriority, byType);
        });
    }

    @Override
    public int purgeTerminal(Instant updatedBefore, int limit) {
        return guard("purgeTerminal", () -> {
            List<UUID> ids = jdbcTemplate.query("""
                SELECT id FROM engine_tasks
                WHERE status IN ('SUCCEEDED', 'FAILED_PERMANENT')
                  AND workflow_id IS NULL
                  AND updated_at < ?
                ORDER BY updated_at
                LIMIT ?
                """, (rs, rowNum) -> UUID.fromString(rs.getString("id")), toTimestamp(updatedBefore), limit);
            if (ids.isEmpty()) {
                return 0;
            }
            return jdbcTemplate.update(
                "DELETE FROM engine_tasks WHERE status IN ('SUCCEEDED', 'FAILED_PERMANENT') AND id IN ("
                    + placeholders(ids.size()) + ")",
                ids.toArray());
        });
    }

    @Override
    public int deleteByWorkflow(UUID workflowId) {
        return guard("deleteByWorkflow",
            () -> jdbcTemplate.update("""
                DELETE FROM engine_tasks
                WHERE workflow_id = ? AND status IN ('SUCCEEDED', 'FAILED_PERMANENT')
                """, workflowId));
    }

    // ========== Helper Methods ==========

    private <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new TaskStoreException(operation, e);
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Task payload is not serialisable", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String workflowId = rs.getString("workflow_id");
                return new Task(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("type"),
                    parseJsonNode(rs.getString("payload")),
                    TaskPriority.fromWeight(rs.getInt("priority")),
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempts"),
                    rs.getInt("max_attempts"),
                    toInstant(rs.getTimestamp("scheduled_for")),
                    toInstant(rs.getTimestamp("last_attempt_at")),
                    toInstant(rs.getTimestamp("claim_expires_at")),
                    mapError(rs),
                    rs.getInt("review_count"),
                    rs.getString("dedupe_key"),
                    workflowId != null ? UUID.fromString(workflowId) : null,
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new SQLException("Failed to map task row", e);
            }
        }

        private TaskError mapError(ResultSet rs) throws SQLException {
            String errorClass = rs.getString("error_class");
            if (errorClass == null) {
                return null;
            }
            return new TaskError(
                ErrorClass.valueOf(errorClass),
                rs.getString("error_code"),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("error_at")));
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
