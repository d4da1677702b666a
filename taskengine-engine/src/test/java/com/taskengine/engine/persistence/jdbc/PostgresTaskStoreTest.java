package com.taskengine.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskPriority;
import com.taskengine.core.model.TaskStatus;
import com.taskengine.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Claim races against a real PostgreSQL. Skipped where Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresTaskStoreTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

    private TimeController time;
    private JdbcTemplate jdbcTemplate;
    private JdbcTaskStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        H2Databases.applySchema(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM engine_tasks");
        time = TimeController.frozen();
        store = new JdbcTaskStore(jdbcTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Concurrent passes claim disjoint sets of tasks")
    void claimDue_fromConcurrentPasses_shouldNeverDoubleClaim() throws Exception {
        for (int i = 0; i < 300; i++) {
            store.enqueue(Task.create("report.build", null, TaskPriority.NORMAL, 3, null, time.now()));
        }
        Instant now = time.now();
        int passes = 6;
        ExecutorService pool = Executors.newFixedThreadPool(passes);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<UUID>>> results = new ArrayList<>();
        try {
            for (int p = 0; p < passes; p++) {
                Callable<List<UUID>> pass = () -> {
                    start.await();
                    List<UUID> mine = new ArrayList<>();
                    List<Task> batch;
                    while (!(batch = store.claimDue(10, Set.of(), now, now.plusSeconds(300))).isEmpty()) {
                        batch.forEach(t -> mine.add(t.id()));
                    }
                    return mine;
                };
                results.add(pool.submit(pass));
            }
            start.countDown();

            List<UUID> all = new ArrayList<>();
            for (Future<List<UUID>> result : results) {
                all.addAll(result.get());
            }

            assertThat(all).hasSize(300);
            assertThat(new HashSet<>(all)).hasSize(300);
            assertThat(store.stats().count(TaskStatus.RUNNING)).isEqualTo(300);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void enqueue_withDuplicateKey_shouldResolveToExistingTask() {
        UUID first = store.enqueue(Task.create("email.send", null, TaskPriority.LOW, 3, null, time.now())
            .withDedupeKey("welcome:7"));
        UUID second = store.enqueue(Task.create("email.send", null, TaskPriority.HIGH, 3, null, time.now())
            .withDedupeKey("welcome:7"));

        assertThat(second).isEqualTo(first);
        assertThat(store.findById(first).orElseThrow().priority()).isEqualTo(TaskPriority.HIGH);
    }
}
