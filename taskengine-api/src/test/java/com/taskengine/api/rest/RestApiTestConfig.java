package com.taskengine.api.rest;

import com.taskengine.core.test.TimeController;
import com.taskengine.engine.config.EngineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Instant;

/**
 * Beans the MVC slice needs besides the controllers: the secret interceptor's properties
 * and a fixed clock for error timestamps.
 */
@TestConfiguration
@EnableConfigurationProperties(EngineProperties.class)
class RestApiTestConfig {

    static final String SECRET = "test-secret";
    static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Bean
    Clock clock() {
        return TimeController.frozenAt(NOW);
    }
}
