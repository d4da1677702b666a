package com.taskengine.api.trigger;

import com.taskengine.engine.config.EngineProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CronTriggerController.class)
@TestPropertySource(properties = "taskengine.trigger.secret=test-secret")
class CronTriggerControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(EngineProperties.class)
    static class Config {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired
    private MockMvc mvc;

    @MockBean
    private InvocationHarness harness;

    @Test
    @DisplayName("Bearer secret lets the dispatch pass run and returns its summary")
    void dispatch_withBearerSecret_shouldReturnSummary() throws Exception {
        when(harness.dispatch(any())).thenReturn(Map.of("claimed", 2, "succeeded", 2, "budgetExhausted", false));

        mvc.perform(get("/api/cron/dispatch").header("Authorization", "Bearer test-secret"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.claimed").value(2))
            .andExpect(jsonPath("$.budgetExhausted").value(false));
    }

    @Test
    void dispatch_withTypesParameter_shouldPassFilter() throws Exception {
        when(harness.dispatch(any())).thenReturn(Map.of());

        mvc.perform(post("/api/cron/dispatch")
                .param("types", "email.send", "report.build")
                .header("X-Cron-Secret", "test-secret"))
            .andExpect(status().isOk());

        verify(harness).dispatch(Set.of("email.send", "report.build"));
    }

    @Test
    void dispatch_withWrongSecret_shouldReturn401WithoutRunningPass() throws Exception {
        mvc.perform(get("/api/cron/dispatch").header("Authorization", "Bearer nope"))
            .andExpect(status().isUnauthorized())
            .andExpect(content().json("{\"error\":\"UNAUTHORIZED\"}"));

        verifyNoInteractions(harness);
    }

    @Test
    void deadLetters_withoutSecret_shouldReturn401() throws Exception {
        mvc.perform(post("/api/cron/dead-letters"))
            .andExpect(status().isUnauthorized());

        verify(harness, never()).reviewDeadLetters();
    }

    @Test
    void deadLetters_acceptsGetAndPost() throws Exception {
        when(harness.reviewDeadLetters()).thenReturn(Map.of("requeued", 1));

        mvc.perform(get("/api/cron/dead-letters").header("X-Cron-Secret", "test-secret"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requeued").value(1));
        mvc.perform(post("/api/cron/dead-letters").header("X-Cron-Secret", "test-secret"))
            .andExpect(status().isOk());
    }

    @Test
    void workflowsAndCleanup_shouldDelegateToHarness() throws Exception {
        when(harness.advanceWorkflows()).thenReturn(Map.of("advanced", 3));
        when(harness.cleanup()).thenReturn(Map.of("tasksPurged", 10));

        mvc.perform(post("/api/cron/workflows").header("X-Cron-Secret", "test-secret"))
            .andExpect(jsonPath("$.advanced").value(3));
        mvc.perform(post("/api/cron/cleanup").header("X-Cron-Secret", "test-secret"))
            .andExpect(jsonPath("$.tasksPurged").value(10));
    }

    @Test
    @DisplayName("A pass that throws surfaces as a 500 with a generic error code")
    void dispatch_whenPassFails_shouldReturn500() throws Exception {
        when(harness.dispatch(any())).thenThrow(new IllegalStateException("connection refused"));

        mvc.perform(get("/api/cron/dispatch").header("X-Cron-Secret", "test-secret"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
            .andExpect(jsonPath("$.message").doesNotExist());
    }
}
