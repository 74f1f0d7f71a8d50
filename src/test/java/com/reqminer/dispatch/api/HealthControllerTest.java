package com.reqminer.dispatch.api;

import com.reqminer.core.health.HealthCheckService;
import com.reqminer.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when every component is up")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled and available", Map.of()),
                new HealthStatus("checkpoints", HealthStatus.Status.UP, "Checkpoint store readable",
                        Map.of("store", "langgraph4j MemorySaver"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.checkpoints.metadata.store").value("langgraph4j MemorySaver"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void componentDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("graph", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("database", HealthStatus.Status.DOWN, "Database connection invalid", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.database.detail").value("Database connection invalid"));
    }
}
