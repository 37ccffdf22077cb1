package com.deepresearch.dispatch.api;

import com.deepresearch.core.health.HealthCheckService;
import com.deepresearch.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("all components UP -> 200 with models")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.up("llm", "Provider openai configured", Map.of("planner", "gpt-4o")),
                HealthStatus.up("mcp", "MCP tools disabled", Map.of())));
        when(healthCheckService.configuredModels()).thenReturn(Map.of("planner", "gpt-4o"));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("UP")))
                .andExpect(jsonPath("$.components.llm.metadata.planner", is("gpt-4o")))
                .andExpect(jsonPath("$.components.mcp.metadata").doesNotExist())
                .andExpect(jsonPath("$.models.planner", is("gpt-4o")));
    }

    @Test
    @DisplayName("a DEGRADED component -> 200 DEGRADED")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.up("llm", "ok", Map.of()),
                new HealthStatus("mcp", HealthStatus.Status.DEGRADED, "1 MCP connection(s) not responding", Map.of())));
        when(healthCheckService.configuredModels()).thenReturn(Map.of());

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("DEGRADED")));
    }

    @Test
    @DisplayName("a DOWN component -> 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("llm", HealthStatus.Status.DOWN, "No API key configured", Map.of())));
        when(healthCheckService.configuredModels()).thenReturn(Map.of());

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status", is("DOWN")))
                .andExpect(jsonPath("$.components.llm.detail", containsString("API key")));
    }
}
