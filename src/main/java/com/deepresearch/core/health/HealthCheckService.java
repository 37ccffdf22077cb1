package com.deepresearch.core.health;

import com.deepresearch.core.engine.ResearchSessionRegistry;
import com.deepresearch.core.llm.AgentType;
import com.deepresearch.core.llm.LlmProperties;
import com.deepresearch.mcp.McpClientManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates component health for the REST health endpoint and the {@code health} CLI command.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    /** Placeholder in application.yml that lets the context start without a key. */
    static final String UNSET_API_KEY = "not-set";

    private final LlmProperties llmProperties;
    private final McpClientManager mcpClientManager;
    private final ResearchSessionRegistry sessionRegistry;
    private final String apiKey;

    public HealthCheckService(LlmProperties llmProperties,
                              @Autowired(required = false) McpClientManager mcpClientManager,
                              @Autowired(required = false) ResearchSessionRegistry sessionRegistry,
                              @Value("${spring.ai.openai.api-key:}") String apiKey) {
        this.llmProperties = llmProperties;
        this.mcpClientManager = mcpClientManager;
        this.sessionRegistry = sessionRegistry;
        this.apiKey = apiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkLlm());
        results.add(checkMcp());
        results.add(checkSessions());
        return results;
    }

    /**
     * Models configured per agent, with the default model filling the gaps.
     */
    public Map<String, String> configuredModels() {
        Map<String, String> models = new LinkedHashMap<>();
        for (AgentType agent : AgentType.values()) {
            String model = llmProperties.modelFor(agent);
            models.put(agent.tag(), model.isBlank() ? "(provider default)" : model);
        }
        return models;
    }

    private HealthStatus checkLlm() {
        Map<String, String> models = configuredModels();
        if (apiKey == null || apiKey.isBlank() || UNSET_API_KEY.equals(apiKey)) {
            return new HealthStatus("llm", HealthStatus.Status.DOWN,
                    "No API key configured for provider " + llmProperties.getProvider(), models);
        }
        return HealthStatus.up("llm", "Provider " + llmProperties.getProvider() + " configured", models);
    }

    private HealthStatus checkMcp() {
        if (mcpClientManager == null || !mcpClientManager.isConfigured()) {
            return HealthStatus.up("mcp", "MCP tools disabled; agents run without search tools", Map.of());
        }
        int connected = 0;
        int failed = 0;
        for (var entry : mcpClientManager.getClients().entrySet()) {
            try {
                entry.getValue().ping();
                connected++;
            } catch (Exception e) {
                log.warn("MCP health check failed for {}: {}", entry.getKey(), e.getMessage());
                failed++;
            }
        }
        Map<String, String> metadata = Map.of("connected", String.valueOf(connected), "failed", String.valueOf(failed));
        if (failed > 0) {
            return new HealthStatus("mcp", HealthStatus.Status.DEGRADED,
                    failed + " MCP connection(s) not responding", metadata);
        }
        return HealthStatus.up("mcp", connected > 0
                ? connected + " MCP connection(s) active"
                : "MCP configured (no active connections yet)", metadata);
    }

    private HealthStatus checkSessions() {
        if (sessionRegistry == null) {
            return new HealthStatus("sessions", HealthStatus.Status.DOWN,
                    "Session registry not available", Map.of());
        }
        return HealthStatus.up("sessions", sessionRegistry.activeCount() + " active research session(s)",
                Map.of("active", String.valueOf(sessionRegistry.activeCount()),
                        "retained", String.valueOf(sessionRegistry.size())));
    }
}
