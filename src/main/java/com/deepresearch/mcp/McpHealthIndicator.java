package com.deepresearch.mcp;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reports the search and crawl tool servers the research agents depend on.
 * <p>
 * Each configured server gets one detail entry listing the agents that have
 * connected to it so far and whether those connections still answer a ping.
 * A server that stopped answering only degrades research, since agents then
 * run without its tools, so the worst status reported is {@code DEGRADED}.
 */
@Component
@ConditionalOnProperty(prefix = "deepresearch.mcp", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");
    static final String NOT_CONNECTED = "not connected yet";

    private final McpClientManager clientManager;
    private final McpProperties props;

    public McpHealthIndicator(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "not configured").build();
        }

        List<McpClientManager.Connection> connections = clientManager.connections();
        var builder = Health.up().withDetail("connections", connections.size());
        boolean anyDown = false;
        for (var server : props.getServers().entrySet()) {
            if (!server.getValue().hasUrl()) continue;
            var agents = new TreeSet<String>();
            String status = NOT_CONNECTED;
            for (var connection : connections) {
                if (!connection.server().equals(server.getKey())) continue;
                agents.addAll(connection.consumers());
                String failure = ping(connection);
                if (failure != null) {
                    status = "DOWN: " + failure;
                    anyDown = true;
                } else if (NOT_CONNECTED.equals(status)) {
                    status = "UP";
                }
            }
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("url", server.getValue().getUrl());
            detail.put("agents", List.copyOf(agents));
            detail.put("status", status);
            builder.withDetail(server.getKey(), detail);
        }
        return anyDown ? builder.status(DEGRADED).build() : builder.build();
    }

    private static String ping(McpClientManager.Connection connection) {
        try {
            connection.client().ping();
            return null;
        } catch (Exception e) {
            return e.getMessage();
        }
    }
}
