package com.deepresearch.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.mcp.SyncMcpToolCallbackProvider;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Provides MCP tools to LLM calls, scoped per consumer.
 */
@Component
public class McpToolProvider {

    private static final Logger log = LoggerFactory.getLogger(McpToolProvider.class);
    private static final ToolCallback[] EMPTY = new ToolCallback[0];

    private final McpClientManager clientManager;

    public McpToolProvider(McpClientManager clientManager) {
        this.clientManager = clientManager;
    }

    /**
     * Returns the tools visible to a consumer across all reachable servers.
     * Never null; empty when MCP is not configured or discovery fails.
     *
     * @param consumer agent tag, e.g. "researcher" or "coder"
     */
    public ToolCallback[] getToolsFor(String consumer) {
        List<McpSyncClient> clients = clientManager.getClientsFor(consumer);
        if (clients.isEmpty()) {
            return EMPTY;
        }
        try {
            var tools = new SyncMcpToolCallbackProvider(clients).getToolCallbacks();
            log.debug("MCP tool discovery for '{}' returned {} tool(s)", consumer, tools.length);
            return tools;
        } catch (Exception e) {
            log.warn("Failed to discover MCP tools for '{}': {}", consumer, e.getMessage());
            return EMPTY;
        }
    }

    public boolean hasTools() {
        return clientManager.isConfigured();
    }
}
