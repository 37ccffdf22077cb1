package com.deepresearch.mcp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpPropertiesTest {

    private static McpProperties.ServerConfig server(String url) {
        var config = new McpProperties.ServerConfig();
        config.setUrl(url);
        return config;
    }

    @Nested
    @DisplayName("isConfigured")
    class IsConfigured {

        @Test
        @DisplayName("disabled by default")
        void disabledByDefault() {
            assertFalse(new McpProperties().isConfigured());
        }

        @Test
        @DisplayName("enabled without any server URL is not configured")
        void enabledWithoutUrl() {
            var props = new McpProperties();
            props.setEnabled(true);
            props.setServers(new LinkedHashMap<>(Map.of("search", server(""))));
            assertFalse(props.isConfigured());
        }

        @Test
        @DisplayName("enabled with a server URL is configured")
        void enabledWithUrl() {
            var props = new McpProperties();
            props.setEnabled(true);
            props.setServers(new LinkedHashMap<>(Map.of("search", server("http://localhost:8931"))));
            assertTrue(props.isConfigured());
        }
    }

    @Nested
    @DisplayName("getTokenFor")
    class TokenFor {

        @Test
        @DisplayName("consumer-specific token wins over the shared one")
        void specificTokenWins() {
            var config = server("http://localhost:8931");
            config.setToken("shared");
            config.setTokens(Map.of("coder", "coder-token"));

            assertEquals("coder-token", config.getTokenFor("CODER"));
            assertEquals("shared", config.getTokenFor("researcher"));
        }

        @Test
        @DisplayName("blank consumer token falls back to the shared one")
        void blankTokenFallsBack() {
            var config = server("http://localhost:8931");
            config.setToken("shared");
            config.setTokens(Map.of("coder", " "));

            assertEquals("shared", config.getTokenFor("coder"));
        }
    }

    @Nested
    @DisplayName("when MCP is not configured")
    class NotConfigured {

        private final McpProperties props = new McpProperties();
        private final McpClientManager manager = new McpClientManager(props);

        @Test
        @DisplayName("client manager returns no clients")
        void noClients() {
            assertTrue(manager.getClientsFor("researcher").isEmpty());
            assertFalse(manager.hasClients());
        }

        @Test
        @DisplayName("tool provider returns an empty tool array")
        void noTools() {
            var provider = new McpToolProvider(manager);
            assertEquals(0, provider.getToolsFor("researcher").length);
            assertFalse(provider.hasTools());
        }

        @Test
        @DisplayName("health indicator reports UNKNOWN")
        void healthUnknown() {
            var health = new McpHealthIndicator(manager, props).health();
            assertEquals(Status.UNKNOWN, health.getStatus());
            assertEquals("not configured", health.getDetails().get("reason"));
        }
    }

    @Test
    @DisplayName("health indicator is UP before any connection is made")
    void healthUpWithoutConnections() {
        var props = new McpProperties();
        props.setEnabled(true);
        props.setServers(new LinkedHashMap<>(Map.of("search", server("http://localhost:8931"))));
        var health = new McpHealthIndicator(new McpClientManager(props), props).health();

        assertEquals(Status.UP, health.getStatus());
        var search = (Map<?, ?>) health.getDetails().get("search");
        assertEquals("not connected yet", search.get("status"));
        assertEquals(List.of(), search.get("agents"));
    }
}
