package com.deepresearch.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Remote MCP servers that supply tools (web search, crawling, code execution) to the agents.
 * <p>
 * Each named server has a URL, a shared token and optional per-consumer token
 * overrides. Consumers are agent tags such as {@code researcher} or {@code coder}.
 *
 * <pre>
 * deepresearch:
 *   mcp:
 *     enabled: true
 *     servers:
 *       search:
 *         url: http://localhost:8931
 *         sse-endpoint: /sse
 *         token: shared-token
 *         tokens:
 *           coder: scoped-token-for-coder
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "deepresearch.mcp")
public class McpProperties {

    private boolean enabled = false;
    private int requestTimeoutSeconds = 30;
    private Map<String, ServerConfig> servers = new LinkedHashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    /**
     * Returns {@code true} when MCP is enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && servers.values().stream().anyMatch(ServerConfig::hasUrl);
    }

    public static class ServerConfig {
        private String url = "";
        private String sseEndpoint = "/sse";
        private String token = "";
        private Map<String, String> tokens = new LinkedHashMap<>();

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getSseEndpoint() { return sseEndpoint; }
        public void setSseEndpoint(String sseEndpoint) { this.sseEndpoint = sseEndpoint; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public Map<String, String> getTokens() { return tokens; }
        public void setTokens(Map<String, String> tokens) { this.tokens = tokens; }

        public boolean hasUrl() {
            return url != null && !url.isBlank();
        }

        /**
         * Returns the token for a consumer, falling back to the shared token.
         */
        public String getTokenFor(String consumer) {
            String specific = tokens.get(consumer.toLowerCase(Locale.ROOT));
            if (specific != null && !specific.isBlank()) return specific;
            return token;
        }
    }
}
