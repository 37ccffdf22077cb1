package com.deepresearch.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages MCP sync client lifecycle for all configured servers.
 * <p>
 * Clients are created lazily per consumer and server, authenticated with that
 * consumer's token, then cached. Consumers sharing a token share a connection.
 * A server that cannot be reached is skipped; the agents then run without its tools.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;

    /** "server:token-hash" to client. */
    private final Map<String, McpSyncClient> clientCache = new ConcurrentHashMap<>();
    /** "server:token-hash" to the consumers that asked for that connection. */
    private final Map<String, Set<String>> consumersByKey = new ConcurrentHashMap<>();

    /**
     * A cached connection with the agents that use it.
     */
    public record Connection(String server, Set<String> consumers, McpSyncClient client) {}

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    /**
     * Returns one client per reachable configured server for the given consumer.
     *
     * @param consumer agent tag, e.g. "researcher" or "coder"
     * @return connected clients, empty when MCP is disabled or nothing is reachable
     */
    public List<McpSyncClient> getClientsFor(String consumer) {
        if (!props.isConfigured()) {
            return List.of();
        }
        var clients = new ArrayList<McpSyncClient>();
        for (var entry : props.getServers().entrySet()) {
            var config = entry.getValue();
            if (!config.hasUrl()) continue;
            McpSyncClient client = clientFor(entry.getKey(), config, consumer);
            if (client != null) {
                clients.add(client);
            }
        }
        return clients;
    }

    private McpSyncClient clientFor(String serverName, McpProperties.ServerConfig config, String consumer) {
        String token = config.getTokenFor(consumer);
        String cacheKey = serverName + ":" + (token != null ? token.hashCode() : "none");
        McpSyncClient cached = clientCache.get(cacheKey);
        if (cached != null) {
            recordConsumer(cacheKey, consumer);
            return cached;
        }
        try {
            var transportBuilder = HttpClientSseClientTransport.builder(config.getUrl())
                    .sseEndpoint(config.getSseEndpoint());
            if (token != null && !token.isBlank()) {
                transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
            }
            var client = McpClient.sync(transportBuilder.build())
                    .requestTimeout(Duration.ofSeconds(props.getRequestTimeoutSeconds()))
                    .build();
            client.initialize();
            log.info("MCP client created for consumer '{}' on server '{}'", consumer, serverName);
            McpSyncClient existing = clientCache.putIfAbsent(cacheKey, client);
            recordConsumer(cacheKey, consumer);
            if (existing != null) {
                client.closeGracefully();
                return existing;
            }
            return client;
        } catch (Exception e) {
            log.warn("Failed to create MCP client for consumer '{}' on server '{}': {}",
                    consumer, serverName, e.getMessage());
            return null;
        }
    }

    private void recordConsumer(String cacheKey, String consumer) {
        consumersByKey.computeIfAbsent(cacheKey, k -> ConcurrentHashMap.newKeySet()).add(consumer);
    }

    /**
     * Returns all currently cached clients keyed by cache key (for health checks).
     */
    public Map<String, McpSyncClient> getClients() {
        return Collections.unmodifiableMap(clientCache);
    }

    /**
     * Cached connections grouped with their consumers, ordered by server name.
     */
    public List<Connection> connections() {
        var result = new ArrayList<Connection>();
        clientCache.forEach((key, client) -> {
            String server = key.substring(0, key.lastIndexOf(':'));
            Set<String> consumers = new TreeSet<>(consumersByKey.getOrDefault(key, Set.of()));
            result.add(new Connection(server, Collections.unmodifiableSet(consumers), client));
        });
        result.sort(Comparator.comparing(Connection::server));
        return result;
    }

    public boolean hasClients() {
        return !clientCache.isEmpty();
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    @PreDestroy
    void shutdown() {
        for (var entry : clientCache.entrySet()) {
            try {
                entry.getValue().close();
                log.info("MCP client disconnected ({})", entry.getKey());
            } catch (Exception e) {
                log.debug("Error closing MCP client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clientCache.clear();
        consumersByKey.clear();
    }
}
