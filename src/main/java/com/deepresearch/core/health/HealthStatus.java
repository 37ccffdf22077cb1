package com.deepresearch.core.health;

import java.util.Map;

/**
 * Health of one component as reported by the health endpoint and CLI command.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
