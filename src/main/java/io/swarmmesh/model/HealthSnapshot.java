package io.swarmmesh.model;

public record HealthSnapshot(
        String sessionId,
        String agentId,
        long timestampMs,
        boolean reachable,
        long latencyMs
) {
}
