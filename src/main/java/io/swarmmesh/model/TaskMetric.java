package io.swarmmesh.model;

public record TaskMetric(
        String taskId,
        String sessionId,
        String agentId,
        long durationMs,
        TaskResult result,
        long timestampMs
) {
}
