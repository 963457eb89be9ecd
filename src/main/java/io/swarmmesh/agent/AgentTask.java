package io.swarmmesh.agent;

public record AgentTask(
        String sessionId,
        String taskId,
        String payload
) {
}
