package io.swarmmesh.model;

import java.util.Set;

public record AgentView(
        String agentId,
        Set<String> capabilityTags,
        AgentState state,
        long lastHeartbeatAtMs,
        double weight,
        boolean leaderEligible
) {
}
