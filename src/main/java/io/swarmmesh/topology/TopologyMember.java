package io.swarmmesh.topology;

import io.swarmmesh.agent.AgentSpec;

public record TopologyMember(String agentId, boolean leaderEligible, boolean pinnedLeader) {
    public static TopologyMember of(AgentSpec spec) {
        return new TopologyMember(spec.agentId(), spec.leaderEligible(), spec.pinnedLeader());
    }

    public static TopologyMember plain(String agentId) {
        return new TopologyMember(agentId, true, false);
    }
}
