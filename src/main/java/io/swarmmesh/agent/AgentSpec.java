package io.swarmmesh.agent;

import java.util.Set;

/**
 * Registration data for one agent of a session.
 *
 * @param weight         voting weight for weighted consensus, must be positive
 * @param leaderEligible whether the agent may be chosen as star coordinator, tree root or Raft leader
 * @param pinnedLeader   pins the agent as leader for leader-bearing topologies
 */
public record AgentSpec(
        String agentId,
        Set<String> capabilityTags,
        double weight,
        boolean leaderEligible,
        boolean pinnedLeader,
        AgentHandle handle
) {
    public AgentSpec {
        capabilityTags = capabilityTags == null ? Set.of() : Set.copyOf(capabilityTags);
    }

    public static AgentSpec of(AgentHandle handle) {
        return new AgentSpec(handle.id(), Set.of(), 1.0d, true, false, handle);
    }

    public static AgentSpec of(AgentHandle handle, double weight) {
        return new AgentSpec(handle.id(), Set.of(), weight, true, false, handle);
    }

    public AgentSpec withTags(Set<String> tags) {
        return new AgentSpec(agentId, tags, weight, leaderEligible, pinnedLeader, handle);
    }

    public AgentSpec withLeaderEligible(boolean eligible) {
        return new AgentSpec(agentId, capabilityTags, weight, eligible, pinnedLeader, handle);
    }

    public AgentSpec asPinnedLeader() {
        return new AgentSpec(agentId, capabilityTags, weight, true, true, handle);
    }
}
