package io.swarmmesh.agent;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agents registered with one session, keyed by agent id.
 */
public final class AgentRegistry {
    private final Map<String, AgentSpec> agents = new ConcurrentHashMap<>();

    public void register(AgentSpec spec) {
        agents.put(spec.agentId(), spec);
    }

    public Optional<AgentSpec> findById(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Optional<AgentHandle> handle(String agentId) {
        return findById(agentId).map(AgentSpec::handle);
    }

    public boolean remove(String agentId) {
        return agents.remove(agentId) != null;
    }

    public List<AgentSpec> specs() {
        return List.copyOf(agents.values());
    }
}
