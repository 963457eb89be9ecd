package io.swarmmesh.runtime;

import io.swarmmesh.metrics.InFlightTask;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.topology.TopologyGraph;

import java.util.List;

/**
 * Host-side callbacks. The engine never dispatches work itself; when it takes tasks away from an agent it
 * tells the host here. Callbacks run on the session worker and must not block.
 */
public interface SwarmEventListener {
    SwarmEventListener NONE = new SwarmEventListener() {
    };

    /**
     * Returns true when the host accepted the tasks for redispatch.
     */
    default boolean onTasksReassigned(String sessionId, String agentId, List<InFlightTask> tasks) {
        return false;
    }

    default void onTopologyChanged(String sessionId, TopologyGraph graph, String reason) {
    }

    default void onAgentStateChanged(String sessionId, String agentId, AgentState from, AgentState to) {
    }

    default void onAgentRemoved(String sessionId, String agentId, String reason) {
    }

    default void onSessionClosed(String sessionId, String failureReason) {
    }
}
