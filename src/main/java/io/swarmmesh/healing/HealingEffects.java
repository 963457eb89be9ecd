package io.swarmmesh.healing;

import io.swarmmesh.metrics.InFlightTask;
import io.swarmmesh.model.AgentState;

import java.util.List;

/**
 * Side effects the healer asks its session to carry out.
 */
public interface HealingEffects {
    boolean restart(String agentId) throws Exception;

    void removeAgent(String agentId, String reason);

    /**
     * Hands the tasks back to the host for redispatch. Returns false when nobody accepted them.
     */
    boolean reassign(String agentId, List<InFlightTask> tasks);

    List<InFlightTask> inFlightFor(String agentId);

    void stateChanged(String agentId, AgentState from, AgentState to);
}
