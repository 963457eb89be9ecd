package io.swarmmesh.runtime;

import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TaskMetric;
import io.swarmmesh.topology.TopologyGraph;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Answer of {@code getStatus}. When {@code degraded} is set the view is the last snapshot taken before the
 * session worker started failing.
 */
public record SessionStatusView(
        String sessionId,
        SessionStatus status,
        ConsensusAlgorithm consensusAlgorithm,
        TopologyGraph topology,
        List<AgentView> agents,
        List<TaskMetric> recentMetrics,
        List<ProposalRecord> openProposals,
        boolean degraded,
        String degradedReason,
        long snapshotAtMs
) {
    public SessionStatusView {
        agents = List.copyOf(agents);
        recentMetrics = List.copyOf(recentMetrics);
        openProposals = List.copyOf(openProposals);
    }

    public Map<String, AgentState> agentHealth() {
        Map<String, AgentState> out = new TreeMap<>();
        for (AgentView a : agents) {
            out.put(a.agentId(), a.state());
        }
        return out;
    }

    SessionStatusView asDegraded(String reason) {
        return new SessionStatusView(sessionId, status, consensusAlgorithm, topology, agents, recentMetrics,
                openProposals, true, reason, snapshotAtMs);
    }
}
