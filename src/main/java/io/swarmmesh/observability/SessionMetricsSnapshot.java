package io.swarmmesh.observability;

import io.swarmmesh.metrics.MetricsCollector;
import io.swarmmesh.metrics.Percentiles;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.HealingActionKind;
import io.swarmmesh.model.HealingStats;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.SessionRecord;
import io.swarmmesh.model.TaskMetric;
import io.swarmmesh.storage.SwarmStore;
import io.swarmmesh.topology.TopologyGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Numbers exported for one session, gathered either from a live session or from the store alone.
 */
public record SessionMetricsSnapshot(
        String sessionId,
        String status,
        Map<String, Integer> agentsByState,
        Map<String, Integer> proposalsByOutcome,
        Map<String, Integer> healingActionsByKind,
        Map<String, Integer> healingSuccessByKind,
        long taskLatencyP95Ms,
        long tasksCompleted,
        long tasksFailed,
        long tasksInFlight,
        long graphVersion
) {
    public static SessionMetricsSnapshot live(String sessionId, List<AgentView> agents, TopologyGraph graph,
                                              MetricsCollector metrics, SwarmStore store) {
        HealingStats healing = store.healingStats(sessionId);
        return new SessionMetricsSnapshot(
                sessionId,
                "ACTIVE",
                agentsByState(agents),
                proposals(store.countProposalsByOutcome(sessionId)),
                healingTotals(healing),
                healingSuccesses(healing),
                metrics.swarmP95(),
                Math.max(metrics.completedTotal(), store.countMetrics(sessionId)),
                Math.max(metrics.failedTotal(), store.countFailedMetrics(sessionId)),
                metrics.inFlightCount(),
                graph == null ? 0L : graph.version());
    }

    public static SessionMetricsSnapshot persisted(SessionRecord session, SwarmStore store) {
        String sessionId = session.sessionId();
        List<Long> durations = new ArrayList<>();
        for (TaskMetric m : store.queryRecentMetrics(sessionId, 1_000)) {
            durations.add(m.durationMs());
        }
        HealingStats healing = store.healingStats(sessionId);
        return new SessionMetricsSnapshot(
                sessionId,
                session.status().name(),
                agentsByState(store.loadAgents(sessionId)),
                proposals(store.countProposalsByOutcome(sessionId)),
                healingTotals(healing),
                healingSuccesses(healing),
                Percentiles.p95(durations),
                store.countMetrics(sessionId),
                store.countFailedMetrics(sessionId),
                0L,
                session.graphVersion());
    }

    private static Map<String, Integer> agentsByState(List<AgentView> agents) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (AgentState state : AgentState.values()) {
            out.put(state.name().toLowerCase(Locale.ROOT), 0);
        }
        for (AgentView a : agents) {
            out.merge(a.state().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        return out;
    }

    private static Map<String, Integer> proposals(Map<ProposalOutcome, Integer> counts) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (ProposalOutcome o : ProposalOutcome.values()) {
            out.put(o.name().toLowerCase(Locale.ROOT), counts.getOrDefault(o, 0));
        }
        return out;
    }

    private static Map<String, Integer> healingTotals(HealingStats stats) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (HealingActionKind kind : HealingActionKind.values()) {
            HealingStats.KindStats k = stats.byKind().get(kind);
            out.put(kind.name().toLowerCase(Locale.ROOT), k == null ? 0 : k.total());
        }
        return out;
    }

    private static Map<String, Integer> healingSuccesses(HealingStats stats) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (HealingActionKind kind : HealingActionKind.values()) {
            HealingStats.KindStats k = stats.byKind().get(kind);
            out.put(kind.name().toLowerCase(Locale.ROOT), k == null ? 0 : k.successful());
        }
        return out;
    }
}
