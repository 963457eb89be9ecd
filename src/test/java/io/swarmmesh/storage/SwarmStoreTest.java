package io.swarmmesh.storage;

import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.HealingAction;
import io.swarmmesh.model.HealingActionKind;
import io.swarmmesh.model.HealingStats;
import io.swarmmesh.model.HealthSnapshot;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.SessionRecord;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TaskMetric;
import io.swarmmesh.model.TaskResult;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.model.Vote;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class SwarmStoreTest {

    @Test
    void sessionRowAndAgentsRoundTrip() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-session-");
        try {
            SwarmStore store = store(root);
            AgentView a = new AgentView("a", Set.of("gpu", "edge"), AgentState.HEALTHY, 100L, 2.5d, true);
            AgentView b = new AgentView("b", Set.of(), AgentState.HEALTHY, 100L, 1.0d, false);
            store.saveSession(session("ses-1", 1_000L), List.of(a, b));

            SessionRecord row = store.loadSession("ses-1").orElseThrow();
            Assertions.assertEquals(TopologyKind.STAR, row.topology());
            Assertions.assertEquals(ConsensusAlgorithm.WEIGHTED, row.consensusAlgorithm());
            Assertions.assertEquals(List.of("a", "b"), row.agentIds());
            Assertions.assertNull(row.closedAtMs());

            store.saveAgentStates("ses-1", List.of(
                    new AgentView("b", Set.of(), AgentState.DEGRADED, 200L, 1.0d, false)));
            List<AgentView> agents = store.loadAgents("ses-1");
            Assertions.assertEquals(2, agents.size());
            Assertions.assertEquals(Set.of("edge", "gpu"), agents.get(0).capabilityTags());
            Assertions.assertEquals(2.5d, agents.get(0).weight(), 1e-9);
            Assertions.assertEquals(AgentState.DEGRADED, agents.get(1).state());
            Assertions.assertFalse(agents.get(1).leaderEligible());
            Assertions.assertTrue(store.loadSession("missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listSessionsIsMostRecentFirst() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-list-");
        try {
            SwarmStore store = store(root);
            store.saveSession(session("ses-old", 1_000L), List.of());
            store.saveSession(session("ses-new", 3_000L), List.of());
            store.saveSession(session("ses-mid", 2_000L), List.of());

            List<String> ids = store.listSessions(10).stream().map(SessionRecord::sessionId).toList();
            Assertions.assertEquals(List.of("ses-new", "ses-mid", "ses-old"), ids);
            Assertions.assertEquals(1, store.listSessions(1).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void markSessionClosedOnlyOnce() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-close-");
        try {
            SwarmStore store = store(root);
            store.saveSession(session("ses-c", 1_000L), List.of());

            Assertions.assertTrue(store.markSessionClosed("ses-c", 5_000L, "state store lost"));
            Assertions.assertFalse(store.markSessionClosed("ses-c", 6_000L, null));
            Assertions.assertFalse(store.markSessionClosed("ses-unknown", 6_000L, null));

            SessionRecord row = store.loadSession("ses-c").orElseThrow();
            Assertions.assertEquals(SessionStatus.CLOSED, row.status());
            Assertions.assertEquals(5_000L, row.closedAtMs());
            Assertions.assertEquals("state store lost", row.failureReason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void metricTimestampsAreStrictlyIncreasingPerAgent() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-metrics-");
        try {
            SwarmStore store = store(root);
            store.saveSession(session("ses-m", 1_000L), List.of());

            List<TaskMetric> batch = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                batch.add(new TaskMetric("t" + i, "ses-m", "a", 10L + i,
                        i == 3 ? TaskResult.FAILURE : TaskResult.SUCCESS, 50_000L));
            }
            batch.add(new TaskMetric("other", "ses-m", "b", 7L, TaskResult.SUCCESS, 50_000L));
            List<TaskMetric> stored = store.appendMetrics(batch);

            for (int i = 1; i < 5; i++) {
                Assertions.assertTrue(stored.get(i).timestampMs() > stored.get(i - 1).timestampMs());
            }
            Assertions.assertEquals(50_000L, stored.get(5).timestampMs());

            TaskMetric older = store.appendMetric(new TaskMetric("late", "ses-m", "a", 1L, TaskResult.SUCCESS, 10L));
            Assertions.assertTrue(older.timestampMs() > stored.get(4).timestampMs());

            Assertions.assertEquals(7, store.countMetrics("ses-m"));
            Assertions.assertEquals(1, store.countFailedMetrics("ses-m"));

            List<TaskMetric> recent = store.queryRecentMetrics("ses-m", 3);
            Assertions.assertEquals(3, recent.size());
            Assertions.assertEquals("late", recent.get(2).taskId());
            Assertions.assertTrue(recent.get(0).timestampMs() <= recent.get(1).timestampMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void purgeDropsOnlyExpiredRows() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-purge-");
        try {
            SwarmStore store = store(root);
            store.saveSession(session("ses-p", 1_000L), List.of());
            store.appendMetric(new TaskMetric("old", "ses-p", "a", 5L, TaskResult.SUCCESS, 1_000L));
            store.appendMetric(new TaskMetric("new", "ses-p", "a", 5L, TaskResult.SUCCESS, 90_000L));
            store.appendHealth(new HealthSnapshot("ses-p", "a", 1_000L, true, 3L));
            store.appendHealth(new HealthSnapshot("ses-p", "a", 2_000L, false, 0L));
            store.appendHealth(new HealthSnapshot("ses-p", "a", 95_000L, true, 4L));

            SwarmStore.PurgeResult result = store.purgeOlderThan(50_000L);
            Assertions.assertEquals(1, result.metricsDeleted());
            Assertions.assertEquals(2, result.healthDeleted());
            Assertions.assertEquals(3, result.total());
            Assertions.assertEquals(1, store.countMetrics("ses-p"));

            List<HealthSnapshot> health = store.queryRecentHealth("ses-p", "a", 10);
            Assertions.assertEquals(1, health.size());
            Assertions.assertTrue(health.get(0).reachable());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void healingStatsGroupByKind() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-healing-");
        try {
            SwarmStore store = store(root);
            store.saveSession(session("ses-h", 1_000L), List.of());
            store.appendHealingAction(action("h1", "a", HealingActionKind.RESTART_AGENT, 10L, true));
            store.appendHealingAction(action("h2", "a", HealingActionKind.RESTART_AGENT, 20L, false));
            store.appendHealingAction(action("h3", "b", HealingActionKind.REASSIGN_TASK, 30L, true));
            store.appendHealingAction(action("h4", null, HealingActionKind.SWITCH_TOPOLOGY, 40L, true));

            HealingStats stats = store.healingStats("ses-h");
            Assertions.assertEquals(4, stats.totalActions());
            Assertions.assertEquals(3, stats.successfulActions());
            Assertions.assertEquals(0.75d, stats.successRate(), 1e-9);
            Assertions.assertEquals(0.5d, stats.byKind().get(HealingActionKind.RESTART_AGENT).successRate(), 1e-9);
            Assertions.assertEquals(1, stats.byKind().get(HealingActionKind.SWITCH_TOPOLOGY).total());

            List<HealingAction> actions = store.listHealingActions("ses-h", 10);
            Assertions.assertEquals(List.of("h1", "h2", "h3", "h4"),
                    actions.stream().map(HealingAction::actionId).toList());
            Assertions.assertNull(actions.get(3).agentId());

            HealingStats empty = store.healingStats("ses-none");
            Assertions.assertEquals(0, empty.totalActions());
            Assertions.assertEquals(0.0d, empty.successRate(), 1e-9);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proposalKeepsVotesAndDetail() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-proposal-");
        try {
            SwarmStore store = store(root);
            store.saveSession(session("ses-v", 1_000L), List.of());
            ProposalRecord pending = new ProposalRecord("prp-1", "ses-v", "scale out", ConsensusAlgorithm.QUORUM,
                    1_000L, 6_000L, List.of("a", "b", "c"), Map.of(), ProposalOutcome.PENDING, null, Map.of());
            store.saveProposal(pending);
            Assertions.assertEquals(ProposalOutcome.PENDING, store.loadProposal("prp-1").orElseThrow().outcome());

            ProposalRecord decided = new ProposalRecord("prp-1", "ses-v", "scale out", ConsensusAlgorithm.QUORUM,
                    1_000L, 6_000L, List.of("a", "b", "c"), Map.of("a", Vote.YES, "b", Vote.NO),
                    ProposalOutcome.REJECTED, 2_000L, Map.of("yes", 1, "no", 1));
            store.saveProposal(decided);

            ProposalRecord loaded = store.loadProposal("prp-1").orElseThrow();
            Assertions.assertEquals(ProposalOutcome.REJECTED, loaded.outcome());
            Assertions.assertEquals(2_000L, loaded.decidedAtMs());
            Assertions.assertEquals(List.of("a", "b", "c"), loaded.participants());
            Assertions.assertEquals(Map.of("a", Vote.YES, "b", Vote.NO), loaded.votes());
            Assertions.assertEquals(1, loaded.detail().get("yes"));

            Map<ProposalOutcome, Integer> counts = store.countProposalsByOutcome("ses-v");
            Assertions.assertEquals(1, counts.get(ProposalOutcome.REJECTED));
            Assertions.assertEquals(0, counts.get(ProposalOutcome.PENDING));
            Assertions.assertTrue(store.loadProposal("prp-none").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stateFileIsReplacedWholesale() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-store-statefile-");
        try {
            SwarmMeshConfig config = SwarmMeshConfig.fromRoot(root.toString());
            SessionStateWriter writer = new SessionStateWriter(config);
            AgentView a = new AgentView("a", Set.of(), AgentState.HEALTHY, 0L, 1.0d, true);
            writer.write("ses-f", TopologyKind.MESH, ConsensusAlgorithm.QUORUM, SessionStatus.ACTIVE, List.of(a));
            Path file = writer.write("ses-f", TopologyKind.RING, ConsensusAlgorithm.QUORUM, SessionStatus.CLOSED,
                    List.of(new AgentView("a", Set.of(), AgentState.REMOVED, 0L, 1.0d, true)));

            Assertions.assertEquals(config.sessionStateFile("ses-f"), file);
            Map<String, Object> doc = writer.read("ses-f");
            Assertions.assertEquals("ses-f", doc.get("session_id"));
            Assertions.assertEquals("ring", doc.get("topology"));
            Assertions.assertEquals("CLOSED", doc.get("status"));
            Assertions.assertEquals(List.of(Map.of("id", "a", "state", "REMOVED")), doc.get("agents"));
            Assertions.assertFalse(Files.exists(file.resolveSibling(file.getFileName() + ".tmp")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static SwarmStore store(Path root) {
        Database db = new Database(SwarmMeshConfig.fromRoot(root.toString()));
        db.init();
        return new SwarmStore(db);
    }

    private static SessionRecord session(String id, long createdAtMs) {
        return new SessionRecord(id, TopologyKind.STAR, ConsensusAlgorithm.WEIGHTED, SessionStatus.ACTIVE,
                List.of("a", "b"), null, 0L, createdAtMs, null, null);
    }

    private static HealingAction action(String id, String agentId, HealingActionKind kind, long at, boolean ok) {
        return new HealingAction(id, "ses-h", agentId, "test", kind, at, ok, ok ? "done" : "failed");
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
