package io.swarmmesh.consensus;

import io.swarmmesh.agent.LocalAgentHandle;
import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.error.NoLeaderAvailableException;
import io.swarmmesh.error.ProposalAlreadyDecidedException;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.SessionRecord;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.model.Vote;
import io.swarmmesh.storage.Database;
import io.swarmmesh.storage.SwarmStore;
import io.swarmmesh.topology.TopologyBuilder;
import io.swarmmesh.topology.TopologyGraph;
import io.swarmmesh.topology.TopologyMember;
import io.swarmmesh.util.NamedThreadFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class ConsensusEngineTest {
    private static final String SESSION = "ses-consensus";

    private Path root;
    private SwarmStore store;
    private ExecutorService votePool;
    private ConsensusEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("swarmmesh-test-consensus-");
        Database db = new Database(SwarmMeshConfig.fromRoot(root.toString()));
        db.init();
        store = new SwarmStore(db);
        store.saveSession(new SessionRecord(SESSION, TopologyKind.MESH, ConsensusAlgorithm.QUORUM,
                SessionStatus.ACTIVE, List.of(), null, 0L, System.currentTimeMillis(), null, null), List.of());
        votePool = Executors.newCachedThreadPool(new NamedThreadFactory("test-vote"));
        engine = new ConsensusEngine(EngineSettings.defaults(), store, votePool, Clock.systemUTC(), new Random(7L));
    }

    @AfterEach
    void tearDown() throws IOException {
        votePool.shutdownNow();
        deleteRecursively(root);
    }

    @Test
    void quorumApprovesTwoOfThree() {
        List<Voter> voters = voters(Vote.YES, Vote.YES, Vote.NO);
        ConsensusProposal p = engine.decide(request("prp-quorum", ConsensusAlgorithm.QUORUM, voters,
                graph(TopologyKind.MESH, voters), 5_000L));

        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        ProposalRecord persisted = store.loadProposal("prp-quorum").orElseThrow();
        Assertions.assertEquals(ProposalOutcome.APPROVED, persisted.outcome());
        Assertions.assertEquals(3, persisted.votes().size());
        Assertions.assertEquals(2, persisted.detail().get("yes"));
        Assertions.assertNotNull(persisted.decidedAtMs());
    }

    @Test
    void secondDecideOfSameIdKeepsFirstOutcome() {
        List<Voter> voters = voters(Vote.NO, Vote.NO, Vote.YES);
        TopologyGraph graph = graph(TopologyKind.MESH, voters);
        ConsensusProposal first = engine.decide(request("prp-once", ConsensusAlgorithm.QUORUM, voters, graph, 5_000L));
        Assertions.assertEquals(ProposalOutcome.REJECTED, first.outcome());

        List<Voter> flipped = voters(Vote.YES, Vote.YES, Vote.YES);
        ProposalAlreadyDecidedException e = Assertions.assertThrows(ProposalAlreadyDecidedException.class,
                () -> engine.decide(request("prp-once", ConsensusAlgorithm.QUORUM, flipped, graph, 5_000L)));
        Assertions.assertEquals(ProposalOutcome.REJECTED, e.originalOutcome());
        Assertions.assertEquals(ProposalOutcome.REJECTED, store.loadProposal("prp-once").orElseThrow().outcome());
    }

    @Test
    void decidedIdIsRecognisedAfterForgetting() {
        List<Voter> voters = voters(Vote.YES);
        TopologyGraph graph = graph(TopologyKind.MESH, voters);
        engine.decide(request("prp-forget", ConsensusAlgorithm.QUORUM, voters, graph, 5_000L));
        engine.forgetSession(SESSION);

        ProposalAlreadyDecidedException e = Assertions.assertThrows(ProposalAlreadyDecidedException.class,
                () -> engine.decide(request("prp-forget", ConsensusAlgorithm.QUORUM, voters, graph, 5_000L)));
        Assertions.assertEquals(ProposalOutcome.APPROVED, e.originalOutcome());
    }

    @Test
    void noAnswerBeforeDeadlineTimesOut() {
        List<Voter> voters = new ArrayList<>();
        for (String id : List.of("slow-1", "slow-2")) {
            voters.add(new Voter(id, 1.0d, new LocalAgentHandle(id).voteDelayMs(3_000L)));
        }
        long started = System.currentTimeMillis();
        ConsensusProposal p = engine.decide(request("prp-slow", ConsensusAlgorithm.QUORUM, voters,
                graph(TopologyKind.MESH, voters), 200L));
        long took = System.currentTimeMillis() - started;

        Assertions.assertEquals(ProposalOutcome.TIMEOUT, p.outcome());
        Assertions.assertTrue(took < 2_500L, "decide waited for slow agents: " + took + "ms");
        Assertions.assertTrue(p.votes().isEmpty());
    }

    @Test
    void lateVotersCountAsAbstainForQuorum() {
        List<Voter> voters = new ArrayList<>(voters(Vote.YES, Vote.YES));
        voters.add(new Voter("late", 1.0d, new LocalAgentHandle("late").votes(Vote.NO).voteDelayMs(3_000L)));
        ConsensusProposal p = engine.decide(request("prp-late", ConsensusAlgorithm.QUORUM, voters,
                graph(TopologyKind.MESH, voters), 300L));

        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        Assertions.assertFalse(p.votes().containsKey("late"));
        Assertions.assertFalse(p.recordVote("late", Vote.NO));
    }

    @Test
    void raftWithoutLeaderFailsBeforeRegistering() {
        List<Voter> voters = voters(Vote.YES, Vote.YES);
        Assertions.assertThrows(NoLeaderAvailableException.class, () -> engine.decide(request("prp-raft-mesh",
                ConsensusAlgorithm.RAFT, voters, graph(TopologyKind.MESH, voters), 1_000L)));
        Assertions.assertTrue(engine.find("prp-raft-mesh").isEmpty());
    }

    @Test
    void raftOnStarUsesCoordinatorAsLeader() {
        List<Voter> voters = voters(Vote.YES, Vote.YES, Vote.NO);
        TopologyGraph star = graph(TopologyKind.STAR, voters);
        ConsensusProposal p = engine.decide(request("prp-raft-star", ConsensusAlgorithm.RAFT, voters, star, 5_000L));
        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        Assertions.assertEquals("agent-1", p.toRecord().detail().get("leader_id"));
    }

    @Test
    void weightedUsesVoterWeights() {
        List<Voter> voters = List.of(
                new Voter("big", 10.0d, new LocalAgentHandle("big").votes(Vote.NO)),
                new Voter("s1", 1.0d, new LocalAgentHandle("s1").votes(Vote.YES)),
                new Voter("s2", 1.0d, new LocalAgentHandle("s2").votes(Vote.YES)));
        ConsensusProposal p = engine.decide(request("prp-weighted", ConsensusAlgorithm.WEIGHTED, voters,
                graph(TopologyKind.MESH, voters), 5_000L));
        Assertions.assertEquals(ProposalOutcome.REJECTED, p.outcome());
    }

    @Test
    void outcomeDoesNotDependOnVoteArrivalOrder() {
        Vote[] ballots = {Vote.YES, Vote.NO, Vote.YES, Vote.ABSTAIN, Vote.YES};
        double[] weights = {1.0d, 4.0d, 1.5d, 2.0d, 1.0d};
        long[][] delayOrders = {{0L, 40L, 80L, 120L, 160L}, {160L, 120L, 80L, 40L, 0L}, {80L, 0L, 160L, 40L, 120L}};
        for (ConsensusAlgorithm algorithm : List.of(ConsensusAlgorithm.QUORUM, ConsensusAlgorithm.WEIGHTED,
                ConsensusAlgorithm.BYZANTINE)) {
            List<ConsensusProposal> runs = new ArrayList<>();
            for (int order = 0; order < delayOrders.length; order++) {
                List<Voter> voters = new ArrayList<>();
                for (int i = 0; i < ballots.length; i++) {
                    String id = "agent-" + (i + 1);
                    voters.add(new Voter(id, weights[i],
                            new LocalAgentHandle(id).votes(ballots[i]).voteDelayMs(delayOrders[order][i])));
                }
                String id = "prp-order-" + algorithm.wireName() + "-" + order;
                runs.add(engine.decide(request(id, algorithm, voters, graph(TopologyKind.MESH, voters), 5_000L)));
            }
            Map<String, Object> first = runs.get(0).toRecord().detail();
            for (ConsensusProposal run : runs) {
                Map<String, Object> detail = run.toRecord().detail();
                Assertions.assertEquals(runs.get(0).outcome(), run.outcome(), algorithm.wireName());
                Assertions.assertEquals(runs.get(0).votes(), run.votes(), algorithm.wireName());
                for (String key : List.of("yes", "no", "abstain")) {
                    Assertions.assertEquals(first.get(key), detail.get(key), algorithm.wireName() + " " + key);
                }
            }
        }
    }

    @Test
    void byzantineDropsLyingReporter() {
        List<Voter> voters = new ArrayList<>(voters(Vote.YES, Vote.YES, Vote.YES));
        LocalAgentHandle liar = new LocalAgentHandle("agent-4").votes(Vote.YES).reportsPeerVotes(observed -> {
            observed.replaceAll((k, v) -> k.equals("agent-4") ? v : Vote.NO);
            return observed;
        });
        voters.add(new Voter("agent-4", 1.0d, liar));
        ConsensusProposal p = engine.decide(request("prp-byz", ConsensusAlgorithm.BYZANTINE, voters,
                graph(TopologyKind.MESH, voters), 5_000L));

        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        Assertions.assertEquals(List.of("agent-4"), p.toRecord().detail().get("faulty_agents"));
    }

    @Test
    void byzantineWithThreeAgentsFallsBackToQuorum() {
        List<Voter> voters = voters(Vote.YES, Vote.YES, Vote.NO);
        ConsensusProposal p = engine.decide(request("prp-byz-small", ConsensusAlgorithm.BYZANTINE, voters,
                graph(TopologyKind.MESH, voters), 5_000L));
        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        Assertions.assertEquals("quorum", p.toRecord().detail().get("fallback"));
    }

    @Test
    void gossipConvergesOnSupermajority() {
        List<Voter> voters = voters(Vote.YES, Vote.YES, Vote.YES, Vote.YES, Vote.NO);
        ConsensusProposal p = engine.decide(request("prp-gossip", ConsensusAlgorithm.GOSSIP, voters,
                graph(TopologyKind.MESH, voters), 5_000L));

        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        Map<String, Object> detail = p.toRecord().detail();
        Assertions.assertEquals(Boolean.TRUE, detail.get("converged"));
        Assertions.assertEquals("YES", detail.get("leading_value"));
        Assertions.assertTrue(((Integer) detail.get("rounds")) >= 1);
    }

    @Test
    void gossipUnanimousConvergesWithoutRounds() {
        List<Voter> voters = voters(Vote.NO, Vote.NO, Vote.NO);
        ConsensusProposal p = engine.decide(request("prp-gossip-no", ConsensusAlgorithm.GOSSIP, voters,
                graph(TopologyKind.RING, voters), 5_000L));
        Assertions.assertEquals(ProposalOutcome.REJECTED, p.outcome());
        Assertions.assertEquals(0, p.toRecord().detail().get("rounds"));
    }

    @Test
    void crdtMergesAlongTopology() {
        List<Voter> voters = voters(Vote.YES, Vote.NO, Vote.YES, Vote.YES);
        ConsensusProposal p = engine.decide(request("prp-crdt", ConsensusAlgorithm.CRDT, voters,
                graph(TopologyKind.RING, voters), 5_000L));
        Assertions.assertEquals(ProposalOutcome.APPROVED, p.outcome());
        Assertions.assertEquals(4, p.toRecord().detail().get("merged_entries"));
    }

    @Test
    void cancelSessionTimesOutPendingProposal() throws Exception {
        List<Voter> voters = new ArrayList<>();
        for (String id : List.of("slow-a", "slow-b")) {
            voters.add(new Voter(id, 1.0d, new LocalAgentHandle(id).voteDelayMs(5_000L)));
        }
        CompletableFuture<ConsensusProposal> running = CompletableFuture.supplyAsync(() -> engine.decide(
                request("prp-cancel", ConsensusAlgorithm.QUORUM, voters, graph(TopologyKind.MESH, voters), 30_000L)));
        long deadline = System.currentTimeMillis() + 5_000L;
        while (engine.openProposals(SESSION).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10L);
        }
        Assertions.assertEquals(1, engine.openProposals(SESSION).size());

        Assertions.assertEquals(1, engine.cancelSession(SESSION));
        ConsensusProposal p = running.get(5, TimeUnit.SECONDS);
        Assertions.assertEquals(ProposalOutcome.TIMEOUT, p.outcome());
        Assertions.assertEquals(ProposalOutcome.TIMEOUT, store.loadProposal("prp-cancel").orElseThrow().outcome());
        Assertions.assertTrue(engine.openProposals(SESSION).isEmpty());
    }

    private static List<Voter> voters(Vote... votes) {
        List<Voter> out = new ArrayList<>();
        for (int i = 0; i < votes.length; i++) {
            String id = "agent-" + (i + 1);
            out.add(new Voter(id, 1.0d, new LocalAgentHandle(id).votes(votes[i])));
        }
        return out;
    }

    private static TopologyGraph graph(TopologyKind kind, List<Voter> voters) {
        List<TopologyMember> members = voters.stream().map(v -> TopologyMember.plain(v.agentId())).toList();
        TopologyBuilder.Layout layout = new TopologyBuilder(4, 5, 20).build(kind, members, null);
        return new TopologyGraph(SESSION, kind, layout.effectiveKind(), layout.edges(), layout.leaderId(), 1L,
                System.currentTimeMillis());
    }

    private static ConsensusEngine.ConsensusRequest request(String id, ConsensusAlgorithm algorithm, List<Voter> voters,
                                                            TopologyGraph graph, long timeoutMs) {
        return new ConsensusEngine.ConsensusRequest(id, SESSION, "deploy", algorithm, voters, graph, timeoutMs);
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
