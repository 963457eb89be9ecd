package io.swarmmesh.consensus;

import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.model.Vote;
import io.swarmmesh.topology.TopologyBuilder;
import io.swarmmesh.topology.TopologyGraph;
import io.swarmmesh.topology.TopologyMember;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

final class ConsensusTallyTest {

    @Test
    void quorumCountsSilentAgentsAgainstApproval() {
        ConsensusDecision approved = QuorumProtocol.tally(
                Map.of("a", Vote.YES, "b", Vote.YES, "c", Vote.NO), 3, 0.5d);
        Assertions.assertEquals(ProposalOutcome.APPROVED, approved.outcome());
        Assertions.assertEquals(2, approved.yes());
        Assertions.assertEquals(1, approved.no());
        Assertions.assertEquals(0, approved.abstain());

        ConsensusDecision rejected = QuorumProtocol.tally(Map.of("a", Vote.YES, "b", Vote.YES), 5, 0.5d);
        Assertions.assertEquals(ProposalOutcome.REJECTED, rejected.outcome());
        Assertions.assertEquals(3, rejected.abstain());
    }

    @Test
    void quorumTieIsRejected() {
        ConsensusDecision d = QuorumProtocol.tally(
                Map.of("a", Vote.YES, "b", Vote.YES, "c", Vote.NO, "d", Vote.NO), 4, 0.5d);
        Assertions.assertEquals(ProposalOutcome.REJECTED, d.outcome());
    }

    @Test
    void weightedFollowsWeightNotHeadcount() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("a", 5.0d);
        weights.put("b", 1.0d);
        weights.put("c", 1.0d);
        ConsensusDecision heavyYes = WeightedProtocol.tally(
                Map.of("a", Vote.YES, "b", Vote.NO, "c", Vote.NO), weights);
        Assertions.assertEquals(ProposalOutcome.APPROVED, heavyYes.outcome());
        Assertions.assertEquals(5.0d, (Double) heavyYes.detail().get("yes_weight"), 1e-9);

        ConsensusDecision heavyNo = WeightedProtocol.tally(
                Map.of("a", Vote.NO, "b", Vote.YES, "c", Vote.YES), weights);
        Assertions.assertEquals(ProposalOutcome.REJECTED, heavyNo.outcome());
    }

    @Test
    void weightedSilentAgentKeepsItsWeightInTheTotal() {
        Map<String, Double> weights = Map.of("a", 2.0d, "b", 2.0d, "c", 1.0d);
        ConsensusDecision d = WeightedProtocol.tally(Map.of("a", Vote.YES), weights);
        Assertions.assertEquals(ProposalOutcome.REJECTED, d.outcome());
        Assertions.assertEquals(2, d.abstain());
    }

    @Test
    void raftNeedsMajorityOfResponders() {
        ConsensusDecision approved = RaftProtocol.tally(
                Map.of("leader", Vote.YES, "f1", Vote.YES, "f2", Vote.NO), "leader", 4);
        Assertions.assertEquals(ProposalOutcome.APPROVED, approved.outcome());
        Assertions.assertEquals("leader", approved.detail().get("leader_id"));
        Assertions.assertEquals(1, approved.abstain());

        ConsensusDecision split = RaftProtocol.tally(Map.of("leader", Vote.YES, "f1", Vote.NO), "leader", 2);
        Assertions.assertEquals(ProposalOutcome.REJECTED, split.outcome());
    }

    @Test
    void byzantineExcludesAgentThatMisreportsPeers() {
        Map<String, Vote> announced = new TreeMap<>();
        announced.put("a", Vote.YES);
        announced.put("b", Vote.YES);
        announced.put("c", Vote.YES);
        announced.put("d", Vote.YES);
        Map<String, Map<String, Vote>> reports = new TreeMap<>();
        reports.put("a", announced);
        reports.put("b", announced);
        reports.put("c", announced);
        Map<String, Vote> lie = new HashMap<>(announced);
        lie.put("a", Vote.NO);
        lie.put("b", Vote.NO);
        reports.put("d", lie);

        Assertions.assertEquals(Set.of("d"), ByzantineProtocol.detectFaulty(announced, reports));
        ConsensusDecision d = ByzantineProtocol.tally(announced, reports, 4);
        // f = 1, so 3 honest YES votes are enough
        Assertions.assertEquals(ProposalOutcome.APPROVED, d.outcome());
        Assertions.assertEquals(List.of("d"), d.detail().get("faulty_agents"));
        Assertions.assertEquals(3, d.yes());
    }

    @Test
    void byzantineFlagsAgentDisowningItsOwnVote() {
        Map<String, Vote> announced = Map.of("a", Vote.YES, "b", Vote.YES, "c", Vote.NO, "d", Vote.YES);
        Map<String, Map<String, Vote>> reports = new TreeMap<>();
        for (String r : List.of("a", "b", "c")) {
            reports.put(r, announced);
        }
        Map<String, Vote> disowned = new HashMap<>(announced);
        disowned.put("d", Vote.NO);
        reports.put("d", disowned);

        Assertions.assertEquals(Set.of("d"), ByzantineProtocol.detectFaulty(announced, reports));
        ConsensusDecision d = ByzantineProtocol.tally(announced, reports, 4);
        Assertions.assertEquals(ProposalOutcome.REJECTED, d.outcome());
        Assertions.assertEquals(2, d.yes());
    }

    @Test
    void byzantineWithHonestReportsFlagsNobody() {
        Map<String, Vote> announced = Map.of("a", Vote.YES, "b", Vote.NO, "c", Vote.YES, "d", Vote.YES, "e", Vote.YES);
        Map<String, Map<String, Vote>> reports = new TreeMap<>();
        for (String r : announced.keySet()) {
            reports.put(r, announced);
        }
        Assertions.assertTrue(ByzantineProtocol.detectFaulty(announced, reports).isEmpty());
        Assertions.assertEquals(ProposalOutcome.APPROVED, ByzantineProtocol.tally(announced, reports, 5).outcome());
    }

    @Test
    void crdtReplicasConvergeAlongRing() {
        TopologyBuilder builder = new TopologyBuilder(4, 5, 20);
        List<TopologyMember> members = List.of(TopologyMember.plain("a"), TopologyMember.plain("b"),
                TopologyMember.plain("c"), TopologyMember.plain("d"));
        TopologyBuilder.Layout layout = builder.build(TopologyKind.RING, members, null);
        TopologyGraph ring = new TopologyGraph("s", TopologyKind.RING, layout.effectiveKind(), layout.edges(),
                null, 1L, 0L);

        Map<String, GrowOnlyVoteSet> replicas = new TreeMap<>();
        replicas.put("a", GrowOnlyVoteSet.of("a", Vote.YES));
        replicas.put("b", GrowOnlyVoteSet.of("b", Vote.YES));
        replicas.put("c", GrowOnlyVoteSet.of("c", Vote.NO));
        replicas.put("d", GrowOnlyVoteSet.of("d", Vote.YES));
        int rounds = CrdtProtocol.propagate(replicas, ring);
        Assertions.assertTrue(rounds >= 3);
        for (GrowOnlyVoteSet replica : replicas.values()) {
            Assertions.assertEquals(4, replica.size());
        }
        ConsensusDecision d = CrdtProtocol.tally(replicas.get("a"), 4);
        Assertions.assertEquals(ProposalOutcome.APPROVED, d.outcome());
        Assertions.assertEquals(3, d.detail().get("quorum"));
    }

    @Test
    void growOnlySetMergeIsOrderIndependent() {
        GrowOnlyVoteSet left = GrowOnlyVoteSet.of("a", Vote.YES);
        left.add("b", Vote.NO);
        GrowOnlyVoteSet right = GrowOnlyVoteSet.of("b", Vote.YES);
        right.add("c", Vote.ABSTAIN);

        GrowOnlyVoteSet lr = left.copy();
        lr.merge(right);
        GrowOnlyVoteSet rl = right.copy();
        rl.merge(left);
        Assertions.assertEquals(lr.asMap(), rl.asMap());
        Assertions.assertEquals(Vote.YES, lr.asMap().get("b"));
        Assertions.assertFalse(lr.merge(rl));
    }

    @Test
    void gossipAgreementReportsLeadingValue() {
        Map<String, Vote> state = Map.of("a", Vote.YES, "b", Vote.YES, "c", Vote.NO, "d", Vote.ABSTAIN);
        GossipProtocol.Agreement agreement = GossipProtocol.agreement(state);
        Assertions.assertEquals(Vote.YES, agreement.value());
        Assertions.assertEquals(0.5d, agreement.ratio(), 1e-9);
        Assertions.assertNull(GossipProtocol.agreement(Map.of("a", Vote.ABSTAIN)).value());
    }
}
