package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;
import io.swarmmesh.topology.TopologyGraph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Every responder starts with a replica holding only its own vote. Replicas are merged along topology edges
 * until nothing changes, then the union is tallied: approved when YES reaches a strict majority of the
 * responders.
 */
public final class CrdtProtocol implements ConsensusProtocol {
    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.CRDT;
    }

    @Override
    public ConsensusDecision decide(VotingContext context) throws InterruptedException {
        Map<String, Vote> votes = context.collector().collectVotes(context.proposal(), context.voters());
        if (votes.isEmpty()) {
            return ConsensusDecision.timeout(context.voters().size(), "no votes before deadline");
        }
        Map<String, GrowOnlyVoteSet> replicas = new TreeMap<>();
        for (Map.Entry<String, Vote> e : votes.entrySet()) {
            replicas.put(e.getKey(), GrowOnlyVoteSet.of(e.getKey(), e.getValue()));
        }
        int rounds = propagate(replicas, context.graph());
        GrowOnlyVoteSet merged = new GrowOnlyVoteSet();
        for (GrowOnlyVoteSet replica : replicas.values()) {
            merged.merge(replica);
        }
        return tally(merged, context.voters().size()).withDetail("merge_rounds", rounds);
    }

    /**
     * Pushes each replica to its neighbours until a full pass changes nothing. Returns the passes made.
     */
    static int propagate(Map<String, GrowOnlyVoteSet> replicas, TopologyGraph graph) {
        int rounds = 0;
        boolean changed = true;
        while (changed && rounds <= replicas.size()) {
            changed = false;
            rounds++;
            Map<String, GrowOnlyVoteSet> snapshot = new TreeMap<>();
            for (Map.Entry<String, GrowOnlyVoteSet> e : replicas.entrySet()) {
                snapshot.put(e.getKey(), e.getValue().copy());
            }
            for (Map.Entry<String, GrowOnlyVoteSet> e : snapshot.entrySet()) {
                for (String neighbour : graph.neighbours(e.getKey())) {
                    GrowOnlyVoteSet target = replicas.get(neighbour);
                    if (target != null) {
                        changed |= target.merge(e.getValue());
                    }
                }
            }
        }
        return rounds;
    }

    public static ConsensusDecision tally(GrowOnlyVoteSet merged, int participants) {
        int responders = merged.size();
        int yes = merged.count(Vote.YES);
        int no = merged.count(Vote.NO);
        int quorum = responders / 2 + 1;
        ProposalOutcome outcome = yes >= quorum ? ProposalOutcome.APPROVED : ProposalOutcome.REJECTED;
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("merged_entries", responders);
        detail.put("quorum", quorum);
        return new ConsensusDecision(outcome, yes, no, participants - yes - no, detail);
    }
}
