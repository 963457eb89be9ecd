package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Approved when the weight behind YES exceeds half the weight of all participants.
 */
public final class WeightedProtocol implements ConsensusProtocol {
    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.WEIGHTED;
    }

    @Override
    public ConsensusDecision decide(VotingContext context) throws InterruptedException {
        Map<String, Vote> votes = context.collector().collectVotes(context.proposal(), context.voters());
        if (votes.isEmpty()) {
            return ConsensusDecision.timeout(context.voters().size(), "no votes before deadline");
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Voter v : context.voters()) {
            weights.put(v.agentId(), v.weight());
        }
        return tally(votes, weights);
    }

    public static ConsensusDecision tally(Map<String, Vote> votes, Map<String, Double> weights) {
        double total = 0.0d;
        for (double w : weights.values()) {
            total += w;
        }
        double yesWeight = 0.0d;
        double noWeight = 0.0d;
        for (Map.Entry<String, Vote> e : votes.entrySet()) {
            double w = weights.getOrDefault(e.getKey(), 0.0d);
            if (e.getValue() == Vote.YES) {
                yesWeight += w;
            } else if (e.getValue() == Vote.NO) {
                noWeight += w;
            }
        }
        int yes = ConsensusDecision.count(votes, Vote.YES);
        int no = ConsensusDecision.count(votes, Vote.NO);
        ProposalOutcome outcome = yesWeight > total / 2.0d ? ProposalOutcome.APPROVED : ProposalOutcome.REJECTED;
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("yes_weight", yesWeight);
        detail.put("no_weight", noWeight);
        detail.put("total_weight", total);
        return new ConsensusDecision(outcome, yes, no, weights.size() - yes - no, detail);
    }
}
