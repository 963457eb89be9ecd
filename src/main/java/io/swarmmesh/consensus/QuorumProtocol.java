package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple majority: approved when YES votes exceed {@code quorumThreshold} of all participants.
 * Participants that did not answer count against approval.
 */
public final class QuorumProtocol implements ConsensusProtocol {
    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.QUORUM;
    }

    @Override
    public ConsensusDecision decide(VotingContext context) throws InterruptedException {
        Map<String, Vote> votes = context.collector().collectVotes(context.proposal(), context.voters());
        if (votes.isEmpty()) {
            return ConsensusDecision.timeout(context.voters().size(), "no votes before deadline");
        }
        return tally(votes, context.voters().size(), context.settings().quorumThreshold());
    }

    public static ConsensusDecision tally(Map<String, Vote> votes, int participants, double threshold) {
        int yes = ConsensusDecision.count(votes, Vote.YES);
        int no = ConsensusDecision.count(votes, Vote.NO);
        int abstain = participants - yes - no;
        double required = threshold * participants;
        ProposalOutcome outcome = yes > required ? ProposalOutcome.APPROVED : ProposalOutcome.REJECTED;
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("participants", participants);
        detail.put("responders", votes.size());
        detail.put("required_yes_above", required);
        return new ConsensusDecision(outcome, yes, no, abstain, detail);
    }
}
