package io.swarmmesh.consensus;

import io.swarmmesh.error.NoLeaderAvailableException;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leader-driven ballot: the topology leader collects acknowledgements from its followers and approves on a
 * majority of the answers, its own vote included. Without an answer from the leader nothing is decided.
 */
public final class RaftProtocol implements ConsensusProtocol {
    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.RAFT;
    }

    @Override
    public ConsensusDecision decide(VotingContext context) throws InterruptedException {
        String leaderId = context.graph().leaderId();
        if (leaderId == null) {
            throw new NoLeaderAvailableException(context.proposal().sessionId(), context.graph().effectiveKind());
        }
        Map<String, Vote> votes = context.collector().collectVotes(context.proposal(), context.voters());
        if (!votes.containsKey(leaderId)) {
            return ConsensusDecision.timeout(context.voters().size(), "leader " + leaderId + " did not respond")
                    .withDetail("leader_id", leaderId);
        }
        return tally(votes, leaderId, context.voters().size());
    }

    public static ConsensusDecision tally(Map<String, Vote> votes, String leaderId, int participants) {
        int yes = ConsensusDecision.count(votes, Vote.YES);
        int no = ConsensusDecision.count(votes, Vote.NO);
        int responders = votes.size();
        ProposalOutcome outcome = yes * 2 > responders ? ProposalOutcome.APPROVED : ProposalOutcome.REJECTED;
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("leader_id", leaderId);
        detail.put("acks", yes);
        detail.put("responders", responders);
        return new ConsensusDecision(outcome, yes, no, participants - yes - no, detail);
    }
}
