package io.swarmmesh.consensus;

import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one tally. {@code abstain} includes participants that never answered.
 */
public record ConsensusDecision(
        ProposalOutcome outcome,
        int yes,
        int no,
        int abstain,
        Map<String, Object> detail
) {
    public ConsensusDecision {
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }

    public static ConsensusDecision timeout(int participants, String reason) {
        return new ConsensusDecision(ProposalOutcome.TIMEOUT, 0, 0, participants, Map.of("reason", reason));
    }

    static int count(Map<String, Vote> votes, Vote value) {
        int n = 0;
        for (Vote v : votes.values()) {
            if (v == value) {
                n++;
            }
        }
        return n;
    }

    ConsensusDecision withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(detail);
        merged.put(key, value);
        return new ConsensusDecision(outcome, yes, no, abstain, merged);
    }
}
