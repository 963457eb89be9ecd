package io.swarmmesh.model;

import java.util.List;
import java.util.Map;

/**
 * Persisted view of a consensus proposal: its participants, the votes that counted and the outcome.
 */
public record ProposalRecord(
        String proposalId,
        String sessionId,
        String text,
        ConsensusAlgorithm algorithm,
        long createdAtMs,
        long deadlineMs,
        List<String> participants,
        Map<String, Vote> votes,
        ProposalOutcome outcome,
        Long decidedAtMs,
        Map<String, Object> detail
) {
    public ProposalRecord {
        participants = participants == null ? List.of() : List.copyOf(participants);
        votes = votes == null ? Map.of() : Map.copyOf(votes);
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }
}
