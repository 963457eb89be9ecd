package io.swarmmesh.agent;

import io.swarmmesh.model.ConsensusAlgorithm;

public record BallotRequest(
        String proposalId,
        String sessionId,
        String text,
        ConsensusAlgorithm algorithm,
        long deadlineMs
) {
}
