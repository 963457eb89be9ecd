package io.swarmmesh.model;

import java.util.List;

/**
 * Persisted row of the {@code sessions} table.
 */
public record SessionRecord(
        String sessionId,
        TopologyKind topology,
        ConsensusAlgorithm consensusAlgorithm,
        SessionStatus status,
        List<String> agentIds,
        String leaderId,
        long graphVersion,
        long createdAtMs,
        Long closedAtMs,
        String failureReason
) {
}
