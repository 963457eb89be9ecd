package io.swarmmesh.model;

import java.util.Locale;

public enum ConsensusAlgorithm {
    QUORUM("quorum"),
    WEIGHTED("weighted"),
    BYZANTINE("byzantine"),
    RAFT("raft"),
    GOSSIP("gossip"),
    CRDT("crdt");

    private final String wireName;

    ConsensusAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ConsensusAlgorithm fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Consensus algorithm cannot be empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ConsensusAlgorithm value : values()) {
            if (value.wireName.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown consensus algorithm: " + raw);
    }
}
