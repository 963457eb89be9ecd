package io.swarmmesh.model;

import java.util.Locale;

public enum TopologyKind {
    MESH("mesh"),
    STAR("star"),
    RING("ring"),
    HIERARCHICAL("hierarchical"),
    ADAPTIVE("adaptive");

    private final String wireName;

    TopologyKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether the structural rule for this kind designates a leader vertex.
     */
    public boolean hasLeader() {
        return this == STAR || this == HIERARCHICAL;
    }

    public static TopologyKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Topology kind cannot be empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TopologyKind value : values()) {
            if (value.wireName.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown topology kind: " + raw);
    }
}
