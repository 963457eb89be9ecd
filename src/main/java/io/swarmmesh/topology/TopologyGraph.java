package io.swarmmesh.topology;

import io.swarmmesh.model.TopologyKind;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable connectivity snapshot of one session.
 *
 * <p>{@code kind} is what the session asked for; {@code effectiveKind} is the structural rule actually
 * applied, which only differs for {@link TopologyKind#ADAPTIVE}. Every agent of the session is a key of
 * {@code edges}, even when it has no outgoing edge.
 */
public record TopologyGraph(
        String sessionId,
        TopologyKind kind,
        TopologyKind effectiveKind,
        SortedMap<String, SortedSet<String>> edges,
        String leaderId,
        long version,
        long createdAtMs
) {
    public TopologyGraph {
        SortedMap<String, SortedSet<String>> copy = new TreeMap<>();
        for (Map.Entry<String, SortedSet<String>> e : edges.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
        }
        edges = Collections.unmodifiableSortedMap(copy);
    }

    public Set<String> vertices() {
        return edges.keySet();
    }

    public Set<String> neighbours(String agentId) {
        SortedSet<String> out = edges.get(agentId);
        return out == null ? Set.of() : out;
    }

    public boolean connected(String from, String to) {
        return neighbours(from).contains(to);
    }

    public int edgeCount() {
        int total = 0;
        for (SortedSet<String> targets : edges.values()) {
            total += targets.size();
        }
        return total;
    }

    public boolean hasLeader() {
        return leaderId != null;
    }
}
