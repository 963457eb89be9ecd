package io.swarmmesh.topology;

import io.swarmmesh.error.TopologyTransitionException;
import io.swarmmesh.model.TopologyKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Applies the structural rule of each topology kind to a set of agents.
 */
public final class TopologyBuilder {
    private final int branchingFactor;
    private final int adaptiveMeshMaxAgents;
    private final int adaptiveStarMaxAgents;

    public TopologyBuilder(int branchingFactor, int adaptiveMeshMaxAgents, int adaptiveStarMaxAgents) {
        this.branchingFactor = Math.max(1, branchingFactor);
        this.adaptiveMeshMaxAgents = Math.max(1, adaptiveMeshMaxAgents);
        this.adaptiveStarMaxAgents = Math.max(this.adaptiveMeshMaxAgents, adaptiveStarMaxAgents);
    }

    public Layout build(TopologyKind kind, Collection<TopologyMember> members, TopologyKind adaptiveOverride) {
        List<TopologyMember> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparing(TopologyMember::agentId));
        TopologyKind effective = kind == TopologyKind.ADAPTIVE
                ? resolveAdaptive(ordered.size(), adaptiveOverride)
                : kind;
        return switch (effective) {
            case MESH -> new Layout(effective, mesh(ordered), null);
            case RING -> new Layout(effective, ring(ordered), null);
            case STAR -> {
                String coordinator = chooseLeader(ordered, effective);
                yield new Layout(effective, star(ordered, coordinator), coordinator);
            }
            case HIERARCHICAL -> {
                String root = chooseLeader(ordered, effective);
                yield new Layout(effective, tree(ordered, root), root);
            }
            case ADAPTIVE -> throw new IllegalStateException("adaptive must resolve to a concrete kind");
        };
    }

    public TopologyKind resolveAdaptive(int agentCount, TopologyKind override) {
        if (override != null && override != TopologyKind.ADAPTIVE) {
            return override;
        }
        if (agentCount <= adaptiveMeshMaxAgents) {
            return TopologyKind.MESH;
        }
        if (agentCount <= adaptiveStarMaxAgents) {
            return TopologyKind.STAR;
        }
        return TopologyKind.HIERARCHICAL;
    }

    String chooseLeader(List<TopologyMember> ordered, TopologyKind kind) {
        for (TopologyMember m : ordered) {
            if (m.pinnedLeader() && m.leaderEligible()) {
                return m.agentId();
            }
        }
        for (TopologyMember m : ordered) {
            if (m.leaderEligible()) {
                return m.agentId();
            }
        }
        throw new TopologyTransitionException(
                kind.wireName() + " topology requires at least one leader-eligible agent");
    }

    private SortedMap<String, SortedSet<String>> empty(List<TopologyMember> ordered) {
        SortedMap<String, SortedSet<String>> edges = new TreeMap<>();
        for (TopologyMember m : ordered) {
            edges.put(m.agentId(), new TreeSet<>());
        }
        return edges;
    }

    private SortedMap<String, SortedSet<String>> mesh(List<TopologyMember> ordered) {
        SortedMap<String, SortedSet<String>> edges = empty(ordered);
        for (TopologyMember a : ordered) {
            for (TopologyMember b : ordered) {
                if (!a.agentId().equals(b.agentId())) {
                    edges.get(a.agentId()).add(b.agentId());
                }
            }
        }
        return edges;
    }

    private SortedMap<String, SortedSet<String>> ring(List<TopologyMember> ordered) {
        SortedMap<String, SortedSet<String>> edges = empty(ordered);
        int n = ordered.size();
        if (n < 2) {
            return edges;
        }
        for (int i = 0; i < n; i++) {
            edges.get(ordered.get(i).agentId()).add(ordered.get((i + 1) % n).agentId());
        }
        return edges;
    }

    private SortedMap<String, SortedSet<String>> star(List<TopologyMember> ordered, String coordinator) {
        SortedMap<String, SortedSet<String>> edges = empty(ordered);
        for (TopologyMember m : ordered) {
            if (!m.agentId().equals(coordinator)) {
                edges.get(coordinator).add(m.agentId());
                edges.get(m.agentId()).add(coordinator);
            }
        }
        return edges;
    }

    private SortedMap<String, SortedSet<String>> tree(List<TopologyMember> ordered, String root) {
        SortedMap<String, SortedSet<String>> edges = empty(ordered);
        List<String> breadthFirst = new ArrayList<>(ordered.size());
        breadthFirst.add(root);
        for (TopologyMember m : ordered) {
            if (!m.agentId().equals(root)) {
                breadthFirst.add(m.agentId());
            }
        }
        // Position i hangs under position (i - 1) / b, which fills each level left to right.
        for (int i = 1; i < breadthFirst.size(); i++) {
            String parent = breadthFirst.get((i - 1) / branchingFactor);
            String child = breadthFirst.get(i);
            edges.get(parent).add(child);
            edges.get(child).add(parent);
        }
        return edges;
    }

    public record Layout(TopologyKind effectiveKind, SortedMap<String, SortedSet<String>> edges, String leaderId) {
    }
}
