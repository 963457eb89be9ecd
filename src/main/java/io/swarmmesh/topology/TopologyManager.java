package io.swarmmesh.topology;

import io.swarmmesh.error.SessionNotFoundException;
import io.swarmmesh.error.StateStoreException;
import io.swarmmesh.error.TopologyTransitionException;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.storage.SwarmStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the connectivity graph of every live session.
 *
 * <p>Readers take the current snapshot from an {@link AtomicReference} without locking; a task that started
 * on an older graph keeps using that snapshot. Writers build a new graph, swap the reference and persist it.
 * A failed persist puts the previous graph back.
 */
public final class TopologyManager {
    private static final Logger LOG = LoggerFactory.getLogger(TopologyManager.class);

    private final TopologyBuilder builder;
    private final SwarmStore store;
    private final Clock clock;
    private final Map<String, SessionTopology> sessions = new ConcurrentHashMap<>();

    public TopologyManager(TopologyBuilder builder, SwarmStore store, Clock clock) {
        this.builder = builder;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Builds version 1 of the session graph. The session row must already exist.
     */
    public TopologyGraph create(String sessionId, TopologyKind kind, Collection<TopologyMember> members) {
        if (members.isEmpty()) {
            throw new TopologyTransitionException("cannot build a topology without agents");
        }
        SessionTopology entry = new SessionTopology(members);
        TopologyBuilder.Layout layout = builder.build(kind, entry.members.values(), null);
        TopologyGraph graph = new TopologyGraph(sessionId, kind, layout.effectiveKind(), layout.edges(),
                layout.leaderId(), 1L, clock.millis());
        store.saveTopology(graph);
        entry.graph.set(graph);
        sessions.put(sessionId, entry);
        LOG.info("session {} topology {} (effective {}) built over {} agents, leader={}",
                sessionId, kind.wireName(), layout.effectiveKind().wireName(), members.size(), layout.leaderId());
        return graph;
    }

    public TopologyGraph current(String sessionId) {
        return entry(sessionId).graph.get();
    }

    public Optional<TopologyGraph> find(String sessionId) {
        SessionTopology entry = sessions.get(sessionId);
        return entry == null ? Optional.empty() : Optional.of(entry.graph.get());
    }

    public Optional<TopologyKind> adaptiveOverride(String sessionId) {
        return Optional.ofNullable(entry(sessionId).adaptiveOverride);
    }

    /**
     * Rebuilds the graph under {@code newKind} over the current agents. The vertex set never changes here.
     * Leaving ADAPTIVE drops any pinned adaptive override.
     */
    public TopologyGraph transitionTo(String sessionId, TopologyKind newKind) {
        SessionTopology entry = entry(sessionId);
        synchronized (entry) {
            TopologyGraph after = rebuild(sessionId, entry, newKind, entry.members.values(), true);
            if (newKind != TopologyKind.ADAPTIVE) {
                entry.adaptiveOverride = null;
            }
            return after;
        }
    }

    /**
     * Pins the concrete kind an adaptive session resolves to. For a non-adaptive session this is a plain
     * transition to {@code override}.
     */
    public TopologyGraph overrideAdaptive(String sessionId, TopologyKind override) {
        if (override == TopologyKind.ADAPTIVE) {
            throw new TopologyTransitionException("adaptive override must name a concrete topology kind");
        }
        SessionTopology entry = entry(sessionId);
        synchronized (entry) {
            TopologyGraph before = entry.graph.get();
            if (before.kind() != TopologyKind.ADAPTIVE) {
                return rebuild(sessionId, entry, override, entry.members.values(), true);
            }
            TopologyKind previousOverride = entry.adaptiveOverride;
            entry.adaptiveOverride = override;
            try {
                return rebuild(sessionId, entry, TopologyKind.ADAPTIVE, entry.members.values(), true);
            } catch (RuntimeException e) {
                entry.adaptiveOverride = previousOverride;
                throw e;
            }
        }
    }

    /**
     * Drops an agent from the vertex set. A leader-bearing topology that loses its last leader-eligible
     * agent falls back to mesh.
     */
    public TopologyGraph removeAgent(String sessionId, String agentId) {
        SessionTopology entry = entry(sessionId);
        synchronized (entry) {
            if (!entry.members.containsKey(agentId)) {
                throw new TopologyTransitionException("agent " + agentId + " is not part of session " + sessionId);
            }
            Map<String, TopologyMember> remaining = new TreeMap<>(entry.members);
            remaining.remove(agentId);
            TopologyGraph before = entry.graph.get();
            TopologyKind kind = before.kind();
            if (needsLeader(kind, before.effectiveKind(), remaining.size(), entry.adaptiveOverride)
                    && remaining.values().stream().noneMatch(TopologyMember::leaderEligible)) {
                LOG.warn("session {} lost its last leader-eligible agent, falling back to mesh", sessionId);
                kind = TopologyKind.MESH;
            }
            TopologyGraph after = rebuild(sessionId, entry, kind, remaining.values(), false);
            entry.members.clear();
            entry.members.putAll(remaining);
            return after;
        }
    }

    public TopologyGraph addAgent(String sessionId, TopologyMember member) {
        SessionTopology entry = entry(sessionId);
        synchronized (entry) {
            if (entry.members.containsKey(member.agentId())) {
                throw new TopologyTransitionException(
                        "agent " + member.agentId() + " is already part of session " + sessionId);
            }
            Map<String, TopologyMember> grown = new TreeMap<>(entry.members);
            grown.put(member.agentId(), member);
            TopologyGraph after = rebuild(sessionId, entry, entry.graph.get().kind(), grown.values(), false);
            entry.members.put(member.agentId(), member);
            return after;
        }
    }

    public void forget(String sessionId) {
        sessions.remove(sessionId);
    }

    private boolean needsLeader(TopologyKind kind, TopologyKind effective, int agentCount, TopologyKind override) {
        if (kind == TopologyKind.ADAPTIVE) {
            return builder.resolveAdaptive(agentCount, override).hasLeader();
        }
        return kind.hasLeader() || effective.hasLeader();
    }

    private TopologyGraph rebuild(String sessionId, SessionTopology entry, TopologyKind kind,
                                  Collection<TopologyMember> members, boolean keepVertexSet) {
        TopologyGraph before = entry.graph.get();
        TopologyBuilder.Layout layout = builder.build(kind, members, entry.adaptiveOverride);
        TopologyGraph after = new TopologyGraph(sessionId, kind, layout.effectiveKind(), layout.edges(),
                layout.leaderId(), before.version() + 1, clock.millis());
        if (keepVertexSet) {
            Set<String> old = new TreeSet<>(before.vertices());
            Set<String> next = new TreeSet<>(after.vertices());
            if (!old.equals(next)) {
                throw new TopologyTransitionException(
                        "transition of " + sessionId + " would change agents from " + old + " to " + next);
            }
        }
        if (!entry.graph.compareAndSet(before, after)) {
            throw new TopologyTransitionException("concurrent topology change on " + sessionId);
        }
        try {
            store.saveTopology(after);
        } catch (StateStoreException e) {
            entry.graph.set(before);
            throw e;
        }
        LOG.info("session {} topology v{} -> v{}: {} (effective {}), leader={}",
                sessionId, before.version(), after.version(), kind.wireName(),
                after.effectiveKind().wireName(), after.leaderId());
        return after;
    }

    private SessionTopology entry(String sessionId) {
        SessionTopology entry = sessions.get(sessionId);
        if (entry == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return entry;
    }

    private static final class SessionTopology {
        private final AtomicReference<TopologyGraph> graph = new AtomicReference<>();
        private final Map<String, TopologyMember> members = new LinkedHashMap<>();
        private volatile TopologyKind adaptiveOverride;

        private SessionTopology(Collection<TopologyMember> initial) {
            for (TopologyMember m : initial) {
                members.put(m.agentId(), m);
            }
        }
    }
}
