package io.swarmmesh.runtime;

import io.swarmmesh.agent.AgentSpec;
import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.consensus.ConsensusEngine;
import io.swarmmesh.consensus.ConsensusEngine.ConsensusRequest;
import io.swarmmesh.consensus.ConsensusProposal;
import io.swarmmesh.consensus.Voter;
import io.swarmmesh.error.InvalidConfigException;
import io.swarmmesh.error.SessionNotFoundException;
import io.swarmmesh.error.StateStoreException;
import io.swarmmesh.error.TopologyTransitionException;
import io.swarmmesh.metrics.InFlightTask;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.HealingAction;
import io.swarmmesh.model.HealingStats;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.SessionRecord;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TaskResult;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.observability.AuditLogger;
import io.swarmmesh.observability.AuditLogger.AuditEvent;
import io.swarmmesh.observability.PrometheusFormatter;
import io.swarmmesh.observability.SessionMetricsSnapshot;
import io.swarmmesh.storage.Database;
import io.swarmmesh.storage.SessionStateWriter;
import io.swarmmesh.storage.SwarmStore;
import io.swarmmesh.topology.TopologyBuilder;
import io.swarmmesh.topology.TopologyGraph;
import io.swarmmesh.topology.TopologyManager;
import io.swarmmesh.topology.TopologyMember;
import io.swarmmesh.util.Ids;
import io.swarmmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: owns the sessions of one root directory and exposes the session lifecycle,
 * topology switches, consensus and the task hooks.
 *
 * <p>Each session has its own worker thread; the coordinator itself holds no lock across sessions, so a slow
 * or failing session never stalls its siblings.
 */
public final class SwarmCoordinator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SwarmCoordinator.class);
    private static final String AUDIT_RESOURCE_SESSION = "swarm/session";

    private final SwarmMeshConfig config;
    private final EngineSettings settings;
    private final Clock clock;
    private final Database database;
    private final SwarmStore store;
    private final TopologyManager topology;
    private final ConsensusEngine consensus;
    private final SessionStateWriter stateWriter;
    private final AuditLogger auditLogger;
    private final ExecutorService votePool;
    private final ExecutorService probePool;
    private final Map<String, SwarmSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> closedSessionIds = ConcurrentHashMap.newKeySet();
    private final ListenerProxy events = new ListenerProxy();
    private volatile SwarmEventListener listener = SwarmEventListener.NONE;

    public SwarmCoordinator(SwarmMeshConfig config) {
        this(config, EngineSettings.load(config.settingsFile()), Clock.systemUTC(), new SecureRandom());
    }

    public SwarmCoordinator(SwarmMeshConfig config, EngineSettings settings, Clock clock, Random gossipRandom) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.store = new SwarmStore(database);
        this.topology = new TopologyManager(
                new TopologyBuilder(settings.hierarchicalBranchingFactor(), settings.adaptiveMeshMaxAgents(),
                        settings.adaptiveStarMaxAgents()),
                store,
                clock);
        this.votePool = Executors.newCachedThreadPool(new NamedThreadFactory("swarm-vote"));
        this.probePool = Executors.newCachedThreadPool(new NamedThreadFactory("swarm-probe"));
        this.consensus = new ConsensusEngine(settings, store, votePool, clock, gossipRandom);
        this.stateWriter = new SessionStateWriter(config);
        this.auditLogger = new AuditLogger(config.auditFile());
    }

    /**
     * Creates directories and schema, then drops task metrics and health snapshots past their retention.
     */
    public void init() {
        database.init();
        purgeExpired(settings.metricsRetentionDays());
    }

    public SwarmMeshConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public SwarmStore store() {
        return store;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public void setListener(SwarmEventListener listener) {
        this.listener = listener == null ? SwarmEventListener.NONE : listener;
    }

    public String initSession(List<AgentSpec> agents) {
        return initSession(settings.defaultTopology(), settings.consensusAlgorithm(), agents);
    }

    /**
     * Validates the agents, builds version 1 of the topology, persists the session and starts its health
     * loop. Returns the new session id.
     */
    public String initSession(TopologyKind kind, ConsensusAlgorithm algorithm, List<AgentSpec> agents) {
        if (kind == null) {
            throw new InvalidConfigException("topology kind is required");
        }
        if (algorithm == null) {
            throw new InvalidConfigException("consensus algorithm is required");
        }
        validateAgents(agents);

        String sessionId = Ids.session();
        long now = clock.millis();
        SwarmSession session = new SwarmSession(sessionId, algorithm, now, services());
        List<String> agentIds = new ArrayList<>();
        List<TopologyMember> members = new ArrayList<>();
        for (AgentSpec spec : agents) {
            agentIds.add(spec.agentId());
            members.add(TopologyMember.of(spec));
            session.register(spec);
        }
        agentIds.sort(String::compareTo);
        store.saveSession(new SessionRecord(sessionId, kind, algorithm, SessionStatus.ACTIVE, agentIds, null, 0L,
                now, null, null), initialViews(agents, now));
        TopologyGraph graph;
        try {
            graph = topology.create(sessionId, kind, members);
        } catch (TopologyTransitionException e) {
            session.worker().stop();
            store.markSessionClosed(sessionId, clock.millis(), "init failed: " + e.getMessage());
            throw new InvalidConfigException("cannot build " + kind.wireName() + " topology: " + e.getMessage(), e);
        }
        sessions.put(sessionId, session);
        session.onFatal(this::failSession);
        try {
            session.publish(SessionStatus.ACTIVE);
        } catch (StateStoreException e) {
            shutdown(session, "state store failure: " + e.getMessage());
            throw e;
        }
        audit("session.init", sessionId, "ok", Map.of(
                "topology", kind.wireName(),
                "effective_topology", graph.effectiveKind().wireName(),
                "consensus_algorithm", algorithm.wireName(),
                "agents", agentIds.size()));
        LOG.info("session {} started: {} agents, topology {} (effective {}), consensus {}",
                sessionId, agentIds.size(), kind.wireName(), graph.effectiveKind().wireName(), algorithm.wireName());
        session.start();
        return sessionId;
    }

    private List<AgentView> initialViews(List<AgentSpec> agents, long now) {
        List<AgentView> views = new ArrayList<>();
        for (AgentSpec spec : agents) {
            views.add(new AgentView(spec.agentId(), spec.capabilityTags(), AgentState.HEALTHY,
                    now, spec.weight(), spec.leaderEligible()));
        }
        return views;
    }

    private void validateAgents(List<AgentSpec> agents) {
        if (agents == null || agents.isEmpty()) {
            throw new InvalidConfigException("a session needs at least one agent");
        }
        if (agents.size() > settings.maxAgents()) {
            throw new InvalidConfigException(
                    "a session supports at most " + settings.maxAgents() + " agents, got " + agents.size());
        }
        Set<String> seen = new HashSet<>();
        int pinned = 0;
        for (AgentSpec spec : agents) {
            validateAgent(spec);
            if (!seen.add(spec.agentId())) {
                throw new InvalidConfigException("duplicate agent id: " + spec.agentId());
            }
            if (spec.pinnedLeader()) {
                pinned++;
            }
        }
        if (pinned > 1) {
            throw new InvalidConfigException("at most one agent can be pinned as leader, got " + pinned);
        }
    }

    private static void validateAgent(AgentSpec spec) {
        if (spec == null) {
            throw new InvalidConfigException("agent spec cannot be null");
        }
        if (spec.agentId() == null || spec.agentId().isBlank()) {
            throw new InvalidConfigException("agent id cannot be empty");
        }
        if (spec.handle() == null) {
            throw new InvalidConfigException("agent " + spec.agentId() + " has no handle");
        }
        if (!(spec.weight() > 0.0d) || Double.isInfinite(spec.weight())) {
            throw new InvalidConfigException("agent " + spec.agentId() + " weight must be positive: " + spec.weight());
        }
    }

    /**
     * Topology, agent health, recent metrics and open proposals of a live session.
     */
    public SessionStatusView getStatus(String sessionId) {
        return live(sessionId).status();
    }

    /**
     * Stops the health loop, flushes pending metrics, times out open proposals and marks the session closed.
     * Closing an already closed session does nothing.
     */
    public void closeSession(String sessionId) {
        SwarmSession session = sessions.get(sessionId);
        if (session == null) {
            if (closedSessionIds.contains(sessionId)) {
                return;
            }
            Optional<SessionRecord> persisted = store.loadSession(sessionId);
            if (persisted.isPresent() && persisted.get().status() == SessionStatus.CLOSED) {
                return;
            }
            throw new SessionNotFoundException(sessionId);
        }
        shutdown(session, null);
    }

    void failSession(SwarmSession session, String reason) {
        shutdown(session, reason);
    }

    /**
     * Each close step runs on its own; a failing step is logged and the first failure becomes the recorded
     * failure reason. The session always ends up marked closed and forgotten.
     */
    private void shutdown(SwarmSession session, String failureReason) {
        if (!session.markClosed()) {
            return;
        }
        String sessionId = session.sessionId();
        String reason = failureReason;
        session.worker().cancelLoop();
        if (reason == null) {
            reason = closeStep(sessionId, "metrics flush", () -> session.worker().call(() -> {
                session.flushMetrics();
                return null;
            }));
        }
        AtomicInteger cancelled = new AtomicInteger();
        reason = firstFailure(reason, closeStep(sessionId, "proposal cancellation",
                () -> cancelled.set(consensus.cancelSession(sessionId))));
        TopologyGraph graph = topology.find(sessionId).orElse(null);
        TopologyKind kind = graph == null ? TopologyKind.MESH : graph.kind();
        reason = firstFailure(reason, closeStep(sessionId, "state file write",
                () -> stateWriter.write(sessionId, kind, session.algorithm(), SessionStatus.CLOSED,
                        session.agentViews())));
        String recorded = reason;
        AtomicBoolean marked = new AtomicBoolean();
        closeStep(sessionId, "close marker",
                () -> marked.set(store.markSessionClosed(sessionId, clock.millis(), recorded)));
        closeStep(sessionId, "close audit", () -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("cancelled_proposals", cancelled.get());
            details.put("failure_reason", recorded == null ? "" : recorded);
            details.put("marked", marked.get());
            audit("session.close", sessionId, recorded == null ? "ok" : "failed", details);
        });
        session.worker().stop();
        topology.forget(sessionId);
        closedSessionIds.add(sessionId);
        sessions.remove(sessionId);
        consensus.forgetSession(sessionId);
        LOG.info("session {} closed{}", sessionId, recorded == null ? "" : " after failure: " + recorded);
        notifyClosed(sessionId, recorded);
    }

    private static String closeStep(String sessionId, String step, Runnable action) {
        try {
            action.run();
            return null;
        } catch (RuntimeException e) {
            LOG.error("session {} close step '{}' failed", sessionId, step, e);
            return step + " failed: " + e.getMessage();
        }
    }

    private static String firstFailure(String first, String next) {
        return first != null ? first : next;
    }

    private void notifyClosed(String sessionId, String failureReason) {
        try {
            listener.onSessionClosed(sessionId, failureReason);
        } catch (RuntimeException e) {
            LOG.warn("listener failed on close of session {}", sessionId, e);
        }
    }

    public ProposalRecord requestConsensus(String sessionId, String text, Duration timeout) {
        return requestConsensus(sessionId, Ids.proposal(), text, timeout);
    }

    /**
     * Runs a ballot over the agents of the session's current graph with the session's algorithm. Blocks the
     * calling thread until the proposal is decided or {@code timeout} elapses; a timeout is the outcome
     * {@code TIMEOUT}, not an error.
     */
    public ProposalRecord requestConsensus(String sessionId, String proposalId, String text, Duration timeout) {
        SwarmSession session = live(sessionId);
        if (proposalId == null || proposalId.isBlank()) {
            throw new InvalidConfigException("proposal id cannot be empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new InvalidConfigException("consensus timeout must be positive");
        }
        TopologyGraph graph = topology.current(sessionId);
        List<Voter> voters = new ArrayList<>();
        for (String agentId : graph.vertices()) {
            session.registry().findById(agentId)
                    .ifPresent(spec -> voters.add(new Voter(agentId, spec.weight(), spec.handle())));
        }
        try {
            ConsensusProposal proposal = consensus.decide(new ConsensusRequest(proposalId, sessionId,
                    text == null ? "" : text, session.algorithm(), voters, graph, timeout.toMillis()));
            ProposalRecord record = proposal.toRecord();
            audit("consensus.decide", sessionId, record.outcome().name(), Map.of(
                    "proposal_id", proposalId,
                    "algorithm", session.algorithm().wireName(),
                    "participants", record.participants().size(),
                    "votes", record.votes().size()));
            return record;
        } catch (StateStoreException e) {
            LOG.error("session {} state store failure during consensus", sessionId, e);
            failSession(session, "state store failure: " + e.getMessage());
            throw e;
        }
    }

    public Optional<ProposalRecord> findProposal(String proposalId) {
        return consensus.find(proposalId);
    }

    /**
     * Rebuilds the session graph under {@code newKind} over the same agents. Tasks already running keep the
     * graph they started with.
     *
     * <p>The switch runs on the session worker, so a health cycle in progress finishes first. That cycle
     * waits on at most {@code probeTimeoutMs} of probes plus the restarts it issues; the call returns after
     * both.
     */
    public TopologyGraph switchTopology(String sessionId, TopologyKind newKind) {
        if (newKind == null) {
            throw new InvalidConfigException("topology kind is required");
        }
        SwarmSession session = live(sessionId);
        return session.worker().call(() -> {
            TopologyGraph before = topology.current(sessionId);
            TopologyGraph after = topology.transitionTo(sessionId, newKind);
            session.publish(SessionStatus.ACTIVE);
            audit("topology.switch", sessionId, "ok", Map.of(
                    "from", before.effectiveKind().wireName(),
                    "to", after.effectiveKind().wireName(),
                    "graph_version", after.version()));
            events.onTopologyChanged(sessionId, after, "switch");
            return after;
        });
    }

    /**
     * Registers a new agent with a live session and grows its graph to include it.
     */
    public TopologyGraph addAgent(String sessionId, AgentSpec spec) {
        validateAgent(spec);
        SwarmSession session = live(sessionId);
        return session.worker().call(() -> {
            if (session.knows(spec.agentId())) {
                throw new InvalidConfigException("agent " + spec.agentId() + " already joined session " + sessionId);
            }
            if (topology.current(sessionId).vertices().size() >= settings.maxAgents()) {
                throw new InvalidConfigException("session " + sessionId + " already has " + settings.maxAgents()
                        + " agents");
            }
            if (spec.pinnedLeader()) {
                throw new InvalidConfigException("an agent joining a running session cannot be pinned as leader");
            }
            return session.addAgent(spec, TopologyMember.of(spec));
        });
    }

    /**
     * Host hook: a task was dispatched to an agent of the current graph.
     */
    public void onTaskStart(String sessionId, String agentId, String taskId) {
        SwarmSession session = live(sessionId);
        TopologyGraph graph = topology.current(sessionId);
        if (!graph.vertices().contains(agentId)) {
            throw new InvalidConfigException("agent " + agentId + " is not part of session " + sessionId);
        }
        session.metrics().onTaskStart(agentId, taskId, graph.version());
    }

    /**
     * Host hook: a task finished. Accepted for any agent the session ever had, including removed ones.
     */
    public void onTaskEnd(String sessionId, String agentId, String taskId, long durationMs, TaskResult result) {
        SwarmSession session = live(sessionId);
        if (!session.knows(agentId)) {
            throw new InvalidConfigException("agent " + agentId + " never joined session " + sessionId);
        }
        session.metrics().onTaskEnd(agentId, taskId, durationMs, result == null ? TaskResult.FAILURE : result);
    }

    /**
     * Runs one health cycle now on the session worker and returns the healing actions it took.
     */
    public List<HealingAction> runCycle(String sessionId) {
        SwarmSession session = live(sessionId);
        return session.worker().call(session::guardedCycle);
    }

    public List<SessionRecord> listSessions(int limit) {
        return store.listSessions(Math.max(1, limit));
    }

    public List<HealingAction> healingActions(String sessionId, int limit) {
        return store.listHealingActions(sessionId, Math.max(1, limit));
    }

    public HealingStats healingStats(String sessionId) {
        return store.healingStats(sessionId);
    }

    /**
     * Prometheus text exposition of a session, live or persisted.
     */
    public String metricsText(String sessionId) {
        SwarmSession session = sessions.get(sessionId);
        SessionMetricsSnapshot snapshot;
        if (session != null) {
            snapshot = SessionMetricsSnapshot.live(session.sessionId(), session.agentViews(),
                    topology.find(sessionId).orElse(null), session.metrics(), store);
        } else {
            SessionRecord record = store.loadSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
            snapshot = SessionMetricsSnapshot.persisted(record, store);
        }
        return PrometheusFormatter.format(snapshot);
    }

    /**
     * What the store and the state file hold for a session, live or closed.
     */
    public Map<String, Object> persistedStatus(String sessionId) {
        SessionRecord record = store.loadSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("session", record);
        out.put("topology", store.loadTopology(sessionId).orElse(null));
        out.put("topology_versions", store.countTopologyVersions(sessionId));
        out.put("agents", store.loadAgents(sessionId));
        out.put("recent_metrics", store.queryRecentMetrics(sessionId, settings.recentMetricsLimit()));
        out.put("proposals", store.countProposalsByOutcome(sessionId));
        if (Files.exists(config.sessionStateFile(sessionId))) {
            out.put("state_file", stateWriter.read(sessionId));
        }
        return out;
    }

    public PurgeOutcome purgeExpired(int retentionDays) {
        int days = Math.max(0, retentionDays);
        long cutoff = clock.millis() - Duration.ofDays(days).toMillis();
        SwarmStore.PurgeResult result = store.purgeOlderThan(cutoff);
        PurgeOutcome out = new PurgeOutcome(days, cutoff, result.metricsDeleted(), result.healthDeleted());
        audit("retention.purge", null, "ok", Map.of(
                "retention_days", days,
                "metrics_deleted", out.metricsDeleted(),
                "health_deleted", out.healthDeleted()));
        if (result.total() > 0) {
            LOG.info("retention purge removed {} task metrics and {} health snapshots older than {} days",
                    out.metricsDeleted(), out.healthDeleted(), days);
        }
        return out;
    }

    public List<String> activeSessionIds() {
        return List.copyOf(sessions.keySet());
    }

    @Override
    public void close() {
        for (SwarmSession session : new ArrayList<>(sessions.values())) {
            shutdown(session, null);
        }
        votePool.shutdownNow();
        probePool.shutdownNow();
    }

    private SwarmSession live(String sessionId) {
        SwarmSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null || session.isClosed()) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private EngineServices services() {
        return new EngineServices(settings, store, topology, consensus, stateWriter, auditLogger,
                events, probePool, clock);
    }

    private void audit(String action, String sessionId, String result, Map<String, Object> details) {
        auditLogger.log(AuditEvent.of(action, sessionId, AUDIT_RESOURCE_SESSION, result, details));
    }

    /**
     * Forwards to whichever listener is registered when the event fires. A throwing listener is logged and
     * never unwinds the engine step that raised the event.
     */
    private final class ListenerProxy implements SwarmEventListener {
        @Override
        public boolean onTasksReassigned(String sessionId, String agentId,
                                         List<InFlightTask> tasks) {
            try {
                return listener.onTasksReassigned(sessionId, agentId, tasks);
            } catch (RuntimeException e) {
                LOG.warn("listener failed on task reassignment from {} in session {}", agentId, sessionId, e);
                return false;
            }
        }

        @Override
        public void onTopologyChanged(String sessionId, TopologyGraph graph, String reason) {
            try {
                listener.onTopologyChanged(sessionId, graph, reason);
            } catch (RuntimeException e) {
                LOG.warn("listener failed on topology change of session {} ({})", sessionId, reason, e);
            }
        }

        @Override
        public void onAgentStateChanged(String sessionId, String agentId, AgentState from,
                                        AgentState to) {
            try {
                listener.onAgentStateChanged(sessionId, agentId, from, to);
            } catch (RuntimeException e) {
                LOG.warn("listener failed on {} {} -> {} in session {}", agentId, from, to, sessionId, e);
            }
        }

        @Override
        public void onAgentRemoved(String sessionId, String agentId, String reason) {
            try {
                listener.onAgentRemoved(sessionId, agentId, reason);
            } catch (RuntimeException e) {
                LOG.warn("listener failed on removal of {} from session {}", agentId, sessionId, e);
            }
        }
    }

    public record PurgeOutcome(int retentionDays, long cutoffMs, int metricsDeleted, int healthDeleted) {
    }
}
