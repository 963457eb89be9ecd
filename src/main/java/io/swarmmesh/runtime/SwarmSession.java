package io.swarmmesh.runtime;

import io.swarmmesh.agent.AgentHandle;
import io.swarmmesh.agent.AgentRegistry;
import io.swarmmesh.agent.AgentSpec;
import io.swarmmesh.agent.ProbeResult;
import io.swarmmesh.error.AgentUnreachableException;
import io.swarmmesh.error.StateStoreException;
import io.swarmmesh.error.TopologyTransitionException;
import io.swarmmesh.healing.AgentHealthTracker;
import io.swarmmesh.healing.AutoHealer;
import io.swarmmesh.healing.BottleneckDetector;
import io.swarmmesh.healing.HealingEffects;
import io.swarmmesh.healing.ProbeOutcome;
import io.swarmmesh.metrics.InFlightTask;
import io.swarmmesh.metrics.MetricsCollector;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.HealingAction;
import io.swarmmesh.model.HealingActionKind;
import io.swarmmesh.model.HealthSnapshot;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TaskMetric;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.observability.AuditLogger.AuditEvent;
import io.swarmmesh.topology.TopologyGraph;
import io.swarmmesh.topology.TopologyMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * One live swarm session. Everything that mutates it runs on its {@link SessionWorker}; callers read the
 * volatile snapshots.
 */
final class SwarmSession implements HealingEffects {
    private static final Logger LOG = LoggerFactory.getLogger(SwarmSession.class);

    private final String sessionId;
    private final ConsensusAlgorithm algorithm;
    private final long createdAtMs;
    private final EngineServices services;
    private final AgentRegistry registry = new AgentRegistry();
    private final Map<String, AgentSpec> allSpecs = new TreeMap<>();
    private final MetricsCollector metrics;
    private final AutoHealer healer;
    private final BottleneckDetector bottleneck;
    private final SessionWorker worker;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile List<AgentView> agentViews = List.of();
    private volatile SessionStatusView lastGood;
    private volatile String degradedReason;
    private volatile BiConsumer<SwarmSession, String> fatalHandler = (session, reason) -> { };

    SwarmSession(String sessionId, ConsensusAlgorithm algorithm, long createdAtMs, EngineServices services) {
        this.sessionId = sessionId;
        this.algorithm = algorithm;
        this.createdAtMs = createdAtMs;
        this.services = services;
        this.metrics = new MetricsCollector(sessionId, services.settings(), services.clock());
        this.healer = new AutoHealer(sessionId, services.settings(), services.clock(), this);
        this.bottleneck = new BottleneckDetector(
                services.settings().bottleneckThroughputRatio(),
                services.settings().bottleneckIntervals(),
                services.settings().throughputBaselineWindow());
        this.worker = new SessionWorker(sessionId);
    }

    String sessionId() {
        return sessionId;
    }

    ConsensusAlgorithm algorithm() {
        return algorithm;
    }

    long createdAtMs() {
        return createdAtMs;
    }

    SessionWorker worker() {
        return worker;
    }

    MetricsCollector metrics() {
        return metrics;
    }

    AgentRegistry registry() {
        return registry;
    }

    boolean isClosed() {
        return closed.get();
    }

    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    boolean knows(String agentId) {
        synchronized (allSpecs) {
            return allSpecs.containsKey(agentId);
        }
    }

    void register(AgentSpec spec) {
        registry.register(spec);
        synchronized (allSpecs) {
            allSpecs.put(spec.agentId(), spec);
        }
        healer.register(spec.agentId());
    }

    List<AgentView> agentViews() {
        return agentViews;
    }

    void onFatal(BiConsumer<SwarmSession, String> handler) {
        this.fatalHandler = handler;
    }

    void start() {
        worker.start(services.settings().stateSyncIntervalMs(), this::guardedCycle);
    }

    /**
     * One health cycle, shielded so a failure never escapes into the scheduler.
     */
    List<HealingAction> guardedCycle() {
        if (closed.get()) {
            return List.of();
        }
        try {
            List<HealingAction> actions = cycle();
            if (degradedReason != null) {
                LOG.info("session {} worker recovered", sessionId);
                degradedReason = null;
            }
            return actions;
        } catch (StateStoreException e) {
            LOG.error("session {} state store failure, closing session", sessionId, e);
            fatalHandler.accept(this, "state store failure: " + e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            LOG.error("session {} health cycle failed, reporting last good snapshot", sessionId, e);
            degradedReason = e.getClass().getSimpleName() + ": " + e.getMessage();
            return List.of();
        }
    }

    private List<HealingAction> cycle() {
        flushMetrics();
        Map<String, ProbeOutcome> probes = services.settings().healthChecksEnabled() ? probeAll() : Map.of();
        List<HealingAction> actions = new ArrayList<>(healer.evaluate(probes, metrics.agentP95()));
        long throughput = metrics.closeInterval();
        if (services.settings().bottleneckDetectionEnabled() && services.settings().metricsEnabled()) {
            bottleneck.observe(throughput, healer.anyUnhealthy())
                    .ifPresent(observation -> actions.addAll(onBottleneck(observation)));
        }
        for (HealingAction action : actions) {
            services.store().appendHealingAction(action);
            audit("healing.action", action.agentId(), action.success() ? "ok" : "failed", Map.of(
                    "action_id", action.actionId(),
                    "kind", action.actionKind().name(),
                    "trigger", action.trigger(),
                    "detail", action.detail() == null ? "" : action.detail()));
        }
        publish(SessionStatus.ACTIVE);
        return actions;
    }

    void flushMetrics() {
        List<TaskMetric> drained = metrics.drainPending();
        if (!drained.isEmpty()) {
            metrics.absorb(services.store().appendMetrics(drained));
        }
    }

    private Map<String, ProbeOutcome> probeAll() {
        Map<String, CompletableFuture<ProbeResult>> pending = new LinkedHashMap<>();
        for (String agentId : healer.states().keySet()) {
            AgentState state = healer.states().get(agentId);
            if (state == AgentState.REMOVED) {
                continue;
            }
            AgentHandle handle = registry.handle(agentId).orElse(null);
            if (handle == null) {
                continue;
            }
            pending.put(agentId, CompletableFuture.supplyAsync(handle::probe, services.probePool()));
        }
        long deadline = services.clock().millis() + services.settings().probeTimeoutMs();
        Map<String, ProbeOutcome> out = new TreeMap<>();
        List<HealthSnapshot> snapshots = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<ProbeResult>> e : pending.entrySet()) {
            ProbeOutcome outcome = await(e.getKey(), e.getValue(), deadline);
            out.put(e.getKey(), outcome);
            snapshots.add(new HealthSnapshot(sessionId, e.getKey(), outcome.observedAtMs(), outcome.reachable(),
                    outcome.latencyMs()));
        }
        services.store().appendHealth(snapshots);
        return out;
    }

    private ProbeOutcome await(String agentId, CompletableFuture<ProbeResult> future, long deadline) {
        long waitMs = Math.max(0L, deadline - services.clock().millis());
        try {
            ProbeResult result = future.get(waitMs, TimeUnit.MILLISECONDS);
            long now = services.clock().millis();
            if (result == null || !result.reachable()) {
                return ProbeOutcome.miss(now);
            }
            return new ProbeOutcome(true, result.latencyMs(), now);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.debug("session {} probe of {} timed out", sessionId, agentId);
            return ProbeOutcome.miss(services.clock().millis());
        } catch (ExecutionException e) {
            LOG.debug("session {} probe of {} failed", sessionId, agentId, e.getCause());
            return ProbeOutcome.miss(services.clock().millis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeOutcome.miss(services.clock().millis());
        }
    }

    private List<HealingAction> onBottleneck(BottleneckDetector.Observation observation) {
        TopologyGraph graph = services.topology().current(sessionId);
        TopologyKind recommended = BottleneckDetector.recommend(graph.effectiveKind());
        LOG.warn("session {} topology {} looks like the bottleneck: {}; recommending {}",
                sessionId, graph.effectiveKind().wireName(), observation.describe(), recommended.wireName());
        audit("healing.bottleneck", null, "detected", Map.of(
                "effective_topology", graph.effectiveKind().wireName(),
                "recommended", recommended.wireName(),
                "throughput", observation.throughput(),
                "baseline", observation.baseline()));
        if (!services.settings().selfHealingEnabled()) {
            return List.of();
        }
        boolean ok;
        String detail;
        try {
            TopologyGraph after = graph.kind() == TopologyKind.ADAPTIVE
                    ? services.topology().overrideAdaptive(sessionId, recommended)
                    : services.topology().transitionTo(sessionId, recommended);
            ok = true;
            detail = graph.effectiveKind().wireName() + " -> " + after.effectiveKind().wireName()
                    + " (v" + after.version() + ")";
            services.listener().onTopologyChanged(sessionId, after, "bottleneck");
        } catch (TopologyTransitionException e) {
            ok = false;
            detail = e.getMessage();
        }
        return List.of(healer.action(null, observation.describe(), HealingActionKind.SWITCH_TOPOLOGY, ok, detail));
    }

    /**
     * Recomputes the agent views and writes them to the store and the session state file.
     */
    void publish(SessionStatus status) {
        TopologyGraph graph = services.topology().find(sessionId).orElse(null);
        List<AgentView> views = buildViews(graph);
        agentViews = views;
        services.store().saveAgentStates(sessionId, views);
        TopologyKind kind = graph == null ? TopologyKind.MESH : graph.kind();
        services.stateWriter().write(sessionId, kind, algorithm, status, views);
        if (status == SessionStatus.ACTIVE && graph != null) {
            lastGood = liveStatus();
        }
    }

    /**
     * One view per vertex of {@code graph}; removed agents drop out. Without a graph every known agent is
     * listed.
     */
    private List<AgentView> buildViews(TopologyGraph graph) {
        List<AgentSpec> specs;
        synchronized (allSpecs) {
            specs = new ArrayList<>(allSpecs.values());
        }
        List<AgentView> out = new ArrayList<>(specs.size());
        for (AgentSpec spec : specs) {
            if (graph != null && !graph.vertices().contains(spec.agentId())) {
                continue;
            }
            out.add(view(spec, null));
        }
        return out;
    }

    private AgentView view(AgentSpec spec, AgentState forced) {
        AgentHealthTracker tracker = healer.tracker(spec.agentId()).orElse(null);
        AgentState state = forced != null ? forced : tracker == null ? AgentState.HEALTHY : tracker.state();
        long heartbeat = tracker == null ? createdAtMs : tracker.lastHeartbeatAtMs();
        return new AgentView(spec.agentId(), spec.capabilityTags(), state, heartbeat, spec.weight(),
                spec.leaderEligible());
    }

    SessionStatusView liveStatus() {
        return new SessionStatusView(
                sessionId,
                SessionStatus.ACTIVE,
                algorithm,
                services.topology().current(sessionId),
                agentViews,
                metrics.recent(),
                services.consensus().openProposals(sessionId),
                false,
                null,
                services.clock().millis());
    }

    SessionStatusView status() {
        String reason = degradedReason;
        if (reason != null && lastGood != null) {
            return lastGood.asDegraded(reason);
        }
        return liveStatus();
    }

    void audit(String action, String resource, String result, Map<String, Object> details) {
        services.audit().log(AuditEvent.of(action, sessionId, resource, result, details));
    }

    // HealingEffects, always invoked on the worker.

    @Override
    public boolean restart(String agentId) throws Exception {
        AgentHandle handle = registry.handle(agentId)
                .orElseThrow(() -> new AgentUnreachableException(agentId, "no handle registered for " + agentId));
        return handle.restart();
    }

    @Override
    public void removeAgent(String agentId, String reason) {
        TopologyGraph after = services.topology().removeAgent(sessionId, agentId);
        registry.remove(agentId);
        List<InFlightTask> orphaned = metrics.forgetAgent(agentId);
        AgentSpec spec;
        synchronized (allSpecs) {
            spec = allSpecs.get(agentId);
        }
        if (spec != null) {
            // The row stays behind as the agent's last known state.
            services.store().saveAgentStates(sessionId, List.of(view(spec, AgentState.REMOVED)));
        }
        audit("topology.remove_agent", agentId, "ok", Map.of(
                "reason", reason,
                "graph_version", after.version(),
                "effective_topology", after.effectiveKind().wireName(),
                "orphaned_tasks", orphaned.size()));
        if (!orphaned.isEmpty()) {
            boolean accepted = services.listener().onTasksReassigned(sessionId, agentId, orphaned);
            LOG.info("session {} handed {} in-flight tasks of removed agent {} back to the host (accepted={})",
                    sessionId, orphaned.size(), agentId, accepted);
        }
        services.listener().onAgentRemoved(sessionId, agentId, reason);
        services.listener().onTopologyChanged(sessionId, after, "remove-agent " + agentId);
    }

    @Override
    public boolean reassign(String agentId, List<InFlightTask> tasks) {
        boolean accepted = services.listener().onTasksReassigned(sessionId, agentId, tasks);
        LOG.info("session {} reassigning {} in-flight tasks away from degraded agent {} (accepted={})",
                sessionId, tasks.size(), agentId, accepted);
        return accepted;
    }

    @Override
    public List<InFlightTask> inFlightFor(String agentId) {
        return metrics.inFlightFor(agentId);
    }

    @Override
    public void stateChanged(String agentId, AgentState from, AgentState to) {
        services.listener().onAgentStateChanged(sessionId, agentId, from, to);
    }

    /**
     * Registers a new agent and grows the topology. Runs on the worker.
     */
    TopologyGraph addAgent(AgentSpec spec, TopologyMember member) {
        TopologyGraph after = services.topology().addAgent(sessionId, member);
        register(spec);
        publish(SessionStatus.ACTIVE);
        audit("topology.add_agent", spec.agentId(), "ok", Map.of("graph_version", after.version()));
        services.listener().onTopologyChanged(sessionId, after, "add-agent " + spec.agentId());
        return after;
    }
}
