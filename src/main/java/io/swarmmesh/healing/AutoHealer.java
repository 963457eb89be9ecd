package io.swarmmesh.healing;

import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.metrics.InFlightTask;
import io.swarmmesh.metrics.Percentiles;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.HealingAction;
import io.swarmmesh.model.HealingActionKind;
import io.swarmmesh.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-agent health state machine of one session:
 * {@code HEALTHY -> DEGRADED -> UNREACHABLE -> (RECOVERED -> HEALTHY | REMOVED)}.
 *
 * <p>An agent degrades on a missed probe or when its rolling p95 latency exceeds
 * {@code degradedLatencyMultiplier} times the median p95 of the swarm. {@code missedProbeThreshold}
 * consecutive misses make a degraded agent unreachable. On the next cycle an unreachable agent is restarted;
 * after {@code maxRestartAttempts} failed restarts it is removed. An agent that stays degraded for
 * {@code predictiveDegradedWindows} cycles has its in-flight tasks handed back to the host.
 *
 * <p>Driven only by the session worker, one {@link #evaluate} call per cycle.
 */
public final class AutoHealer {
    private static final Logger LOG = LoggerFactory.getLogger(AutoHealer.class);

    private final String sessionId;
    private final EngineSettings settings;
    private final Clock clock;
    private final HealingEffects effects;
    private final Map<String, AgentHealthTracker> trackers = new TreeMap<>();

    public AutoHealer(String sessionId, EngineSettings settings, Clock clock, HealingEffects effects) {
        this.sessionId = sessionId;
        this.settings = settings;
        this.clock = clock;
        this.effects = effects;
    }

    public void register(String agentId) {
        trackers.putIfAbsent(agentId, new AgentHealthTracker(agentId, clock.millis()));
    }

    public Optional<AgentHealthTracker> tracker(String agentId) {
        return Optional.ofNullable(trackers.get(agentId));
    }

    public Map<String, AgentState> states() {
        Map<String, AgentState> out = new TreeMap<>();
        for (AgentHealthTracker t : trackers.values()) {
            out.put(t.agentId(), t.state());
        }
        return out;
    }

    public boolean anyUnhealthy() {
        for (AgentHealthTracker t : trackers.values()) {
            if (t.state() == AgentState.DEGRADED || t.state() == AgentState.UNREACHABLE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs one cycle over every tracked agent and returns the healing actions taken.
     *
     * @param probes   probe outcome per agent; empty when health checks are disabled
     * @param agentP95 rolling p95 latency per agent with enough samples
     */
    public List<HealingAction> evaluate(Map<String, ProbeOutcome> probes, Map<String, Long> agentP95) {
        List<HealingAction> actions = new ArrayList<>();
        double medianP95 = Percentiles.median(agentP95.values());
        for (AgentHealthTracker t : new ArrayList<>(trackers.values())) {
            switch (t.state()) {
                case REMOVED -> {
                }
                case UNREACHABLE -> recover(t, probes.get(t.agentId()), actions);
                default -> observe(t, probes.get(t.agentId()), slow(t.agentId(), agentP95, medianP95), actions);
            }
        }
        return actions;
    }

    private boolean slow(String agentId, Map<String, Long> agentP95, double medianP95) {
        Long p95 = agentP95.get(agentId);
        if (p95 == null || agentP95.size() < 2 || medianP95 <= 0.0d) {
            return false;
        }
        return p95 > settings.degradedLatencyMultiplier() * medianP95;
    }

    private void observe(AgentHealthTracker t, ProbeOutcome probe, boolean slow, List<HealingAction> actions) {
        boolean missed = probe != null && !probe.reachable();
        if (probe != null && probe.reachable()) {
            t.recordHeartbeat(probe.observedAtMs(), probe.latencyMs());
        }
        if (missed) {
            t.recordMiss();
        }
        if (t.state() == AgentState.HEALTHY || t.state() == AgentState.RECOVERED) {
            if (missed || slow) {
                transition(t, AgentState.DEGRADED, missed ? "missed health probe" : "p95 latency above swarm median");
                t.countDegradedWindow();
            } else if (t.state() == AgentState.RECOVERED) {
                transition(t, AgentState.HEALTHY, "recovered");
            }
            return;
        }
        // DEGRADED
        if (missed && t.consecutiveMisses() >= settings.missedProbeThreshold()) {
            transition(t, AgentState.UNREACHABLE, t.consecutiveMisses() + " consecutive missed probes");
            return;
        }
        if (!missed && !slow) {
            transition(t, AgentState.HEALTHY, "probe and latency back to normal");
            return;
        }
        t.countDegradedWindow();
        if (settings.predictiveHealingEnabled() && t.degradedWindows() >= settings.predictiveDegradedWindows()) {
            reassign(t, actions);
        }
    }

    private void recover(AgentHealthTracker t, ProbeOutcome probe, List<HealingAction> actions) {
        if (!settings.selfHealingEnabled()) {
            if (probe != null && probe.reachable()) {
                t.recordHeartbeat(probe.observedAtMs(), probe.latencyMs());
                transition(t, AgentState.RECOVERED, "probe answered again");
                transition(t, AgentState.HEALTHY, "recovered");
            }
            return;
        }
        String trigger = "agent unreachable after " + t.consecutiveMisses() + " missed probes";
        boolean restarted;
        String detail;
        try {
            restarted = effects.restart(t.agentId());
            detail = restarted ? "restart succeeded" : "restart reported failure";
        } catch (Exception e) {
            LOG.warn("session {} restart of {} failed", sessionId, t.agentId(), e);
            restarted = false;
            detail = "restart threw " + e.getClass().getSimpleName() + ": " + e.getMessage();
        }
        t.countRestartAttempt();
        detail = detail + " (attempt " + t.restartAttempts() + "/" + settings.maxRestartAttempts() + ")";
        actions.add(action(t.agentId(), trigger, HealingActionKind.RESTART_AGENT, restarted, detail));
        if (restarted) {
            t.recordHeartbeat(clock.millis(), 0L);
            transition(t, AgentState.RECOVERED, "restart succeeded");
            transition(t, AgentState.HEALTHY, "recovered");
            return;
        }
        if (t.restartAttempts() >= settings.maxRestartAttempts()) {
            // Graph first: the tracker only reads REMOVED once the vertex is gone.
            effects.removeAgent(t.agentId(), "exceeded " + settings.maxRestartAttempts() + " restart attempts");
            transition(t, AgentState.REMOVED, "restart failed " + t.restartAttempts() + " times");
        }
    }

    private void reassign(AgentHealthTracker t, List<HealingAction> actions) {
        List<InFlightTask> fresh = new ArrayList<>();
        for (InFlightTask task : effects.inFlightFor(t.agentId())) {
            if (t.markReassigned(task.taskId())) {
                fresh.add(task);
            }
        }
        if (fresh.isEmpty()) {
            return;
        }
        boolean accepted = effects.reassign(t.agentId(), fresh);
        List<String> ids = new ArrayList<>();
        for (InFlightTask task : fresh) {
            ids.add(task.taskId());
        }
        actions.add(action(t.agentId(), "degraded for " + t.degradedWindows() + " consecutive windows",
                HealingActionKind.REASSIGN_TASK, accepted, "tasks=" + ids));
    }

    private void transition(AgentHealthTracker t, AgentState next, String reason) {
        AgentState from = t.state();
        if (from == next) {
            return;
        }
        t.state(next);
        LOG.info("session {} agent {} {} -> {} ({})", sessionId, t.agentId(), from, next, reason);
        effects.stateChanged(t.agentId(), from, next);
    }

    public HealingAction action(String agentId, String trigger, HealingActionKind kind, boolean success, String detail) {
        return new HealingAction(Ids.healingAction(), sessionId, agentId, trigger, kind, clock.millis(), success, detail);
    }
}
