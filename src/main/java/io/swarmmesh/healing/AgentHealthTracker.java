package io.swarmmesh.healing;

import io.swarmmesh.model.AgentState;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable health bookkeeping of one agent. Touched only by the session worker.
 */
public final class AgentHealthTracker {
    private final String agentId;
    private AgentState state = AgentState.HEALTHY;
    private int consecutiveMisses;
    private int degradedWindows;
    private int restartAttempts;
    private long lastHeartbeatAtMs;
    private long lastProbeLatencyMs;
    private final Set<String> reassignedTasks = new LinkedHashSet<>();

    public AgentHealthTracker(String agentId, long registeredAtMs) {
        this.agentId = agentId;
        this.lastHeartbeatAtMs = registeredAtMs;
    }

    public String agentId() {
        return agentId;
    }

    public AgentState state() {
        return state;
    }

    void state(AgentState next) {
        if (next != AgentState.DEGRADED) {
            degradedWindows = 0;
            reassignedTasks.clear();
        }
        if (next == AgentState.HEALTHY) {
            consecutiveMisses = 0;
            restartAttempts = 0;
        }
        this.state = next;
    }

    public int consecutiveMisses() {
        return consecutiveMisses;
    }

    void recordMiss() {
        consecutiveMisses++;
    }

    void recordHeartbeat(long atMs, long latencyMs) {
        consecutiveMisses = 0;
        lastHeartbeatAtMs = atMs;
        lastProbeLatencyMs = latencyMs;
    }

    public int degradedWindows() {
        return degradedWindows;
    }

    void countDegradedWindow() {
        degradedWindows++;
    }

    public int restartAttempts() {
        return restartAttempts;
    }

    void countRestartAttempt() {
        restartAttempts++;
    }

    public long lastHeartbeatAtMs() {
        return lastHeartbeatAtMs;
    }

    public long lastProbeLatencyMs() {
        return lastProbeLatencyMs;
    }

    boolean markReassigned(String taskId) {
        return reassignedTasks.add(taskId);
    }
}
