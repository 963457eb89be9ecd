package io.swarmmesh.metrics;

import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.model.TaskMetric;
import io.swarmmesh.model.TaskResult;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Task metrics of one session.
 *
 * <p>Host threads only enqueue: {@link #onTaskStart} and {@link #onTaskEnd} never take a lock. The session
 * worker drains the queue once per interval, which feeds the per-agent latency windows, the recent-metrics
 * buffer and the interval throughput count.
 */
public final class MetricsCollector {
    private final String sessionId;
    private final EngineSettings settings;
    private final Clock clock;
    private final Queue<TaskMetric> pending = new ConcurrentLinkedQueue<>();
    private final Map<String, InFlightTask> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Deque<Long>> latencyWindows = new TreeMap<>();
    private final Deque<TaskMetric> recent = new ArrayDeque<>();
    private long completedInInterval;
    private long completedTotal;
    private long failedTotal;

    public MetricsCollector(String sessionId, EngineSettings settings, Clock clock) {
        this.sessionId = sessionId;
        this.settings = settings;
        this.clock = clock;
    }

    public void onTaskStart(String agentId, String taskId, long graphVersion) {
        inFlight.put(taskId, new InFlightTask(taskId, agentId, clock.millis(), graphVersion));
    }

    public void onTaskEnd(String agentId, String taskId, long durationMs, TaskResult result) {
        inFlight.remove(taskId);
        if (!settings.metricsEnabled()) {
            return;
        }
        pending.add(new TaskMetric(taskId, sessionId, agentId, Math.max(0L, durationMs), result, clock.millis()));
    }

    /**
     * Takes every queued metric. Callers persist the result and then hand it to {@link #absorb(List)}.
     */
    public List<TaskMetric> drainPending() {
        List<TaskMetric> out = new ArrayList<>();
        TaskMetric m;
        while ((m = pending.poll()) != null) {
            out.add(m);
        }
        return out;
    }

    public synchronized void absorb(List<TaskMetric> stored) {
        int windowSize = settings.latencyWindowSize();
        int recentLimit = settings.recentMetricsLimit();
        for (TaskMetric m : stored) {
            Deque<Long> window = latencyWindows.computeIfAbsent(m.agentId(), k -> new ArrayDeque<>());
            window.addLast(m.durationMs());
            while (window.size() > windowSize) {
                window.removeFirst();
            }
            recent.addLast(m);
            while (recent.size() > recentLimit) {
                recent.removeFirst();
            }
            completedInInterval++;
            completedTotal++;
            if (m.result() == TaskResult.FAILURE) {
                failedTotal++;
            }
        }
    }

    /**
     * Tasks completed since the previous call. Resets the counter.
     */
    public synchronized long closeInterval() {
        long count = completedInInterval;
        completedInInterval = 0L;
        return count;
    }

    /**
     * Rolling p95 latency of every agent with at least {@code minLatencySamples} samples in its window.
     */
    public synchronized Map<String, Long> agentP95() {
        Map<String, Long> out = new TreeMap<>();
        for (Map.Entry<String, Deque<Long>> e : latencyWindows.entrySet()) {
            if (e.getValue().size() >= settings.minLatencySamples()) {
                out.put(e.getKey(), Percentiles.p95(e.getValue()));
            }
        }
        return out;
    }

    public synchronized long swarmP95() {
        List<Long> all = new ArrayList<>();
        for (Deque<Long> window : latencyWindows.values()) {
            all.addAll(window);
        }
        return Percentiles.p95(all);
    }

    /**
     * Last metrics in arrival order, including ones not drained yet.
     */
    public synchronized List<TaskMetric> recent() {
        List<TaskMetric> out = new ArrayList<>(recent);
        out.addAll(pending);
        int limit = settings.recentMetricsLimit();
        if (out.size() > limit) {
            return List.copyOf(out.subList(out.size() - limit, out.size()));
        }
        return List.copyOf(out);
    }

    public List<InFlightTask> inFlightFor(String agentId) {
        List<InFlightTask> out = new ArrayList<>();
        for (InFlightTask t : inFlight.values()) {
            if (t.agentId().equals(agentId)) {
                out.add(t);
            }
        }
        out.sort((a, b) -> a.taskId().compareTo(b.taskId()));
        return out;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Drops the agent's latency window and evicts its in-flight tasks. Returns the evicted tasks so the
     * caller can hand them to the host.
     */
    public synchronized List<InFlightTask> forgetAgent(String agentId) {
        latencyWindows.remove(agentId);
        List<InFlightTask> evicted = inFlightFor(agentId);
        for (InFlightTask t : evicted) {
            inFlight.remove(t.taskId(), t);
        }
        return evicted;
    }

    public synchronized long completedTotal() {
        return completedTotal;
    }

    public synchronized long failedTotal() {
        return failedTotal;
    }
}
