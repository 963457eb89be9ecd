package io.swarmmesh.healing;

import io.swarmmesh.model.TopologyKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Topology-level anomaly: aggregate throughput stays below {@code ratio} of its rolling baseline for
 * {@code intervals} consecutive measurement intervals while every agent is healthy.
 *
 * <p>The baseline is the mean of the last {@code baselineWindow} intervals that were neither low nor idle.
 * Idle intervals (no completed task) are ignored altogether.
 */
public final class BottleneckDetector {
    private final double ratio;
    private final int intervals;
    private final int baselineWindow;
    private final Deque<Long> baseline = new ArrayDeque<>();
    private int lowStreak;

    public BottleneckDetector(double ratio, int intervals, int baselineWindow) {
        this.ratio = ratio;
        this.intervals = Math.max(1, intervals);
        this.baselineWindow = Math.max(1, baselineWindow);
    }

    /**
     * Feeds one interval. Returns the observation when the bottleneck condition has just been met.
     */
    public Optional<Observation> observe(long completed, boolean anyAgentUnhealthy) {
        if (completed <= 0L) {
            return Optional.empty();
        }
        if (baseline.isEmpty()) {
            baseline.addLast(completed);
            return Optional.empty();
        }
        double base = baselineMean();
        boolean low = completed < ratio * base;
        if (!low) {
            lowStreak = 0;
            baseline.addLast(completed);
            while (baseline.size() > baselineWindow) {
                baseline.removeFirst();
            }
            return Optional.empty();
        }
        if (anyAgentUnhealthy) {
            lowStreak = 0;
            return Optional.empty();
        }
        lowStreak++;
        if (lowStreak < intervals) {
            return Optional.empty();
        }
        lowStreak = 0;
        return Optional.of(new Observation(completed, base, intervals));
    }

    public double baselineMean() {
        if (baseline.isEmpty()) {
            return 0.0d;
        }
        long sum = 0L;
        for (long v : baseline) {
            sum += v;
        }
        return (double) sum / baseline.size();
    }

    public int lowStreak() {
        return lowStreak;
    }

    /**
     * Topology suggested when the current one is the bottleneck.
     */
    public static TopologyKind recommend(TopologyKind effective) {
        return switch (effective) {
            case MESH, STAR -> TopologyKind.HIERARCHICAL;
            case RING, HIERARCHICAL, ADAPTIVE -> TopologyKind.MESH;
        };
    }

    public record Observation(long throughput, double baseline, int lowIntervals) {
        public String describe() {
            return "throughput " + throughput + " below " + baseline + " baseline for " + lowIntervals + " intervals";
        }
    }
}
