package io.swarmmesh.healing;

import io.swarmmesh.model.TopologyKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

final class BottleneckDetectorTest {

    @Test
    void firesAfterConsecutiveLowIntervals() {
        BottleneckDetector detector = new BottleneckDetector(0.7d, 3, 10);
        Assertions.assertTrue(detector.observe(100L, false).isEmpty());
        Assertions.assertTrue(detector.observe(100L, false).isEmpty());
        Assertions.assertEquals(100.0d, detector.baselineMean(), 1e-9);

        Assertions.assertTrue(detector.observe(40L, false).isEmpty());
        Assertions.assertTrue(detector.observe(40L, false).isEmpty());
        Optional<BottleneckDetector.Observation> fired = detector.observe(40L, false);
        Assertions.assertTrue(fired.isPresent());
        Assertions.assertEquals(40L, fired.get().throughput());
        Assertions.assertEquals(100.0d, fired.get().baseline(), 1e-9);
        Assertions.assertEquals(3, fired.get().lowIntervals());
        Assertions.assertEquals(0, detector.lowStreak());
        // low intervals never feed the baseline
        Assertions.assertEquals(100.0d, detector.baselineMean(), 1e-9);
    }

    @Test
    void normalIntervalBreaksTheStreak() {
        BottleneckDetector detector = new BottleneckDetector(0.7d, 3, 10);
        detector.observe(100L, false);
        detector.observe(50L, false);
        detector.observe(50L, false);
        Assertions.assertEquals(2, detector.lowStreak());
        Assertions.assertTrue(detector.observe(90L, false).isEmpty());
        Assertions.assertEquals(0, detector.lowStreak());
        Assertions.assertEquals(95.0d, detector.baselineMean(), 1e-9);
    }

    @Test
    void unhealthyAgentsExplainLowThroughput() {
        BottleneckDetector detector = new BottleneckDetector(0.7d, 2, 10);
        detector.observe(100L, false);
        detector.observe(10L, false);
        Assertions.assertTrue(detector.observe(10L, true).isEmpty());
        Assertions.assertEquals(0, detector.lowStreak());
        Assertions.assertTrue(detector.observe(10L, false).isEmpty());
        Assertions.assertTrue(detector.observe(10L, false).isPresent());
    }

    @Test
    void idleIntervalsAreIgnored() {
        BottleneckDetector detector = new BottleneckDetector(0.7d, 1, 10);
        Assertions.assertTrue(detector.observe(0L, false).isEmpty());
        Assertions.assertEquals(0.0d, detector.baselineMean(), 1e-9);
        detector.observe(20L, false);
        Assertions.assertTrue(detector.observe(0L, false).isEmpty());
        Assertions.assertEquals(0, detector.lowStreak());
        Assertions.assertTrue(detector.observe(5L, false).isPresent());
    }

    @Test
    void baselineIsRollingWindow() {
        BottleneckDetector detector = new BottleneckDetector(0.5d, 3, 2);
        detector.observe(10L, false);
        detector.observe(20L, false);
        detector.observe(30L, false);
        Assertions.assertEquals(25.0d, detector.baselineMean(), 1e-9);
    }

    @Test
    void recommendationMovesAwayFromCurrentShape() {
        Assertions.assertEquals(TopologyKind.HIERARCHICAL, BottleneckDetector.recommend(TopologyKind.MESH));
        Assertions.assertEquals(TopologyKind.HIERARCHICAL, BottleneckDetector.recommend(TopologyKind.STAR));
        Assertions.assertEquals(TopologyKind.MESH, BottleneckDetector.recommend(TopologyKind.RING));
        Assertions.assertEquals(TopologyKind.MESH, BottleneckDetector.recommend(TopologyKind.HIERARCHICAL));
    }
}
