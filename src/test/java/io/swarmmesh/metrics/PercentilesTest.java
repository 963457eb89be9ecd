package io.swarmmesh.metrics;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class PercentilesTest {

    @Test
    void nearestRankOnSmallSamples() {
        Assertions.assertEquals(0L, Percentiles.p95(List.of()));
        Assertions.assertEquals(7L, Percentiles.p95(List.of(7L)));
        Assertions.assertEquals(40L, Percentiles.p95(List.of(40L, 10L, 30L, 20L)));
        Assertions.assertEquals(10L, Percentiles.nearestRank(List.of(40L, 10L, 30L, 20L), 25.0d));
    }

    @Test
    void p95OfHundredSamplesIsNinetyFifthValue() {
        List<Long> samples = new ArrayList<>();
        for (long i = 100; i >= 1; i--) {
            samples.add(i);
        }
        Assertions.assertEquals(95L, Percentiles.p95(samples));
    }

    @Test
    void medianOfOddAndEvenCounts() {
        Assertions.assertEquals(0.0d, Percentiles.median(List.of()), 1e-9);
        Assertions.assertEquals(3.0d, Percentiles.median(List.of(5L, 1L, 3L)), 1e-9);
        Assertions.assertEquals(2.5d, Percentiles.median(List.of(4L, 1L, 3L, 2L)), 1e-9);
    }
}
