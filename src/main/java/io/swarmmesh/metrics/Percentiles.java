package io.swarmmesh.metrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public final class Percentiles {
    private Percentiles() {
    }

    /**
     * Nearest-rank percentile, {@code p} in (0, 100]. Returns 0 for an empty sample.
     */
    public static long nearestRank(Collection<Long> samples, double p) {
        if (samples.isEmpty()) {
            return 0L;
        }
        List<Long> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        int rank = (int) Math.ceil(p / 100.0d * sorted.size());
        return sorted.get(Math.max(0, Math.min(sorted.size(), rank) - 1));
    }

    public static long p95(Collection<Long> samples) {
        return nearestRank(samples, 95.0d);
    }

    public static double median(Collection<Long> values) {
        if (values.isEmpty()) {
            return 0.0d;
        }
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0d;
    }
}
