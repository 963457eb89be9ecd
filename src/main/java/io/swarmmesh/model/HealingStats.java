package io.swarmmesh.model;

import java.util.Map;

public record HealingStats(
        String sessionId,
        int totalActions,
        int successfulActions,
        double successRate,
        Map<HealingActionKind, KindStats> byKind
) {
    public record KindStats(int total, int successful) {
        public double successRate() {
            return total == 0 ? 0.0d : (double) successful / total;
        }
    }
}
