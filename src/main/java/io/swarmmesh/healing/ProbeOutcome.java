package io.swarmmesh.healing;

/**
 * Result of one liveness probe as seen by the session worker. A probe that timed out or threw is a miss.
 */
public record ProbeOutcome(boolean reachable, long latencyMs, long observedAtMs) {
    public static ProbeOutcome miss(long atMs) {
        return new ProbeOutcome(false, 0L, atMs);
    }
}
