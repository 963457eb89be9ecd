package io.swarmmesh.agent;

public record ProbeResult(boolean reachable, long latencyMs) {
    public static ProbeResult reachable(long latencyMs) {
        return new ProbeResult(true, Math.max(0L, latencyMs));
    }

    public static ProbeResult unreachable() {
        return new ProbeResult(false, -1L);
    }
}
