package io.swarmmesh.model;

/**
 * Per-agent health state driven by the metrics and healing loop.
 *
 * <p>{@code RECOVERED} is transient: an agent passes through it after a successful restart and is
 * reported as {@code HEALTHY} right after. {@code REMOVED} is terminal.
 */
public enum AgentState {
    HEALTHY,
    DEGRADED,
    UNREACHABLE,
    RECOVERED,
    REMOVED
}
