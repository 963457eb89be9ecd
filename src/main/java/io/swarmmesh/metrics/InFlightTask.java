package io.swarmmesh.metrics;

/**
 * A task the host reported as started and not yet finished. {@code graphVersion} is the topology version
 * it was dispatched under.
 */
public record InFlightTask(String taskId, String agentId, long startedAtMs, long graphVersion) {
}
