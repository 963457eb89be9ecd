package io.swarmmesh.consensus;

import io.swarmmesh.agent.AgentHandle;

/**
 * One participant of a ballot, frozen at proposal creation.
 */
public record Voter(String agentId, double weight, AgentHandle handle) {
}
