package io.swarmmesh.agent;

import io.swarmmesh.model.Vote;

import java.util.Map;

/**
 * A logical worker the engine coordinates but never drives directly.
 *
 * <p>The host dispatches task work through {@link #execute(AgentTask)}; the engine itself only probes,
 * restarts and polls votes.
 */
public interface AgentHandle {
    String id();

    AgentResult execute(AgentTask task) throws Exception;

    ProbeResult probe();

    /**
     * Attempts to bring an unreachable agent back. Returns {@code true} when the agent is serving again.
     */
    boolean restart() throws Exception;

    Vote vote(BallotRequest request) throws Exception;

    /**
     * Reports what this agent observed the other participants voting. Honest agents relay what they saw.
     */
    default Map<String, Vote> reportPeerVotes(String proposalId, Map<String, Vote> observed) {
        return Map.copyOf(observed);
    }
}
