package io.swarmmesh.consensus;

import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.topology.TopologyGraph;

import java.time.Clock;
import java.util.List;

/**
 * Everything a protocol needs to run one ballot.
 */
public record VotingContext(
        ConsensusProposal proposal,
        List<Voter> voters,
        TopologyGraph graph,
        VoteCollector collector,
        EngineSettings settings,
        Clock clock
) {
    public long remainingMs() {
        return Math.max(0L, proposal.deadlineMs() - clock.millis());
    }

    public boolean expired() {
        return clock.millis() >= proposal.deadlineMs();
    }
}
