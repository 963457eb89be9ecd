package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;

/**
 * Vote collection and tally rule of one consensus algorithm.
 */
public interface ConsensusProtocol {
    ConsensusAlgorithm algorithm();

    ConsensusDecision decide(VotingContext context) throws InterruptedException;
}
