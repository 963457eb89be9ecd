package io.swarmmesh.error;

public final class TopologyTransitionException extends SwarmException {
    public TopologyTransitionException(String message) {
        super(ErrorCode.TOPOLOGY_TRANSITION_ERROR, message);
    }
}
