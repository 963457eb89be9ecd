package io.swarmmesh.error;

import io.swarmmesh.model.TopologyKind;

public final class NoLeaderAvailableException extends SwarmException {
    public NoLeaderAvailableException(String sessionId, TopologyKind topology) {
        super(ErrorCode.NO_LEADER_AVAILABLE,
                "Raft needs a leader but session " + sessionId + " runs a " + topology.wireName() + " topology");
    }
}
