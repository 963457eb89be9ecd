package io.swarmmesh.error;

public enum ErrorCode {
    INVALID_CONFIG,
    SESSION_NOT_FOUND,
    TOPOLOGY_TRANSITION_ERROR,
    NO_LEADER_AVAILABLE,
    PROPOSAL_ALREADY_DECIDED,
    AGENT_UNREACHABLE,
    STATE_STORE_FAILURE
}
