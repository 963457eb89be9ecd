package io.swarmmesh.error;

public final class AgentUnreachableException extends SwarmException {
    private final String agentId;

    public AgentUnreachableException(String agentId, String message) {
        super(ErrorCode.AGENT_UNREACHABLE, message);
        this.agentId = agentId;
    }

    public AgentUnreachableException(String agentId, String message, Throwable cause) {
        super(ErrorCode.AGENT_UNREACHABLE, message, cause);
        this.agentId = agentId;
    }

    public String agentId() {
        return agentId;
    }
}
