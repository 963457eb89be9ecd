package io.swarmmesh.error;

public final class SessionNotFoundException extends SwarmException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Unknown or closed session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
