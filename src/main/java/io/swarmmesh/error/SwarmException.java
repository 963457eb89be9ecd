package io.swarmmesh.error;

/**
 * Root of the typed failures the engine surfaces to its host.
 */
public abstract class SwarmException extends RuntimeException {
    private final ErrorCode code;

    protected SwarmException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SwarmException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
