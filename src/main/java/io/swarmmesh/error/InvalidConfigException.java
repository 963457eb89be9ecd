package io.swarmmesh.error;

public final class InvalidConfigException extends SwarmException {
    public InvalidConfigException(String message) {
        super(ErrorCode.INVALID_CONFIG, message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIG, message, cause);
    }
}
