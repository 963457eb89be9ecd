package io.swarmmesh.error;

public final class StateStoreException extends SwarmException {
    public StateStoreException(String message, Throwable cause) {
        super(ErrorCode.STATE_STORE_FAILURE, message, cause);
    }
}
