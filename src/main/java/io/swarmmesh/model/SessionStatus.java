package io.swarmmesh.model;

public enum SessionStatus {
    ACTIVE,
    CLOSED
}
