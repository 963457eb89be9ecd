package io.swarmmesh.model;

public enum TaskResult {
    SUCCESS,
    FAILURE
}
