package io.swarmmesh.model;

public enum Vote {
    YES,
    NO,
    ABSTAIN
}
