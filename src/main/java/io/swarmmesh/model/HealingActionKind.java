package io.swarmmesh.model;

public enum HealingActionKind {
    RESTART_AGENT,
    REASSIGN_TASK,
    SWITCH_TOPOLOGY
}
