package io.swarmmesh.model;

public record HealingAction(
        String actionId,
        String sessionId,
        String agentId,
        String trigger,
        HealingActionKind actionKind,
        long appliedAtMs,
        boolean success,
        String detail
) {
}
