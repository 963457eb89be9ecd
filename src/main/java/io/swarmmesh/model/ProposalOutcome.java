package io.swarmmesh.model;

public enum ProposalOutcome {
    PENDING,
    APPROVED,
    REJECTED,
    TIMEOUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
