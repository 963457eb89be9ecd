package io.swarmmesh.error;

import io.swarmmesh.model.ProposalOutcome;

/**
 * Raised when a decided proposal is submitted again. Carries the original outcome unchanged.
 */
public final class ProposalAlreadyDecidedException extends SwarmException {
    private final String proposalId;
    private final ProposalOutcome originalOutcome;

    public ProposalAlreadyDecidedException(String proposalId, ProposalOutcome originalOutcome) {
        super(ErrorCode.PROPOSAL_ALREADY_DECIDED,
                "Proposal " + proposalId + " already decided: " + originalOutcome);
        this.proposalId = proposalId;
        this.originalOutcome = originalOutcome;
    }

    public String proposalId() {
        return proposalId;
    }

    public ProposalOutcome originalOutcome() {
        return originalOutcome;
    }
}
