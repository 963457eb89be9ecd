package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.Vote;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * A live proposal. Votes are accepted only from the participants fixed at creation and only while the
 * outcome is {@code PENDING}; once an outcome is set the proposal never changes again.
 */
public final class ConsensusProposal {
    private final String proposalId;
    private final String sessionId;
    private final String text;
    private final ConsensusAlgorithm algorithm;
    private final long createdAtMs;
    private final long deadlineMs;
    private final List<String> participants;
    private final Set<String> participantSet;
    private final Map<String, Vote> votes = new TreeMap<>();
    private final CompletableFuture<Void> cancellation = new CompletableFuture<>();
    private ProposalOutcome outcome = ProposalOutcome.PENDING;
    private Long decidedAtMs;
    private Map<String, Object> detail = Map.of();

    public ConsensusProposal(String proposalId, String sessionId, String text, ConsensusAlgorithm algorithm,
                             long createdAtMs, long deadlineMs, List<String> participants) {
        this.proposalId = proposalId;
        this.sessionId = sessionId;
        this.text = text;
        this.algorithm = algorithm;
        this.createdAtMs = createdAtMs;
        this.deadlineMs = deadlineMs;
        this.participants = List.copyOf(participants);
        this.participantSet = Set.copyOf(participants);
    }

    public String proposalId() {
        return proposalId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String text() {
        return text;
    }

    public ConsensusAlgorithm algorithm() {
        return algorithm;
    }

    public long deadlineMs() {
        return deadlineMs;
    }

    public List<String> participants() {
        return participants;
    }

    /**
     * Accepts a vote. Returns false for late votes and for agents that were not participants.
     */
    public synchronized boolean recordVote(String agentId, Vote vote) {
        if (outcome.isTerminal() || !participantSet.contains(agentId) || vote == null) {
            return false;
        }
        votes.put(agentId, vote);
        return true;
    }

    public synchronized Map<String, Vote> votes() {
        return Map.copyOf(votes);
    }

    public synchronized ProposalOutcome outcome() {
        return outcome;
    }

    public synchronized boolean isDecided() {
        return outcome.isTerminal();
    }

    /**
     * Sets the terminal outcome. Returns false when an outcome was already set.
     */
    public synchronized boolean complete(ProposalOutcome result, Map<String, Object> resultDetail, long nowMs) {
        if (outcome.isTerminal() || !result.isTerminal()) {
            return false;
        }
        outcome = result;
        decidedAtMs = nowMs;
        detail = resultDetail == null ? Map.of() : Map.copyOf(resultDetail);
        return true;
    }

    /**
     * Ends a pending proposal as {@code TIMEOUT} and wakes anything waiting on its votes.
     */
    public boolean cancel(String reason, long nowMs) {
        boolean changed = complete(ProposalOutcome.TIMEOUT, Map.of("reason", reason), nowMs);
        cancellation.complete(null);
        return changed;
    }

    CompletableFuture<Void> cancellation() {
        return cancellation;
    }

    public synchronized ProposalRecord toRecord() {
        return new ProposalRecord(proposalId, sessionId, text, algorithm, createdAtMs, deadlineMs,
                participants, votes, outcome, decidedAtMs, detail);
    }
}
