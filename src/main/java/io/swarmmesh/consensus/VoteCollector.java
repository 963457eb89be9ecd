package io.swarmmesh.consensus;

import io.swarmmesh.agent.BallotRequest;
import io.swarmmesh.model.Vote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fans a request out to every voter on the vote pool and fans the answers back in until the proposal
 * deadline. Voters that fail or answer late are left out of the result.
 */
public final class VoteCollector {
    private static final Logger LOG = LoggerFactory.getLogger(VoteCollector.class);

    private final ExecutorService votePool;
    private final Clock clock;

    public VoteCollector(ExecutorService votePool, Clock clock) {
        this.votePool = votePool;
        this.clock = clock;
    }

    /**
     * Polls every voter and records the answers on the proposal. Returns the votes that counted.
     */
    public Map<String, Vote> collectVotes(ConsensusProposal proposal, Collection<Voter> voters)
            throws InterruptedException {
        BallotRequest request = new BallotRequest(proposal.proposalId(), proposal.sessionId(), proposal.text(),
                proposal.algorithm(), proposal.deadlineMs());
        Map<String, Vote> answers = fanOut(proposal, voters, v -> () -> v.handle().vote(request));
        Map<String, Vote> counted = new TreeMap<>();
        for (Map.Entry<String, Vote> e : answers.entrySet()) {
            if (proposal.recordVote(e.getKey(), e.getValue())) {
                counted.put(e.getKey(), e.getValue());
            }
        }
        return counted;
    }

    /**
     * Asks every voter what it saw the others vote, given the announced votes.
     */
    public Map<String, Map<String, Vote>> collectPeerReports(ConsensusProposal proposal, Collection<Voter> voters,
                                                            Map<String, Vote> announced) throws InterruptedException {
        Map<String, Vote> observed = Map.copyOf(announced);
        return fanOut(proposal, voters, v -> () -> v.handle().reportPeerVotes(proposal.proposalId(), observed));
    }

    <T> Map<String, T> fanOut(ConsensusProposal proposal, Collection<Voter> voters,
                              Function<Voter, Callable<T>> call) throws InterruptedException {
        Map<String, CompletableFuture<T>> pending = new LinkedHashMap<>();
        for (Voter voter : voters) {
            Callable<T> task = call.apply(voter);
            pending.put(voter.agentId(), CompletableFuture.supplyAsync(() -> {
                try {
                    return task.call();
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, votePool));
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]));
        long waitMs = Math.max(0L, proposal.deadlineMs() - clock.millis());
        try {
            CompletableFuture.anyOf(all, proposal.cancellation()).get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.debug("proposal {} deadline reached with {} of {} answers",
                    proposal.proposalId(), countDone(pending.values()), pending.size());
        } catch (ExecutionException e) {
            LOG.debug("proposal {} fan-out finished with failures", proposal.proposalId());
        }
        Map<String, T> out = new TreeMap<>();
        for (Map.Entry<String, CompletableFuture<T>> e : pending.entrySet()) {
            CompletableFuture<T> f = e.getValue();
            if (f.isDone() && !f.isCompletedExceptionally()) {
                T value = f.getNow(null);
                if (value != null) {
                    out.put(e.getKey(), value);
                }
            } else if (f.isCompletedExceptionally()) {
                LOG.warn("agent {} failed to answer proposal {}", e.getKey(), proposal.proposalId(),
                        failureOf(f));
            } else {
                f.cancel(false);
            }
        }
        return out;
    }

    private static int countDone(Collection<? extends CompletableFuture<?>> futures) {
        int n = 0;
        for (CompletableFuture<?> f : futures) {
            if (f.isDone()) {
                n++;
            }
        }
        return n;
    }

    private static Throwable failureOf(CompletableFuture<?> f) {
        try {
            f.join();
            return null;
        } catch (CompletionException e) {
            return e.getCause() == null ? e : e.getCause();
        } catch (RuntimeException e) {
            return e;
        }
    }
}
