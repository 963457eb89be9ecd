package io.swarmmesh.consensus;

import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.Vote;
import io.swarmmesh.topology.TopologyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Epidemic agreement. Each agent starts from its own vote (ABSTAIN when it did not answer); every round it
 * samples up to {@code gossipFanout} peers, preferring its topology neighbours, and adopts their YES/NO
 * majority, keeping its own value on a tie. The ballot converges once {@code gossipConvergenceThreshold}
 * of the agents hold the same value.
 */
public final class GossipProtocol implements ConsensusProtocol {
    private static final Logger LOG = LoggerFactory.getLogger(GossipProtocol.class);

    private final Random random;

    public GossipProtocol(Random random) {
        this.random = random;
    }

    @Override
    public ConsensusAlgorithm algorithm() {
        return ConsensusAlgorithm.GOSSIP;
    }

    @Override
    public ConsensusDecision decide(VotingContext context) throws InterruptedException {
        Map<String, Vote> votes = context.collector().collectVotes(context.proposal(), context.voters());
        int n = context.voters().size();
        if (votes.isEmpty()) {
            return ConsensusDecision.timeout(n, "no votes before deadline");
        }
        Map<String, Vote> state = new TreeMap<>();
        for (Voter v : context.voters()) {
            state.put(v.agentId(), votes.getOrDefault(v.agentId(), Vote.ABSTAIN));
        }
        int fanout = context.settings().gossipFanout();
        int maxRounds = context.settings().gossipMaxRounds();
        double threshold = context.settings().gossipConvergenceThreshold();
        long roundDelayMs = context.settings().gossipRoundDelayMs();

        int rounds = 0;
        while (true) {
            Agreement agreement = agreement(state);
            if (agreement.ratio() >= threshold && agreement.value() != null) {
                ProposalOutcome outcome = agreement.value() == Vote.YES ? ProposalOutcome.APPROVED : ProposalOutcome.REJECTED;
                return result(outcome, votes, n, rounds, agreement, true);
            }
            if (rounds >= maxRounds) {
                return result(ProposalOutcome.REJECTED, votes, n, rounds, agreement, false);
            }
            if (context.expired() || context.proposal().isDecided()) {
                return result(ProposalOutcome.TIMEOUT, votes, n, rounds, agreement, false);
            }
            if (rounds > 0 && roundDelayMs > 0L) {
                Thread.sleep(Math.min(roundDelayMs, context.remainingMs()));
            }
            state = round(state, context.graph(), fanout);
            rounds++;
            LOG.debug("proposal {} gossip round {} agreement {}", context.proposal().proposalId(), rounds,
                    agreement(state).ratio());
        }
    }

    Map<String, Vote> round(Map<String, Vote> state, TopologyGraph graph, int fanout) {
        Map<String, Vote> next = new TreeMap<>();
        for (Map.Entry<String, Vote> e : state.entrySet()) {
            List<String> peers = samplePeers(e.getKey(), state, graph, fanout);
            int yes = 0;
            int no = 0;
            for (String peer : peers) {
                Vote v = state.get(peer);
                if (v == Vote.YES) {
                    yes++;
                } else if (v == Vote.NO) {
                    no++;
                }
            }
            Vote adopted = e.getValue();
            if (yes > no) {
                adopted = Vote.YES;
            } else if (no > yes) {
                adopted = Vote.NO;
            }
            next.put(e.getKey(), adopted);
        }
        return next;
    }

    private List<String> samplePeers(String self, Map<String, Vote> state, TopologyGraph graph, int fanout) {
        List<String> candidates = new ArrayList<>();
        for (String neighbour : graph.neighbours(self)) {
            if (state.containsKey(neighbour)) {
                candidates.add(neighbour);
            }
        }
        if (candidates.isEmpty()) {
            for (String other : state.keySet()) {
                if (!other.equals(self)) {
                    candidates.add(other);
                }
            }
        }
        if (candidates.size() > fanout) {
            Collections.shuffle(candidates, random);
            return candidates.subList(0, fanout);
        }
        return candidates;
    }

    static Agreement agreement(Map<String, Vote> state) {
        if (state.isEmpty()) {
            return new Agreement(null, 0.0d);
        }
        int yes = 0;
        int no = 0;
        for (Vote v : state.values()) {
            if (v == Vote.YES) {
                yes++;
            } else if (v == Vote.NO) {
                no++;
            }
        }
        if (yes == 0 && no == 0) {
            return new Agreement(null, 0.0d);
        }
        Vote leading = yes >= no ? Vote.YES : Vote.NO;
        return new Agreement(leading, (double) Math.max(yes, no) / state.size());
    }

    private static ConsensusDecision result(ProposalOutcome outcome, Map<String, Vote> votes, int n, int rounds,
                                            Agreement agreement, boolean converged) {
        int yes = ConsensusDecision.count(votes, Vote.YES);
        int no = ConsensusDecision.count(votes, Vote.NO);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("rounds", rounds);
        detail.put("agreement_ratio", agreement.ratio());
        detail.put("converged", converged);
        if (agreement.value() != null) {
            detail.put("leading_value", agreement.value().name());
        }
        return new ConsensusDecision(outcome, yes, no, n - yes - no, detail);
    }

    record Agreement(Vote value, double ratio) {
    }
}
