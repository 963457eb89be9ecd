package io.swarmmesh.consensus;

import io.swarmmesh.config.EngineSettings;
import io.swarmmesh.error.NoLeaderAvailableException;
import io.swarmmesh.error.ProposalAlreadyDecidedException;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.storage.SwarmStore;
import io.swarmmesh.topology.TopologyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs ballots with the protocol of the requested algorithm and keeps the registry of proposals.
 *
 * <p>A proposal id is decided at most once. Deciding it again raises {@link ProposalAlreadyDecidedException}
 * carrying the first outcome. Vote collection never holds a lock shared with other sessions.
 */
public final class ConsensusEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ConsensusEngine.class);

    private final EngineSettings settings;
    private final SwarmStore store;
    private final Clock clock;
    private final VoteCollector collector;
    private final Map<ConsensusAlgorithm, ConsensusProtocol> protocols = new EnumMap<>(ConsensusAlgorithm.class);
    private final Map<String, ConsensusProposal> proposals = new ConcurrentHashMap<>();

    public ConsensusEngine(EngineSettings settings, SwarmStore store, ExecutorService votePool, Clock clock,
                           Random gossipRandom) {
        this.settings = settings;
        this.store = store;
        this.clock = clock;
        this.collector = new VoteCollector(votePool, clock);
        register(new QuorumProtocol());
        register(new WeightedProtocol());
        register(new ByzantineProtocol());
        register(new RaftProtocol());
        register(new GossipProtocol(gossipRandom));
        register(new CrdtProtocol());
    }

    private void register(ConsensusProtocol protocol) {
        protocols.put(protocol.algorithm(), protocol);
    }

    /**
     * Decides a proposal and returns it in its terminal state. Blocks the caller until the tally is done or
     * the timeout elapses; a timeout is an outcome, not an error.
     */
    public ConsensusProposal decide(ConsensusRequest request) {
        ConsensusProposal existing = proposals.get(request.proposalId());
        if (existing != null) {
            throw new ProposalAlreadyDecidedException(request.proposalId(), existing.outcome());
        }
        Optional<ProposalRecord> persisted = store.loadProposal(request.proposalId());
        if (persisted.isPresent()) {
            throw new ProposalAlreadyDecidedException(request.proposalId(), persisted.get().outcome());
        }
        if (request.algorithm() == ConsensusAlgorithm.RAFT && request.graph().leaderId() == null) {
            throw new NoLeaderAvailableException(request.sessionId(), request.graph().effectiveKind());
        }
        long now = clock.millis();
        List<String> participants = new ArrayList<>();
        for (Voter v : request.voters()) {
            participants.add(v.agentId());
        }
        ConsensusProposal proposal = new ConsensusProposal(request.proposalId(), request.sessionId(), request.text(),
                request.algorithm(), now, now + Math.max(1L, request.timeoutMs()), participants);
        ConsensusProposal raced = proposals.putIfAbsent(request.proposalId(), proposal);
        if (raced != null) {
            throw new ProposalAlreadyDecidedException(request.proposalId(), raced.outcome());
        }
        store.saveProposal(proposal.toRecord());

        ConsensusDecision decision = run(proposal, request);
        Map<String, Object> detail = new LinkedHashMap<>(decision.detail());
        detail.put("yes", decision.yes());
        detail.put("no", decision.no());
        detail.put("abstain", decision.abstain());
        if (!proposal.complete(decision.outcome(), detail, clock.millis())) {
            LOG.info("proposal {} was closed before its tally finished, keeping {}", proposal.proposalId(),
                    proposal.outcome());
        }
        store.saveProposal(proposal.toRecord());
        LOG.info("proposal {} ({}) on session {} decided {} yes={} no={} abstain={}",
                proposal.proposalId(), request.algorithm().wireName(), request.sessionId(), proposal.outcome(),
                decision.yes(), decision.no(), decision.abstain());
        return proposal;
    }

    private ConsensusDecision run(ConsensusProposal proposal, ConsensusRequest request) {
        ConsensusProtocol protocol = protocols.get(request.algorithm());
        VotingContext context = new VotingContext(proposal, request.voters(), request.graph(), collector, settings, clock);
        try {
            return protocol.decide(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConsensusDecision.timeout(request.voters().size(), "interrupted");
        } catch (NoLeaderAvailableException e) {
            proposal.cancel("no leader", clock.millis());
            store.saveProposal(proposal.toRecord());
            throw e;
        } catch (RuntimeException e) {
            LOG.error("proposal {} tally failed", proposal.proposalId(), e);
            return ConsensusDecision.timeout(request.voters().size(), "tally failed: " + e.getMessage());
        }
    }

    /**
     * Ends every pending proposal of the session as {@code TIMEOUT}. Returns how many were cancelled.
     */
    public int cancelSession(String sessionId) {
        int cancelled = 0;
        for (ConsensusProposal p : proposals.values()) {
            if (p.sessionId().equals(sessionId) && p.cancel("session closed", clock.millis())) {
                store.saveProposal(p.toRecord());
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Drops decided proposals of a closed session from memory. They stay readable from the store.
     */
    public void forgetSession(String sessionId) {
        proposals.values().removeIf(p -> p.sessionId().equals(sessionId) && p.isDecided());
    }

    public List<ProposalRecord> openProposals(String sessionId) {
        List<ProposalRecord> out = new ArrayList<>();
        for (ConsensusProposal p : proposals.values()) {
            if (p.sessionId().equals(sessionId) && p.outcome() == ProposalOutcome.PENDING) {
                out.add(p.toRecord());
            }
        }
        return out;
    }

    public Optional<ProposalRecord> find(String proposalId) {
        ConsensusProposal live = proposals.get(proposalId);
        if (live != null) {
            return Optional.of(live.toRecord());
        }
        return store.loadProposal(proposalId);
    }

    public record ConsensusRequest(
            String proposalId,
            String sessionId,
            String text,
            ConsensusAlgorithm algorithm,
            List<Voter> voters,
            TopologyGraph graph,
            long timeoutMs
    ) {
        public ConsensusRequest {
            voters = List.copyOf(voters);
        }
    }
}
