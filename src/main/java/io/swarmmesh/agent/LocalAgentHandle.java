package io.swarmmesh.agent;

import io.swarmmesh.model.Vote;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * In-process agent with scripted behavior, used by the demo command and by tests.
 *
 * <p>All knobs are volatile so a test can flip reachability or the ballot between health cycles.
 */
public final class LocalAgentHandle implements AgentHandle {
    private final String id;
    private final AtomicInteger restartCalls = new AtomicInteger();
    private final AtomicInteger executeCalls = new AtomicInteger();
    private volatile Vote vote = Vote.YES;
    private volatile boolean reachable = true;
    private volatile boolean restartSucceeds = true;
    private volatile boolean failTasks;
    private volatile long taskLatencyMs;
    private volatile long voteDelayMs;
    private volatile long probeLatencyMs = 1L;
    private volatile UnaryOperator<Map<String, Vote>> peerReportOverride;

    public LocalAgentHandle(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("local agent id cannot be empty");
        }
        this.id = id;
    }

    public LocalAgentHandle votes(Vote vote) {
        this.vote = vote;
        return this;
    }

    public LocalAgentHandle reachable(boolean reachable) {
        this.reachable = reachable;
        return this;
    }

    public LocalAgentHandle restartSucceeds(boolean restartSucceeds) {
        this.restartSucceeds = restartSucceeds;
        return this;
    }

    public LocalAgentHandle failTasks(boolean failTasks) {
        this.failTasks = failTasks;
        return this;
    }

    public LocalAgentHandle taskLatencyMs(long taskLatencyMs) {
        this.taskLatencyMs = Math.max(0L, taskLatencyMs);
        return this;
    }

    public LocalAgentHandle voteDelayMs(long voteDelayMs) {
        this.voteDelayMs = Math.max(0L, voteDelayMs);
        return this;
    }

    public LocalAgentHandle probeLatencyMs(long probeLatencyMs) {
        this.probeLatencyMs = Math.max(0L, probeLatencyMs);
        return this;
    }

    /**
     * Makes the agent lie about the votes it observed from its peers.
     */
    public LocalAgentHandle reportsPeerVotes(UnaryOperator<Map<String, Vote>> override) {
        this.peerReportOverride = override;
        return this;
    }

    public int restartCalls() {
        return restartCalls.get();
    }

    public int executeCalls() {
        return executeCalls.get();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public AgentResult execute(AgentTask task) throws InterruptedException {
        executeCalls.incrementAndGet();
        if (!reachable) {
            return AgentResult.fail("agent unreachable: " + id);
        }
        long latency = taskLatencyMs;
        if (latency > 0L) {
            Thread.sleep(latency);
        }
        if (failTasks) {
            return AgentResult.fail("scripted failure from " + id);
        }
        return AgentResult.ok("""
                {"agent":"%s","task":"%s","at":"%s"}""".formatted(id, task.taskId(), Instant.now()));
    }

    @Override
    public ProbeResult probe() {
        return reachable ? ProbeResult.reachable(probeLatencyMs) : ProbeResult.unreachable();
    }

    @Override
    public boolean restart() {
        restartCalls.incrementAndGet();
        if (restartSucceeds) {
            reachable = true;
            return true;
        }
        return false;
    }

    @Override
    public Vote vote(BallotRequest request) throws InterruptedException {
        long delay = voteDelayMs;
        if (delay > 0L) {
            Thread.sleep(delay);
        }
        return vote;
    }

    @Override
    public Map<String, Vote> reportPeerVotes(String proposalId, Map<String, Vote> observed) {
        UnaryOperator<Map<String, Vote>> override = peerReportOverride;
        if (override == null) {
            return Map.copyOf(observed);
        }
        return Map.copyOf(override.apply(new HashMap<>(observed)));
    }
}
