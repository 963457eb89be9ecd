package io.swarmmesh.cli;

import io.swarmmesh.agent.AgentResult;
import io.swarmmesh.agent.AgentSpec;
import io.swarmmesh.agent.AgentTask;
import io.swarmmesh.agent.LocalAgentHandle;
import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.error.SwarmException;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.HealingAction;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.model.Vote;
import io.swarmmesh.runtime.SwarmCoordinator;
import io.swarmmesh.topology.TopologyGraph;
import io.swarmmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "swarmmesh",
        mixinStandardHelpOptions = true,
        description = "SwarmMesh agent swarm coordinator CLI",
        subcommands = {
                SwarmMeshCommand.InitCommand.class,
                SwarmMeshCommand.DemoCommand.class,
                SwarmMeshCommand.SessionsCommand.class,
                SwarmMeshCommand.StatusCommand.class,
                SwarmMeshCommand.MetricsCommand.class,
                SwarmMeshCommand.HealingCommand.class,
                SwarmMeshCommand.PurgeCommand.class
        }
)
public final class SwarmMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Engine data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | demo | sessions | status | metrics | healing | purge");
    }

    SwarmCoordinator coordinator() {
        return new SwarmCoordinator(SwarmMeshConfig.fromRoot(root));
    }

    private static int fail(SwarmException e) {
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("error", e.code().name());
        err.put("message", e.getMessage());
        System.out.println(Jsons.toJson(err));
        return 1;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Override
        public Integer call() {
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                System.out.println("Initialized SwarmMesh at: " + coordinator.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "demo", description = "Run an in-process swarm: tasks, one consensus vote, a topology switch")
    static final class DemoCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--agents"}, defaultValue = "5", description = "Number of local agents")
        int agents;

        @Option(names = {"--topology"}, defaultValue = "adaptive", description = "mesh|star|ring|hierarchical|adaptive")
        String topology;

        @Option(names = {"--consensus"}, defaultValue = "quorum",
                description = "quorum|weighted|byzantine|raft|gossip|crdt")
        String consensus;

        @Option(names = {"--tasks"}, defaultValue = "20", description = "Tasks dispatched across the agents")
        int tasks;

        @Option(names = {"--switch-to"}, defaultValue = "ring", description = "Topology applied after the vote")
        String switchTo;

        @Option(names = {"--proposal"}, defaultValue = "deploy", description = "Proposal text")
        String proposal;

        @Override
        public Integer call() throws Exception {
            TopologyKind kind;
            TopologyKind next;
            ConsensusAlgorithm algorithm;
            try {
                kind = TopologyKind.fromString(topology);
                next = TopologyKind.fromString(switchTo);
                algorithm = ConsensusAlgorithm.fromString(consensus);
            } catch (IllegalArgumentException e) {
                System.out.println("{\"error\":\"" + e.getMessage() + "\"}");
                return 2;
            }
            List<LocalAgentHandle> handles = new ArrayList<>();
            List<AgentSpec> specs = new ArrayList<>();
            for (int i = 1; i <= Math.max(1, agents); i++) {
                LocalAgentHandle handle = new LocalAgentHandle("agent-" + i)
                        .votes(i % 3 == 0 ? Vote.NO : Vote.YES)
                        .taskLatencyMs(i);
                handles.add(handle);
                specs.add(AgentSpec.of(handle).withTags(Set.of("demo")));
            }
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                String sessionId = coordinator.initSession(kind, algorithm, specs);
                for (int t = 0; t < Math.max(0, tasks); t++) {
                    LocalAgentHandle handle = handles.get(t % handles.size());
                    String taskId = sessionId + "-task-" + t;
                    coordinator.onTaskStart(sessionId, handle.id(), taskId);
                    long started = System.nanoTime();
                    AgentResult result = handle.execute(new AgentTask(sessionId, taskId, "demo payload " + t));
                    long tookMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
                    coordinator.onTaskEnd(sessionId, handle.id(), taskId, tookMs, result.taskResult());
                }
                ProposalRecord decided = coordinator.requestConsensus(sessionId, proposal, Duration.ofSeconds(5));
                TopologyGraph switched = coordinator.switchTopology(sessionId, next);
                List<HealingAction> actions = coordinator.runCycle(sessionId);

                Map<String, Object> out = new LinkedHashMap<>();
                out.put("session_id", sessionId);
                out.put("proposal", decided);
                out.put("switched_to", switched.effectiveKind().wireName());
                out.put("healing_actions", actions);
                out.put("status", coordinator.getStatus(sessionId));
                coordinator.closeSession(sessionId);
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (SwarmException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "sessions", description = "List persisted sessions, most recent first")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum rows")
        int limit;

        @Override
        public Integer call() {
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                System.out.println(Jsons.toJson(coordinator.listSessions(limit)));
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Show the persisted snapshot of a session")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                System.out.println(Jsons.toJson(coordinator.persistedStatus(sessionId)));
                return 0;
            } catch (SwarmException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics of a session")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                System.out.print(coordinator.metricsText(sessionId));
                return 0;
            } catch (SwarmException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "healing", description = "Show healing actions and success rates of a session")
    static final class HealingCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Maximum actions")
        int limit;

        @Override
        public Integer call() {
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("stats", coordinator.healingStats(sessionId));
                out.put("actions", coordinator.healingActions(sessionId, limit));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "purge", description = "Delete task metrics and health snapshots past retention")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--days"}, defaultValue = "7", description = "Keep rows newer than this many days")
        int days;

        @Override
        public Integer call() {
            try (SwarmCoordinator coordinator = parent.coordinator()) {
                coordinator.init();
                System.out.println(Jsons.toJson(coordinator.purgeExpired(days)));
                return 0;
            }
        }
    }
}
