package io.swarmmesh.agent;

import io.swarmmesh.model.Vote;
import io.swarmmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Agent backed by an external command. The payload goes to stdin, stdout is the result.
 *
 * <p>Ballots are sent as a JSON object; the first output token must be {@code YES}, {@code NO} or
 * {@code ABSTAIN}.
 */
public final class ScriptAgentHandle implements AgentHandle {
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptAgentHandle(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script agent id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public AgentResult execute(AgentTask task) {
        return run(task.payload());
    }

    @Override
    public ProbeResult probe() {
        long started = System.nanoTime();
        boolean ok = isResolvable(command.get(0));
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        return ok ? ProbeResult.reachable(latencyMs) : ProbeResult.unreachable();
    }

    @Override
    public boolean restart() {
        // Each invocation spawns a fresh process, so a restart only has to confirm the binary is back.
        return probe().reachable();
    }

    @Override
    public Vote vote(BallotRequest request) {
        String ballot = Jsons.toCompactJson(Map.of(
                "proposal_id", request.proposalId(),
                "session_id", request.sessionId(),
                "text", request.text(),
                "algorithm", request.algorithm().wireName()
        ));
        AgentResult result = run(ballot);
        if (!result.success() || result.output() == null || result.output().isBlank()) {
            return Vote.ABSTAIN;
        }
        String first = result.output().strip().split("\\s+", 2)[0].toUpperCase(Locale.ROOT);
        try {
            return Vote.valueOf(first);
        } catch (IllegalArgumentException e) {
            return Vote.ABSTAIN;
        }
    }

    private AgentResult run(String payload) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return AgentResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            byte[] input = payload == null ? new byte[0] : payload.getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return AgentResult.fail("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() == 0) {
                return AgentResult.ok(combined.strip());
            }
            return AgentResult.fail("script exit=" + process.exitValue() + " output=" + truncate(combined));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return AgentResult.fail("script interrupted: " + id);
        } catch (IOException e) {
            process.destroyForcibly();
            return AgentResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private static boolean isResolvable(String executable) {
        Path direct = Path.of(executable);
        if (direct.isAbsolute() || executable.contains("/")) {
            return Files.isExecutable(direct);
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isBlank()) {
            return false;
        }
        for (String dir : pathEnv.split(java.io.File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
