package io.swarmmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.error.StateStoreException;
import io.swarmmesh.util.Hashing;
import io.swarmmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Each row carries the hash of the previous row, so any edit to the file
 * breaks the chain from that row on.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    LOG.debug("audit file appeared concurrently: {}", auditFile);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("session_id", event.sessionId());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new StateStoreException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-hashes every row and checks the {@code prev_hash} links. Returns the number of verified rows, or
     * -1 when the chain is broken.
     */
    public synchronized int verifyChain() {
        try {
            String expectedPrev = "";
            int rows = 0;
            for (String line : readLines()) {
                JsonNode node = Jsons.mapper().readTree(line);
                String hash = node.path("hash").asText("");
                String prev = node.path("prev_hash").asText("");
                if (!prev.equals(expectedPrev)) {
                    return -1;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.compactMapper().convertValue(node, LinkedHashMap.class);
                row.remove("hash");
                if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                    return -1;
                }
                expectedPrev = hash;
                rows++;
            }
            return rows;
        } catch (IOException e) {
            throw new StateStoreException("Failed to verify audit log", e);
        }
    }

    private List<String> readLines() throws IOException {
        return Files.readAllLines(auditFile, StandardCharsets.UTF_8).stream()
                .filter(line -> line != null && !line.isBlank())
                .toList();
    }

    private String loadLastHash() {
        try {
            List<String> lines = readLines();
            if (lines.isEmpty()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(lines.get(lines.size() - 1));
            return node.path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("audit log {} unreadable, starting a fresh hash chain", auditFile, e);
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String sessionId,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String sessionId, String resource, String result,
                                    Map<String, Object> details) {
            return new AuditEvent(action, sessionId, resource, result, details == null ? Map.of() : details);
        }
    }
}
