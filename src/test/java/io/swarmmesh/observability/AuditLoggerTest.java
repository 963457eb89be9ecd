package io.swarmmesh.observability;

import io.swarmmesh.error.ErrorCode;
import io.swarmmesh.error.StateStoreException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file);
            Assertions.assertEquals("", first.currentHash());
            first.log(AuditLogger.AuditEvent.of("session.init", "ses-1", "swarm/session", "ok",
                    Map.of("topology", "mesh", "agents", 3)));
            first.log(AuditLogger.AuditEvent.of("consensus.decide", "ses-1", "swarm/session", "APPROVED", null));
            Assertions.assertEquals(2, first.verifyChain());
            String head = first.currentHash();

            AuditLogger reopened = new AuditLogger(file);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("session.close", "ses-1", "swarm/session", "ok", Map.of()));
            Assertions.assertEquals(3, reopened.verifyChain());

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("APPROVED", "REJECTED"));
            Files.write(file, lines, StandardCharsets.UTF_8);
            Assertions.assertEquals(-1, reopened.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void droppedRowBreaksTheLinks() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-audit-drop-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            for (int i = 0; i < 3; i++) {
                audit.log(AuditLogger.AuditEvent.of("healing.action", "ses-2", "swarm/session", "ok",
                        Map.of("n", i)));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(file, lines, StandardCharsets.UTF_8);
            Assertions.assertEquals(-1, audit.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unwritableFileSurfacesAsStateStoreFailure() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-test-audit-io-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            audit.log(AuditLogger.AuditEvent.of("session.init", "ses-3", "swarm/session", "ok", null));
            Files.delete(file);
            Files.createDirectory(file);

            StateStoreException e = Assertions.assertThrows(StateStoreException.class,
                    () -> audit.log(AuditLogger.AuditEvent.of("session.close", "ses-3", "swarm/session", "ok", null)));
            Assertions.assertEquals(ErrorCode.STATE_STORE_FAILURE, e.code());
            Assertions.assertThrows(StateStoreException.class, audit::verifyChain);
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
