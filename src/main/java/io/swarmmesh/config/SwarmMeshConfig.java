package io.swarmmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one engine root.
 */
public final class SwarmMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "swarmmesh-settings.json";

    private final Path rootDir;

    public SwarmMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SwarmMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new SwarmMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("swarmmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path sessionsDir() {
        return rootDir.resolve("sessions");
    }

    public Path sessionStateFile(String sessionId) {
        return sessionsDir().resolve(sessionId + ".json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
