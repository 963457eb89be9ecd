package io.swarmmesh.storage;

import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.error.StateStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "swarmmesh.schema.migration.v1";
    private final SwarmMeshConfig config;
    private final String jdbcUrl;

    public Database(SwarmMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        // foreign_keys is a per-connection setting in SQLite, so it travels with every connection.
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", "5000");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.sessionsDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StateStoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sessions (
                        session_id TEXT PRIMARY KEY,
                        topology TEXT NOT NULL,
                        consensus_algorithm TEXT NOT NULL,
                        status TEXT NOT NULL,
                        agent_ids TEXT NOT NULL DEFAULT '[]',
                        leader_id TEXT,
                        graph_version INTEGER NOT NULL DEFAULT 0,
                        created_at INTEGER NOT NULL,
                        closed_at INTEGER,
                        failure_reason TEXT,
                        updated_at INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_agents (
                        session_id TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        capability_tags TEXT NOT NULL DEFAULT '[]',
                        weight REAL NOT NULL DEFAULT 1.0,
                        leader_eligible INTEGER NOT NULL DEFAULT 1,
                        state TEXT NOT NULL,
                        last_heartbeat_at INTEGER NOT NULL DEFAULT 0,
                        updated_at INTEGER NOT NULL,
                        PRIMARY KEY(session_id, agent_id),
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS topology_graphs (
                        session_id TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        kind TEXT NOT NULL,
                        effective_kind TEXT NOT NULL,
                        leader_id TEXT,
                        edges TEXT NOT NULL,
                        created_at INTEGER NOT NULL,
                        PRIMARY KEY(session_id, version),
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_metrics (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL,
                        session_id TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        duration_ms INTEGER NOT NULL,
                        result TEXT NOT NULL,
                        ts INTEGER NOT NULL,
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS health_snapshots (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        agent_id TEXT NOT NULL,
                        session_id TEXT NOT NULL,
                        ts INTEGER NOT NULL,
                        reachable INTEGER NOT NULL,
                        latency_ms INTEGER NOT NULL,
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS proposals (
                        proposal_id TEXT PRIMARY KEY,
                        session_id TEXT NOT NULL,
                        text TEXT NOT NULL,
                        algorithm TEXT NOT NULL,
                        participants TEXT NOT NULL DEFAULT '[]',
                        created_at INTEGER NOT NULL,
                        deadline_ms INTEGER NOT NULL,
                        outcome TEXT NOT NULL,
                        decided_at INTEGER,
                        detail TEXT NOT NULL DEFAULT '{}',
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS proposal_votes (
                        proposal_id TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        vote TEXT NOT NULL,
                        PRIMARY KEY(proposal_id, agent_id),
                        FOREIGN KEY(proposal_id) REFERENCES proposals(proposal_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS healing_actions (
                        action_id TEXT PRIMARY KEY,
                        session_id TEXT NOT NULL,
                        agent_id TEXT,
                        trigger_text TEXT NOT NULL,
                        action_kind TEXT NOT NULL,
                        applied_at INTEGER NOT NULL,
                        success INTEGER NOT NULL,
                        detail TEXT,
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_status_created ON sessions(status, created_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_metrics_session_ts ON task_metrics(session_id, ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_metrics_agent_ts ON task_metrics(session_id, agent_id, ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_metrics_ts ON task_metrics(ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_health_agent_ts ON health_snapshots(session_id, agent_id, ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_health_ts ON health_snapshots(ts)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_proposals_session_outcome ON proposals(session_id, outcome)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_healing_session_applied ON healing_actions(session_id, applied_at)");
        } catch (SQLException e) {
            throw new StateStoreException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_topology_history_index",
                "Index topology history by creation time",
                List.of("CREATE INDEX IF NOT EXISTS idx_topology_graphs_created ON topology_graphs(session_id, created_at)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StateStoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
