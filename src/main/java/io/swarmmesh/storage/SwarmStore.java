package io.swarmmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.swarmmesh.error.StateStoreException;
import io.swarmmesh.model.AgentState;
import io.swarmmesh.model.AgentView;
import io.swarmmesh.model.ConsensusAlgorithm;
import io.swarmmesh.model.HealingAction;
import io.swarmmesh.model.HealingActionKind;
import io.swarmmesh.model.HealingStats;
import io.swarmmesh.model.HealthSnapshot;
import io.swarmmesh.model.ProposalOutcome;
import io.swarmmesh.model.ProposalRecord;
import io.swarmmesh.model.SessionRecord;
import io.swarmmesh.model.SessionStatus;
import io.swarmmesh.model.TaskMetric;
import io.swarmmesh.model.TaskResult;
import io.swarmmesh.model.TopologyKind;
import io.swarmmesh.model.Vote;
import io.swarmmesh.topology.TopologyGraph;
import io.swarmmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Relational persistence for sessions, agents, topology history, metrics, proposals and healing actions.
 *
 * <p>Every multi-statement write runs in one JDBC transaction. Task metrics and health snapshots are
 * append-only and their timestamps are kept strictly increasing per (session, agent): a row whose
 * timestamp is not newer than the last stored one is written at {@code last + 1}.
 */
public final class SwarmStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, List<String>>> EDGE_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> DETAIL_MAP = new TypeReference<>() {
    };

    private final Database database;

    public SwarmStore(Database database) {
        this.database = database;
    }

    public Database database() {
        return database;
    }

    public void saveSession(SessionRecord session, List<AgentView> agents) {
        long nowMs = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO sessions(session_id,topology,consensus_algorithm,status,agent_ids,leader_id,graph_version,created_at,closed_at,failure_reason,updated_at)
                        VALUES(?,?,?,?,?,?,?,?,?,?,?)
                        ON CONFLICT(session_id) DO UPDATE SET
                            topology=excluded.topology,
                            consensus_algorithm=excluded.consensus_algorithm,
                            status=excluded.status,
                            agent_ids=excluded.agent_ids,
                            leader_id=excluded.leader_id,
                            graph_version=excluded.graph_version,
                            closed_at=excluded.closed_at,
                            failure_reason=excluded.failure_reason,
                            updated_at=excluded.updated_at
                        """)) {
                    ps.setString(1, session.sessionId());
                    ps.setString(2, session.topology().wireName());
                    ps.setString(3, session.consensusAlgorithm().wireName());
                    ps.setString(4, session.status().name());
                    ps.setString(5, toJson(session.agentIds()));
                    ps.setString(6, session.leaderId());
                    ps.setLong(7, session.graphVersion());
                    ps.setLong(8, session.createdAtMs());
                    setNullableLong(ps, 9, session.closedAtMs());
                    ps.setString(10, session.failureReason());
                    ps.setLong(11, nowMs);
                    ps.executeUpdate();
                }
                upsertAgents(c, session.sessionId(), agents, nowMs);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to save session " + session.sessionId(), e);
        }
    }

    public void saveAgentStates(String sessionId, List<AgentView> agents) {
        long nowMs = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                upsertAgents(c, sessionId, agents, nowMs);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to save agent states of " + sessionId, e);
        }
    }

    private void upsertAgents(Connection c, String sessionId, List<AgentView> agents, long nowMs) throws SQLException {
        if (agents == null || agents.isEmpty()) {
            return;
        }
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO session_agents(session_id,agent_id,capability_tags,weight,leader_eligible,state,last_heartbeat_at,updated_at)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(session_id,agent_id) DO UPDATE SET
                    capability_tags=excluded.capability_tags,
                    weight=excluded.weight,
                    leader_eligible=excluded.leader_eligible,
                    state=excluded.state,
                    last_heartbeat_at=excluded.last_heartbeat_at,
                    updated_at=excluded.updated_at
                """)) {
            for (AgentView a : agents) {
                ps.setString(1, sessionId);
                ps.setString(2, a.agentId());
                ps.setString(3, toJson(new TreeSet<>(a.capabilityTags())));
                ps.setDouble(4, a.weight());
                ps.setInt(5, a.leaderEligible() ? 1 : 0);
                ps.setString(6, a.state().name());
                ps.setLong(7, a.lastHeartbeatAtMs());
                ps.setLong(8, nowMs);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public Optional<SessionRecord> loadSession(String sessionId) {
        String sql = """
                SELECT session_id,topology,consensus_algorithm,status,agent_ids,leader_id,graph_version,created_at,closed_at,failure_reason
                FROM sessions WHERE session_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapSession(rs));
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load session " + sessionId, e);
        }
    }

    /**
     * Persisted sessions, most recent first.
     */
    public List<SessionRecord> listSessions(int limit) {
        String sql = """
                SELECT session_id,topology,consensus_algorithm,status,agent_ids,leader_id,graph_version,created_at,closed_at,failure_reason
                FROM sessions ORDER BY created_at DESC, session_id DESC LIMIT ?
                """;
        List<SessionRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapSession(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list sessions", e);
        }
    }

    private SessionRecord mapSession(ResultSet rs) throws SQLException {
        long closedAt = rs.getLong("closed_at");
        Long closedAtMs = rs.wasNull() ? null : closedAt;
        return new SessionRecord(
                rs.getString("session_id"),
                TopologyKind.fromString(rs.getString("topology")),
                ConsensusAlgorithm.fromString(rs.getString("consensus_algorithm")),
                SessionStatus.valueOf(rs.getString("status")),
                fromJson(rs.getString("agent_ids"), STRING_LIST),
                rs.getString("leader_id"),
                rs.getLong("graph_version"),
                rs.getLong("created_at"),
                closedAtMs,
                rs.getString("failure_reason")
        );
    }

    public List<AgentView> loadAgents(String sessionId) {
        String sql = """
                SELECT agent_id,capability_tags,weight,leader_eligible,state,last_heartbeat_at
                FROM session_agents WHERE session_id=? ORDER BY agent_id ASC
                """;
        List<AgentView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AgentView(
                            rs.getString("agent_id"),
                            new LinkedHashSet<>(fromJson(rs.getString("capability_tags"), STRING_LIST)),
                            AgentState.valueOf(rs.getString("state")),
                            rs.getLong("last_heartbeat_at"),
                            rs.getDouble("weight"),
                            rs.getInt("leader_eligible") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load agents of " + sessionId, e);
        }
    }

    /**
     * Appends a graph version and points the session row at it, in one transaction.
     */
    public void saveTopology(TopologyGraph graph) {
        long nowMs = Instant.now().toEpochMilli();
        Map<String, List<String>> edges = new TreeMap<>();
        for (Map.Entry<String, SortedSet<String>> e : graph.edges().entrySet()) {
            edges.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ins = c.prepareStatement("""
                        INSERT INTO topology_graphs(session_id,version,kind,effective_kind,leader_id,edges,created_at)
                        VALUES(?,?,?,?,?,?,?)
                        """)) {
                    ins.setString(1, graph.sessionId());
                    ins.setLong(2, graph.version());
                    ins.setString(3, graph.kind().wireName());
                    ins.setString(4, graph.effectiveKind().wireName());
                    ins.setString(5, graph.leaderId());
                    ins.setString(6, toJson(edges));
                    ins.setLong(7, graph.createdAtMs());
                    ins.executeUpdate();
                }
                int updated;
                try (PreparedStatement upd = c.prepareStatement("""
                        UPDATE sessions SET topology=?, agent_ids=?, leader_id=?, graph_version=?, updated_at=?
                        WHERE session_id=?
                        """)) {
                    upd.setString(1, graph.kind().wireName());
                    upd.setString(2, toJson(new ArrayList<>(graph.vertices())));
                    upd.setString(3, graph.leaderId());
                    upd.setLong(4, graph.version());
                    upd.setLong(5, nowMs);
                    upd.setString(6, graph.sessionId());
                    updated = upd.executeUpdate();
                }
                if (updated != 1) {
                    throw new SQLException("session row missing for " + graph.sessionId());
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to save topology v" + graph.version() + " of " + graph.sessionId(), e);
        }
    }

    /**
     * Latest persisted graph of the session.
     */
    public Optional<TopologyGraph> loadTopology(String sessionId) {
        String sql = """
                SELECT session_id,version,kind,effective_kind,leader_id,edges,created_at
                FROM topology_graphs WHERE session_id=? ORDER BY version DESC LIMIT 1
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Map<String, List<String>> raw = fromJson(rs.getString("edges"), EDGE_MAP);
                SortedMap<String, SortedSet<String>> edges = new TreeMap<>();
                for (Map.Entry<String, List<String>> e : raw.entrySet()) {
                    edges.put(e.getKey(), new TreeSet<>(e.getValue()));
                }
                return Optional.of(new TopologyGraph(
                        rs.getString("session_id"),
                        TopologyKind.fromString(rs.getString("kind")),
                        TopologyKind.fromString(rs.getString("effective_kind")),
                        edges,
                        rs.getString("leader_id"),
                        rs.getLong("version"),
                        rs.getLong("created_at")
                ));
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load topology of " + sessionId, e);
        }
    }

    public int countTopologyVersions(String sessionId) {
        return countWhereSession("SELECT COUNT(*) FROM topology_graphs WHERE session_id=?", sessionId);
    }

    public TaskMetric appendMetric(TaskMetric metric) {
        List<TaskMetric> stored = appendMetrics(List.of(metric));
        return stored.get(0);
    }

    /**
     * Appends metrics in one transaction and returns them as stored, with timestamps possibly bumped.
     */
    public List<TaskMetric> appendMetrics(List<TaskMetric> metrics) {
        if (metrics.isEmpty()) {
            return List.of();
        }
        List<TaskMetric> stored = new ArrayList<>(metrics.size());
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement last = c.prepareStatement(
                    "SELECT MAX(ts) FROM task_metrics WHERE session_id=? AND agent_id=?");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO task_metrics(task_id,session_id,agent_id,duration_ms,result,ts) VALUES(?,?,?,?,?,?)")) {
                for (TaskMetric m : metrics) {
                    long ts = monotonic(last, m.sessionId(), m.agentId(), m.timestampMs());
                    ins.setString(1, m.taskId());
                    ins.setString(2, m.sessionId());
                    ins.setString(3, m.agentId());
                    ins.setLong(4, m.durationMs());
                    ins.setString(5, m.result().name());
                    ins.setLong(6, ts);
                    ins.executeUpdate();
                    stored.add(new TaskMetric(m.taskId(), m.sessionId(), m.agentId(), m.durationMs(), m.result(), ts));
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
            return stored;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to append task metrics", e);
        }
    }

    public HealthSnapshot appendHealth(HealthSnapshot snapshot) {
        List<HealthSnapshot> stored = appendHealth(List.of(snapshot));
        return stored.get(0);
    }

    public List<HealthSnapshot> appendHealth(List<HealthSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return List.of();
        }
        List<HealthSnapshot> stored = new ArrayList<>(snapshots.size());
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement last = c.prepareStatement(
                    "SELECT MAX(ts) FROM health_snapshots WHERE session_id=? AND agent_id=?");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO health_snapshots(agent_id,session_id,ts,reachable,latency_ms) VALUES(?,?,?,?,?)")) {
                for (HealthSnapshot h : snapshots) {
                    long ts = monotonic(last, h.sessionId(), h.agentId(), h.timestampMs());
                    ins.setString(1, h.agentId());
                    ins.setString(2, h.sessionId());
                    ins.setLong(3, ts);
                    ins.setInt(4, h.reachable() ? 1 : 0);
                    ins.setLong(5, h.latencyMs());
                    ins.executeUpdate();
                    stored.add(new HealthSnapshot(h.sessionId(), h.agentId(), ts, h.reachable(), h.latencyMs()));
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
            return stored;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to append health snapshots", e);
        }
    }

    private long monotonic(PreparedStatement last, String sessionId, String agentId, long requestedTs) throws SQLException {
        last.setString(1, sessionId);
        last.setString(2, agentId);
        try (ResultSet rs = last.executeQuery()) {
            if (rs.next()) {
                long prev = rs.getLong(1);
                if (!rs.wasNull() && requestedTs <= prev) {
                    return prev + 1;
                }
            }
        }
        return requestedTs;
    }

    /**
     * Last {@code limit} metrics of the session in chronological order.
     */
    public List<TaskMetric> queryRecentMetrics(String sessionId, int limit) {
        String sql = """
                SELECT task_id,session_id,agent_id,duration_ms,result,ts FROM (
                    SELECT id,task_id,session_id,agent_id,duration_ms,result,ts
                    FROM task_metrics WHERE session_id=?
                    ORDER BY ts DESC, id DESC LIMIT ?
                ) ORDER BY ts ASC, id ASC
                """;
        List<TaskMetric> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TaskMetric(
                            rs.getString("task_id"),
                            rs.getString("session_id"),
                            rs.getString("agent_id"),
                            rs.getLong("duration_ms"),
                            TaskResult.valueOf(rs.getString("result")),
                            rs.getLong("ts")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to query metrics of " + sessionId, e);
        }
    }

    public List<HealthSnapshot> queryRecentHealth(String sessionId, String agentId, int limit) {
        String sql = """
                SELECT session_id,agent_id,ts,reachable,latency_ms FROM (
                    SELECT id,session_id,agent_id,ts,reachable,latency_ms
                    FROM health_snapshots WHERE session_id=? AND agent_id=?
                    ORDER BY ts DESC, id DESC LIMIT ?
                ) ORDER BY ts ASC, id ASC
                """;
        List<HealthSnapshot> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setString(2, agentId);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new HealthSnapshot(
                            rs.getString("session_id"),
                            rs.getString("agent_id"),
                            rs.getLong("ts"),
                            rs.getInt("reachable") == 1,
                            rs.getLong("latency_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to query health of " + agentId, e);
        }
    }

    public int countMetrics(String sessionId) {
        return countWhereSession("SELECT COUNT(*) FROM task_metrics WHERE session_id=?", sessionId);
    }

    public int countFailedMetrics(String sessionId) {
        return countWhereSession(
                "SELECT COUNT(*) FROM task_metrics WHERE session_id=? AND result='FAILURE'", sessionId);
    }

    public int countHealth(String sessionId) {
        return countWhereSession("SELECT COUNT(*) FROM health_snapshots WHERE session_id=?", sessionId);
    }

    public void appendHealingAction(HealingAction action) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                INSERT INTO healing_actions(action_id,session_id,agent_id,trigger_text,action_kind,applied_at,success,detail)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, action.actionId());
            ps.setString(2, action.sessionId());
            ps.setString(3, action.agentId());
            ps.setString(4, action.trigger());
            ps.setString(5, action.actionKind().name());
            ps.setLong(6, action.appliedAtMs());
            ps.setInt(7, action.success() ? 1 : 0);
            ps.setString(8, action.detail());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("Failed to append healing action " + action.actionId(), e);
        }
    }

    /**
     * Healing actions of the session, oldest first.
     */
    public List<HealingAction> listHealingActions(String sessionId, int limit) {
        String sql = """
                SELECT action_id,session_id,agent_id,trigger_text,action_kind,applied_at,success,detail
                FROM healing_actions WHERE session_id=?
                ORDER BY applied_at ASC, rowid ASC LIMIT ?
                """;
        List<HealingAction> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new HealingAction(
                            rs.getString("action_id"),
                            rs.getString("session_id"),
                            rs.getString("agent_id"),
                            rs.getString("trigger_text"),
                            HealingActionKind.valueOf(rs.getString("action_kind")),
                            rs.getLong("applied_at"),
                            rs.getInt("success") == 1,
                            rs.getString("detail")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list healing actions of " + sessionId, e);
        }
    }

    public HealingStats healingStats(String sessionId) {
        String sql = """
                SELECT action_kind, COUNT(*) AS total, SUM(success) AS ok
                FROM healing_actions WHERE session_id=? GROUP BY action_kind
                """;
        Map<HealingActionKind, HealingStats.KindStats> byKind = new EnumMap<>(HealingActionKind.class);
        int total = 0;
        int ok = 0;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int kindTotal = rs.getInt("total");
                    int kindOk = rs.getInt("ok");
                    byKind.put(HealingActionKind.valueOf(rs.getString("action_kind")),
                            new HealingStats.KindStats(kindTotal, kindOk));
                    total += kindTotal;
                    ok += kindOk;
                }
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to compute healing stats of " + sessionId, e);
        }
        double rate = total == 0 ? 0.0d : (double) ok / total;
        return new HealingStats(sessionId, total, ok, rate, Collections.unmodifiableMap(byKind));
    }

    public void saveProposal(ProposalRecord p) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                try (PreparedStatement ps = c.prepareStatement("""
                        INSERT INTO proposals(proposal_id,session_id,text,algorithm,participants,created_at,deadline_ms,outcome,decided_at,detail)
                        VALUES(?,?,?,?,?,?,?,?,?,?)
                        ON CONFLICT(proposal_id) DO UPDATE SET
                            outcome=excluded.outcome,
                            decided_at=excluded.decided_at,
                            detail=excluded.detail
                        """)) {
                    ps.setString(1, p.proposalId());
                    ps.setString(2, p.sessionId());
                    ps.setString(3, p.text());
                    ps.setString(4, p.algorithm().wireName());
                    ps.setString(5, toJson(p.participants()));
                    ps.setLong(6, p.createdAtMs());
                    ps.setLong(7, p.deadlineMs());
                    ps.setString(8, p.outcome().name());
                    setNullableLong(ps, 9, p.decidedAtMs());
                    ps.setString(10, toJson(p.detail()));
                    ps.executeUpdate();
                }
                try (PreparedStatement vs = c.prepareStatement("""
                        INSERT INTO proposal_votes(proposal_id,agent_id,vote) VALUES(?,?,?)
                        ON CONFLICT(proposal_id,agent_id) DO UPDATE SET vote=excluded.vote
                        """)) {
                    for (Map.Entry<String, Vote> v : p.votes().entrySet()) {
                        vs.setString(1, p.proposalId());
                        vs.setString(2, v.getKey());
                        vs.setString(3, v.getValue().name());
                        vs.addBatch();
                    }
                    vs.executeBatch();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to save proposal " + p.proposalId(), e);
        }
    }

    public Optional<ProposalRecord> loadProposal(String proposalId) {
        String sql = """
                SELECT proposal_id,session_id,text,algorithm,participants,created_at,deadline_ms,outcome,decided_at,detail
                FROM proposals WHERE proposal_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, proposalId);
            ProposalRecord base;
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long decided = rs.getLong("decided_at");
                Long decidedAt = rs.wasNull() ? null : decided;
                base = new ProposalRecord(
                        rs.getString("proposal_id"),
                        rs.getString("session_id"),
                        rs.getString("text"),
                        ConsensusAlgorithm.fromString(rs.getString("algorithm")),
                        rs.getLong("created_at"),
                        rs.getLong("deadline_ms"),
                        fromJson(rs.getString("participants"), STRING_LIST),
                        Map.of(),
                        ProposalOutcome.valueOf(rs.getString("outcome")),
                        decidedAt,
                        fromJson(rs.getString("detail"), DETAIL_MAP)
                );
            }
            Map<String, Vote> votes = new LinkedHashMap<>();
            try (PreparedStatement vs = c.prepareStatement(
                    "SELECT agent_id,vote FROM proposal_votes WHERE proposal_id=? ORDER BY agent_id ASC")) {
                vs.setString(1, proposalId);
                try (ResultSet rs = vs.executeQuery()) {
                    while (rs.next()) {
                        votes.put(rs.getString("agent_id"), Vote.valueOf(rs.getString("vote")));
                    }
                }
            }
            return Optional.of(new ProposalRecord(
                    base.proposalId(), base.sessionId(), base.text(), base.algorithm(), base.createdAtMs(),
                    base.deadlineMs(), base.participants(), votes, base.outcome(), base.decidedAtMs(), base.detail()
            ));
        } catch (SQLException e) {
            throw new StateStoreException("Failed to load proposal " + proposalId, e);
        }
    }

    public Map<ProposalOutcome, Integer> countProposalsByOutcome(String sessionId) {
        Map<ProposalOutcome, Integer> out = new EnumMap<>(ProposalOutcome.class);
        for (ProposalOutcome o : ProposalOutcome.values()) {
            out.put(o, 0);
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(
                "SELECT outcome, COUNT(*) FROM proposals WHERE session_id=? GROUP BY outcome")) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(ProposalOutcome.valueOf(rs.getString(1)), rs.getInt(2));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to count proposals of " + sessionId, e);
        }
    }

    /**
     * Marks the session CLOSED. Returns false when the session was already closed or is unknown.
     */
    public boolean markSessionClosed(String sessionId, long closedAtMs, String failureReason) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement("""
                UPDATE sessions SET status=?, closed_at=?, failure_reason=?, updated_at=?
                WHERE session_id=? AND status<>?
                """)) {
            ps.setString(1, SessionStatus.CLOSED.name());
            ps.setLong(2, closedAtMs);
            ps.setString(3, failureReason);
            ps.setLong(4, closedAtMs);
            ps.setString(5, sessionId);
            ps.setString(6, SessionStatus.CLOSED.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to close session " + sessionId, e);
        }
    }

    /**
     * Retention job: drops task metrics and health snapshots older than the cutoff.
     */
    public PurgeResult purgeOlderThan(long cutoffMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement m = c.prepareStatement("DELETE FROM task_metrics WHERE ts < ?");
                 PreparedStatement h = c.prepareStatement("DELETE FROM health_snapshots WHERE ts < ?")) {
                m.setLong(1, cutoffMs);
                int metrics = m.executeUpdate();
                h.setLong(1, cutoffMs);
                int health = h.executeUpdate();
                c.commit();
                return new PurgeResult(metrics, health);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to purge records older than " + cutoffMs, e);
        }
    }

    private int countWhereSession(String sql, String sessionId) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to count rows of " + sessionId, e);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private static String toJson(Object value) {
        try {
            return Jsons.compactMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to encode JSON column", e);
        }
    }

    private static <T> T fromJson(String raw, TypeReference<T> type) {
        try {
            return Jsons.compactMapper().readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to decode JSON column", e);
        }
    }

    public record PurgeResult(int metricsDeleted, int healthDeleted) {
        public int total() {
            return metricsDeleted + healthDeleted;
        }
    }
}
