package io.swarmmesh.observability;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(SessionMetricsSnapshot s) {
        StringBuilder sb = new StringBuilder();
        String session = s.sessionId();
        appendMapGauge(sb, "swarmmesh_agents", "Agents grouped by health state", session, "state", s.agentsByState());
        appendMapGauge(sb, "swarmmesh_proposals_total", "Consensus proposals grouped by outcome", session, "outcome",
                s.proposalsByOutcome());
        appendMapGauge(sb, "swarmmesh_healing_actions_total", "Healing actions grouped by kind", session, "kind",
                s.healingActionsByKind());
        appendMapGauge(sb, "swarmmesh_healing_actions_succeeded_total", "Successful healing actions grouped by kind",
                session, "kind", s.healingSuccessByKind());
        appendGauge(sb, "swarmmesh_task_latency_ms", "Task latency percentiles in milliseconds", session,
                "quantile", "0.95", s.taskLatencyP95Ms());
        appendGauge(sb, "swarmmesh_tasks_completed_total", "Tasks reported finished", session, null, null,
                s.tasksCompleted());
        appendGauge(sb, "swarmmesh_tasks_failed_total", "Tasks reported failed", session, null, null, s.tasksFailed());
        appendGauge(sb, "swarmmesh_tasks_in_flight", "Tasks started and not finished yet", session, null, null,
                s.tasksInFlight());
        appendGauge(sb, "swarmmesh_topology_version", "Current topology graph version", session, null, null,
                s.graphVersion());
        appendGauge(sb, "swarmmesh_session_active", "Session status (1=active,0=closed)", session, null, null,
                "ACTIVE".equals(s.status()) ? 1L : 0L);
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String session, String label,
                                       Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append("{session=\"").append(escapeLabel(session)).append("\",")
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String session, String label,
                                    String labelValue, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric).append("{session=\"").append(escapeLabel(session)).append('"');
        if (label != null && labelValue != null) {
            sb.append(',').append(label).append("=\"").append(escapeLabel(labelValue)).append('"');
        }
        sb.append("} ").append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
