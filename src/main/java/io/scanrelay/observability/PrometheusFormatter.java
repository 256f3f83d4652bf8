package io.scanrelay.observability;

import io.scanrelay.anomaly.FindingStats;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.Priority;
import io.scanrelay.model.QueueStats;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(QueueStats queue, FindingStats findings, String namespace) {
        StringBuilder sb = new StringBuilder();
        String ns = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        sb.append("# HELP scanrelay_jobs Jobs grouped by priority tier and status\n");
        sb.append("# TYPE scanrelay_jobs gauge\n");
        for (Priority p : Priority.values()) {
            QueueStats.TierStats tier = queue.tier(p);
            for (JobStatus s : JobStatus.values()) {
                sb.append("scanrelay_jobs{namespace=\"").append(escapeLabel(ns))
                        .append("\",priority=\"").append(p.queueName())
                        .append("\",status=\"").append(s.name().toLowerCase(Locale.ROOT))
                        .append("\"} ").append(tier.count(s)).append('\n');
            }
        }
        Map<String, Long> depth = new LinkedHashMap<>();
        for (Priority p : Priority.values()) {
            depth.put(p.queueName(), queue.tier(p).queued());
        }
        appendMapGauge(sb, "scanrelay_queue_depth", "Queued jobs per priority tier", "priority", depth, ns);
        appendGauge(sb, "scanrelay_findings_total", "Findings recorded", findings.total(), ns);
        appendGauge(sb, "scanrelay_findings_open", "Findings still ACTIVE or INVESTIGATING", findings.open(), ns);
        appendGauge(sb, "scanrelay_findings_open_critical", "Open findings with CRITICAL severity", findings.critical(), ns);
        appendMapGauge(sb, "scanrelay_findings_by_severity", "Findings grouped by severity", "severity",
                findings.bySeverity(), ns);
        appendMapGauge(sb, "scanrelay_findings_by_status", "Findings grouped by status", "status",
                findings.byStatus(), ns);
        appendMapGauge(sb, "scanrelay_findings_by_category", "Findings grouped by category", "category",
                findings.byCategory(), ns);
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label,
                                       Map<String, Long> values, String ns) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append("{namespace=\"").append(escapeLabel(ns)).append("\",")
                    .append(label).append("=\"").append(escapeLabel(e.getKey().toLowerCase(Locale.ROOT))).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value, String ns) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric).append("{namespace=\"").append(escapeLabel(ns)).append("\"} ").append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
