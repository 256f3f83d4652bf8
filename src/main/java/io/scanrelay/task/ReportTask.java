package io.scanrelay.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scanrelay.anomaly.AnomalyClassifier;
import io.scanrelay.anomaly.Finding;
import io.scanrelay.anomaly.FindingFilter;
import io.scanrelay.anomaly.FindingStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a tenant report from the requested sections and writes it as JSON
 * under the reports directory.
 */
public final class ReportTask implements TaskHandler {
    private static final List<String> DEFAULT_SECTIONS = List.of("summary", "open_findings");

    private final AnomalyClassifier classifier;
    private final Path reportsRoot;
    private final Clock clock;

    public ReportTask(AnomalyClassifier classifier, Path reportsRoot, Clock clock) {
        this.classifier = classifier;
        this.reportsRoot = reportsRoot;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.REPORT;
    }

    @Override
    public JsonNode execute(TaskContext context) throws Exception {
        JsonNode payload = context.payload();
        String reportType = payload.path("report_type").asText("security_summary");
        List<String> sections = sections(payload.path("parameters"));
        String tenant = context.tenantId();

        ObjectNode report = Jsons.mapper().createObjectNode();
        report.put("report_id", "report_" + context.jobId());
        report.put("report_type", reportType);
        report.put("tenant_id", tenant);
        report.put("generated_at", clock.instant().toString());
        ObjectNode body = report.putObject("sections");
        for (int i = 0; i < sections.size(); i++) {
            String section = sections.get(i);
            context.checkpoint((int) ((i * 90L) / sections.size()), section);
            body.set(section, renderSection(section, tenant));
        }
        context.checkpoint(95, "write");

        Files.createDirectories(reportsRoot);
        Path file = reportsRoot.resolve(context.jobId() + ".json");
        Files.writeString(file, Jsons.toJson(report), StandardCharsets.UTF_8);

        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("report_id", report.path("report_id").asText());
        out.put("report_type", reportType);
        out.put("path", file.toString());
        ArrayNode names = out.putArray("sections");
        sections.forEach(names::add);
        return out;
    }

    private JsonNode renderSection(String section, String tenant) {
        switch (section) {
            case "summary":
                return Jsons.mapper().valueToTree(classifier.stats(tenant));
            case "open_findings": {
                ArrayNode rows = Jsons.mapper().createArrayNode();
                for (FindingStatus status : List.of(FindingStatus.ACTIVE, FindingStatus.INVESTIGATING)) {
                    for (Finding f : classifier.list(new FindingFilter(tenant, status, null, null, 200, 0))) {
                        rows.add(Jsons.mapper().valueToTree(f));
                    }
                }
                return rows;
            }
            default: {
                ObjectNode unknown = Jsons.mapper().createObjectNode();
                unknown.put("status", "unsupported_section");
                return unknown;
            }
        }
    }

    static List<String> sections(JsonNode parameters) {
        JsonNode raw = parameters.path("sections");
        if (!raw.isArray() || raw.size() == 0) {
            return DEFAULT_SECTIONS;
        }
        List<String> out = new ArrayList<>();
        for (JsonNode s : raw) {
            String v = s.asText("").trim().toLowerCase(Locale.ROOT);
            if (!v.isBlank() && !out.contains(v)) {
                out.add(v);
            }
        }
        return out.isEmpty() ? DEFAULT_SECTIONS : out;
    }
}
