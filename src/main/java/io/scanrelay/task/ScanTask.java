package io.scanrelay.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scanrelay.model.JobType;
import io.scanrelay.util.Jsons;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Walks the scan phases for the requested scan type, reporting progress after
 * each one. Probing itself belongs to the scanner plugins; this body tracks
 * the phases and summarizes what they reported.
 */
public final class ScanTask implements TaskHandler {
    private static final Map<String, List<String>> PHASES_BY_SCAN_TYPE = Map.of(
            "vulnerability", List.of("discovery", "enumeration", "vulnerability_check", "reporting"),
            "network", List.of("discovery", "port_scan", "service_detection", "reporting"),
            "compliance", List.of("collect", "evaluate", "reporting")
    );
    private static final List<String> DEFAULT_PHASES = List.of("discovery", "scan", "reporting");

    private final Clock clock;

    public ScanTask(Clock clock) {
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.SCAN;
    }

    @Override
    public JsonNode execute(TaskContext context) throws Exception {
        JsonNode payload = context.payload();
        String target = payload.path("target").asText("");
        if (target.isBlank()) {
            throw new IllegalArgumentException("scan payload requires a target");
        }
        String scanType = payload.path("scan_type").asText("vulnerability").trim().toLowerCase(Locale.ROOT);
        JsonNode config = payload.path("config");
        List<String> phases = phases(scanType, config);
        long phaseDelayMs = Math.max(0L, config.path("phase_delay_ms").asLong(0L));
        JsonNode reported = config.path("phase_results");

        long startedAt = clock.millis();
        ArrayNode completed = Jsons.mapper().createArrayNode();
        int vulnerabilities = 0;
        for (int i = 0; i < phases.size(); i++) {
            String phase = phases.get(i);
            context.checkpoint(progressBefore(i, phases.size()), phase);
            if (phaseDelayMs > 0L) {
                Thread.sleep(phaseDelayMs);
            }
            ObjectNode row = completed.addObject();
            row.put("phase", phase);
            JsonNode phaseResult = reported.path(phase);
            if (phaseResult.isObject()) {
                row.set("result", phaseResult);
                vulnerabilities += phaseResult.path("vulnerabilities_found").asInt(0);
            }
        }
        context.checkpoint(100, "completed");

        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("scan_id", "scan_" + context.jobId());
        out.put("status", "completed");
        out.put("target", target);
        out.put("scan_type", scanType);
        out.set("phases", completed);
        out.put("vulnerabilities_found", vulnerabilities);
        out.put("duration_ms", clock.millis() - startedAt);
        out.put("completed_at", clock.instant().toString());
        return out;
    }

    static List<String> phases(String scanType, JsonNode config) {
        JsonNode explicit = config.path("phases");
        if (explicit.isArray() && explicit.size() > 0) {
            List<String> out = new ArrayList<>();
            for (JsonNode p : explicit) {
                String v = p.asText("").trim();
                if (!v.isBlank()) {
                    out.add(v);
                }
            }
            if (!out.isEmpty()) {
                return out;
            }
        }
        return PHASES_BY_SCAN_TYPE.getOrDefault(scanType, DEFAULT_PHASES);
    }

    private static int progressBefore(int index, int total) {
        return (int) ((index * 100L) / Math.max(1, total));
    }
}
