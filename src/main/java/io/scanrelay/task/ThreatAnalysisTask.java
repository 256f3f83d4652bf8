package io.scanrelay.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scanrelay.anomaly.Observation;
import io.scanrelay.model.JobType;
import io.scanrelay.util.Jsons;

import java.util.List;

/**
 * Normalizes externally scored threat data into the observation list the
 * anomaly classifier consumes. Accepts either {@code threat_data.observations}
 * or a top-level {@code observations} array.
 */
public final class ThreatAnalysisTask implements TaskHandler {
    private static final int CHECKPOINT_EVERY = 50;

    @Override
    public JobType type() {
        return JobType.ANALYSIS;
    }

    @Override
    public JsonNode execute(TaskContext context) {
        JsonNode payload = context.payload();
        JsonNode source = payload.path("threat_data").isObject() ? payload.path("threat_data") : payload;
        int offered = source.path("observations").isArray() ? source.path("observations").size() : 0;
        context.checkpoint(0, "normalize");

        List<Observation> observations = Observation.listFrom(source);
        ArrayNode rows = Jsons.mapper().createArrayNode();
        int i = 0;
        for (Observation o : observations) {
            ObjectNode row = rows.addObject();
            row.put("score", o.clampedScore());
            row.put("confidence", o.effectiveConfidence());
            row.put("category", o.category());
            row.put("source", o.source());
            row.put("description", o.description());
            i++;
            if (i % CHECKPOINT_EVERY == 0) {
                context.checkpoint((int) ((i * 90L) / Math.max(1, observations.size())), "normalize");
            }
        }
        context.checkpoint(95, "summarize");

        double maxScore = 0.0d;
        for (Observation o : observations) {
            maxScore = Math.max(maxScore, o.clampedScore());
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("analysis_id", "analysis_" + context.jobId());
        out.put("threat_type", source.path("type").asText("unknown"));
        out.put("observation_count", observations.size());
        out.put("skipped", offered - observations.size());
        out.put("max_score", maxScore);
        out.set("observations", rows);
        return out;
    }
}
