package io.scanrelay.anomaly;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One scored data point produced by a threat-analysis job.
 */
public record Observation(
        double score,
        Double confidence,
        String category,
        String source,
        String description
) {
    public static final String DEFAULT_CATEGORY = "security";

    /**
     * Confidence reported by the model, or the score when the model gave none.
     * Clamped to [0, 1].
     */
    public double effectiveConfidence() {
        double raw = confidence == null ? score : confidence;
        return clamp(raw);
    }

    public double clampedScore() {
        return clamp(score);
    }

    /**
     * Reads {@code {"observations":[...]}}. Entries without a numeric score are skipped.
     */
    public static List<Observation> listFrom(JsonNode result) {
        List<Observation> out = new ArrayList<>();
        if (result == null || !result.path("observations").isArray()) {
            return out;
        }
        for (JsonNode n : result.path("observations")) {
            if (!n.path("score").isNumber()) {
                continue;
            }
            JsonNode conf = n.path("confidence");
            String category = n.path("category").asText("");
            out.add(new Observation(
                    n.path("score").asDouble(),
                    conf.isNumber() ? conf.asDouble() : null,
                    category.isBlank() ? DEFAULT_CATEGORY : category.trim().toLowerCase(Locale.ROOT),
                    n.path("source").asText(""),
                    n.path("description").asText("")
            ));
        }
        return out;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, v));
    }
}
