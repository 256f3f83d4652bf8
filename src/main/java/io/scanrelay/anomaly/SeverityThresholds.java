package io.scanrelay.anomaly;

/**
 * Monotonic score to severity mapping.
 */
public record SeverityThresholds(double critical, double high, double medium) {
    public static final SeverityThresholds DEFAULTS = new SeverityThresholds(0.8d, 0.6d, 0.4d);

    public SeverityThresholds {
        if (!(medium <= high && high <= critical)) {
            throw new IllegalArgumentException(
                    "thresholds must satisfy medium <= high <= critical: " + medium + "/" + high + "/" + critical);
        }
    }

    public Severity classify(double score) {
        if (score >= critical) {
            return Severity.CRITICAL;
        }
        if (score >= high) {
            return Severity.HIGH;
        }
        if (score >= medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
