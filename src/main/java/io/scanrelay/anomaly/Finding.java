package io.scanrelay.anomaly;

public record Finding(
        String findingId,
        String tenantId,
        String sourceJobId,
        Severity severity,
        double confidence,
        double score,
        String category,
        String source,
        String description,
        FindingStatus status,
        long detectedAtMs,
        Long resolvedAtMs,
        long updatedAtMs,
        String updatedBy,
        String note,
        long version
) {
    public boolean open() {
        return !status.isTerminal();
    }
}
