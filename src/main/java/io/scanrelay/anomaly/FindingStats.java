package io.scanrelay.anomaly;

import java.util.Map;

public record FindingStats(
        String tenantId,
        long total,
        long open,
        long critical,
        long resolved,
        Map<String, Long> bySeverity,
        Map<String, Long> byStatus,
        Map<String, Long> byCategory
) {
}
