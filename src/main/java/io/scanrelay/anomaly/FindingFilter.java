package io.scanrelay.anomaly;

import java.util.Locale;

public record FindingFilter(
        String tenantId,
        FindingStatus status,
        Severity severity,
        String category,
        int limit,
        int offset
) {
    public static final int DEFAULT_LIMIT = 50;

    public FindingFilter {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, 1000);
        offset = Math.max(0, offset);
        category = category == null || category.isBlank() ? null : category.trim().toLowerCase(Locale.ROOT);
        tenantId = tenantId == null || tenantId.isBlank() ? null : tenantId.trim();
    }

    public static FindingFilter all() {
        return new FindingFilter(null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static FindingFilter forTenant(String tenantId) {
        return new FindingFilter(tenantId, null, null, null, DEFAULT_LIMIT, 0);
    }
}
