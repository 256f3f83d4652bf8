package io.scanrelay.observability;

import java.util.Map;

public record AuditEvent(
        String action,
        String actor,
        String resource,
        String result,
        String jobId,
        String findingId,
        String tenantId,
        Map<String, Object> details
) {
    public AuditEvent {
        details = details == null ? Map.of() : details;
    }

    public static AuditEvent forJob(String action, String actor, String jobId, String tenantId,
                                    String result, Map<String, Object> details) {
        return new AuditEvent(action, actor, "job:" + jobId, result, jobId, null, tenantId, details);
    }

    public static AuditEvent forFinding(String action, String actor, String findingId, String tenantId,
                                        String result, Map<String, Object> details) {
        return new AuditEvent(action, actor, "finding:" + findingId, result, null, findingId, tenantId, details);
    }

    public static AuditEvent system(String action, String resource, String result, Map<String, Object> details) {
        return new AuditEvent(action, "system", resource, result, null, null, null, details);
    }
}
