package io.scanrelay.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

public record JobView(
        String jobId,
        JobType type,
        Priority priority,
        JobStatus status,
        int progress,
        String tenantId,
        JsonNode payload,
        JsonNode meta,
        JsonNode result,
        ErrorKind errorKind,
        String error,
        String workerId,
        long timeoutMs,
        long resultTtlMs,
        long createdAtMs,
        Long startedAtMs,
        Long endedAtMs,
        Long expiresAtMs
) {
    public Optional<String> currentPhase() {
        if (meta == null || !meta.hasNonNull("current_phase")) {
            return Optional.empty();
        }
        return Optional.of(meta.get("current_phase").asText());
    }

    public boolean cancelRequested() {
        return meta != null && meta.path("cancelled").asBoolean(false);
    }
}
