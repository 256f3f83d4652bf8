package io.scanrelay.model;

public record JobHistoryEntry(
        long seq,
        String jobId,
        JobStatus fromStatus,
        JobStatus toStatus,
        String workerId,
        String detail,
        long atMs
) {
}
