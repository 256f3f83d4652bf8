package io.scanrelay.runtime;

import io.scanrelay.model.JobStatus;

/**
 * Result of one worker iteration. {@code processed} is false when nothing
 * was claimed.
 */
public record WorkerOutcome(boolean processed, String jobId, JobStatus status, String message) {
    public static WorkerOutcome idle() {
        return new WorkerOutcome(false, null, null, "No queued jobs");
    }
}
