package io.scanrelay.task;

import io.scanrelay.error.ScanRelayException;

/**
 * Thrown from a checkpoint to unwind a task body whose job was cancelled or
 * taken away from the running worker.
 */
public class JobCancelledException extends ScanRelayException {
    private final String jobId;

    public JobCancelledException(String jobId, String reason) {
        super("Job " + jobId + " cancelled: " + reason);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
