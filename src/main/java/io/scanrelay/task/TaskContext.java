package io.scanrelay.task;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.model.JobType;

public final class TaskContext {
    private final String jobId;
    private final JobType type;
    private final String tenantId;
    private final JsonNode payload;
    private final JsonNode meta;
    private final CancellationToken cancellation;
    private final ProgressRecorder recorder;

    public TaskContext(String jobId, JobType type, String tenantId, JsonNode payload, JsonNode meta,
                       CancellationToken cancellation, ProgressRecorder recorder) {
        this.jobId = jobId;
        this.type = type;
        this.tenantId = tenantId;
        this.payload = payload;
        this.meta = meta;
        this.cancellation = cancellation;
        this.recorder = recorder;
    }

    public String jobId() {
        return jobId;
    }

    public JobType type() {
        return type;
    }

    public String tenantId() {
        return tenantId;
    }

    public JsonNode payload() {
        return payload;
    }

    public JsonNode meta() {
        return meta;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Records progress and the current phase, then observes cancellation.
     *
     * @throws JobCancelledException when the job was cancelled, the worker
     *                               lost the job, or the body thread was interrupted
     */
    public void checkpoint(int progress, String phase) {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException(jobId, "interrupted");
        }
        if (!recorder.record(progress, phase)) {
            throw new JobCancelledException(jobId, "job is no longer owned by this worker");
        }
        cancellation.throwIfCancelled(jobId);
    }

    @FunctionalInterface
    public interface ProgressRecorder {
        boolean record(int progress, String phase);
    }
}
