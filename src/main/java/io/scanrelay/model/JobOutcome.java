package io.scanrelay.model;

import java.util.Objects;

/**
 * Terminal result of one job execution. Exactly one of {@code result} or
 * {@code error} is populated, selected by {@code status}.
 */
public record JobOutcome(
        JobStatus status,
        String result,
        ErrorKind errorKind,
        String error
) {
    public JobOutcome {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal: " + status);
        }
        if (status == JobStatus.FINISHED && (errorKind != null || error != null)) {
            throw new IllegalArgumentException("finished outcome cannot carry an error");
        }
        if (status != JobStatus.FINISHED && result != null) {
            throw new IllegalArgumentException(status + " outcome cannot carry a result");
        }
    }

    public static JobOutcome finished(String result) {
        return new JobOutcome(JobStatus.FINISHED, result == null ? "null" : result, null, null);
    }

    public static JobOutcome failed(ErrorKind kind, String error) {
        return new JobOutcome(JobStatus.FAILED, null, kind == null ? ErrorKind.TASK_FAILURE : kind, error);
    }

    public static JobOutcome cancelled(String reason) {
        return new JobOutcome(JobStatus.CANCELLED, null, ErrorKind.CANCELLED,
                reason == null || reason.isBlank() ? "cancelled" : reason);
    }

    public boolean success() {
        return status == JobStatus.FINISHED;
    }
}
