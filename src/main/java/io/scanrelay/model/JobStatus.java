package io.scanrelay.model;

/**
 * Job lifecycle. Transitions only move forward:
 * QUEUED -> STARTED -> FINISHED | FAILED | CANCELLED, and QUEUED -> CANCELLED
 * when a job is cancelled before any worker claimed it.
 */
public enum JobStatus {
    QUEUED,
    STARTED,
    FINISHED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case QUEUED -> next == STARTED || next == CANCELLED;
            case STARTED -> next.isTerminal();
            case FINISHED, FAILED, CANCELLED -> false;
        };
    }
}
