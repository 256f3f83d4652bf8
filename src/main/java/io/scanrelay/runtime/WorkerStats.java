package io.scanrelay.runtime;

public record WorkerStats(
        String workerId,
        long processed,
        long succeeded,
        long failed,
        long cancelled,
        String currentJobId,
        String lastJobId
) {
}
