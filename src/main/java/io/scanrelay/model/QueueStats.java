package io.scanrelay.model;

import java.util.Map;

public record QueueStats(Map<String, TierStats> tiers, long generatedAtMs) {

    public TierStats tier(Priority priority) {
        TierStats stats = tiers.get(priority.queueName());
        return stats == null ? TierStats.EMPTY : stats;
    }

    public long total(JobStatus status) {
        long sum = 0L;
        for (TierStats stats : tiers.values()) {
            sum += stats.count(status);
        }
        return sum;
    }

    public record TierStats(long queued, long started, long finished, long failed, long cancelled) {
        public static final TierStats EMPTY = new TierStats(0L, 0L, 0L, 0L, 0L);

        public long count(JobStatus status) {
            return switch (status) {
                case QUEUED -> queued;
                case STARTED -> started;
                case FINISHED -> finished;
                case FAILED -> failed;
                case CANCELLED -> cancelled;
            };
        }
    }
}
