package io.scanrelay.runtime;

import io.scanrelay.anomaly.AnomalyClassifier;
import io.scanrelay.anomaly.Finding;
import io.scanrelay.anomaly.FindingFilter;
import io.scanrelay.anomaly.FindingStats;
import io.scanrelay.model.JobHistoryEntry;
import io.scanrelay.model.JobView;
import io.scanrelay.model.QueueStats;

import java.util.List;
import java.util.Optional;

/**
 * Read-only facade for dashboards and notification senders. Nothing here
 * mutates jobs or findings.
 */
public final class StatusView {
    private final JobQueueManager queue;
    private final AnomalyClassifier classifier;

    public StatusView(JobQueueManager queue, AnomalyClassifier classifier) {
        this.queue = queue;
        this.classifier = classifier;
    }

    public Optional<JobView> status(String jobId) {
        return queue.status(jobId);
    }

    public QueueStats stats() {
        return queue.stats();
    }

    public List<JobHistoryEntry> history(String jobId) {
        return queue.history(jobId);
    }

    public List<Finding> findings(FindingFilter filter) {
        return classifier.list(filter);
    }

    public Optional<Finding> finding(String findingId) {
        return classifier.find(findingId);
    }

    public FindingStats findingStats(String tenantId) {
        return classifier.stats(tenantId);
    }
}
