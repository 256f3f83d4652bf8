package io.scanrelay.anomaly;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.error.ConflictException;
import io.scanrelay.error.InvalidTransitionException;
import io.scanrelay.error.NotFoundException;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.model.JobView;
import io.scanrelay.observability.AuditEvent;
import io.scanrelay.observability.AuditLogger;
import io.scanrelay.storage.FindingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns threat-analysis results into findings and drives the analyst
 * workflow on them.
 */
public final class AnomalyClassifier {
    public static final String SYSTEM_ACTOR = "system";
    private static final Logger log = LoggerFactory.getLogger(AnomalyClassifier.class);
    private static final int INACTIVITY_BATCH = 200;

    private final FindingStore store;
    private final RuntimeSettings settings;
    private final SeverityThresholds thresholds;
    private final AuditLogger audit;
    private final Clock clock;

    public AnomalyClassifier(FindingStore store, RuntimeSettings settings, AuditLogger audit, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.thresholds = new SeverityThresholds(
                settings.criticalThreshold(), settings.highThreshold(), settings.mediumThreshold());
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Creates one ACTIVE finding per observation scoring at or above the
     * tenant's detection threshold. Observations are never merged.
     */
    public List<Finding> ingest(String sourceJobId, String tenantId, JsonNode result) {
        double threshold = settings.detectionThresholdFor(tenantId);
        long now = clock.millis();
        List<Finding> created = new ArrayList<>();
        for (Observation o : Observation.listFrom(result)) {
            double score = o.clampedScore();
            if (score < threshold) {
                continue;
            }
            created.add(new Finding(
                    "fnd_" + UUID.randomUUID(),
                    tenantId,
                    sourceJobId,
                    thresholds.classify(score),
                    o.effectiveConfidence(),
                    score,
                    o.category(),
                    o.source(),
                    o.description(),
                    FindingStatus.ACTIVE,
                    now,
                    null,
                    now,
                    SYSTEM_ACTOR,
                    null,
                    1L
            ));
        }
        store.insertAll(created);
        for (Finding f : created) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("source_job_id", sourceJobId);
            details.put("severity", f.severity().name());
            details.put("score", f.score());
            details.put("category", f.category());
            audit.log(AuditEvent.forFinding("finding.detect", SYSTEM_ACTOR, f.findingId(), tenantId, "ok", details));
        }
        if (!created.isEmpty()) {
            log.info("Job {} produced {} finding(s) for tenant {}", sourceJobId, created.size(), tenantId);
        }
        return created;
    }

    /**
     * Replays ingestion for a FINISHED analysis job from its stored result.
     * A job that already produced findings is left alone.
     *
     * @throws InvalidTransitionException when the job is not a finished analysis job
     */
    public ReingestOutcome reingest(JobView job) {
        if (job.type() != JobType.ANALYSIS || job.status() != JobStatus.FINISHED) {
            throw new InvalidTransitionException(job.jobId(), job.type().name() + "/" + job.status().name(), "INGEST");
        }
        List<Finding> existing = store.listBySourceJob(job.jobId());
        if (!existing.isEmpty()) {
            return new ReingestOutcome(job.jobId(), false, existing);
        }
        List<Finding> created = ingest(job.jobId(), job.tenantId(), job.result());
        audit.log(AuditEvent.forJob("finding.reingest", SYSTEM_ACTOR, job.jobId(), job.tenantId(), "ok",
                Map.of("findings", created.size())));
        return new ReingestOutcome(job.jobId(), true, created);
    }

    public record ReingestOutcome(String jobId, boolean replayed, List<Finding> findings) {
    }

    public Finding resolve(String findingId, String actor, String note) {
        return transition(findingId, null, FindingStatus.RESOLVED, actor, note);
    }

    public Finding markFalsePositive(String findingId, String actor, String note) {
        return transition(findingId, null, FindingStatus.FALSE_POSITIVE, actor, note);
    }

    public Finding beginInvestigation(String findingId, String actor, String note) {
        return transition(findingId, null, FindingStatus.INVESTIGATING, actor, note);
    }

    /**
     * Applies an analyst command. When {@code expectedVersion} is given the
     * caller's view must still be current; otherwise the version read here is
     * used for the compare-and-set.
     */
    public Finding transition(String findingId, Long expectedVersion, FindingStatus target, String actor, String note) {
        String who = actor == null || actor.isBlank() ? "analyst" : actor.trim();
        Finding current = store.find(findingId)
                .orElseThrow(() -> new NotFoundException("finding", findingId));
        if (expectedVersion != null && expectedVersion != current.version()) {
            throw new ConflictException(findingId, expectedVersion);
        }
        if (!current.status().canTransitionTo(target)) {
            audit.log(AuditEvent.forFinding(actionFor(target), who, findingId, current.tenantId(), "rejected",
                    Map.of("from", current.status().name(), "to", target.name())));
            throw new InvalidTransitionException(findingId, current.status().name(), target.name());
        }
        long now = clock.millis();
        if (!store.compareAndSetStatus(findingId, current.version(), target, who, note, now)) {
            audit.log(AuditEvent.forFinding(actionFor(target), who, findingId, current.tenantId(), "conflict",
                    Map.of("expected_version", current.version())));
            throw new ConflictException(findingId, current.version());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", current.status().name());
        details.put("to", target.name());
        if (note != null && !note.isBlank()) {
            details.put("note", note);
        }
        audit.log(AuditEvent.forFinding(actionFor(target), who, findingId, current.tenantId(), "ok", details));
        return store.find(findingId).orElseThrow(() -> new NotFoundException("finding", findingId));
    }

    public Optional<Finding> find(String findingId) {
        return store.find(findingId);
    }

    public List<Finding> list(FindingFilter filter) {
        return store.list(filter == null ? FindingFilter.all() : filter);
    }

    public FindingStats stats(String tenantId) {
        return store.stats(tenantId);
    }

    /**
     * Moves ACTIVE findings nobody touched within the inactivity window to
     * INVESTIGATING. No-op while the window is 0.
     */
    public List<Finding> escalateInactive() {
        long window = settings.findingInactivityMs();
        if (window <= 0L) {
            return List.of();
        }
        long cutoff = clock.millis() - window;
        List<Finding> moved = new ArrayList<>();
        for (Finding f : store.staleActive(cutoff, INACTIVITY_BATCH)) {
            try {
                moved.add(transition(f.findingId(), f.version(), FindingStatus.INVESTIGATING, SYSTEM_ACTOR,
                        "no analyst activity for " + window + "ms"));
            } catch (ConflictException | InvalidTransitionException e) {
                // an analyst acted on it since the scan; their change wins
                log.debug("Skipped inactivity escalation for {}: {}", f.findingId(), e.getMessage());
            }
        }
        return moved;
    }

    private static String actionFor(FindingStatus target) {
        return switch (target) {
            case RESOLVED -> "finding.resolve";
            case FALSE_POSITIVE -> "finding.false_positive";
            case INVESTIGATING -> "finding.investigate";
            case ACTIVE -> "finding.detect";
        };
    }
}
