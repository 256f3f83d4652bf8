package io.scanrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.error.InvalidTransitionException;
import io.scanrelay.error.NotFoundException;
import io.scanrelay.model.JobHistoryEntry;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.model.JobView;
import io.scanrelay.model.Priority;
import io.scanrelay.model.QueueStats;
import io.scanrelay.observability.AuditEvent;
import io.scanrelay.observability.AuditLogger;
import io.scanrelay.storage.JobStore;
import io.scanrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Producer-side API: enqueue, inspect, cancel and retry jobs.
 */
public final class JobQueueManager {
    private static final Logger log = LoggerFactory.getLogger(JobQueueManager.class);
    private static final String DEFAULT_ACTOR = "api";

    private final JobStore store;
    private final RuntimeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;

    public JobQueueManager(JobStore store, RuntimeSettings settings, AuditLogger audit, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Enqueues a job. A blank priority, timeout or result TTL takes the job
     * type's default; an unrecognized priority falls back to {@code default}.
     *
     * @throws IllegalArgumentException when timeout or result TTL is under one millisecond,
     *                                  or the payload is not a JSON object
     */
    public String enqueue(JobType type, String priorityRaw, JsonNode payload, Duration timeout, Duration resultTtl,
                          JsonNode meta) {
        if (type == null) {
            throw new IllegalArgumentException("job type must not be null");
        }
        Priority priority = resolvePriority(type, priorityRaw);
        Duration effectiveTimeout = timeout == null ? type.defaultTimeout() : timeout;
        Duration effectiveTtl = resultTtl == null ? type.defaultResultTtl() : resultTtl;
        requirePositive("timeout", effectiveTimeout);
        requirePositive("result_ttl", effectiveTtl);
        ObjectNode body = payloadObject(payload);
        ObjectNode metaNode = Jsons.objectOrEmpty(meta);
        metaNode.remove("cancelled");
        metaNode.remove("current_phase");
        String tenantId = tenantOf(body, metaNode);

        long now = clock.millis();
        String jobId = newJobId(type, tenantId, now);
        store.insert(new JobStore.NewJob(
                jobId,
                type,
                priority,
                tenantId,
                body,
                metaNode,
                effectiveTimeout.toMillis(),
                effectiveTtl.toMillis(),
                settings.failureTtlMs(),
                now
        ));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", type.wireName());
        details.put("priority", priority.queueName());
        details.put("timeout_ms", effectiveTimeout.toMillis());
        details.put("result_ttl_ms", effectiveTtl.toMillis());
        details.put("payload", body);
        audit.log(AuditEvent.forJob("job.enqueue", DEFAULT_ACTOR, jobId, tenantId, "queued", details));
        log.debug("Enqueued {} on {} queue", jobId, priority.queueName());
        return jobId;
    }

    public String enqueue(JobType type, Priority priority, JsonNode payload) {
        return enqueue(type, priority == null ? null : priority.queueName(), payload, null, null, null);
    }

    public String enqueueScan(String tenantId, String scanType, String target, JsonNode config, String priority) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("tenant_id", tenantId);
        payload.put("scan_type", scanType == null || scanType.isBlank() ? "vulnerability" : scanType);
        payload.put("target", target);
        payload.set("config", Jsons.objectOrEmpty(config));
        return enqueue(JobType.SCAN, priority, payload, null, null, null);
    }

    public String enqueueThreatAnalysis(String tenantId, JsonNode threatData, String priority) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("tenant_id", tenantId);
        payload.set("threat_data", Jsons.objectOrEmpty(threatData));
        return enqueue(JobType.ANALYSIS, priority, payload, null, null, null);
    }

    public String enqueueReport(String tenantId, String reportType, JsonNode parameters, String priority) {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("tenant_id", tenantId);
        payload.put("report_type", reportType == null || reportType.isBlank() ? "security_summary" : reportType);
        payload.set("parameters", Jsons.objectOrEmpty(parameters));
        return enqueue(JobType.REPORT, priority, payload, null, null, null);
    }

    public Optional<JobView> status(String jobId) {
        return store.find(jobId, clock.millis());
    }

    /**
     * @return true when a queued job was cancelled or a running job was asked to stop
     */
    public boolean cancel(String jobId) {
        return cancelDetailed(jobId).accepted();
    }

    public JobStore.CancelResult cancelDetailed(String jobId) {
        JobStore.CancelResult result = store.cancel(jobId, clock.millis());
        audit.log(AuditEvent.forJob("job.cancel", DEFAULT_ACTOR, jobId, null,
                result.outcome().name().toLowerCase(Locale.ROOT),
                result.statusBefore() == null ? Map.of() : Map.of("status_before", result.statusBefore().name())));
        return result;
    }

    public QueueStats stats() {
        return store.counts(clock.millis());
    }

    public List<JobView> failedJobs(Priority priority, int limit) {
        return store.list(JobStatus.FAILED, priority, limit, clock.millis());
    }

    public List<JobView> jobs(JobStatus status, Priority priority, int limit) {
        return store.list(status, priority, limit, clock.millis());
    }

    public List<JobHistoryEntry> history(String jobId) {
        return store.history(jobId);
    }

    /**
     * Re-enqueues a FAILED or CANCELLED job as a new job carrying
     * {@code meta.retry_of}. The original job keeps its terminal status.
     */
    public String retry(String jobId) {
        JobView original = status(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
        if (original.status() != JobStatus.FAILED && original.status() != JobStatus.CANCELLED) {
            throw new InvalidTransitionException(jobId, original.status().name(), "RETRY");
        }
        ObjectNode meta = Jsons.objectOrEmpty(original.meta());
        meta.put("retry_of", jobId);
        String newId = enqueue(
                original.type(),
                original.priority().queueName(),
                original.payload(),
                Duration.ofMillis(original.timeoutMs()),
                Duration.ofMillis(original.resultTtlMs()),
                meta
        );
        audit.log(AuditEvent.forJob("job.retry", DEFAULT_ACTOR, jobId, original.tenantId(), "requeued",
                Map.of("new_job_id", newId)));
        return newId;
    }

    private Priority resolvePriority(JobType type, String raw) {
        if (raw == null || raw.isBlank()) {
            return type.defaultPriority();
        }
        Optional<Priority> parsed = Priority.parse(raw);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        log.warn("InvalidPriority '{}' for {} job, falling back to {}", raw, type.wireName(), Priority.DEFAULT.queueName());
        audit.log(AuditEvent.system("job.enqueue.invalid_priority", "queue/" + type.wireName(), "fallback",
                Map.of("requested", raw, "used", Priority.DEFAULT.queueName())));
        return Priority.DEFAULT;
    }

    private static void requirePositive(String name, Duration value) {
        // stored at millisecond precision
        if (value.toMillis() <= 0L) {
            throw new IllegalArgumentException(name + " must be at least 1ms, got " + value);
        }
    }

    private static ObjectNode payloadObject(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Jsons.mapper().createObjectNode();
        }
        if (!payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object, got " + payload.getNodeType());
        }
        return ((ObjectNode) payload).deepCopy();
    }

    private static String tenantOf(JsonNode payload, JsonNode meta) {
        String tenant = payload.path("tenant_id").asText("");
        if (tenant.isBlank()) {
            tenant = meta.path("tenant_id").asText("");
        }
        return tenant.isBlank() ? null : tenant.trim();
    }

    static String newJobId(JobType type, String tenantId, long nowMs) {
        String tenant = tenantId == null ? "system" : tenantId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        return type.wireName() + "_" + tenant + "_" + (nowMs / 1000L) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
