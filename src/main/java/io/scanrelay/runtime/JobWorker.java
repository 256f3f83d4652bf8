package io.scanrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.anomaly.AnomalyClassifier;
import io.scanrelay.anomaly.Finding;
import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.model.ErrorKind;
import io.scanrelay.model.JobOutcome;
import io.scanrelay.model.JobType;
import io.scanrelay.observability.AuditEvent;
import io.scanrelay.observability.AuditLogger;
import io.scanrelay.storage.JobStore;
import io.scanrelay.task.CancellationToken;
import io.scanrelay.task.JobCancelledException;
import io.scanrelay.task.TaskContext;
import io.scanrelay.task.TaskHandler;
import io.scanrelay.task.TaskRegistry;
import io.scanrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Execution harness for a single claimed job. The task body runs on the body
 * executor while the calling worker thread enforces the job deadline, so a
 * body that never returns cannot hold the worker past its timeout.
 */
public final class JobWorker {
    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final JobStore store;
    private final TaskRegistry registry;
    private final AnomalyClassifier classifier;
    private final RuntimeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;
    private final ExecutorService bodyExecutor;

    public JobWorker(JobStore store, TaskRegistry registry, AnomalyClassifier classifier, RuntimeSettings settings,
                     AuditLogger audit, Clock clock, ExecutorService bodyExecutor) {
        this.store = store;
        this.registry = registry;
        this.classifier = classifier;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
        this.bodyExecutor = bodyExecutor;
    }

    public TaskRegistry registry() {
        return registry;
    }

    public WorkerOutcome runOnce(String workerId) {
        return runOnce(workerId, jobId -> {
        });
    }

    /**
     * Claims the head job, runs it to a terminal outcome and records it.
     *
     * @param onClaimed notified with the job id right after the claim
     */
    public WorkerOutcome runOnce(String workerId, Consumer<String> onClaimed) {
        Optional<JobStore.ClaimedJob> maybe = store.claimNext(workerId, clock.millis());
        if (maybe.isEmpty()) {
            return WorkerOutcome.idle();
        }
        JobStore.ClaimedJob job = maybe.get();
        onClaimed.accept(job.jobId());
        audit.log(AuditEvent.forJob("job.claim", workerId, job.jobId(), job.tenantId(), "started",
                Map.of("type", job.type().wireName(), "priority", job.priority().queueName())));
        log.debug("Worker {} claimed {} ({})", workerId, job.jobId(), job.type().wireName());

        JobOutcome outcome = execute(workerId, job);
        boolean recorded = store.complete(job.jobId(), workerId, outcome, clock.millis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", outcome.status().name());
        if (outcome.errorKind() != null) {
            details.put("error_kind", outcome.errorKind().name());
            details.put("error", outcome.error());
        }
        audit.log(AuditEvent.forJob("job.complete", workerId, job.jobId(), job.tenantId(),
                recorded ? "recorded" : "superseded", details));
        if (!recorded) {
            // watchdog or a second completer got there first; the stored outcome stands
            log.info("Outcome {} for {} not recorded, job already terminal", outcome.status(), job.jobId());
            return new WorkerOutcome(true, job.jobId(), outcome.status(), "Job already completed elsewhere");
        }
        if (outcome.success() && job.type() == JobType.ANALYSIS) {
            ingestFindings(job, outcome.result());
        }
        return new WorkerOutcome(true, job.jobId(), outcome.status(),
                outcome.success() ? "Job finished" : outcome.status() + ": " + outcome.error());
    }

    private JobOutcome execute(String workerId, JobStore.ClaimedJob job) {
        Optional<TaskHandler> handler = registry.find(job.type());
        if (handler.isEmpty()) {
            return JobOutcome.failed(ErrorKind.TASK_FAILURE, "No task handler registered for " + job.type());
        }
        CancellationToken token = new CancellationToken(
                () -> store.cancelRequested(job.jobId()), clock, settings.checkpointIntervalMs());
        TaskContext context = new TaskContext(
                job.jobId(),
                job.type(),
                job.tenantId(),
                job.payload(),
                job.meta(),
                token,
                (progress, phase) -> store.checkpoint(job.jobId(), workerId, progress, phase, clock.millis())
        );
        TaskHandler body = handler.get();
        Future<JsonNode> future = bodyExecutor.submit(() -> body.execute(context));
        long waitMs = Math.max(1L, job.deadlineAtMs() - clock.millis());
        try {
            JsonNode result = future.get(waitMs, TimeUnit.MILLISECONDS);
            return JobOutcome.finished(Jsons.toCompactJson(result));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Job {} exceeded its {}ms timeout on worker {}", job.jobId(), job.timeoutMs(), workerId);
            return JobOutcome.failed(ErrorKind.TIMEOUT_EXCEEDED, JobStore.timeoutMessage(job.timeoutMs()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof JobCancelledException) {
                return JobOutcome.cancelled(cause.getMessage());
            }
            log.warn("Job {} failed: {}", job.jobId(), cause.toString());
            return JobOutcome.failed(ErrorKind.TASK_FAILURE, describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return JobOutcome.failed(ErrorKind.TASK_FAILURE, "Worker " + workerId + " interrupted during shutdown");
        }
    }

    private void ingestFindings(JobStore.ClaimedJob job, String result) {
        if (classifier == null) {
            return;
        }
        try {
            List<Finding> findings = classifier.ingest(job.jobId(), job.tenantId(), Jsons.parse(result));
            log.debug("Analysis job {} ingested, {} finding(s)", job.jobId(), findings.size());
        } catch (RuntimeException e) {
            // the job stays FINISHED; ScanRelayRuntime.reingestFindings replays it from the stored result
            log.error("Failed to ingest findings for job {}: {}", job.jobId(), e.getMessage(), e);
            audit.log(AuditEvent.forJob("finding.ingest", "system", job.jobId(), job.tenantId(), "error",
                    Map.of("error", describe(e))));
        }
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return t.getClass().getName() + (message == null || message.isBlank() ? "" : ": " + message);
    }
}
