package io.scanrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.anomaly.AnomalyClassifier;
import io.scanrelay.anomaly.Finding;
import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.config.ScanRelayConfig;
import io.scanrelay.error.NotFoundException;
import io.scanrelay.observability.AuditEvent;
import io.scanrelay.observability.AuditLogger;
import io.scanrelay.observability.PrometheusFormatter;
import io.scanrelay.storage.Database;
import io.scanrelay.storage.FindingStore;
import io.scanrelay.storage.JobStore;
import io.scanrelay.task.ReportTask;
import io.scanrelay.task.ScanTask;
import io.scanrelay.task.TaskRegistry;
import io.scanrelay.task.ThreatAnalysisTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Wires the stores, queue manager, classifier and worker harness for one
 * runtime root. Every process pointed at the same root shares state through
 * the SQLite database.
 */
public final class ScanRelayRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScanRelayRuntime.class);

    private final ScanRelayConfig config;
    private final Clock clock;
    private final RuntimeSettings settings;
    private final Database database;
    private final JobStore jobStore;
    private final FindingStore findingStore;
    private final AuditLogger auditLogger;
    private final AnomalyClassifier classifier;
    private final JobQueueManager queue;
    private final StatusView statusView;
    private final TaskRegistry registry;
    private final ExecutorService bodyExecutor;
    private final JobWorker worker;

    public ScanRelayRuntime(ScanRelayConfig config) {
        this(config, Clock.systemUTC(), null);
    }

    /**
     * @param settingsOverride used instead of {@code scanrelay-settings.json} when not null
     */
    public ScanRelayRuntime(ScanRelayConfig config, Clock clock, RuntimeSettings settingsOverride) {
        this.config = config;
        this.clock = clock;
        this.settings = settingsOverride != null ? settingsOverride : RuntimeSettings.load(config.settingsFile());
        this.database = new Database(config, clock);
        this.jobStore = new JobStore(database);
        this.findingStore = new FindingStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), clock);
        this.classifier = new AnomalyClassifier(findingStore, settings, auditLogger, clock);
        this.queue = new JobQueueManager(jobStore, settings, auditLogger, clock);
        this.statusView = new StatusView(queue, classifier);
        this.registry = new TaskRegistry()
                .register(new ScanTask(clock))
                .register(new ThreatAnalysisTask())
                .register(new ReportTask(classifier, config.reportsRoot(), clock));
        this.bodyExecutor = Executors.newCachedThreadPool(bodyThreads());
        this.worker = new JobWorker(jobStore, registry, classifier, settings, auditLogger, clock, bodyExecutor);
    }

    public void init() {
        database.init();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("settings_file", config.settingsFile().toString());
        details.put("settings_file_present", Files.isRegularFile(config.settingsFile()));
        details.put("worker_count", settings.workerCount());
        details.put("checkpoint_interval_ms", settings.checkpointIntervalMs());
        details.put("detection_threshold", settings.detectionThreshold());
        auditLogger.log(AuditEvent.system("runtime.init", "runtime/" + config.namespace(), "ok", details));
    }

    public ScanRelayConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public JobQueueManager queue() {
        return queue;
    }

    public StatusView statusView() {
        return statusView;
    }

    public AnomalyClassifier classifier() {
        return classifier;
    }

    public TaskRegistry registry() {
        return registry;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public WorkerPool newWorkerPool(String namePrefix) {
        return new WorkerPool(worker, jobStore, settings, auditLogger, clock, namePrefix);
    }

    public WorkerOutcome runWorkerOnce(String workerId) {
        return worker.runOnce(workerId);
    }

    public WorkerOutcome runWorkerOnce(String workerId, Consumer<String> onClaimed) {
        return worker.runOnce(workerId, onClaimed);
    }

    /**
     * One maintenance pass: fail overdue jobs, purge expired ones, and apply
     * the finding inactivity policy when it is enabled.
     */
    public MaintenanceOutcome runMaintenance() {
        long now = clock.millis();
        List<String> overdue = jobStore.failOverdue(now);
        int purged = jobStore.purgeExpired(now);
        List<Finding> escalated = classifier.escalateInactive();
        MaintenanceOutcome out = new MaintenanceOutcome(overdue.size(), purged, escalated.size(), clock.instant().toString());
        auditLogger.log(AuditEvent.system("runtime.maintenance", "runtime/" + config.namespace(), "ok", Map.of(
                "overdue_failed", overdue.size(),
                "expired_purged", purged,
                "findings_escalated", escalated.size()
        )));
        if (!overdue.isEmpty() || purged > 0 || !escalated.isEmpty()) {
            log.info("Maintenance: {} overdue failed, {} expired purged, {} finding(s) escalated",
                    overdue.size(), purged, escalated.size());
        }
        return out;
    }

    public HealthOutcome health() {
        boolean dbOk = database.ping();
        boolean auditDir = Files.isDirectory(config.auditRoot());
        boolean reportsDir = Files.isDirectory(config.reportsRoot());
        int brokenAt = auditLogger.verifyChain();
        boolean ok = dbOk && auditDir && reportsDir && brokenAt == 0;
        return new HealthOutcome(ok, dbOk, auditDir, reportsDir, brokenAt == 0, brokenAt,
                database.listSchemaMigrations().size(), clock.instant().toString());
    }

    public String metricsText() {
        return PrometheusFormatter.format(queue.stats(), classifier.stats(null), config.namespace());
    }

    public AnomalyClassifier.ReingestOutcome reingestFindings(String jobId) {
        return classifier.reingest(queue.status(jobId).orElseThrow(() -> new NotFoundException("job", jobId)));
    }

    public List<JsonNode> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    @Override
    public void close() {
        bodyExecutor.shutdownNow();
    }

    private static ThreadFactory bodyThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "scanrelay-task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record MaintenanceOutcome(int overdueFailed, int expiredPurged, int findingsEscalated, String at) {
    }

    public record HealthOutcome(
            boolean ok,
            boolean databaseOk,
            boolean auditDirOk,
            boolean reportsDirOk,
            boolean auditChainOk,
            int auditChainBrokenAtLine,
            int schemaMigrations,
            String checkedAt
    ) {
    }
}
