package io.scanrelay.runtime;

import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.model.JobStatus;
import io.scanrelay.observability.AuditEvent;
import io.scanrelay.observability.AuditLogger;
import io.scanrelay.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * N independent workers polling the job store, plus a watchdog that fails
 * jobs whose deadline passed without their worker recording an outcome.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobWorker worker;
    private final JobStore store;
    private final RuntimeSettings settings;
    private final AuditLogger audit;
    private final Clock clock;
    private final String namePrefix;
    private final List<Slot> slots = new ArrayList<>();
    private volatile boolean running;
    private ExecutorService workers;
    private ScheduledExecutorService watchdog;

    public WorkerPool(JobWorker worker, JobStore store, RuntimeSettings settings, AuditLogger audit, Clock clock,
                      String namePrefix) {
        this.worker = worker;
        this.store = store;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
        this.namePrefix = namePrefix == null || namePrefix.isBlank() ? "worker" : namePrefix.trim();
    }

    /**
     * @throws IllegalStateException when some job type has no handler, or the pool already ran
     */
    public synchronized void start() {
        if (workers != null) {
            throw new IllegalStateException("worker pool already started");
        }
        worker.registry().requireComplete();
        int count = settings.workerCount();
        running = true;
        workers = Executors.newFixedThreadPool(count, namedThreads(namePrefix));
        for (int i = 0; i < count; i++) {
            Slot slot = new Slot(namePrefix + "-" + (i + 1));
            slots.add(slot);
            workers.submit(() -> loop(slot));
        }
        watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads(namePrefix + "-watchdog"));
        watchdog.scheduleWithFixedDelay(this::sweepOverdue,
                settings.watchdogIntervalMs(), settings.watchdogIntervalMs(), TimeUnit.MILLISECONDS);
        audit.log(AuditEvent.system("pool.start", "pool/" + namePrefix, "ok", Map.of("workers", count)));
        log.info("Started {} worker(s) with prefix {}", count, namePrefix);
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized List<WorkerStats> workerStats() {
        List<WorkerStats> out = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            out.add(slot.snapshot());
        }
        return out;
    }

    /**
     * Stops claiming, waits up to the shutdown grace period for in-flight jobs
     * and then interrupts whatever is still running.
     */
    @Override
    public synchronized void close() {
        if (workers == null || !running) {
            return;
        }
        running = false;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}ms grace, interrupting", settings.shutdownGraceMs());
                workers.shutdownNow();
                workers.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            watchdog.shutdownNow();
            audit.log(AuditEvent.system("pool.stop", "pool/" + namePrefix, "ok", Map.of("workers", slots.size())));
        }
    }

    private void loop(Slot slot) {
        while (running && !Thread.currentThread().isInterrupted()) {
            WorkerOutcome outcome;
            try {
                outcome = worker.runOnce(slot.workerId, slot.currentJobId::set);
            } catch (RuntimeException e) {
                // a storage hiccup must not kill the worker thread
                log.error("Worker {} iteration failed: {}", slot.workerId, e.getMessage(), e);
                slot.currentJobId.set(null);
                if (!pause()) {
                    return;
                }
                continue;
            }
            if (!outcome.processed()) {
                if (!pause()) {
                    return;
                }
                continue;
            }
            slot.record(outcome);
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(settings.pollIntervalMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void sweepOverdue() {
        try {
            List<String> failed = store.failOverdue(clock.millis());
            for (String jobId : failed) {
                log.warn("Watchdog failed overdue job {}", jobId);
                audit.log(AuditEvent.forJob("job.timeout", "watchdog", jobId, null, "failed",
                        Map.of("error_kind", "TIMEOUT_EXCEEDED")));
            }
        } catch (RuntimeException e) {
            log.error("Watchdog sweep failed: {}", e.getMessage(), e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "scanrelay-" + prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Slot {
        private final String workerId;
        private final AtomicLong processed = new AtomicLong();
        private final AtomicLong succeeded = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private final AtomicLong cancelled = new AtomicLong();
        private final AtomicReference<String> currentJobId = new AtomicReference<>();
        private final AtomicReference<String> lastJobId = new AtomicReference<>();

        private Slot(String workerId) {
            this.workerId = workerId;
        }

        private void record(WorkerOutcome outcome) {
            processed.incrementAndGet();
            if (outcome.status() == JobStatus.FINISHED) {
                succeeded.incrementAndGet();
            } else if (outcome.status() == JobStatus.CANCELLED) {
                cancelled.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
            lastJobId.set(outcome.jobId());
            currentJobId.set(null);
        }

        private WorkerStats snapshot() {
            return new WorkerStats(workerId, processed.get(), succeeded.get(), failed.get(), cancelled.get(),
                    currentJobId.get(), lastJobId.get());
        }
    }
}
