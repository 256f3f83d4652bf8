package io.scanrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.anomaly.AnomalyClassifier;
import io.scanrelay.anomaly.Finding;
import io.scanrelay.anomaly.FindingFilter;
import io.scanrelay.anomaly.Severity;
import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.config.ScanRelayConfig;
import io.scanrelay.error.InvalidTransitionException;
import io.scanrelay.error.NotFoundException;
import io.scanrelay.model.ErrorKind;
import io.scanrelay.model.JobOutcome;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.model.JobView;
import io.scanrelay.task.TaskContext;
import io.scanrelay.task.TaskHandler;
import io.scanrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

final class JobWorkerTest {

    @Test
    void failingTaskIsRecordedAndWorkerContinues() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-task-failure-");
        try (ScanRelayRuntime runtime = newRuntime(root)) {
            runtime.registry().register(handler(context -> {
                if (context.payload().path("fail").asBoolean(false)) {
                    throw new IllegalStateException("probe refused");
                }
                return Jsons.parse("{\"ok\":true}");
            }));
            String bad = runtime.queue().enqueue(JobType.SCAN, "high", Jsons.parse("{\"fail\":true}"), null, null, null);
            String good = runtime.queue().enqueue(JobType.SCAN, "default", Jsons.parse("{}"), null, null, null);

            WorkerOutcome first = runtime.runWorkerOnce("w1");
            Assertions.assertEquals(bad, first.jobId());
            Assertions.assertEquals(JobStatus.FAILED, first.status());
            JobView failed = runtime.queue().status(bad).orElseThrow();
            Assertions.assertEquals(ErrorKind.TASK_FAILURE, failed.errorKind());
            Assertions.assertEquals("java.lang.IllegalStateException: probe refused", failed.error());
            Assertions.assertNull(failed.result());

            WorkerOutcome second = runtime.runWorkerOnce("w1");
            Assertions.assertEquals(good, second.jobId());
            Assertions.assertEquals(JobStatus.FINISHED, second.status());
            Assertions.assertTrue(runtime.queue().status(good).orElseThrow().result().path("ok").asBoolean());

            Assertions.assertFalse(runtime.runWorkerOnce("w1").processed());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void bodyExceedingTimeoutFailsAndNextJobStillRuns() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-timeout-");
        try (ScanRelayRuntime runtime = newRuntime(root)) {
            runtime.registry().register(handler(context -> {
                if (context.payload().path("hang").asBoolean(false)) {
                    Thread.sleep(10_000L);
                }
                return Jsons.parse("{}");
            }));
            String slow = runtime.queue().enqueue(JobType.SCAN, "high", Jsons.parse("{\"hang\":true}"),
                    Duration.ofSeconds(1), null, null);
            String fast = runtime.queue().enqueue(JobType.SCAN, "low", Jsons.parse("{}"), null, null, null);

            long started = System.nanoTime();
            WorkerOutcome timedOut = runtime.runWorkerOnce("w1");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            Assertions.assertEquals(slow, timedOut.jobId());
            Assertions.assertEquals(JobStatus.FAILED, timedOut.status());
            Assertions.assertTrue(elapsedMs < 5_000L, "worker was held for " + elapsedMs + "ms");
            JobView view = runtime.queue().status(slow).orElseThrow();
            Assertions.assertEquals(ErrorKind.TIMEOUT_EXCEEDED, view.errorKind());
            Assertions.assertEquals("Job exceeded timeout of 1000ms", view.error());

            WorkerOutcome next = runtime.runWorkerOnce("w1");
            Assertions.assertEquals(fast, next.jobId());
            Assertions.assertEquals(JobStatus.FINISHED, next.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancellingStartedJobStopsItAtNextCheckpoint() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-cancel-started-");
        try (ScanRelayRuntime runtime = newRuntime(root)) {
            runtime.registry().register(handler(context -> {
                for (int i = 0; i < 500; i++) {
                    context.checkpoint(i / 5, "probe");
                    Thread.sleep(20L);
                }
                return Jsons.parse("{}");
            }));
            String jobId = runtime.queue().enqueueScan("acme", null, "host-a", null, null);

            CountDownLatch claimed = new CountDownLatch(1);
            AtomicReference<WorkerOutcome> outcome = new AtomicReference<>();
            CompletableFuture<Void> worker = CompletableFuture.runAsync(
                    () -> outcome.set(runtime.runWorkerOnce("w1", id -> claimed.countDown())));
            Assertions.assertTrue(claimed.await(5, TimeUnit.SECONDS));

            Assertions.assertTrue(runtime.queue().cancel(jobId));
            worker.get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(JobStatus.CANCELLED, outcome.get().status());
            JobView view = runtime.queue().status(jobId).orElseThrow();
            Assertions.assertEquals(JobStatus.CANCELLED, view.status());
            Assertions.assertEquals(ErrorKind.CANCELLED, view.errorKind());
            Assertions.assertTrue(view.progress() < 100);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelledQueuedJobIsNeverExecuted() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-cancel-queued-");
        try (ScanRelayRuntime runtime = newRuntime(root)) {
            AtomicInteger invocations = new AtomicInteger();
            runtime.registry().register(handler(context -> {
                invocations.incrementAndGet();
                return Jsons.parse("{}");
            }));
            String jobId = runtime.queue().enqueueScan("acme", null, "host-a", null, null);
            Assertions.assertTrue(runtime.queue().cancel(jobId));

            Assertions.assertFalse(runtime.runWorkerOnce("w1").processed());
            Assertions.assertEquals(0, invocations.get());
            Assertions.assertEquals(0L, runtime.jobStore().countTransitionsTo(JobStatus.STARTED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void finishedAnalysisProducesClassifiedFindings() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-analysis-ingest-");
        try (ScanRelayRuntime runtime = newRuntime(root)) {
            String jobId = runtime.queue().enqueueThreatAnalysis("acme", Jsons.parse(
                    "{\"type\":\"beaconing\",\"observations\":[{\"score\":0.85,\"category\":\"c2\"},"
                            + "{\"score\":0.5},{\"score\":0.2}]}"), null);

            WorkerOutcome out = runtime.runWorkerOnce("w1");
            Assertions.assertEquals(JobStatus.FINISHED, out.status());

            List<Finding> findings = runtime.classifier().list(FindingFilter.forTenant("acme"));
            Assertions.assertEquals(2, findings.size());
            findings = new ArrayList<>(findings);
            findings.sort(Comparator.comparingDouble(Finding::score).reversed());
            Assertions.assertEquals(Severity.CRITICAL, findings.get(0).severity());
            Assertions.assertEquals("c2", findings.get(0).category());
            Assertions.assertEquals(Severity.MEDIUM, findings.get(1).severity());
            for (Finding f : findings) {
                Assertions.assertEquals(jobId, f.sourceJobId());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void findingsMissedAfterCompletionAreReplayedOnce() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-reingest-");
        try (ScanRelayRuntime runtime = newRuntime(root)) {
            String jobId = runtime.queue().enqueueThreatAnalysis("acme", Jsons.parse("{}"), null);
            runtime.jobStore().claimNext("crashed-worker", System.currentTimeMillis());
            runtime.jobStore().complete(jobId, "crashed-worker", JobOutcome.finished(
                    "{\"observations\":[{\"score\":0.95,\"category\":\"exfil\"},{\"score\":0.05}]}"),
                    System.currentTimeMillis());
            Assertions.assertTrue(runtime.classifier().list(FindingFilter.forTenant("acme")).isEmpty());

            AnomalyClassifier.ReingestOutcome first = runtime.reingestFindings(jobId);
            Assertions.assertTrue(first.replayed());
            Assertions.assertEquals(1, first.findings().size());
            Assertions.assertEquals(Severity.CRITICAL, first.findings().get(0).severity());
            Assertions.assertEquals(jobId, first.findings().get(0).sourceJobId());

            AnomalyClassifier.ReingestOutcome second = runtime.reingestFindings(jobId);
            Assertions.assertFalse(second.replayed());
            Assertions.assertEquals(first.findings().get(0).findingId(), second.findings().get(0).findingId());
            Assertions.assertEquals(1, runtime.classifier().list(FindingFilter.forTenant("acme")).size());

            String scanId = runtime.queue().enqueueScan("acme", null, "host-a", null, null);
            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.reingestFindings(scanId));
            Assertions.assertThrows(NotFoundException.class, () -> runtime.reingestFindings("analysis_missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void describeIncludesExceptionClassAndMessage() {
        Assertions.assertEquals("java.io.IOException: connection reset",
                JobWorker.describe(new IOException("connection reset")));
        Assertions.assertEquals("java.lang.NullPointerException", JobWorker.describe(new NullPointerException()));
    }

    static TaskHandler handler(Body body) {
        return new TaskHandler() {
            @Override
            public JobType type() {
                return JobType.SCAN;
            }

            @Override
            public JsonNode execute(TaskContext context) throws Exception {
                return body.run(context);
            }
        };
    }

    @FunctionalInterface
    interface Body {
        JsonNode run(TaskContext context) throws Exception;
    }

    static ScanRelayRuntime newRuntime(Path root) {
        RuntimeSettings settings = RuntimeSettings.defaults()
                .withCheckpointIntervalMs(0L)
                .withPollIntervalMs(20L);
        ScanRelayRuntime runtime = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString()), Clock.systemUTC(),
                settings);
        runtime.init();
        return runtime;
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
