package io.scanrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.MutableClock;
import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.config.ScanRelayConfig;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class ScanRelayRuntimeTest {

    @Test
    void initCreatesLayoutAndHealthIsGreen() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-health-");
        try (ScanRelayRuntime runtime = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString()))) {
            runtime.init();

            Assertions.assertTrue(Files.isRegularFile(runtime.config().dbFile()));
            Assertions.assertTrue(Files.isDirectory(runtime.config().reportsRoot()));
            ScanRelayRuntime.HealthOutcome health = runtime.health();
            Assertions.assertTrue(health.ok(), health.toString());
            Assertions.assertTrue(health.schemaMigrations() >= 2);
            Assertions.assertTrue(runtime.registry().missingTypes().isEmpty());
            Assertions.assertEquals("runtime.init", runtime.auditTail(1).get(0).path("action").asText());
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }

    @Test
    void runtimesSharingRootKeepAuditChainHealthy() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-shared-root-");
        try (ScanRelayRuntime cli = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString()));
             ScanRelayRuntime worker = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString()))) {
            cli.init();
            worker.init();

            cli.queue().enqueueScan("acme", null, "host-a", null, null);
            worker.queue().enqueueScan("acme", null, "host-b", null, null);
            cli.queue().enqueueScan("acme", null, "host-c", null, null);

            ScanRelayRuntime.HealthOutcome fromCli = cli.health();
            ScanRelayRuntime.HealthOutcome fromWorker = worker.health();
            Assertions.assertTrue(fromCli.ok(), fromCli.toString());
            Assertions.assertTrue(fromWorker.ok(), fromWorker.toString());
            Assertions.assertEquals(3L, worker.queue().stats().total(JobStatus.QUEUED));
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }

    @Test
    void maintenanceFailsOverdueAndPurgesExpired() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-maintenance-");
        MutableClock clock = MutableClock.startingNow();
        try (ScanRelayRuntime runtime = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString()), clock,
                RuntimeSettings.defaults())) {
            runtime.init();
            String stuck = runtime.queue().enqueue(JobType.SCAN, "high",
                    Jsons.parse("{\"target\":\"a\"}"), Duration.ofSeconds(5), null, null);
            String cancelled = runtime.queue().enqueueScan("acme", null, "b", null, null);
            runtime.jobStore().claimNext("crashed-worker", clock.millis());
            runtime.queue().cancel(cancelled);

            clock.advance(Duration.ofSeconds(6));
            ScanRelayRuntime.MaintenanceOutcome first = runtime.runMaintenance();
            Assertions.assertEquals(1, first.overdueFailed());
            Assertions.assertEquals(0, first.expiredPurged());
            Assertions.assertEquals(JobStatus.FAILED, runtime.queue().status(stuck).orElseThrow().status());

            clock.advance(Duration.ofDays(2));
            ScanRelayRuntime.MaintenanceOutcome second = runtime.runMaintenance();
            Assertions.assertEquals(0, second.overdueFailed());
            Assertions.assertEquals(2, second.expiredPurged());
            Assertions.assertEquals(0, second.findingsEscalated());
            Assertions.assertTrue(runtime.queue().status(stuck).isEmpty());
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }

    @Test
    void metricsReflectQueueState() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-metrics-");
        try (ScanRelayRuntime runtime = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString(), "blue"),
                MutableClock.startingNow(), RuntimeSettings.defaults())) {
            runtime.init();
            runtime.queue().enqueueReport("acme", null, null, null);
            runtime.queue().enqueueReport("acme", null, null, null);

            String text = runtime.metricsText();
            Assertions.assertTrue(text.contains("scanrelay_queue_depth{namespace=\"blue\",priority=\"low\"} 2"), text);
            List<JsonNode> tail = runtime.auditTail(2);
            Assertions.assertEquals("blue", tail.get(1).path("namespace").asText());
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }
}
