package io.scanrelay.runtime;

import io.scanrelay.config.RuntimeSettings;
import io.scanrelay.config.ScanRelayConfig;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

final class WorkerPoolTest {

    @Test
    void singleWorkerServesHighThenDefaultThenLow() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-pool-order-");
        try (ScanRelayRuntime runtime = newRuntime(root, 1)) {
            List<String> executed = Collections.synchronizedList(new ArrayList<>());
            runtime.registry().register(JobWorkerTest.handler(context -> {
                executed.add(context.payload().path("name").asText());
                return Jsons.parse("{}");
            }));
            for (String p : List.of("low", "high", "default")) {
                runtime.queue().enqueue(JobType.SCAN, p, Jsons.parse("{\"name\":\"" + p + "\"}"), null, null, null);
            }

            try (WorkerPool pool = runtime.newWorkerPool("order")) {
                pool.start();
                awaitFinished(runtime, 3, 15_000L);
            }
            Assertions.assertEquals(List.of("high", "default", "low"), executed);
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }

    @Test
    void concurrentWorkersRunEveryJobExactlyOnce() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-pool-once-");
        int jobs = 24;
        try (ScanRelayRuntime runtime = newRuntime(root, 4)) {
            List<String> executed = Collections.synchronizedList(new ArrayList<>());
            runtime.registry().register(JobWorkerTest.handler(context -> {
                executed.add(context.jobId());
                Thread.sleep(10L);
                return Jsons.parse("{}");
            }));
            List<String> ids = new ArrayList<>();
            String[] tiers = {"high", "default", "low"};
            for (int i = 0; i < jobs; i++) {
                ids.add(runtime.queue().enqueue(JobType.SCAN, tiers[i % 3], Jsons.parse("{}"), null, null, null));
            }

            WorkerPool pool = runtime.newWorkerPool("once");
            try {
                pool.start();
                Assertions.assertTrue(pool.isRunning());
                awaitFinished(runtime, jobs, 30_000L);
            } finally {
                pool.close();
            }
            Assertions.assertFalse(pool.isRunning());
            List<WorkerStats> stats = pool.workerStats();

            Assertions.assertEquals(jobs, executed.size());
            Assertions.assertEquals(new HashSet<>(ids), new HashSet<>(executed));
            Assertions.assertEquals(jobs, runtime.jobStore().countTransitionsTo(JobStatus.STARTED));
            Assertions.assertEquals(jobs, runtime.jobStore().countTransitionsTo(JobStatus.FINISHED));
            Assertions.assertEquals(4, stats.size());
            long processed = 0L;
            for (WorkerStats s : stats) {
                processed += s.processed();
            }
            Assertions.assertEquals(jobs, processed);
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }

    @Test
    void poolCannotStartTwice() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-pool-start-");
        try (ScanRelayRuntime runtime = newRuntime(root, 1)) {
            try (WorkerPool pool = runtime.newWorkerPool("twice")) {
                pool.start();
                Assertions.assertThrows(IllegalStateException.class, pool::start);
            }
        } finally {
            JobWorkerTest.deleteRecursively(root);
        }
    }

    private static void awaitFinished(ScanRelayRuntime runtime, long expected, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (runtime.queue().stats().total(JobStatus.FINISHED) >= expected) {
                return;
            }
            Thread.sleep(25L);
        }
        Assertions.fail("timed out waiting for " + expected + " finished job(s): " + runtime.queue().stats());
    }

    private static ScanRelayRuntime newRuntime(Path root, int workers) {
        RuntimeSettings settings = RuntimeSettings.defaults()
                .withWorkerCount(workers)
                .withPollIntervalMs(20L);
        ScanRelayRuntime runtime = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root.toString()), Clock.systemUTC(),
                settings);
        runtime.init();
        return runtime;
    }
}
