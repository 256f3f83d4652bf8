package io.scanrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class ScanRelayCommandTest {

    @Test
    void scanLifecycleThroughCli() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-cli-scan-");
        try {
            Assertions.assertEquals(0, run(root, "init").code());

            Result enqueued = run(root, "scan", "--tenant", "acme", "--target", "10.0.0.7",
                    "--scan-type", "network", "--priority", "high");
            Assertions.assertEquals(0, enqueued.code());
            String jobId = enqueued.json().path("job_id").asText();
            Assertions.assertTrue(jobId.startsWith("scan_acme_"), jobId);

            Result queued = run(root, "job", jobId);
            Assertions.assertEquals(0, queued.code());
            Assertions.assertEquals("QUEUED", queued.json().path("status").asText());
            Assertions.assertEquals("HIGH", queued.json().path("priority").asText());

            Result worker = run(root, "worker", "--once", "--worker-id", "cli-worker");
            Assertions.assertEquals(0, worker.code());
            Assertions.assertEquals(jobId, worker.json().path("jobId").asText());

            Result finished = run(root, "job", jobId);
            Assertions.assertEquals("FINISHED", finished.json().path("status").asText());
            Assertions.assertEquals(100, finished.json().path("progress").asInt());
            Assertions.assertEquals("network", finished.json().path("result").path("scan_type").asText());

            Result history = run(root, "history", jobId);
            Assertions.assertEquals(3, history.json().size());

            Result stats = run(root, "stats");
            Assertions.assertEquals(1, stats.json().path("tiers").path("high").path("finished").asInt());

            Result metrics = run(root, "metrics");
            Assertions.assertTrue(metrics.out().contains("scanrelay_jobs{namespace=\"default\",priority=\"high\",status=\"finished\"} 1"));

            Assertions.assertEquals(1, run(root, "cancel", jobId).code());
            Assertions.assertEquals(1, run(root, "job", "scan_missing").code());
            Assertions.assertEquals(0, run(root, "health").code());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void analysisFindingsCanBeTriaged() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-cli-findings-");
        try {
            Result enqueued = run(root, "analyze", "--tenant", "acme", "--threat-data",
                    "{\"observations\":[{\"score\":0.92,\"category\":\"malware\"},{\"score\":0.1}]}");
            Assertions.assertEquals(0, enqueued.code());
            Assertions.assertEquals(0, run(root, "worker", "--once").code());

            String analysisId = enqueued.json().path("job_id").asText();
            Result replay = run(root, "reingest", analysisId);
            Assertions.assertEquals(0, replay.code());
            Assertions.assertFalse(replay.json().path("replayed").asBoolean());
            Assertions.assertEquals(1, replay.json().path("findings").asInt());

            Result findings = run(root, "findings", "--tenant", "acme", "--severity", "critical");
            Assertions.assertEquals(1, findings.json().size());
            JsonNode finding = findings.json().get(0);
            String findingId = finding.path("findingId").asText();
            Assertions.assertEquals("ACTIVE", finding.path("status").asText());

            Result investigating = run(root, "investigate", findingId, "--actor", "alice");
            Assertions.assertEquals(0, investigating.code());
            Assertions.assertEquals("INVESTIGATING", investigating.json().path("status").asText());

            Result stale = run(root, "resolve", findingId, "--expected-version", "1");
            Assertions.assertEquals(1, stale.code());
            Assertions.assertEquals("ConflictException", stale.json().path("error").asText());

            Result resolved = run(root, "resolve", findingId, "--actor", "alice", "--note", "reimaged host");
            Assertions.assertEquals(0, resolved.code());
            Assertions.assertEquals("RESOLVED", resolved.json().path("status").asText());

            Result again = run(root, "false-positive", findingId);
            Assertions.assertEquals(1, again.code());
            Assertions.assertEquals("InvalidTransitionException", again.json().path("error").asText());

            Result stats = run(root, "finding-stats", "--tenant", "acme");
            Assertions.assertEquals(1, stats.json().path("resolved").asInt());
            Assertions.assertEquals(0, stats.json().path("open").asInt());

            Result tail = run(root, "audit-tail", "--lines", "3");
            Assertions.assertEquals(0, tail.code());
            Assertions.assertEquals(3, tail.out().trim().split("\\R").length);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedJobsCanBeRetried() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-cli-retry-");
        try {
            Result enqueued = run(root, "enqueue", "scan", "--payload", "{\"scan_type\":\"network\"}");
            String jobId = enqueued.json().path("job_id").asText();
            Assertions.assertEquals(0, run(root, "worker", "--once").code());

            Result failed = run(root, "failed");
            Assertions.assertEquals(1, failed.json().size());
            Assertions.assertEquals("TASK_FAILURE", failed.json().get(0).path("errorKind").asText());

            Result retried = run(root, "retry", jobId);
            Assertions.assertEquals(0, retried.code());
            Assertions.assertEquals(jobId, retried.json().path("retry_of").asText());
            Assertions.assertEquals(1, run(root, "retry", retried.json().path("job_id").asText()).code());

            Assertions.assertEquals(1, run(root, "enqueue", "scan", "--payload", "[1]").code());
            Result badTier = run(root, "failed", "--priority", "urgent");
            Assertions.assertEquals(1, badTier.code());
            Assertions.assertEquals("unknown priority: urgent", badTier.json().path("error").asText());
            Assertions.assertEquals(1, run(root, "reingest", jobId).code());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namespacesAreIsolated() throws Exception {
        Path root = Files.createTempDirectory("scanrelay-test-cli-namespace-");
        try {
            String jobId = run(root, "report", "--tenant", "acme").json().path("job_id").asText();
            Assertions.assertEquals(0, run(root, "job", jobId).code());

            List<String> scoped = new ArrayList<>(List.of("--root", root.toString(), "--namespace", "blue", "job", jobId));
            Result other = execute(scoped.toArray(new String[0]));
            Assertions.assertEquals(1, other.code());
            Assertions.assertTrue(Files.isDirectory(root.resolve("namespaces").resolve("blue")));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        List<String> all = new ArrayList<>();
        all.add("--root");
        all.add(root.toString());
        all.addAll(List.of(args));
        return execute(all.toArray(new String[0]));
    }

    private static synchronized Result execute(String[] args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new ScanRelayCommand()).execute(args);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out) {
        JsonNode json() {
            return Jsons.parse(out);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
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
