package io.scanrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.scanrelay.anomaly.AnomalyClassifier;
import io.scanrelay.anomaly.Finding;
import io.scanrelay.anomaly.FindingFilter;
import io.scanrelay.anomaly.FindingStatus;
import io.scanrelay.anomaly.Severity;
import io.scanrelay.config.ScanRelayConfig;
import io.scanrelay.error.ScanRelayException;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.model.JobView;
import io.scanrelay.model.Priority;
import io.scanrelay.runtime.ScanRelayRuntime;
import io.scanrelay.runtime.WorkerOutcome;
import io.scanrelay.runtime.WorkerPool;
import io.scanrelay.storage.JobStore;
import io.scanrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "scanrelay",
        mixinStandardHelpOptions = true,
        description = "Security scan and threat-analysis job runtime CLI",
        subcommands = {
                ScanRelayCommand.InitCommand.class,
                ScanRelayCommand.EnqueueCommand.class,
                ScanRelayCommand.ScanCommand.class,
                ScanRelayCommand.AnalyzeCommand.class,
                ScanRelayCommand.ReportCommand.class,
                ScanRelayCommand.JobCommand.class,
                ScanRelayCommand.HistoryCommand.class,
                ScanRelayCommand.CancelCommand.class,
                ScanRelayCommand.RetryCommand.class,
                ScanRelayCommand.ReingestCommand.class,
                ScanRelayCommand.FailedCommand.class,
                ScanRelayCommand.StatsCommand.class,
                ScanRelayCommand.MetricsCommand.class,
                ScanRelayCommand.WorkerCommand.class,
                ScanRelayCommand.MaintenanceCommand.class,
                ScanRelayCommand.FindingsCommand.class,
                ScanRelayCommand.FindingCommand.class,
                ScanRelayCommand.InvestigateCommand.class,
                ScanRelayCommand.ResolveCommand.class,
                ScanRelayCommand.FalsePositiveCommand.class,
                ScanRelayCommand.FindingStatsCommand.class,
                ScanRelayCommand.HealthCommand.class,
                ScanRelayCommand.AuditTailCommand.class
        }
)
public final class ScanRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | enqueue | scan | analyze | report | job | history | cancel | retry | "
                + "reingest | failed | stats | metrics | worker | maintenance | findings | finding | investigate | resolve | "
                + "false-positive | finding-stats | health | audit-tail");
    }

    ScanRelayRuntime runtime() {
        ScanRelayRuntime runtime = new ScanRelayRuntime(ScanRelayConfig.fromRoot(root, namespace));
        runtime.init();
        return runtime;
    }

    static int error(String message) {
        System.out.println(Jsons.toCompactJson(Map.of("error", message)));
        return 1;
    }

    static Duration millisOrNull(Long ms) {
        return ms == null ? null : Duration.ofMillis(ms);
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                System.out.println("Initialized ScanRelay at: " + runtime.config().rootDir());
                return 0;
            }
        }
    }

    @Command(name = "enqueue", description = "Enqueue a job with a raw JSON payload")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Job type: scan|analysis|report")
        String type;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON payload object")
        String payload;

        @Option(names = {"--meta"}, description = "JSON meta object")
        String meta;

        @Option(names = {"--priority"}, description = "high|default|low (type default when omitted)")
        String priority;

        @Option(names = {"--timeout-ms"}, description = "Execution timeout in ms")
        Long timeoutMs;

        @Option(names = {"--result-ttl-ms"}, description = "Result retention in ms")
        Long resultTtlMs;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                String jobId = runtime.queue().enqueue(
                        JobType.fromString(type),
                        priority,
                        Jsons.parse(payload),
                        millisOrNull(timeoutMs),
                        millisOrNull(resultTtlMs),
                        Jsons.parse(meta)
                );
                System.out.println(Jsons.toJson(Map.of("job_id", jobId)));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "scan", description = "Enqueue a security scan")
    static final class ScanCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--target"}, required = true, description = "Scan target (host, CIDR or URL)")
        String target;

        @Option(names = {"--scan-type"}, defaultValue = "vulnerability", description = "vulnerability|network|compliance")
        String scanType;

        @Option(names = {"--config"}, description = "JSON scan configuration")
        String configJson;

        @Option(names = {"--priority"}, description = "high|default|low")
        String priority;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                String jobId = runtime.queue().enqueueScan(tenant, scanType, target, Jsons.parse(configJson), priority);
                System.out.println(Jsons.toJson(Map.of("job_id", jobId)));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "analyze", description = "Enqueue a threat analysis over scored observations")
    static final class AnalyzeCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--threat-data"}, required = true, description = "JSON object with an observations array")
        String threatData;

        @Option(names = {"--priority"}, description = "high|default|low")
        String priority;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                String jobId = runtime.queue().enqueueThreatAnalysis(tenant, Jsons.parse(threatData), priority);
                System.out.println(Jsons.toJson(Map.of("job_id", jobId)));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "report", description = "Enqueue report generation")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--tenant"}, required = true, description = "Tenant id")
        String tenant;

        @Option(names = {"--report-type"}, defaultValue = "security_summary", description = "Report type")
        String reportType;

        @Option(names = {"--parameters"}, description = "JSON parameters, e.g. {\"sections\":[\"summary\"]}")
        String parameters;

        @Option(names = {"--priority"}, description = "high|default|low")
        String priority;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                String jobId = runtime.queue().enqueueReport(tenant, reportType, Jsons.parse(parameters), priority);
                System.out.println(Jsons.toJson(Map.of("job_id", jobId)));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "job", description = "Show job status, progress and result")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                Optional<JobView> job = runtime.statusView().status(jobId);
                if (job.isEmpty()) {
                    return error("job not found");
                }
                System.out.println(Jsons.toJson(job.get()));
                return 0;
            }
        }
    }

    @Command(name = "history", description = "Show the status history of a job")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.statusView().history(jobId)));
                return 0;
            }
        }
    }

    @Command(name = "cancel", description = "Cancel a queued job or ask a running one to stop")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                JobStore.CancelResult out = runtime.queue().cancelDetailed(jobId);
                System.out.println(Jsons.toJson(out));
                return out.accepted() ? 0 : 1;
            }
        }
    }

    @Command(name = "retry", description = "Re-enqueue a failed or cancelled job as a new job")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                String newId = runtime.queue().retry(jobId);
                System.out.println(Jsons.toJson(Map.of("job_id", newId, "retry_of", jobId)));
                return 0;
            } catch (ScanRelayException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "reingest", description = "Replay finding ingestion for a finished analysis job")
    static final class ReingestCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Analysis job id")
        String jobId;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                AnomalyClassifier.ReingestOutcome out = runtime.reingestFindings(jobId);
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("job_id", out.jobId());
                row.put("replayed", out.replayed());
                row.put("findings", out.findings().size());
                System.out.println(Jsons.toJson(row));
                return 0;
            } catch (ScanRelayException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "failed", description = "List failed jobs")
    static final class FailedCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--priority"}, description = "Restrict to one tier: high|default|low")
        String priority;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                Priority tier = priority == null ? null : Priority.parse(priority).orElse(null);
                if (priority != null && tier == null) {
                    return error("unknown priority: " + priority);
                }
                System.out.println(Jsons.toJson(runtime.queue().failedJobs(tier, limit)));
                return 0;
            }
        }
    }

    @Command(name = "stats", description = "Per-priority job counts")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.statusView().stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Prometheus text exposition of queue and finding gauges")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "worker", description = "Run the worker pool, or a single claim with --once")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Claim and run at most one job")
        boolean once;

        @Option(names = {"--worker-id"}, defaultValue = "worker-local", description = "Worker identity")
        String workerId;

        @Option(names = {"--duration-ms"}, defaultValue = "0",
                description = "Stop the pool after this many ms; 0 runs until the process is stopped")
        long durationMs;

        @Override
        public Integer call() throws Exception {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                if (once) {
                    WorkerOutcome result = runtime.runWorkerOnce(workerId);
                    System.out.println(Jsons.toJson(result));
                    return 0;
                }
                WorkerPool pool = runtime.newWorkerPool(workerId);
                CountDownLatch stopped = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    pool.close();
                    stopped.countDown();
                }, "scanrelay-shutdown-hook"));
                pool.start();
                if (durationMs > 0L) {
                    stopped.await(durationMs, TimeUnit.MILLISECONDS);
                } else {
                    stopped.await();
                }
                pool.close();
                System.out.println(Jsons.toJson(pool.workerStats()));
                return 0;
            }
        }
    }

    @Command(name = "maintenance", description = "Fail overdue jobs, purge expired ones, apply finding inactivity policy")
    static final class MaintenanceCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.runMaintenance()));
                return 0;
            }
        }
    }

    @Command(name = "findings", description = "List findings")
    static final class FindingsCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--tenant"}, description = "Tenant id")
        String tenant;

        @Option(names = {"--status"}, description = "active|investigating|resolved|false_positive")
        String status;

        @Option(names = {"--severity"}, description = "low|medium|high|critical")
        String severity;

        @Option(names = {"--category"}, description = "Observation category")
        String category;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Page size")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Page offset")
        int offset;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                FindingFilter filter = new FindingFilter(
                        tenant,
                        status == null ? null : FindingStatus.fromString(status),
                        severity == null ? null : Severity.fromString(severity),
                        category,
                        limit,
                        offset
                );
                List<Finding> rows = runtime.statusView().findings(filter);
                System.out.println(Jsons.toJson(rows));
                return 0;
            } catch (IllegalArgumentException e) {
                return error(e.getMessage());
            }
        }
    }

    @Command(name = "finding", description = "Show one finding")
    static final class FindingCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Finding id")
        String findingId;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                Optional<Finding> finding = runtime.statusView().finding(findingId);
                if (finding.isEmpty()) {
                    return error("finding not found");
                }
                System.out.println(Jsons.toJson(finding.get()));
                return 0;
            }
        }
    }

    abstract static class FindingTransitionCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Parameters(index = "0", description = "Finding id")
        String findingId;

        @Option(names = {"--actor"}, defaultValue = "analyst", description = "Analyst id")
        String actor;

        @Option(names = {"--note"}, description = "Analyst note")
        String note;

        @Option(names = {"--expected-version"}, description = "Fail with a conflict unless the finding is at this version")
        Long expectedVersion;

        abstract FindingStatus target();

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                Finding updated = runtime.classifier().transition(findingId, expectedVersion, target(), actor, note);
                System.out.println(Jsons.toJson(updated));
                return 0;
            } catch (ScanRelayException e) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("error", e.getClass().getSimpleName());
                out.put("message", e.getMessage());
                System.out.println(Jsons.toCompactJson(out));
                return 1;
            }
        }
    }

    @Command(name = "investigate", description = "Start investigating an ACTIVE finding")
    static final class InvestigateCommand extends FindingTransitionCommand {
        @Override
        FindingStatus target() {
            return FindingStatus.INVESTIGATING;
        }
    }

    @Command(name = "resolve", description = "Resolve a finding")
    static final class ResolveCommand extends FindingTransitionCommand {
        @Override
        FindingStatus target() {
            return FindingStatus.RESOLVED;
        }
    }

    @Command(name = "false-positive", description = "Mark a finding as a false positive")
    static final class FalsePositiveCommand extends FindingTransitionCommand {
        @Override
        FindingStatus target() {
            return FindingStatus.FALSE_POSITIVE;
        }
    }

    @Command(name = "finding-stats", description = "Finding counts by severity, status and category")
    static final class FindingStatsCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--tenant"}, description = "Tenant id; all tenants when omitted")
        String tenant;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.statusView().findingStats(tenant)));
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Check store reachability, directories and audit chain")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                ScanRelayRuntime.HealthOutcome out = runtime.health();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        ScanRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            try (ScanRelayRuntime runtime = parent.runtime()) {
                for (JsonNode row : runtime.auditTail(lines)) {
                    System.out.println(Jsons.toCompactJson(row));
                }
                return 0;
            }
        }
    }
}
