package io.scanrelay.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.scanrelay.model.ErrorKind;
import io.scanrelay.model.JobHistoryEntry;
import io.scanrelay.model.JobOutcome;
import io.scanrelay.model.JobStatus;
import io.scanrelay.model.JobType;
import io.scanrelay.model.JobView;
import io.scanrelay.model.Priority;
import io.scanrelay.model.QueueStats;
import io.scanrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job records, per-tier queue lists and the status history log.
 * Every mutating method runs in a single IMMEDIATE transaction, so a job is
 * never visible half-written and two claimers can never pop the same entry.
 */
public final class JobStore {
    private static final String JOB_COLUMNS = "job_id,job_type,priority,status,progress,tenant_id,payload,meta,"
            + "result_payload,error_kind,last_error,worker_id,timeout_ms,result_ttl_ms,created_at_ms,"
            + "started_at_ms,ended_at_ms,expires_at_ms";
    private static final int MAX_STALE_QUEUE_SKIPS = 64;

    private final Database database;
    private final String namespace;

    public JobStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public void insert(NewJob job) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(
                    "INSERT INTO jobs(job_id,namespace,job_type,priority,status,progress,tenant_id,payload,meta,"
                            + "timeout_ms,result_ttl_ms,failure_ttl_ms,created_at_ms,updated_at_ms) "
                            + "VALUES(?,?,?,?,?,0,?,?,?,?,?,?,?,?)");
                 PreparedStatement q = c.prepareStatement(
                         "INSERT INTO job_queue(job_id,tier_rank,enqueued_at_ms) VALUES(?,?,?)")) {
                ins.setString(1, job.jobId());
                ins.setString(2, namespace);
                ins.setString(3, job.type().name());
                ins.setString(4, job.priority().name());
                ins.setString(5, JobStatus.QUEUED.name());
                ins.setString(6, job.tenantId() == null ? "" : job.tenantId());
                ins.setString(7, Jsons.toCompactJson(job.payload()));
                ins.setString(8, Jsons.toCompactJson(Jsons.objectOrEmpty(job.meta())));
                ins.setLong(9, job.timeoutMs());
                ins.setLong(10, job.resultTtlMs());
                ins.setLong(11, job.failureTtlMs());
                ins.setLong(12, job.nowMs());
                ins.setLong(13, job.nowMs());
                ins.executeUpdate();

                q.setString(1, job.jobId());
                q.setInt(2, job.priority().rank());
                q.setLong(3, job.nowMs());
                q.executeUpdate();

                appendHistory(c, job.jobId(), null, JobStatus.QUEUED, null, job.priority().queueName(), job.nowMs());
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to insert job " + job.jobId(), e);
        }
    }

    /**
     * Pops the head of the highest non-empty tier and marks the job STARTED
     * for {@code workerId}. Empty when every tier is empty.
     */
    public Optional<ClaimedJob> claimNext(String workerId, long nowMs) {
        String head = "SELECT seq,job_id FROM job_queue ORDER BY tier_rank, seq LIMIT 1";
        String pop = "DELETE FROM job_queue WHERE seq=?";
        String start = "UPDATE jobs SET status=?, worker_id=?, started_at_ms=?, deadline_at_ms=?+timeout_ms, updated_at_ms=? "
                + "WHERE job_id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psHead = c.prepareStatement(head);
                 PreparedStatement psPop = c.prepareStatement(pop);
                 PreparedStatement psStart = c.prepareStatement(start)) {
                for (int i = 0; i < MAX_STALE_QUEUE_SKIPS; i++) {
                    long seq;
                    String jobId;
                    try (ResultSet rs = psHead.executeQuery()) {
                        if (!rs.next()) {
                            c.commit();
                            return Optional.empty();
                        }
                        seq = rs.getLong("seq");
                        jobId = rs.getString("job_id");
                    }
                    psPop.setLong(1, seq);
                    psPop.executeUpdate();

                    psStart.setString(1, JobStatus.STARTED.name());
                    psStart.setString(2, workerId);
                    psStart.setLong(3, nowMs);
                    psStart.setLong(4, nowMs);
                    psStart.setLong(5, nowMs);
                    psStart.setString(6, jobId);
                    psStart.setString(7, JobStatus.QUEUED.name());
                    if (psStart.executeUpdate() != 1) {
                        // queue entry outlived its job; drop it and look at the next head
                        continue;
                    }
                    appendHistory(c, jobId, JobStatus.QUEUED, JobStatus.STARTED, workerId, null, nowMs);
                    ClaimedJob claimed = loadClaimed(c, jobId);
                    c.commit();
                    return Optional.of(claimed);
                }
                c.commit();
                return Optional.empty();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to claim job", e);
        }
    }

    public Optional<JobView> find(String jobId, long nowMs) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        String sql = "SELECT " + JOB_COLUMNS + " FROM jobs WHERE job_id=? AND (expires_at_ms IS NULL OR expires_at_ms>=?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapView(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load job " + jobId, e);
        }
    }

    /**
     * Raises progress and records the current phase. Returns false once the
     * job is no longer STARTED under {@code workerId}.
     */
    public boolean checkpoint(String jobId, String workerId, int progress, String phase, long nowMs) {
        int clamped = Math.max(0, Math.min(100, progress));
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement(
                    "SELECT meta FROM jobs WHERE job_id=? AND status=? AND worker_id=?");
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE jobs SET progress=MAX(progress, ?), meta=?, updated_at_ms=? WHERE job_id=? AND status=? AND worker_id=?")) {
                read.setString(1, jobId);
                read.setString(2, JobStatus.STARTED.name());
                read.setString(3, workerId);
                ObjectNode meta;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return false;
                    }
                    meta = Jsons.parseObject(rs.getString("meta"));
                }
                if (phase != null && !phase.isBlank()) {
                    meta.put("current_phase", phase);
                }
                upd.setInt(1, clamped);
                upd.setString(2, Jsons.toCompactJson(meta));
                upd.setLong(3, nowMs);
                upd.setString(4, jobId);
                upd.setString(5, JobStatus.STARTED.name());
                upd.setString(6, workerId);
                boolean owned = upd.executeUpdate() == 1;
                c.commit();
                return owned;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to checkpoint job " + jobId, e);
        }
    }

    public boolean cancelRequested(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT meta FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                return Jsons.parseObject(rs.getString("meta")).path("cancelled").asBoolean(false);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cancel flag for job " + jobId, e);
        }
    }

    /**
     * Write-once terminal transition. Only the worker that owns the STARTED
     * job can complete it; every later caller gets false.
     */
    public boolean complete(String jobId, String workerId, JobOutcome outcome, long nowMs) {
        String sql = "UPDATE jobs SET status=?, result_payload=?, error_kind=?, last_error=?, "
                + "progress=CASE WHEN ?=1 THEN 100 ELSE progress END, ended_at_ms=?, "
                + "expires_at_ms=?+CASE WHEN ?=1 THEN result_ttl_ms ELSE failure_ttl_ms END, updated_at_ms=? "
                + "WHERE job_id=? AND status=? AND worker_id=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int finished = outcome.success() ? 1 : 0;
                ps.setString(1, outcome.status().name());
                ps.setString(2, outcome.result());
                ps.setString(3, outcome.errorKind() == null ? null : outcome.errorKind().name());
                ps.setString(4, outcome.error());
                ps.setInt(5, finished);
                ps.setLong(6, nowMs);
                ps.setLong(7, nowMs);
                ps.setInt(8, finished);
                ps.setLong(9, nowMs);
                ps.setString(10, jobId);
                ps.setString(11, JobStatus.STARTED.name());
                ps.setString(12, workerId);
                boolean won = ps.executeUpdate() == 1;
                if (won) {
                    appendHistory(c, jobId, JobStatus.STARTED, outcome.status(), workerId,
                            outcome.errorKind() == null ? null : outcome.errorKind().name(), nowMs);
                }
                c.commit();
                return won;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to complete job " + jobId, e);
        }
    }

    /**
     * QUEUED jobs leave their tier list and become CANCELLED at once. STARTED
     * jobs get {@code meta.cancelled=true} and stop at their next checkpoint.
     */
    public CancelResult cancel(String jobId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement(
                    "SELECT status,meta,worker_id FROM jobs WHERE job_id=? AND (expires_at_ms IS NULL OR expires_at_ms>=?)")) {
                read.setString(1, jobId);
                read.setLong(2, nowMs);
                JobStatus status;
                ObjectNode meta;
                String workerId;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return new CancelResult(jobId, CancelOutcome.NOT_FOUND, null);
                    }
                    status = JobStatus.valueOf(rs.getString("status"));
                    meta = Jsons.parseObject(rs.getString("meta"));
                    workerId = rs.getString("worker_id");
                }
                CancelResult result;
                if (status == JobStatus.QUEUED) {
                    cancelQueued(c, jobId, nowMs);
                    result = new CancelResult(jobId, CancelOutcome.CANCELLED, status);
                } else if (status == JobStatus.STARTED) {
                    meta.put("cancelled", true);
                    try (PreparedStatement upd = c.prepareStatement(
                            "UPDATE jobs SET meta=?, updated_at_ms=? WHERE job_id=? AND status=?")) {
                        upd.setString(1, Jsons.toCompactJson(meta));
                        upd.setLong(2, nowMs);
                        upd.setString(3, jobId);
                        upd.setString(4, JobStatus.STARTED.name());
                        upd.executeUpdate();
                    }
                    appendHistory(c, jobId, JobStatus.STARTED, JobStatus.STARTED, workerId, "cancel_requested", nowMs);
                    result = new CancelResult(jobId, CancelOutcome.REQUESTED, status);
                } else {
                    result = new CancelResult(jobId, CancelOutcome.TERMINAL, status);
                }
                c.commit();
                return result;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to cancel job " + jobId, e);
        }
    }

    private void cancelQueued(Connection c, String jobId, long nowMs) throws SQLException {
        try (PreparedStatement del = c.prepareStatement("DELETE FROM job_queue WHERE job_id=?");
             PreparedStatement upd = c.prepareStatement(
                     "UPDATE jobs SET status=?, error_kind=?, last_error=?, ended_at_ms=?, "
                             + "expires_at_ms=?+failure_ttl_ms, updated_at_ms=? WHERE job_id=? AND status=?")) {
            del.setString(1, jobId);
            del.executeUpdate();
            upd.setString(1, JobStatus.CANCELLED.name());
            upd.setString(2, ErrorKind.CANCELLED.name());
            upd.setString(3, "cancelled before start");
            upd.setLong(4, nowMs);
            upd.setLong(5, nowMs);
            upd.setLong(6, nowMs);
            upd.setString(7, jobId);
            upd.setString(8, JobStatus.QUEUED.name());
            upd.executeUpdate();
        }
        appendHistory(c, jobId, JobStatus.QUEUED, JobStatus.CANCELLED, null, null, nowMs);
    }

    /**
     * Watchdog sweep: fails every STARTED job whose deadline has passed.
     * Returns the ids it failed.
     */
    public List<String> failOverdue(long nowMs) {
        List<String> failed = new ArrayList<>();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement find = c.prepareStatement(
                    "SELECT job_id,worker_id,timeout_ms FROM jobs WHERE status=? AND deadline_at_ms<?");
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE jobs SET status=?, error_kind=?, last_error=?, ended_at_ms=?, "
                                 + "expires_at_ms=?+failure_ttl_ms, updated_at_ms=? WHERE job_id=? AND status=?")) {
                find.setString(1, JobStatus.STARTED.name());
                find.setLong(2, nowMs);
                List<String[]> overdue = new ArrayList<>();
                try (ResultSet rs = find.executeQuery()) {
                    while (rs.next()) {
                        overdue.add(new String[]{
                                rs.getString("job_id"),
                                rs.getString("worker_id"),
                                String.valueOf(rs.getLong("timeout_ms"))
                        });
                    }
                }
                for (String[] row : overdue) {
                    upd.setString(1, JobStatus.FAILED.name());
                    upd.setString(2, ErrorKind.TIMEOUT_EXCEEDED.name());
                    upd.setString(3, timeoutMessage(Long.parseLong(row[2])));
                    upd.setLong(4, nowMs);
                    upd.setLong(5, nowMs);
                    upd.setLong(6, nowMs);
                    upd.setString(7, row[0]);
                    upd.setString(8, JobStatus.STARTED.name());
                    if (upd.executeUpdate() == 1) {
                        appendHistory(c, row[0], JobStatus.STARTED, JobStatus.FAILED, row[1], "watchdog", nowMs);
                        failed.add(row[0]);
                    }
                }
                c.commit();
                return failed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to sweep overdue jobs", e);
        }
    }

    public static String timeoutMessage(long timeoutMs) {
        return "Job exceeded timeout of " + timeoutMs + "ms";
    }

    public QueueStats counts(long nowMs) {
        String sql = "SELECT priority,status,COUNT(*) AS n FROM jobs "
                + "WHERE expires_at_ms IS NULL OR expires_at_ms>=? GROUP BY priority,status";
        Map<Priority, Map<JobStatus, Long>> grouped = new EnumMap<>(Priority.class);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Priority p = Priority.valueOf(rs.getString("priority"));
                    JobStatus s = JobStatus.valueOf(rs.getString("status"));
                    grouped.computeIfAbsent(p, k -> new EnumMap<>(JobStatus.class)).put(s, rs.getLong("n"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
        Map<String, QueueStats.TierStats> tiers = new LinkedHashMap<>();
        for (Priority p : Priority.values()) {
            Map<JobStatus, Long> m = grouped.getOrDefault(p, Map.of());
            tiers.put(p.queueName(), new QueueStats.TierStats(
                    m.getOrDefault(JobStatus.QUEUED, 0L),
                    m.getOrDefault(JobStatus.STARTED, 0L),
                    m.getOrDefault(JobStatus.FINISHED, 0L),
                    m.getOrDefault(JobStatus.FAILED, 0L),
                    m.getOrDefault(JobStatus.CANCELLED, 0L)
            ));
        }
        return new QueueStats(tiers, nowMs);
    }

    /**
     * Newest first. {@code status} and {@code priority} are optional filters.
     */
    public List<JobView> list(JobStatus status, Priority priority, int limit, long nowMs) {
        StringBuilder sql = new StringBuilder("SELECT ").append(JOB_COLUMNS)
                .append(" FROM jobs WHERE (expires_at_ms IS NULL OR expires_at_ms>=?)");
        if (status != null) {
            sql.append(" AND status=?");
        }
        if (priority != null) {
            sql.append(" AND priority=?");
        }
        sql.append(" ORDER BY COALESCE(ended_at_ms, created_at_ms) DESC, job_id LIMIT ?");
        List<JobView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setLong(i++, nowMs);
            if (status != null) {
                ps.setString(i++, status.name());
            }
            if (priority != null) {
                ps.setString(i++, priority.name());
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapView(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list jobs", e);
        }
    }

    public List<JobHistoryEntry> history(String jobId) {
        String sql = "SELECT seq,job_id,from_status,to_status,worker_id,detail,at_ms FROM job_history WHERE job_id=? ORDER BY seq";
        List<JobHistoryEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String from = rs.getString("from_status");
                    out.add(new JobHistoryEntry(
                            rs.getLong("seq"),
                            rs.getString("job_id"),
                            from == null ? null : JobStatus.valueOf(from),
                            JobStatus.valueOf(rs.getString("to_status")),
                            rs.getString("worker_id"),
                            rs.getString("detail"),
                            rs.getLong("at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load history for job " + jobId, e);
        }
    }

    /**
     * Number of history rows moving a job into {@code status}, across all jobs.
     */
    public long countTransitionsTo(JobStatus status) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*) FROM job_history WHERE to_status=? AND (from_status IS NULL OR from_status<>to_status)")) {
            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count transitions", e);
        }
    }

    /**
     * Deletes jobs (and their history) whose retention window has elapsed.
     */
    public int purgeExpired(long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement hist = c.prepareStatement(
                    "DELETE FROM job_history WHERE job_id IN (SELECT job_id FROM jobs WHERE expires_at_ms<?)");
                 PreparedStatement jobs = c.prepareStatement("DELETE FROM jobs WHERE expires_at_ms<?")) {
                hist.setLong(1, nowMs);
                hist.executeUpdate();
                jobs.setLong(1, nowMs);
                int removed = jobs.executeUpdate();
                c.commit();
                return removed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to purge expired jobs", e);
        }
    }

    private ClaimedJob loadClaimed(Connection c, String jobId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT job_id,job_type,priority,tenant_id,payload,meta,timeout_ms,started_at_ms,deadline_at_ms FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("claimed job vanished: " + jobId);
                }
                String tenant = rs.getString("tenant_id");
                return new ClaimedJob(
                        rs.getString("job_id"),
                        JobType.valueOf(rs.getString("job_type")),
                        Priority.valueOf(rs.getString("priority")),
                        tenant == null || tenant.isBlank() ? null : tenant,
                        Jsons.parse(rs.getString("payload")),
                        Jsons.parseObject(rs.getString("meta")),
                        rs.getLong("timeout_ms"),
                        rs.getLong("started_at_ms"),
                        rs.getLong("deadline_at_ms")
                );
            }
        }
    }

    private void appendHistory(Connection c, String jobId, JobStatus from, JobStatus to, String workerId,
                               String detail, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO job_history(job_id,from_status,to_status,worker_id,detail,at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, jobId);
            ps.setString(2, from == null ? null : from.name());
            ps.setString(3, to.name());
            ps.setString(4, workerId);
            ps.setString(5, detail);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        }
    }

    private JobView mapView(ResultSet rs) throws SQLException {
        String tenant = rs.getString("tenant_id");
        String errorKind = rs.getString("error_kind");
        String result = rs.getString("result_payload");
        return new JobView(
                rs.getString("job_id"),
                JobType.valueOf(rs.getString("job_type")),
                Priority.valueOf(rs.getString("priority")),
                JobStatus.valueOf(rs.getString("status")),
                rs.getInt("progress"),
                tenant == null || tenant.isBlank() ? null : tenant,
                Jsons.parse(rs.getString("payload")),
                Jsons.parseObject(rs.getString("meta")),
                result == null ? null : parseResult(result),
                errorKind == null ? null : ErrorKind.valueOf(errorKind),
                rs.getString("last_error"),
                rs.getString("worker_id"),
                rs.getLong("timeout_ms"),
                rs.getLong("result_ttl_ms"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "ended_at_ms"),
                nullableLong(rs, "expires_at_ms")
        );
    }

    private static JsonNode parseResult(String raw) {
        try {
            return Jsons.parse(raw);
        } catch (IllegalArgumentException e) {
            // handlers may return plain text
            return Jsons.mapper().getNodeFactory().textNode(raw);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    public record NewJob(
            String jobId,
            JobType type,
            Priority priority,
            String tenantId,
            JsonNode payload,
            JsonNode meta,
            long timeoutMs,
            long resultTtlMs,
            long failureTtlMs,
            long nowMs
    ) {
    }

    public record ClaimedJob(
            String jobId,
            JobType type,
            Priority priority,
            String tenantId,
            JsonNode payload,
            ObjectNode meta,
            long timeoutMs,
            long startedAtMs,
            long deadlineAtMs
    ) {
    }

    public enum CancelOutcome {
        CANCELLED,
        REQUESTED,
        TERMINAL,
        NOT_FOUND
    }

    public record CancelResult(String jobId, CancelOutcome outcome, JobStatus statusBefore) {
        public boolean accepted() {
            return outcome == CancelOutcome.CANCELLED || outcome == CancelOutcome.REQUESTED;
        }
    }
}
