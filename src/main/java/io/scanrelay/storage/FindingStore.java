package io.scanrelay.storage;

import io.scanrelay.anomaly.Finding;
import io.scanrelay.anomaly.FindingFilter;
import io.scanrelay.anomaly.FindingStats;
import io.scanrelay.anomaly.FindingStatus;
import io.scanrelay.anomaly.Severity;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Findings are retained indefinitely. Status changes are compare-and-set on
 * the row version so concurrent analyst commands cannot overwrite each other.
 */
public final class FindingStore {
    private static final String COLUMNS = "finding_id,tenant_id,source_job_id,severity,confidence,score,category,source,"
            + "description,status,detected_at_ms,resolved_at_ms,updated_at_ms,updated_by,note,version";

    private final Database database;

    public FindingStore(Database database) {
        this.database = database;
    }

    public void insertAll(List<Finding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO findings(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (Finding f : findings) {
                    ps.setString(1, f.findingId());
                    ps.setString(2, f.tenantId() == null ? "" : f.tenantId());
                    ps.setString(3, f.sourceJobId());
                    ps.setString(4, f.severity().name());
                    ps.setDouble(5, f.confidence());
                    ps.setDouble(6, f.score());
                    ps.setString(7, f.category());
                    ps.setString(8, f.source() == null ? "" : f.source());
                    ps.setString(9, f.description() == null ? "" : f.description());
                    ps.setString(10, f.status().name());
                    ps.setLong(11, f.detectedAtMs());
                    if (f.resolvedAtMs() == null) {
                        ps.setNull(12, Types.INTEGER);
                    } else {
                        ps.setLong(12, f.resolvedAtMs());
                    }
                    ps.setLong(13, f.updatedAtMs());
                    ps.setString(14, f.updatedBy());
                    ps.setString(15, f.note());
                    ps.setLong(16, f.version());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to insert findings", e);
        }
    }

    public Optional<Finding> find(String findingId) {
        if (findingId == null || findingId.isBlank()) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM findings WHERE finding_id=?")) {
            ps.setString(1, findingId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load finding " + findingId, e);
        }
    }

    /**
     * Moves the finding to {@code next} only if its version is still
     * {@code expectedVersion}. Returns false when another writer got there first.
     */
    public boolean compareAndSetStatus(String findingId, long expectedVersion, FindingStatus next,
                                       String actor, String note, long nowMs) {
        String sql = "UPDATE findings SET status=?, updated_at_ms=?, updated_by=?, note=COALESCE(?, note), "
                + "resolved_at_ms=CASE WHEN ?=1 THEN ? ELSE resolved_at_ms END, version=version+1 "
                + "WHERE finding_id=? AND version=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int terminal = next.isTerminal() ? 1 : 0;
            ps.setString(1, next.name());
            ps.setLong(2, nowMs);
            ps.setString(3, actor);
            ps.setString(4, note == null || note.isBlank() ? null : note);
            ps.setInt(5, terminal);
            ps.setLong(6, nowMs);
            ps.setString(7, findingId);
            ps.setLong(8, expectedVersion);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update finding " + findingId, e);
        }
    }

    public List<Finding> list(FindingFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM findings WHERE 1=1");
        List<Object> args = new ArrayList<>();
        appendFilter(sql, args, filter);
        sql.append(" ORDER BY detected_at_ms DESC, finding_id LIMIT ? OFFSET ?");
        args.add(filter.limit());
        args.add(filter.offset());
        List<Finding> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list findings", e);
        }
    }

    public List<Finding> listBySourceJob(String jobId) {
        List<Finding> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM findings WHERE source_job_id=? ORDER BY detected_at_ms, finding_id")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list findings for job " + jobId, e);
        }
    }

    public FindingStats stats(String tenantId) {
        String tenant = tenantId == null || tenantId.isBlank() ? null : tenantId.trim();
        String sql = "SELECT severity,status,category,COUNT(*) AS n FROM findings"
                + (tenant == null ? "" : " WHERE tenant_id=?")
                + " GROUP BY severity,status,category";
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (Severity s : Severity.values()) {
            bySeverity.put(s.name(), 0L);
        }
        for (FindingStatus s : FindingStatus.values()) {
            byStatus.put(s.name(), 0L);
        }
        long total = 0L;
        long open = 0L;
        long critical = 0L;
        long resolved = 0L;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (tenant != null) {
                ps.setString(1, tenant);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long n = rs.getLong("n");
                    Severity severity = Severity.valueOf(rs.getString("severity"));
                    FindingStatus status = FindingStatus.valueOf(rs.getString("status"));
                    total += n;
                    if (!status.isTerminal()) {
                        open += n;
                        if (severity == Severity.CRITICAL) {
                            critical += n;
                        }
                    }
                    if (status == FindingStatus.RESOLVED) {
                        resolved += n;
                    }
                    bySeverity.merge(severity.name(), n, Long::sum);
                    byStatus.merge(status.name(), n, Long::sum);
                    byCategory.merge(rs.getString("category"), n, Long::sum);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute finding stats", e);
        }
        return new FindingStats(tenant, total, open, critical, resolved, bySeverity, byStatus, byCategory);
    }

    /**
     * ACTIVE findings not touched since {@code updatedBeforeMs}, oldest first.
     */
    public List<Finding> staleActive(long updatedBeforeMs, int limit) {
        List<Finding> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + COLUMNS + " FROM findings WHERE status=? AND updated_at_ms<? ORDER BY updated_at_ms LIMIT ?")) {
            ps.setString(1, FindingStatus.ACTIVE.name());
            ps.setLong(2, updatedBeforeMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list stale findings", e);
        }
    }

    private void appendFilter(StringBuilder sql, List<Object> args, FindingFilter filter) {
        if (filter.tenantId() != null) {
            sql.append(" AND tenant_id=?");
            args.add(filter.tenantId());
        }
        if (filter.status() != null) {
            sql.append(" AND status=?");
            args.add(filter.status().name());
        }
        if (filter.severity() != null) {
            sql.append(" AND severity=?");
            args.add(filter.severity().name());
        }
        if (filter.category() != null) {
            sql.append(" AND category=?");
            args.add(filter.category());
        }
    }

    private void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object v = args.get(i);
            if (v instanceof Integer) {
                ps.setInt(i + 1, (Integer) v);
            } else {
                ps.setString(i + 1, String.valueOf(v));
            }
        }
    }

    private Finding map(ResultSet rs) throws SQLException {
        long resolvedAt = rs.getLong("resolved_at_ms");
        Long resolved = rs.wasNull() ? null : resolvedAt;
        String tenant = rs.getString("tenant_id");
        return new Finding(
                rs.getString("finding_id"),
                tenant == null || tenant.isBlank() ? null : tenant,
                rs.getString("source_job_id"),
                Severity.valueOf(rs.getString("severity")),
                rs.getDouble("confidence"),
                rs.getDouble("score"),
                rs.getString("category"),
                rs.getString("source"),
                rs.getString("description"),
                FindingStatus.valueOf(rs.getString("status")),
                rs.getLong("detected_at_ms"),
                resolved,
                rs.getLong("updated_at_ms"),
                rs.getString("updated_by"),
                rs.getString("note"),
                rs.getLong("version")
        );
    }
}
