package io.scanrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.scanrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Effective runtime settings. Values come from {@code scanrelay-settings.json}
 * in the runtime root; absent or out-of-range values fall back to defaults.
 */
public record RuntimeSettings(
        int workerCount,
        long pollIntervalMs,
        long checkpointIntervalMs,
        long watchdogIntervalMs,
        long shutdownGraceMs,
        long failureTtlMs,
        double detectionThreshold,
        double criticalThreshold,
        double highThreshold,
        double mediumThreshold,
        Map<String, Double> tenantThresholds,
        long findingInactivityMs
) {
    public RuntimeSettings {
        tenantThresholds = tenantThresholds == null ? Map.of() : Map.copyOf(tenantThresholds);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(
                ScanRelayConfig.DEFAULT_WORKER_COUNT,
                ScanRelayConfig.DEFAULT_POLL_INTERVAL_MS,
                ScanRelayConfig.DEFAULT_CHECKPOINT_INTERVAL_MS,
                ScanRelayConfig.DEFAULT_WATCHDOG_INTERVAL_MS,
                ScanRelayConfig.DEFAULT_SHUTDOWN_GRACE_MS,
                ScanRelayConfig.DEFAULT_FAILURE_TTL_MS,
                0.4d,
                0.8d,
                0.6d,
                0.4d,
                Map.of(),
                0L
        );
    }

    public static RuntimeSettings load(Path file) {
        RuntimeSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load runtime settings: " + file, e);
        }
    }

    static RuntimeSettings fromFile(SettingsFile file, RuntimeSettings defaults) {
        if (file == null) {
            return defaults;
        }
        double medium = sanitizeRatio(file.mediumThreshold(), defaults.mediumThreshold());
        double high = sanitizeRatio(file.highThreshold(), defaults.highThreshold());
        double critical = sanitizeRatio(file.criticalThreshold(), defaults.criticalThreshold());
        // the score -> severity mapping must stay monotonic
        if (high < medium) {
            high = medium;
        }
        if (critical < high) {
            critical = high;
        }
        Map<String, Double> tenants = new LinkedHashMap<>();
        if (file.tenantThresholds() != null) {
            for (Map.Entry<String, Double> e : file.tenantThresholds().entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank() || e.getValue() == null) {
                    continue;
                }
                tenants.put(e.getKey().trim().toLowerCase(Locale.ROOT), clampRatio(e.getValue()));
            }
        }
        return new RuntimeSettings(
                sanitizeInt(file.workerCount(), defaults.workerCount(), 1),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                sanitizeLong(file.checkpointIntervalMs(), defaults.checkpointIntervalMs(), 0L),
                sanitizeLong(file.watchdogIntervalMs(), defaults.watchdogIntervalMs(), 50L),
                sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L),
                sanitizeLong(file.failureTtlMs(), defaults.failureTtlMs(), 1L),
                sanitizeRatio(file.detectionThreshold(), defaults.detectionThreshold()),
                critical,
                high,
                medium,
                tenants,
                sanitizeLong(file.findingInactivityMs(), defaults.findingInactivityMs(), 0L)
        );
    }

    public double detectionThresholdFor(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return detectionThreshold;
        }
        Double override = tenantThresholds.get(tenantId.trim().toLowerCase(Locale.ROOT));
        return override == null ? detectionThreshold : override;
    }

    public RuntimeSettings withWorkerCount(int count) {
        return new RuntimeSettings(Math.max(1, count), pollIntervalMs, checkpointIntervalMs, watchdogIntervalMs,
                shutdownGraceMs, failureTtlMs, detectionThreshold, criticalThreshold, highThreshold, mediumThreshold,
                tenantThresholds, findingInactivityMs);
    }

    public RuntimeSettings withCheckpointIntervalMs(long intervalMs) {
        return new RuntimeSettings(workerCount, pollIntervalMs, Math.max(0L, intervalMs), watchdogIntervalMs,
                shutdownGraceMs, failureTtlMs, detectionThreshold, criticalThreshold, highThreshold, mediumThreshold,
                tenantThresholds, findingInactivityMs);
    }

    public RuntimeSettings withPollIntervalMs(long intervalMs) {
        return new RuntimeSettings(workerCount, Math.max(10L, intervalMs), checkpointIntervalMs, watchdogIntervalMs,
                shutdownGraceMs, failureTtlMs, detectionThreshold, criticalThreshold, highThreshold, mediumThreshold,
                tenantThresholds, findingInactivityMs);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static double sanitizeRatio(Double value, double fallback) {
        if (value == null || value.isNaN()) {
            return fallback;
        }
        return clampRatio(value);
    }

    private static double clampRatio(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer workerCount,
            Long pollIntervalMs,
            Long checkpointIntervalMs,
            Long watchdogIntervalMs,
            Long shutdownGraceMs,
            Long failureTtlMs,
            Double detectionThreshold,
            Double criticalThreshold,
            Double highThreshold,
            Double mediumThreshold,
            Map<String, Double> tenantThresholds,
            Long findingInactivityMs
    ) {
    }
}
