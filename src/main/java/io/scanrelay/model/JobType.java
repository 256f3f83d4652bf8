package io.scanrelay.model;

import java.time.Duration;

public enum JobType {
    SCAN("scan", Priority.DEFAULT, Duration.ofMinutes(30), Duration.ofHours(24)),
    ANALYSIS("analysis", Priority.HIGH, Duration.ofMinutes(10), Duration.ofHours(24)),
    REPORT("report", Priority.LOW, Duration.ofMinutes(60), Duration.ofDays(7));

    private final String wireName;
    private final Priority defaultPriority;
    private final Duration defaultTimeout;
    private final Duration defaultResultTtl;

    JobType(String wireName, Priority defaultPriority, Duration defaultTimeout, Duration defaultResultTtl) {
        this.wireName = wireName;
        this.defaultPriority = defaultPriority;
        this.defaultTimeout = defaultTimeout;
        this.defaultResultTtl = defaultResultTtl;
    }

    public String wireName() {
        return wireName;
    }

    public Priority defaultPriority() {
        return defaultPriority;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public Duration defaultResultTtl() {
        return defaultResultTtl;
    }

    public static JobType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job type must not be blank");
        }
        String v = raw.trim();
        for (JobType value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireName.equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + raw);
    }
}
