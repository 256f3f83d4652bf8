package io.scanrelay.anomaly;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("severity must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + raw, e);
        }
    }
}
