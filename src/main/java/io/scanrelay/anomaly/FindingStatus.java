package io.scanrelay.anomaly;

import java.util.Locale;

/**
 * Analyst workflow for a finding:
 * ACTIVE -> INVESTIGATING, and ACTIVE | INVESTIGATING -> RESOLVED | FALSE_POSITIVE.
 */
public enum FindingStatus {
    ACTIVE,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean canTransitionTo(FindingStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case ACTIVE -> next == INVESTIGATING || next == RESOLVED || next == FALSE_POSITIVE;
            case INVESTIGATING -> next == RESOLVED || next == FALSE_POSITIVE;
            case RESOLVED, FALSE_POSITIVE -> false;
        };
    }

    public static FindingStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("finding status must not be blank");
        }
        String v = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown finding status: " + raw, e);
        }
    }
}
