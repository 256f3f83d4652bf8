package io.scanrelay.model;

import java.util.Locale;
import java.util.Optional;

public enum Priority {
    HIGH("high", 0),
    DEFAULT("default", 1),
    LOW("low", 2);

    private final String queueName;
    private final int rank;

    Priority(String queueName, int rank) {
        this.queueName = queueName;
        this.rank = rank;
    }

    public String queueName() {
        return queueName;
    }

    /**
     * Service order of the tier; lower ranks are always drained first.
     */
    public int rank() {
        return rank;
    }

    public static Optional<Priority> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String v = raw.trim();
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.queueName.equalsIgnoreCase(v)) {
                return Optional.of(value);
            }
        }
        if ("normal".equals(v.toLowerCase(Locale.ROOT))) {
            return Optional.of(DEFAULT);
        }
        return Optional.empty();
    }
}
