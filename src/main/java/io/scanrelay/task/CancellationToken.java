package io.scanrelay.task;

import java.time.Clock;
import java.util.function.BooleanSupplier;

/**
 * Polled cancel flag. The backing probe is consulted at most once per
 * {@code checkIntervalMs}; a positive answer sticks.
 */
public final class CancellationToken {
    private final BooleanSupplier probe;
    private final Clock clock;
    private final long checkIntervalMs;
    private long lastPollMs;
    private boolean polled;
    private volatile boolean cancelled;
    private int polls;

    public CancellationToken(BooleanSupplier probe, Clock clock, long checkIntervalMs) {
        this.probe = probe;
        this.clock = clock;
        this.checkIntervalMs = Math.max(0L, checkIntervalMs);
    }

    public static CancellationToken never(Clock clock) {
        return new CancellationToken(() -> false, clock, Long.MAX_VALUE);
    }

    public synchronized boolean isCancellationRequested() {
        if (cancelled) {
            return true;
        }
        long now = clock.millis();
        if (!polled || now - lastPollMs >= checkIntervalMs) {
            polled = true;
            lastPollMs = now;
            polls++;
            if (probe.getAsBoolean()) {
                cancelled = true;
            }
        }
        return cancelled;
    }

    public void throwIfCancelled(String jobId) {
        if (isCancellationRequested()) {
            throw new JobCancelledException(jobId, "cancel requested");
        }
    }

    synchronized int polls() {
        return polls;
    }
}
