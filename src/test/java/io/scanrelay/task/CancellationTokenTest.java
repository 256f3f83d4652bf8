package io.scanrelay.task;

import io.scanrelay.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

final class CancellationTokenTest {

    @Test
    void probeIsConsultedAtMostOncePerInterval() {
        MutableClock clock = MutableClock.startingNow();
        AtomicInteger probes = new AtomicInteger();
        CancellationToken token = new CancellationToken(() -> {
            probes.incrementAndGet();
            return false;
        }, clock, 1_000L);

        for (int i = 0; i < 100; i++) {
            Assertions.assertFalse(token.isCancellationRequested());
        }
        Assertions.assertEquals(1, probes.get());

        clock.advanceMillis(999L);
        token.isCancellationRequested();
        Assertions.assertEquals(1, token.polls());

        clock.advanceMillis(1L);
        token.isCancellationRequested();
        Assertions.assertEquals(2, token.polls());
    }

    @Test
    void cancelIsObservedWithinOneIntervalAndSticks() {
        MutableClock clock = MutableClock.startingNow();
        AtomicBoolean flag = new AtomicBoolean();
        CancellationToken token = new CancellationToken(flag::get, clock, 1_000L);

        Assertions.assertFalse(token.isCancellationRequested());
        flag.set(true);
        Assertions.assertFalse(token.isCancellationRequested());
        clock.advanceMillis(1_000L);
        Assertions.assertTrue(token.isCancellationRequested());

        flag.set(false);
        clock.advanceMillis(5_000L);
        Assertions.assertTrue(token.isCancellationRequested());
        JobCancelledException e = Assertions.assertThrows(JobCancelledException.class,
                () -> token.throwIfCancelled("job-1"));
        Assertions.assertEquals("job-1", e.jobId());
    }

    @Test
    void neverTokenDoesNotCancel() {
        MutableClock clock = MutableClock.startingNow();
        CancellationToken token = CancellationToken.never(clock);
        clock.advanceMillis(60_000L);
        Assertions.assertFalse(token.isCancellationRequested());
        token.throwIfCancelled("job-1");
    }

    @Test
    void checkpointStopsWhenWorkerNoLongerOwnsJob() {
        MutableClock clock = MutableClock.startingNow();
        AtomicBoolean owned = new AtomicBoolean(true);
        TaskContext context = new TaskContext("job-1", null, "acme", null, null,
                CancellationToken.never(clock), (progress, phase) -> owned.get());

        context.checkpoint(10, "discovery");
        owned.set(false);
        Assertions.assertThrows(JobCancelledException.class, () -> context.checkpoint(20, "scan"));
    }
}
