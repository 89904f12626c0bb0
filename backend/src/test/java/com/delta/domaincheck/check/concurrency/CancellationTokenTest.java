package com.delta.domaincheck.check.concurrency;

import org.junit.jupiter.api.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void listenersRunOnceOnCancel() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel("user_abort");
        token.cancel("again");

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
        assertEquals("user_abort", token.reason());
    }

    @Test
    void listenerRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void closedRegistrationIsNotNotified() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

        registration.close();
        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void awaitReturnsEarlyWhenCancelled() throws Exception {
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(() -> token.cancel(), 50, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();

            assertTrue(token.awaitCancellation(10_000));
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) < 5_000);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void awaitTimesOutWhenNotCancelled() throws Exception {
        CancellationToken token = new CancellationToken();

        assertFalse(token.awaitCancellation(20));
        assertFalse(token.awaitCancellation(0));
    }
}
