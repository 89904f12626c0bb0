package com.delta.domaincheck.check.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handle shared by reference across one check run.
 * <p>
 * Triggering it never interrupts work that already started; units of work poll {@link #isCancelled()}
 * before they begin. Backoff waits use {@link #awaitCancellation(long)} so a pending retry wakes up as soon
 * as the run is cancelled.
 */
public class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }

    public void cancel() {
        cancel("cancelled");
    }

    /**
     * Marks the token as cancelled and notifies listeners once. Later calls are no-ops.
     */
    public void cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        this.reason = reason;
        latch.countDown();
        for (Runnable listener : listeners) {
            notifyListener(listener);
        }
    }

    /**
     * Registers a listener invoked once on cancellation. If the token is already cancelled the listener runs
     * immediately on the calling thread.
     *
     * @return a registration whose {@code close()} removes the listener
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            notifyListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Waits up to {@code millis} for cancellation.
     *
     * @return {@code true} if the token was cancelled before the wait elapsed
     */
    public boolean awaitCancellation(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isCancelled();
        }
        return latch.await(millis, TimeUnit.MILLISECONDS);
    }

    private void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed", e);
        }
    }

    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
