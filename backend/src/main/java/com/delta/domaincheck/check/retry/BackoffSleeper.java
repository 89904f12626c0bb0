package com.delta.domaincheck.check.retry;

import com.delta.domaincheck.check.concurrency.CancellationToken;

/**
 * Waits out a retry delay.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /**
     * @return {@code true} if the full delay elapsed, {@code false} if the wait ended early because the run
     *     was cancelled or the thread was interrupted; callers tell the two apart through the token
     */
    boolean sleep(long millis, CancellationToken token);

    /**
     * Sleeps on the token so cancellation ends the wait immediately.
     */
    static BackoffSleeper cancellable() {
        return (millis, token) -> {
            try {
                return !token.awaitCancellation(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        };
    }
}
