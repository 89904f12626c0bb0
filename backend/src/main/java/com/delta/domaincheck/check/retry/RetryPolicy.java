package com.delta.domaincheck.check.retry;

import com.delta.domaincheck.check.model.CategorizedError;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Exponential backoff keyed on the failure category: {@code base * 2^(attempt-1)} plus up to one second of
 * jitter. Non-retryable categories never wait and never retry.
 */
public class RetryPolicy {
    public static final long MAX_JITTER_MS = 1000;

    private final int maxRetries;
    private final LongSupplier jitter;

    public RetryPolicy(int maxRetries) {
        this(maxRetries, () -> ThreadLocalRandom.current().nextLong(MAX_JITTER_MS + 1));
    }

    public RetryPolicy(int maxRetries, LongSupplier jitter) {
        this.maxRetries = Math.max(0, maxRetries);
        this.jitter = jitter;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * @param error   classification of the failed attempt
     * @param attempt 1-based number of the attempt that just failed
     */
    public boolean shouldRetry(CategorizedError error, int attempt) {
        return error.retryable() && attempt <= maxRetries;
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     * @return delay before the next attempt in milliseconds, {@code 0} for non-retryable errors
     */
    public long computeDelay(CategorizedError error, int attempt) {
        if (!error.retryable()) {
            return 0L;
        }
        long base = error.category().baseDelayMs();
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long exponential = base * (1L << exponent);
        long extra = Math.max(0L, Math.min(MAX_JITTER_MS, jitter.getAsLong()));
        return exponential + extra;
    }
}
