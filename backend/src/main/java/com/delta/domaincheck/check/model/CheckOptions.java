package com.delta.domaincheck.check.model;

import com.delta.domaincheck.check.concurrency.CancellationToken;

import java.util.function.Consumer;

/**
 * Per-invocation settings shared by the single-domain and multi-domain entry points.
 * <p>
 * {@code onProgress} receives domain-local snapshots; {@code onOverallProgress} receives run-wide snapshots
 * and is only used by the multi-domain entry point. A missing cancellation token is replaced by a fresh one.
 */
public record CheckOptions(
    long timeoutMs,
    int retries,
    int maxConcurrency,
    Consumer<Progress> onProgress,
    Consumer<OverallProgress> onOverallProgress,
    CancellationToken cancellationToken
) {
    public static final long DEFAULT_TIMEOUT_MS = 5000;
    public static final int DEFAULT_RETRIES = 2;
    public static final int DEFAULT_MAX_CONCURRENCY = 10;

    public CheckOptions {
        timeoutMs = timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : timeoutMs;
        retries = Math.max(0, retries);
        maxConcurrency = maxConcurrency <= 0 ? DEFAULT_MAX_CONCURRENCY : maxConcurrency;
        if (cancellationToken == null) {
            cancellationToken = new CancellationToken();
        }
    }

    public static CheckOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .timeoutMs(timeoutMs)
            .retries(retries)
            .maxConcurrency(maxConcurrency)
            .onProgress(onProgress)
            .onOverallProgress(onOverallProgress)
            .cancellationToken(cancellationToken);
    }

    public static final class Builder {
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private int retries = DEFAULT_RETRIES;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Consumer<Progress> onProgress;
        private Consumer<OverallProgress> onOverallProgress;
        private CancellationToken cancellationToken;

        private Builder() {
        }

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder onProgress(Consumer<Progress> onProgress) {
            this.onProgress = onProgress;
            return this;
        }

        public Builder onOverallProgress(Consumer<OverallProgress> onOverallProgress) {
            this.onOverallProgress = onOverallProgress;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public CheckOptions build() {
            return new CheckOptions(
                timeoutMs,
                retries,
                maxConcurrency,
                onProgress,
                onOverallProgress,
                cancellationToken
            );
        }
    }
}
