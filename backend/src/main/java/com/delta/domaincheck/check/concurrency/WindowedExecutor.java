package com.delta.domaincheck.check.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;

/**
 * Runs deferred operations in fixed-size windows: every operation of a window is started at once and the
 * next window only starts after the whole window settled, so at most {@code limit} operations are in flight.
 * Results come back in input order regardless of completion order.
 * <p>
 * Operations must not throw. An operation that does is treated as a programming error and its exception
 * propagates to the caller once its window settled.
 */
public class WindowedExecutor {
    private static final Logger log = LoggerFactory.getLogger(WindowedExecutor.class);

    private final Executor executor;

    public WindowedExecutor(Executor executor) {
        this.executor = executor;
    }

    public <T> List<T> runAll(List<? extends Supplier<T>> operations, int limit) {
        return runAll(operations, limit, null);
    }

    /**
     * Executes the operations window by window.
     *
     * @param operations deferred operations, started in list order
     * @param limit      window size, values below one are treated as one
     * @param token      checked before each window; once cancelled no further window starts
     * @return results of every started operation, in input order; shorter than the input only after cancellation
     */
    public <T> List<T> runAll(List<? extends Supplier<T>> operations, int limit, CancellationToken token) {
        if (operations.isEmpty()) {
            return List.of();
        }
        int windowSize = Math.max(1, limit);
        int total = operations.size();
        AtomicReferenceArray<T> slots = new AtomicReferenceArray<>(total);
        int started = 0;

        for (int from = 0; from < total; from += windowSize) {
            if (token != null && token.isCancelled()) {
                log.debug("Cancellation observed, skipping {} of {} operations", total - from, total);
                break;
            }
            int to = Math.min(total, from + windowSize);
            List<CompletableFuture<Void>> window = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                final int index = i;
                Supplier<T> operation = operations.get(i);
                window.add(CompletableFuture.runAsync(() -> slots.set(index, operation.get()), executor));
            }
            awaitWindow(window);
            started = to;
        }

        List<T> results = new ArrayList<>(started);
        for (int i = 0; i < started; i++) {
            results.add(slots.get(i));
        }
        return results;
    }

    private void awaitWindow(List<CompletableFuture<Void>> window) {
        try {
            CompletableFuture.allOf(window.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
