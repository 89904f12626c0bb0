package com.delta.domaincheck.check.service;

import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.Progress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Counts completions of one domain batch. Operations of a window finish on different threads, so updates
 * and listener calls happen under the tracker lock and listeners observe counts in increasing order.
 */
class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final int total;
    private final Consumer<Progress> listener;
    private int completed;
    private int failed;

    ProgressTracker(int total, Consumer<Progress> listener) {
        this.total = total;
        this.listener = listener;
    }

    synchronized Progress record(CheckResult result) {
        completed++;
        if (result.isFailed()) {
            failed++;
        }
        return emit();
    }

    synchronized Progress emit() {
        Progress progress = Progress.of(total, completed, failed);
        if (listener != null) {
            try {
                listener.accept(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed at {}/{}", completed, total, e);
            }
        }
        return progress;
    }
}
