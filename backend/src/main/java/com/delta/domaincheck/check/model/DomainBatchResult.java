package com.delta.domaincheck.check.model;

import java.time.Instant;
import java.util.List;

public record DomainBatchResult(
    String name,
    List<CheckResult> results,
    List<CheckResult> successful,
    List<CheckResult> failed,
    Progress progress,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    boolean cancelled
) {
    public DomainBatchResult {
        results = List.copyOf(results);
        successful = List.copyOf(successful);
        failed = List.copyOf(failed);
    }

    public static DomainBatchResult empty(String name, Instant startedAt) {
        Instant now = Instant.now();
        return new DomainBatchResult(
            name,
            List.of(),
            List.of(),
            List.of(),
            Progress.empty(),
            startedAt,
            now,
            Math.max(0L, now.toEpochMilli() - startedAt.toEpochMilli()),
            false
        );
    }
}
