package com.delta.domaincheck.check.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record UnifiedBatchResult(
    List<String> domainNames,
    List<String> tlds,
    Map<String, DomainBatchResult> resultsByDomain,
    OverallProgress overallProgress,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    boolean cancelled
) {
    public UnifiedBatchResult {
        domainNames = List.copyOf(domainNames);
        tlds = List.copyOf(tlds);
        resultsByDomain = Collections.unmodifiableMap(new LinkedHashMap<>(resultsByDomain));
    }

    public int totalResults() {
        int count = 0;
        for (DomainBatchResult batch : resultsByDomain.values()) {
            count += batch.results().size();
        }
        return count;
    }
}
