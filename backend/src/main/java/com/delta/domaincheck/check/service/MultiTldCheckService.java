package com.delta.domaincheck.check.service;

import com.delta.domaincheck.check.concurrency.CancellationToken;
import com.delta.domaincheck.check.concurrency.WindowedExecutor;
import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckRequest;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.DomainBatchResult;
import com.delta.domaincheck.check.model.Progress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Service
public class MultiTldCheckService {
    private static final Logger log = LoggerFactory.getLogger(MultiTldCheckService.class);

    private final SingleDomainChecker checker;
    private final WindowedExecutor windowedExecutor;

    public MultiTldCheckService(SingleDomainChecker checker, WindowedExecutor windowedExecutor) {
        this.checker = checker;
        this.windowedExecutor = windowedExecutor;
    }

    public DomainBatchResult checkDomainAcrossTlds(String name, List<String> tlds, CheckOptions options) {
        return checkDomainAcrossTlds(name, tlds, options, options.onProgress(), options.cancellationToken());
    }

    /**
     * Checks {@code name} against every TLD with at most {@code options.maxConcurrency()} lookups in flight.
     * Results keep the order of {@code tlds}. After cancellation the batch holds only the started lookups
     * and is flagged as cancelled.
     *
     * @param progressListener receives a snapshot after each lookup settles and once more at the end
     */
    DomainBatchResult checkDomainAcrossTlds(
        String name,
        List<String> tlds,
        CheckOptions options,
        Consumer<Progress> progressListener,
        CancellationToken token
    ) {
        Instant startedAt = Instant.now();
        if (tlds == null || tlds.isEmpty()) {
            return DomainBatchResult.empty(name, startedAt);
        }

        ProgressTracker tracker = new ProgressTracker(tlds.size(), progressListener);
        List<Supplier<CheckResult>> operations = new ArrayList<>(tlds.size());
        for (String tld : tlds) {
            CheckRequest request = new CheckRequest(name, tld);
            operations.add(() -> {
                CheckResult result = checker.check(request, options, token);
                tracker.record(result);
                return result;
            });
        }

        List<CheckResult> results = windowedExecutor.runAll(operations, options.maxConcurrency(), token);

        List<CheckResult> successful = new ArrayList<>();
        List<CheckResult> failed = new ArrayList<>();
        for (CheckResult result : results) {
            if (result.isFailed()) {
                failed.add(result);
            } else {
                successful.add(result);
            }
        }
        Progress finalProgress = tracker.emit();
        Instant completedAt = Instant.now();
        boolean cancelled = token.isCancelled();
        long durationMs = Duration.between(startedAt, completedAt).toMillis();

        log.debug(
            "Checked {} across {} TLDs: successful={} failed={} durationMs={} cancelled={}",
            name,
            tlds.size(),
            successful.size(),
            failed.size(),
            durationMs,
            cancelled
        );
        return new DomainBatchResult(
            name,
            results,
            successful,
            failed,
            finalProgress,
            startedAt,
            completedAt,
            durationMs,
            cancelled
        );
    }
}
