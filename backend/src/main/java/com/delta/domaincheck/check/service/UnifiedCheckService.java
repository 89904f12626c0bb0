package com.delta.domaincheck.check.service;

import com.delta.domaincheck.check.concurrency.CancellationToken;
import com.delta.domaincheck.check.concurrency.WindowedExecutor;
import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckRequest;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.DomainBatchResult;
import com.delta.domaincheck.check.model.OverallProgress;
import com.delta.domaincheck.check.model.Progress;
import com.delta.domaincheck.check.model.UnifiedBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Checks several names against the same TLD set. Names run one after another, the TLDs of a name run
 * concurrently, and progress is reported both per domain and for the run as a whole.
 */
@Service
public class UnifiedCheckService {
    private static final Logger log = LoggerFactory.getLogger(UnifiedCheckService.class);

    private final MultiTldCheckService multiTldCheckService;
    private final SingleDomainChecker checker;
    private final WindowedExecutor windowedExecutor;

    public UnifiedCheckService(
        MultiTldCheckService multiTldCheckService,
        SingleDomainChecker checker,
        WindowedExecutor windowedExecutor
    ) {
        this.multiTldCheckService = multiTldCheckService;
        this.checker = checker;
        this.windowedExecutor = windowedExecutor;
    }

    public UnifiedBatchResult checkDomainsUnified(List<String> names, List<String> tlds, CheckOptions options) {
        Instant startedAt = Instant.now();
        List<String> domainNames = distinctNames(names);
        List<String> tldList = tlds == null ? List.of() : copyWithoutNulls(tlds);
        CancellationToken token = options.cancellationToken();
        RunProgress runProgress = new RunProgress(
            domainNames.size(),
            domainNames.size() * tldList.size(),
            options.onProgress(),
            options.onOverallProgress()
        );
        Map<String, DomainBatchResult> resultsByDomain = new LinkedHashMap<>();

        if (domainNames.isEmpty() || tldList.isEmpty()) {
            return finish(domainNames, tldList, resultsByDomain, runProgress, startedAt, token.isCancelled());
        }

        log.info("Checking {} name(s) across {} TLD(s)", domainNames.size(), tldList.size());
        boolean cancelled = false;
        for (String name : domainNames) {
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            DomainBatchResult batch = multiTldCheckService.checkDomainAcrossTlds(
                name,
                tldList,
                options,
                progress -> runProgress.onDomainProgress(name, progress),
                token
            );
            resultsByDomain.put(name, batch);
            runProgress.finishDomain(name, batch);
            if (batch.cancelled()) {
                cancelled = true;
                break;
            }
        }

        UnifiedBatchResult result = finish(domainNames, tldList, resultsByDomain, runProgress, startedAt, cancelled);
        OverallProgress overall = result.overallProgress();
        log.info(
            "Finished checking {}/{} name(s): completed={} failed={} durationMs={} cancelled={}",
            overall.domainsCompleted(),
            overall.totalDomains(),
            overall.completed(),
            overall.failed(),
            result.durationMs(),
            result.cancelled()
        );
        return result;
    }

    /**
     * Checks every name and TLD combination as one flat list ordered name by name, with at most
     * {@code options.maxConcurrency()} lookups in flight. After cancellation only the started combinations
     * are returned.
     */
    public List<CheckResult> checkMultipleDomains(List<String> names, List<String> tlds, CheckOptions options) {
        List<String> nameList = names == null ? List.of() : copyWithoutNulls(names);
        List<String> tldList = tlds == null ? List.of() : copyWithoutNulls(tlds);
        CancellationToken token = options.cancellationToken();
        List<Supplier<CheckResult>> operations = new ArrayList<>(nameList.size() * tldList.size());
        for (String name : nameList) {
            for (String tld : tldList) {
                CheckRequest request = new CheckRequest(name, tld);
                operations.add(() -> checker.check(request, options, token));
            }
        }
        return windowedExecutor.runAll(operations, options.maxConcurrency(), token);
    }

    private UnifiedBatchResult finish(
        List<String> domainNames,
        List<String> tlds,
        Map<String, DomainBatchResult> resultsByDomain,
        RunProgress runProgress,
        Instant startedAt,
        boolean cancelled
    ) {
        Instant completedAt = Instant.now();
        return new UnifiedBatchResult(
            domainNames,
            tlds,
            resultsByDomain,
            runProgress.current(),
            startedAt,
            completedAt,
            Duration.between(startedAt, completedAt).toMillis(),
            cancelled
        );
    }

    private static List<String> distinctNames(List<String> names) {
        if (names == null) {
            return List.of();
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String name : names) {
            distinct.add(name == null ? "" : name.trim());
        }
        return new ArrayList<>(distinct);
    }

    private static List<String> copyWithoutNulls(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    /**
     * Folds domain-local progress into run-wide progress. Counts of finished domains form a base offset that
     * is added to the live counts of the domain currently running.
     */
    private static final class RunProgress {
        private final int totalDomains;
        private final int total;
        private final Consumer<Progress> domainListener;
        private final Consumer<OverallProgress> overallListener;
        private int baseCompleted;
        private int baseFailed;
        private int domainsCompleted;
        private OverallProgress current;

        RunProgress(
            int totalDomains,
            int total,
            Consumer<Progress> domainListener,
            Consumer<OverallProgress> overallListener
        ) {
            this.totalDomains = totalDomains;
            this.total = total;
            this.domainListener = domainListener;
            this.overallListener = overallListener;
            this.current = OverallProgress.of(total, 0, 0, null, 0, totalDomains);
        }

        synchronized void onDomainProgress(String name, Progress progress) {
            notify(domainListener, progress);
            publish(OverallProgress.of(
                total,
                baseCompleted + progress.completed(),
                baseFailed + progress.failed(),
                name,
                domainsCompleted,
                totalDomains
            ));
        }

        synchronized void finishDomain(String name, DomainBatchResult batch) {
            baseCompleted += batch.results().size();
            baseFailed += batch.failed().size();
            domainsCompleted++;
            publish(OverallProgress.of(total, baseCompleted, baseFailed, name, domainsCompleted, totalDomains));
        }

        synchronized OverallProgress current() {
            return current;
        }

        private void publish(OverallProgress progress) {
            current = progress;
            notify(overallListener, progress);
        }

        private <T> void notify(Consumer<T> listener, T progress) {
            if (listener == null) {
                return;
            }
            try {
                listener.accept(progress);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed", e);
            }
        }
    }
}
