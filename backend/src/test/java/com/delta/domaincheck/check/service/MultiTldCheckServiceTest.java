package com.delta.domaincheck.check.service;

import com.delta.domaincheck.check.concurrency.CancellationToken;
import com.delta.domaincheck.check.concurrency.WindowedExecutor;
import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.CheckStatus;
import com.delta.domaincheck.check.model.DomainBatchResult;
import com.delta.domaincheck.check.model.LookupVerdict;
import com.delta.domaincheck.check.model.Progress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MultiTldCheckServiceTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private MultiTldCheckService service(ScriptedLookupService lookup) {
        SingleDomainChecker checker = new SingleDomainChecker(lookup, (millis, token) -> true);
        return new MultiTldCheckService(checker, new WindowedExecutor(executor));
    }

    @Test
    void splitsTakenAndUnresolvableTldsInInputOrder() {
        ScriptedLookupService lookup = new ScriptedLookupService((name, tld) -> ".com".equals(tld)
            ? CompletableFuture.completedFuture(LookupVerdict.taken())
            : ScriptedLookupService.failing("NXDOMAIN"));
        List<Progress> snapshots = new CopyOnWriteArrayList<>();
        CheckOptions options = CheckOptions.builder().retries(2).onProgress(snapshots::add).build();

        DomainBatchResult batch = service(lookup).checkDomainAcrossTlds("example", List.of(".com", ".net"), options);

        assertThat(batch.results()).extracting(CheckResult::tld).containsExactly(".com", ".net");
        assertThat(batch.successful()).singleElement().satisfies(result -> {
            assertEquals(".com", result.tld());
            assertEquals(CheckStatus.TAKEN, result.status());
        });
        assertThat(batch.failed()).singleElement().satisfies(result -> {
            assertEquals(".net", result.tld());
            assertThat(result.errorMessage()).contains("available");
            assertEquals(3, result.attempts());
        });
        assertEquals(3, lookup.callsFor("example.net"));
        assertEquals(1, lookup.callsFor("example.com"));
        assertEquals(100, batch.progress().percentage());
        assertEquals(Progress.of(2, 2, 1), batch.progress());
        assertFalse(batch.cancelled());
    }

    @Test
    void progressSnapshotsAreConsistentAndMonotonic() {
        List<String> tlds = List.of(".com", ".net", ".org", ".io", ".dev", ".app", ".ai");
        ScriptedLookupService lookup = new ScriptedLookupService((name, tld) -> CompletableFuture.supplyAsync(() -> {
            sleepQuietly(tld.length() * 3L);
            return tld.length() % 2 == 0 ? LookupVerdict.available() : LookupVerdict.taken();
        }));
        List<Progress> snapshots = new CopyOnWriteArrayList<>();
        CheckOptions options = CheckOptions.builder().maxConcurrency(3).onProgress(snapshots::add).build();

        DomainBatchResult batch = service(lookup).checkDomainAcrossTlds("sample", tlds, options);

        assertThat(batch.results()).extracting(CheckResult::tld).containsExactlyElementsOf(tlds);
        assertThat(snapshots).isNotEmpty();
        int previous = -1;
        for (Progress snapshot : snapshots) {
            assertEquals(tlds.size(), snapshot.total());
            assertEquals(snapshot.total(), snapshot.completed() + snapshot.remaining());
            assertThat(snapshot.completed()).isGreaterThanOrEqualTo(previous);
            assertThat(snapshot.percentage()).isBetween(0, 100);
            previous = snapshot.completed();
        }
        Progress last = snapshots.get(snapshots.size() - 1);
        assertEquals(tlds.size(), last.completed());
        assertEquals(100, last.percentage());
        assertEquals(last, batch.progress());
    }

    @Test
    void emptyTldListSkipsLookups() {
        ScriptedLookupService lookup = ScriptedLookupService.takenEverywhere();

        DomainBatchResult batch = service(lookup).checkDomainAcrossTlds("example", List.of(), CheckOptions.defaults());

        assertThat(batch.results()).isEmpty();
        assertEquals(Progress.empty(), batch.progress());
        assertThat(lookup.calls()).isEmpty();
    }

    @Test
    void cancellationMidBatchReturnsStartedLookupsOnly() {
        CancellationToken token = new CancellationToken();
        ScriptedLookupService lookup = new ScriptedLookupService((name, tld) -> {
            if (".net".equals(tld)) {
                token.cancel("user_abort");
            }
            return CompletableFuture.completedFuture(LookupVerdict.available());
        });
        CheckOptions options = CheckOptions.builder().maxConcurrency(1).cancellationToken(token).build();

        DomainBatchResult batch = service(lookup).checkDomainAcrossTlds(
            "example",
            List.of(".com", ".net", ".org", ".io"),
            options
        );

        assertTrue(batch.cancelled());
        assertThat(batch.results()).extracting(CheckResult::tld).containsExactly(".com", ".net");
        assertThat(lookup.calls()).containsExactlyInAnyOrder("example.com", "example.net");
        assertEquals(2, batch.progress().completed());
        assertEquals(2, batch.progress().remaining());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
