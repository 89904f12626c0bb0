package com.delta.domaincheck.check.lookup;

import com.delta.domaincheck.check.model.LookupVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Treats a name that resolves as taken and a name the resolver reports as unknown as available.
 */
public class DnsLookupService implements LookupService {
    private static final Logger log = LoggerFactory.getLogger(DnsLookupService.class);

    private final ExecutorService executor;
    private final HostResolver resolver;

    public DnsLookupService(ExecutorService executor) {
        this(executor, InetAddress::getAllByName);
    }

    public DnsLookupService(ExecutorService executor, HostResolver resolver) {
        this.executor = executor;
        this.resolver = resolver;
    }

    @Override
    public CompletableFuture<LookupVerdict> lookup(String name, String tld, Duration timeout) {
        String hostname = name + tld;
        return CompletableFuture.supplyAsync(() -> resolve(hostname), executor)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionallyCompose(e -> {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                if (cause instanceof TimeoutException) {
                    return CompletableFuture.failedFuture(
                        new LookupException("Lookup timed out after " + timeout.toMillis() + " ms"));
                }
                return CompletableFuture.failedFuture(cause);
            });
    }

    private LookupVerdict resolve(String hostname) {
        try {
            InetAddress[] addresses = resolver.resolve(hostname);
            if (addresses == null || addresses.length == 0) {
                throw new LookupException("DNS lookup returned no address for " + hostname);
            }
            log.debug("Resolved {} to {}", hostname, addresses[0].getHostAddress());
            return LookupVerdict.taken();
        } catch (UnknownHostException e) {
            log.debug("No DNS record for {}", hostname);
            return LookupVerdict.available();
        }
    }

    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String hostname) throws UnknownHostException;
    }
}
