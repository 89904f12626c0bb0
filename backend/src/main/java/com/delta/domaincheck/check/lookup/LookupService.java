package com.delta.domaincheck.check.lookup;

import com.delta.domaincheck.check.model.LookupVerdict;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Determines whether {@code name + tld} is registered. Implementations complete the future exceptionally,
 * usually with a {@link LookupException}, whenever the outcome cannot be determined; the message of that
 * failure is what drives retry classification.
 */
public interface LookupService {

    CompletableFuture<LookupVerdict> lookup(String name, String tld, Duration timeout);
}
