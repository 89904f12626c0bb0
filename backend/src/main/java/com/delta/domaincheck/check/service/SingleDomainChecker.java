package com.delta.domaincheck.check.service;

import com.delta.domaincheck.check.concurrency.CancellationToken;
import com.delta.domaincheck.check.lookup.LookupService;
import com.delta.domaincheck.check.model.CategorizedError;
import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckRequest;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.ErrorCategory;
import com.delta.domaincheck.check.model.LookupVerdict;
import com.delta.domaincheck.check.retry.BackoffSleeper;
import com.delta.domaincheck.check.retry.RetryPolicy;
import com.delta.domaincheck.check.util.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Checks one name and TLD pair: validates the input, calls the lookup service and retries classified
 * failures with backoff until the verdict arrives, retries run out or the run is cancelled.
 * Never throws for lookup failures; they surface as FAILED results.
 */
@Service
public class SingleDomainChecker {
    private static final Logger log = LoggerFactory.getLogger(SingleDomainChecker.class);
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9-]+$");
    static final String CANCELLED_MESSAGE = "Check cancelled before completion";
    static final String INTERRUPTED_MESSAGE = "Check interrupted before completion";

    private final LookupService lookupService;
    private final BackoffSleeper sleeper;

    @Autowired
    public SingleDomainChecker(LookupService lookupService) {
        this(lookupService, BackoffSleeper.cancellable());
    }

    public SingleDomainChecker(LookupService lookupService, BackoffSleeper sleeper) {
        this.lookupService = lookupService;
        this.sleeper = sleeper;
    }

    public CheckResult check(String name, String tld, CheckOptions options) {
        return check(new CheckRequest(name, tld), options, options.cancellationToken());
    }

    public CheckResult check(CheckRequest request, CheckOptions options, CancellationToken token) {
        String validationError = validate(request);
        if (validationError != null) {
            return CheckResult.failed(request, ErrorClassifier.classify(validationError), 0);
        }

        RetryPolicy retryPolicy = new RetryPolicy(options.retries());
        Duration timeout = Duration.ofMillis(options.timeoutMs());
        int attempt = 0;
        while (true) {
            if (token.isCancelled()) {
                return cancelled(request, attempt);
            }
            attempt++;
            CategorizedError error;
            try {
                LookupVerdict verdict = lookupOnce(request, timeout);
                return CheckResult.succeeded(request, verdict, attempt);
            } catch (AttemptFailedException e) {
                error = ErrorClassifier.classify(e.getCause());
            }

            if (!retryPolicy.shouldRetry(error, attempt)) {
                log.debug(
                    "Check of {} failed after {} attempt(s): category={} message={}",
                    request.fullDomain(),
                    attempt,
                    error.category(),
                    error.rawMessage()
                );
                return CheckResult.failed(request, error, attempt);
            }
            long delayMs = retryPolicy.computeDelay(error, attempt);
            log.debug(
                "Retrying {} in {} ms after attempt {} failed: {}",
                request.fullDomain(),
                delayMs,
                attempt,
                error.rawMessage()
            );
            if (!sleeper.sleep(delayMs, token)) {
                return token.isCancelled() ? cancelled(request, attempt) : interrupted(request, attempt);
            }
        }
    }

    private LookupVerdict lookupOnce(CheckRequest request, Duration timeout) {
        CompletableFuture<LookupVerdict> future;
        try {
            future = lookupService.lookup(request.name(), request.tld(), timeout);
        } catch (RuntimeException e) {
            throw new AttemptFailedException(e);
        }
        if (future == null) {
            throw new AttemptFailedException(new IllegalStateException("Lookup service returned no result"));
        }
        try {
            LookupVerdict verdict = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
            if (verdict == null) {
                throw new AttemptFailedException(new IllegalStateException("Lookup service returned no verdict"));
            }
            return verdict;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof Error fatal) {
                throw fatal;
            }
            if (cause instanceof TimeoutException) {
                cause = new TimeoutException("Lookup timed out after " + timeout.toMillis() + " ms");
            }
            throw new AttemptFailedException(cause);
        } catch (CancellationException e) {
            throw new AttemptFailedException(e);
        }
    }

    private CheckResult cancelled(CheckRequest request, int attempts) {
        return aborted(request, CANCELLED_MESSAGE, attempts);
    }

    private CheckResult interrupted(CheckRequest request, int attempts) {
        log.debug("Backoff for {} interrupted after {} attempt(s)", request.fullDomain(), attempts);
        return aborted(request, INTERRUPTED_MESSAGE, attempts);
    }

    private CheckResult aborted(CheckRequest request, String message, int attempts) {
        CategorizedError error = new CategorizedError(ErrorCategory.UNKNOWN, message, message, false, null);
        return CheckResult.failed(request, error, attempts);
    }

    static String validate(CheckRequest request) {
        if (request.name().isEmpty() || request.tld().isEmpty()) {
            return "Domain and TLD are required";
        }
        if (!NAME_PATTERN.matcher(request.name()).matches()) {
            return "Invalid domain format";
        }
        return null;
    }

    private static final class AttemptFailedException extends RuntimeException {
        AttemptFailedException(Throwable cause) {
            super(cause);
        }
    }
}
