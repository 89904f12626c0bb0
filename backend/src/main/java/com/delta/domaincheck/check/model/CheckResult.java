package com.delta.domaincheck.check.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record CheckResult(
    String name,
    String tld,
    CheckStatus status,
    String errorMessage,
    CategorizedError error,
    int attempts,
    Instant checkedAt
) {
    public CheckResult {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        boolean failed = status == CheckStatus.FAILED;
        if (failed != (errorMessage != null)) {
            throw new IllegalArgumentException("errorMessage must be present exactly when status is FAILED");
        }
        if (!failed && error != null) {
            throw new IllegalArgumentException("categorized error is only allowed on FAILED results");
        }
        if (checkedAt == null) {
            checkedAt = Instant.now();
        }
    }

    public static CheckResult succeeded(CheckRequest request, LookupVerdict verdict, int attempts) {
        return new CheckResult(
            request.name(),
            request.tld(),
            verdict.status(),
            null,
            null,
            attempts,
            verdict.checkedAt()
        );
    }

    public static CheckResult failed(CheckRequest request, CategorizedError error, int attempts) {
        return new CheckResult(
            request.name(),
            request.tld(),
            CheckStatus.FAILED,
            error.userMessage(),
            error,
            attempts,
            Instant.now()
        );
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == CheckStatus.FAILED;
    }
}
