package com.delta.domaincheck.check.model;

import java.time.Instant;

public record LookupVerdict(CheckStatus status, Instant checkedAt) {

    public LookupVerdict {
        if (status == null || status == CheckStatus.FAILED) {
            throw new IllegalArgumentException("Lookup verdict must be AVAILABLE or TAKEN, got " + status);
        }
        if (checkedAt == null) {
            checkedAt = Instant.now();
        }
    }

    public static LookupVerdict available() {
        return new LookupVerdict(CheckStatus.AVAILABLE, Instant.now());
    }

    public static LookupVerdict taken() {
        return new LookupVerdict(CheckStatus.TAKEN, Instant.now());
    }
}
