package com.delta.domaincheck.check.model;

public enum CheckStatus {
    AVAILABLE,
    TAKEN,
    FAILED
}
