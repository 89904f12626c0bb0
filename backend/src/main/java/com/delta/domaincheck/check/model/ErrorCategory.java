package com.delta.domaincheck.check.model;

public enum ErrorCategory {
    NETWORK(1000, true, "Network Error"),
    RESOLUTION(500, true, "DNS Lookup Failed"),
    LOOKUP_SERVICE(2000, true, "Whois Lookup Failed"),
    TIMEOUT(3000, true, "Request Timeout"),
    RATE_LIMIT(10000, true, "Rate Limited"),
    VALIDATION(0, false, "Invalid Input"),
    SERVER_SIDE(5000, true, "Server Error"),
    UNKNOWN(2000, true, "Error");

    private final long baseDelayMs;
    private final boolean retryable;
    private final String title;

    ErrorCategory(long baseDelayMs, boolean retryable, String title) {
        this.baseDelayMs = baseDelayMs;
        this.retryable = retryable;
        this.title = title;
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public boolean retryable() {
        return retryable;
    }

    public String title() {
        return title;
    }
}
