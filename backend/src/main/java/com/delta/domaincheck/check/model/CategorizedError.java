package com.delta.domaincheck.check.model;

public record CategorizedError(
    ErrorCategory category,
    String rawMessage,
    String userMessage,
    boolean retryable,
    String suggestedAction
) {
}
