package com.delta.domaincheck.check.util;

import com.delta.domaincheck.check.model.CategorizedError;
import com.delta.domaincheck.check.model.ErrorCategory;
import com.delta.domaincheck.check.model.ErrorNotice;

import java.util.Locale;

/**
 * Maps raw lookup failure messages onto {@link ErrorCategory} by substring matching. The first matching rule
 * wins, so a message mentioning both "dns" and "timeout" is a resolution failure.
 */
public final class ErrorClassifier {
    public static final String UNKNOWN_ERROR = "Unknown error";

    private ErrorClassifier() {}

    public static CategorizedError classify(Throwable error) {
        if (error == null) {
            return classify((String) null);
        }
        String message = error.getMessage();
        return classify(message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
    }

    public static CategorizedError classify(String rawMessage) {
        String message = rawMessage == null || rawMessage.isBlank() ? UNKNOWN_ERROR : rawMessage;
        String lower = message.toLowerCase(Locale.ROOT);

        if (containsAny(lower, "network", "fetch")) {
            return new CategorizedError(
                ErrorCategory.NETWORK,
                message,
                "Network connection failed. Please check your internet connection.",
                true,
                "Check your internet connection and try again."
            );
        }
        if (containsAny(lower, "nxdomain", "notfound", "dns")) {
            return new CategorizedError(
                ErrorCategory.RESOLUTION,
                message,
                "DNS lookup failed. This might indicate the domain is available.",
                true,
                "This is normal for available domains. If unexpected, try again."
            );
        }
        if (lower.contains("whois")) {
            return new CategorizedError(
                ErrorCategory.LOOKUP_SERVICE,
                message,
                "Whois lookup failed. The domain availability is uncertain.",
                true,
                "Try again or check the domain manually."
            );
        }
        if (containsAny(lower, "timeout", "timed out")) {
            return new CategorizedError(
                ErrorCategory.TIMEOUT,
                message,
                "Request timed out. The service might be slow or unavailable.",
                true,
                "Wait a moment and try again."
            );
        }
        if (containsAny(lower, "rate limit", "too many requests", "429")) {
            return new CategorizedError(
                ErrorCategory.RATE_LIMIT,
                message,
                "Too many requests. Please wait before checking more domains.",
                true,
                "Wait a minute before trying again."
            );
        }
        if (containsAny(lower, "invalid", "validation", "required")) {
            return new CategorizedError(
                ErrorCategory.VALIDATION,
                message,
                "Invalid input. Please check your domain name format.",
                false,
                "Check the domain name format and try again."
            );
        }
        if (containsAny(lower, "server", "500", "503")) {
            return new CategorizedError(
                ErrorCategory.SERVER_SIDE,
                message,
                "Server error. Our service is temporarily unavailable.",
                true,
                "Try again in a few minutes."
            );
        }
        return new CategorizedError(
            ErrorCategory.UNKNOWN,
            message,
            "An unexpected error occurred.",
            true,
            "Try again or contact support if the problem persists."
        );
    }

    public static boolean isRetryable(String rawMessage) {
        return classify(rawMessage).retryable();
    }

    public static String userMessage(String rawMessage) {
        return classify(rawMessage).userMessage();
    }

    public static String suggestedAction(String rawMessage) {
        return classify(rawMessage).suggestedAction();
    }

    public static ErrorNotice notice(String rawMessage) {
        CategorizedError error = classify(rawMessage);
        String description = error.suggestedAction() == null
            ? error.userMessage()
            : error.userMessage() + " " + error.suggestedAction();
        return new ErrorNotice(error.category().title(), description);
    }

    private static boolean containsAny(String haystack, String... needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
