package com.delta.domaincheck.check.lookup;

import com.delta.domaincheck.check.model.CheckStatus;
import com.delta.domaincheck.check.model.LookupVerdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Delegates each lookup to a remote domain-check endpoint speaking JSON:
 * request {@code {"domain": ..., "tld": ...}}, response {@code {"status": "available|taken|error", "error": ...}}.
 */
public class HttpLookupService implements LookupService {
    private static final Logger log = LoggerFactory.getLogger(HttpLookupService.class);
    static final String CHECK_PATH = "/api/domain-check";

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String userAgent;

    public HttpLookupService(
        String baseUrl,
        String userAgent,
        Duration connectTimeout,
        ExecutorService executor,
        ObjectMapper objectMapper
    ) {
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .executor(executor)
            .build();
        this.objectMapper = objectMapper;
        this.endpoint = resolveEndpoint(baseUrl);
        this.userAgent = userAgent;
    }

    @Override
    public CompletableFuture<LookupVerdict> lookup(String name, String tld, Duration timeout) {
        HttpRequest request;
        try {
            Map<String, String> body = new LinkedHashMap<>();
            body.put("domain", name);
            body.put("tld", tld);
            request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new LookupException("Invalid lookup request: " + e.getOriginalMessage(), e));
        }

        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
            .thenApply(response -> toVerdict(name + tld, response))
            .exceptionallyCompose(e -> CompletableFuture.failedFuture(translate(e)));
    }

    private LookupVerdict toVerdict(String domain, HttpResponse<String> response) {
        int status = response.statusCode();
        JsonNode root = parse(response.body());
        String error = root == null ? null : root.path("error").asText(null);

        if (status == 429) {
            throw new LookupException(error == null ? "rate limit exceeded" : "rate limit exceeded: " + error);
        }
        if (status < 200 || status >= 300) {
            log.debug("Lookup endpoint answered {} for {}", status, domain);
            throw new LookupException(error == null ? "API request failed (HTTP " + status + ")" : error);
        }
        if (root == null) {
            throw new LookupException("Invalid lookup response payload");
        }

        String verdict = root.path("status").asText("").toLowerCase(Locale.ROOT);
        Instant checkedAt = parseInstant(root.path("checkedAt").asText(null));
        return switch (verdict) {
            case "available" -> new LookupVerdict(CheckStatus.AVAILABLE, checkedAt);
            case "taken" -> new LookupVerdict(CheckStatus.TAKEN, checkedAt);
            case "error" -> throw new LookupException(error == null ? "Lookup failed" : error);
            default -> throw new LookupException("Invalid lookup status '" + verdict + "'");
        };
    }

    private Throwable translate(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof LookupException) {
            return cause;
        }
        if (cause instanceof HttpTimeoutException) {
            return new LookupException("Lookup request timed out", cause);
        }
        if (cause instanceof ConnectException) {
            return new LookupException("Network error: connection refused", cause);
        }
        if (cause instanceof IOException) {
            String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            return new LookupException("Network error: " + message, cause);
        }
        return cause;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Lookup endpoint returned non-JSON body: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    private static URI resolveEndpoint(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Lookup base URL is required for the http lookup mode");
        }
        String value = baseUrl.trim();
        if (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return URI.create(value + CHECK_PATH);
    }
}
