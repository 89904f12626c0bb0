package com.delta.domaincheck.config;

import com.delta.domaincheck.check.model.CheckOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "domain-checker")
public class DomainCheckerProperties {
    private static final String DEFAULT_USER_AGENT = "delta-domain-check/0.1 (+contact)";

    private int retries = CheckOptions.DEFAULT_RETRIES;
    private int maxConcurrency = CheckOptions.DEFAULT_MAX_CONCURRENCY;
    private int executorThreads = 32;
    private Lookup lookup = new Lookup();
    private Api api = new Api();
    private Cli cli = new Cli();

    public int getRetries() {
        return retries;
    }

    public void setRetries(int retries) {
        this.retries = Math.max(0, retries);
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public int getExecutorThreads() {
        return Math.max(1, executorThreads);
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = Math.max(1, executorThreads);
    }

    public Lookup getLookup() {
        return lookup;
    }

    public void setLookup(Lookup lookup) {
        this.lookup = lookup;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Options seeded with the configured defaults; callers add listeners and a cancellation token.
     */
    public CheckOptions.Builder defaultOptions() {
        return CheckOptions.builder()
            .timeoutMs(lookup.getTimeoutMs())
            .retries(getRetries())
            .maxConcurrency(getMaxConcurrency());
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }

    public enum LookupMode {
        DNS,
        HTTP;

        public static LookupMode parse(String value) {
            if (value == null || value.isBlank()) {
                return DNS;
            }
            return LookupMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static class Lookup {
        private String mode = "dns";
        private long timeoutMs = CheckOptions.DEFAULT_TIMEOUT_MS;
        private String baseUrl;
        private String userAgent;

        public LookupMode getModeValue() {
            return LookupMode.parse(mode);
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public long getTimeoutMs() {
            return timeoutMs <= 0 ? CheckOptions.DEFAULT_TIMEOUT_MS : timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }
    }

    public static class Api {
        private int maxDomains = 50;
        private int maxTlds = 200;
        private int maxCombinations = 2000;
        private int maxRetries = 5;

        public int getMaxDomains() {
            return Math.max(1, maxDomains);
        }

        public void setMaxDomains(int maxDomains) {
            this.maxDomains = maxDomains;
        }

        public int getMaxTlds() {
            return Math.max(1, maxTlds);
        }

        public void setMaxTlds(int maxTlds) {
            this.maxTlds = maxTlds;
        }

        public int getMaxCombinations() {
            return Math.max(1, maxCombinations);
        }

        public void setMaxCombinations(int maxCombinations) {
            this.maxCombinations = maxCombinations;
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }
    }

    public static class Cli {
        private boolean run;
        private String names = "";
        private String tlds = ".com,.net,.org";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getNames() {
            return names;
        }

        public void setNames(String names) {
            this.names = names;
        }

        public List<String> getNameList() {
            return splitList(names);
        }

        public String getTlds() {
            return tlds;
        }

        public void setTlds(String tlds) {
            this.tlds = tlds;
        }

        public List<String> getTldList() {
            return splitList(tlds);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
