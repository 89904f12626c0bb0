package com.delta.domaincheck.check.api;

import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.UnifiedBatchResult;
import com.delta.domaincheck.check.service.SingleDomainChecker;
import com.delta.domaincheck.check.service.UnifiedCheckService;
import com.delta.domaincheck.config.DomainCheckerProperties;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class DomainCheckController {
    private final SingleDomainChecker singleDomainChecker;
    private final UnifiedCheckService unifiedCheckService;
    private final DomainCheckerProperties properties;

    public DomainCheckController(
        SingleDomainChecker singleDomainChecker,
        UnifiedCheckService unifiedCheckService,
        DomainCheckerProperties properties
    ) {
        this.singleDomainChecker = singleDomainChecker;
        this.unifiedCheckService = unifiedCheckService;
        this.properties = properties;
    }

    @PostMapping("/domain-check")
    public CheckResult checkDomain(@RequestBody(required = false) DomainCheckApiRequest request) {
        if (request == null) {
            throw new InvalidCheckRequestException("Domain and TLD are required");
        }
        return singleDomainChecker.check(request.domain(), request.tld(), properties.defaultOptions().build());
    }

    @PostMapping("/domain-checks")
    public UnifiedBatchResult checkDomains(@RequestBody(required = false) BatchCheckApiRequest request) {
        if (request == null) {
            throw new InvalidCheckRequestException("names and tlds are required");
        }
        List<String> names = request.normalizedNames();
        List<String> tlds = request.normalizedTlds();
        if (names.isEmpty() || tlds.isEmpty()) {
            throw new InvalidCheckRequestException("names and tlds are required");
        }
        DomainCheckerProperties.Api limits = properties.getApi();
        if (names.size() > limits.getMaxDomains()) {
            throw new InvalidCheckRequestException(
                "Too many names: " + names.size() + " (max " + limits.getMaxDomains() + ")");
        }
        if (tlds.size() > limits.getMaxTlds()) {
            throw new InvalidCheckRequestException(
                "Too many TLDs: " + tlds.size() + " (max " + limits.getMaxTlds() + ")");
        }
        long combinations = (long) names.size() * tlds.size();
        if (combinations > limits.getMaxCombinations()) {
            throw new InvalidCheckRequestException(
                "Too many combinations: " + combinations + " (max " + limits.getMaxCombinations() + ")");
        }

        CheckOptions.Builder options = properties.defaultOptions();
        if (request.maxConcurrency() != null) {
            options.maxConcurrency(Math.max(1, Math.min(request.maxConcurrency(), properties.getExecutorThreads())));
        }
        if (request.retries() != null) {
            options.retries(Math.max(0, Math.min(request.retries(), limits.getMaxRetries())));
        }
        if (request.timeoutMs() != null) {
            options.timeoutMs(Math.max(1L, request.timeoutMs()));
        }
        return unifiedCheckService.checkDomainsUnified(names, tlds, options.build());
    }
}
