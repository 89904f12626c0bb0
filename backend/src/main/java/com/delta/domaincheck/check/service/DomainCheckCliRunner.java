package com.delta.domaincheck.check.service;

import com.delta.domaincheck.check.model.CheckOptions;
import com.delta.domaincheck.check.model.CheckResult;
import com.delta.domaincheck.check.model.CheckStatus;
import com.delta.domaincheck.check.model.DomainBatchResult;
import com.delta.domaincheck.check.model.OverallProgress;
import com.delta.domaincheck.check.model.UnifiedBatchResult;
import com.delta.domaincheck.config.DomainCheckerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class DomainCheckCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DomainCheckCliRunner.class);

    private final DomainCheckerProperties properties;
    private final UnifiedCheckService unifiedCheckService;
    private final ConfigurableApplicationContext applicationContext;

    public DomainCheckCliRunner(
        DomainCheckerProperties properties,
        UnifiedCheckService unifiedCheckService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.unifiedCheckService = unifiedCheckService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        runChecks();

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    UnifiedBatchResult runChecks() {
        List<String> names = properties.getCli().getNameList();
        List<String> tlds = properties.getCli().getTldList();
        if (names.isEmpty()) {
            log.warn("No names configured (domain-checker.cli.names), nothing to check");
        }

        CheckOptions options = properties.defaultOptions()
            .onOverallProgress(this::logProgress)
            .build();
        UnifiedBatchResult result = unifiedCheckService.checkDomainsUnified(names, tlds, options);

        for (DomainBatchResult batch : result.resultsByDomain().values()) {
            log.info(
                "Summary {}: available={}, taken={}, failed={}, durationMs={}",
                batch.name(),
                describe(batch.successful(), true),
                describe(batch.successful(), false),
                batch.failed().stream()
                    .map(r -> r.tld() + " (" + r.errorMessage() + ")")
                    .collect(Collectors.toList()),
                batch.durationMs()
            );
        }
        log.info(
            "Domain check finished: {}/{} checks, {} failed, cancelled={}",
            result.overallProgress().completed(),
            result.overallProgress().total(),
            result.overallProgress().failed(),
            result.cancelled()
        );
        return result;
    }

    private void logProgress(OverallProgress progress) {
        log.debug(
            "Progress {}% ({}/{}), domain {} ({}/{})",
            progress.percentage(),
            progress.completed(),
            progress.total(),
            progress.currentDomainName(),
            progress.domainsCompleted(),
            progress.totalDomains()
        );
    }

    private static List<String> describe(List<CheckResult> results, boolean available) {
        return results.stream()
            .filter(r -> (r.status() == CheckStatus.AVAILABLE) == available)
            .map(CheckResult::tld)
            .collect(Collectors.toList());
    }
}
