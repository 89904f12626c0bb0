package com.delta.domaincheck.check.model;

/**
 * Progress across a multi-domain run. Carries the same counters as {@link Progress}, measured over every
 * name and TLD combination of the run, plus the domain-level position.
 */
public record OverallProgress(
    int total,
    int completed,
    int failed,
    int remaining,
    int percentage,
    String currentDomainName,
    int domainsCompleted,
    int totalDomains,
    int overallPercentage
) {

    public static OverallProgress of(
        int total,
        int completed,
        int failed,
        String currentDomainName,
        int domainsCompleted,
        int totalDomains
    ) {
        return new OverallProgress(
            total,
            completed,
            failed,
            total - completed,
            Progress.percentage(completed, total),
            currentDomainName,
            domainsCompleted,
            totalDomains,
            Progress.percentage(domainsCompleted, totalDomains)
        );
    }

    public Progress asProgress() {
        return new Progress(total, completed, failed, remaining, percentage);
    }
}
