package com.delta.domaincheck.check.api;

public record DomainCheckApiRequest(String domain, String tld) {
}
