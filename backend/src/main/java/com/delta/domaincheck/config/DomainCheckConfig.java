package com.delta.domaincheck.config;

import com.delta.domaincheck.check.concurrency.WindowedExecutor;
import com.delta.domaincheck.check.lookup.DnsLookupService;
import com.delta.domaincheck.check.lookup.HttpLookupService;
import com.delta.domaincheck.check.lookup.LookupService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DomainCheckConfig {
    private static final Logger log = LoggerFactory.getLogger(DomainCheckConfig.class);

    @Bean(name = "checkExecutor", destroyMethod = "shutdown")
    public ExecutorService checkExecutor(DomainCheckerProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutorThreads());
    }

    @Bean(name = "lookupExecutor", destroyMethod = "shutdown")
    public ExecutorService lookupExecutor(DomainCheckerProperties properties) {
        int size = Math.max(4, properties.getExecutorThreads());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public WindowedExecutor windowedExecutor(@Qualifier("checkExecutor") ExecutorService checkExecutor) {
        return new WindowedExecutor(checkExecutor);
    }

    @Bean
    public LookupService lookupService(
        DomainCheckerProperties properties,
        @Qualifier("lookupExecutor") ExecutorService lookupExecutor,
        ObjectMapper objectMapper
    ) {
        DomainCheckerProperties.Lookup lookup = properties.getLookup();
        return switch (lookup.getModeValue()) {
            case HTTP -> {
                log.info("Using remote lookup service at {}", lookup.getBaseUrl());
                yield new HttpLookupService(
                    lookup.getBaseUrl(),
                    lookup.getUserAgent(),
                    Duration.ofMillis(lookup.getTimeoutMs()),
                    lookupExecutor,
                    objectMapper
                );
            }
            case DNS -> {
                log.info("Using DNS lookup service");
                yield new DnsLookupService(lookupExecutor);
            }
        };
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
