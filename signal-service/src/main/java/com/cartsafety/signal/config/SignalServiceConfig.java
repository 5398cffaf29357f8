package com.cartsafety.signal.config;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.config.SafetyConfigurationLoader;
import com.cartsafety.signal.cache.ReportCountCache;
import com.cartsafety.signal.client.ReportCountSource;
import com.cartsafety.signal.model.RecentApprovalPolicy;
import com.cartsafety.signal.ratelimit.RequestBudget;
import com.cartsafety.signal.service.ReportCountGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class SignalServiceConfig {

    // Blank → configuration bundled with common-lib
    @Value("${safety.config-path:}")
    private String configPath;

    @Value("${signal.budget.requests:40}")
    private long budgetRequests;

    @Value("${signal.budget.window-seconds:60}")
    private long budgetWindowSeconds;

    @Value("${signal.cache.ttl-seconds:86400}")
    private long cacheTtlSeconds;

    @Value("${signal.cache.max-entries:10000}")
    private int cacheMaxEntries;

    @Value("${signal.query.timeout-ms:30000}")
    private long queryTimeoutMs;

    @Value("${signal.query.retry-attempts:2}")
    private int retryAttempts;

    @Value("${signal.query.retry-backoff-ms:500}")
    private long retryBackoffMs;

    @Value("${signal.recent-approval.policy:ANNOTATE}")
    private RecentApprovalPolicy recentApprovalPolicy;

    @Value("${signal.recent-approval.window-months:24}")
    private int recentApprovalMonths;

    @Value("${signal.source.name:openFDA drug adverse event reports}")
    private String sourceName;

    @Bean
    public SafetyConfiguration safetyConfiguration() {
        SafetyConfigurationLoader loader = new SafetyConfigurationLoader();
        return configPath == null || configPath.isBlank()
            ? loader.loadDefault()
            : loader.load(Path.of(configPath));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReportCountCache reportCountCache(Clock clock) {
        return new ReportCountCache(Duration.ofSeconds(cacheTtlSeconds), cacheMaxEntries, clock);
    }

    @Bean
    public RequestBudget requestBudget() {
        return new RequestBudget(budgetRequests, Duration.ofSeconds(budgetWindowSeconds));
    }

    @Bean
    public ReportCountGateway reportCountGateway(ReportCountSource source, ReportCountCache cache,
                                                 RequestBudget budget) {
        return new ReportCountGateway(source, cache, budget, retryAttempts, Duration.ofMillis(retryBackoffMs));
    }

    @Bean
    public SignalDefaults signalDefaults() {
        return new SignalDefaults(Duration.ofMillis(queryTimeoutMs), recentApprovalPolicy,
            recentApprovalMonths, sourceName);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
