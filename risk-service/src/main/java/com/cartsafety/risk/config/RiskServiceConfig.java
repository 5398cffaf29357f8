package com.cartsafety.risk.config;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.config.SafetyConfigurationLoader;
import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.mitigation.MitigationCombiner;
import com.cartsafety.common.registry.HeterogeneityPolicy;
import com.cartsafety.common.registry.ModelRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class RiskServiceConfig {

    // Blank → configuration bundled with common-lib
    @Value("${safety.config-path:}")
    private String configPath;

    @Value("${risk.meta-analysis.heterogeneity-policy:ANNOTATE}")
    private HeterogeneityPolicy heterogeneityPolicy;

    @Value("${risk.meta-analysis.i2-threshold:0.5}")
    private double heterogeneityThreshold;

    @Value("${risk.mitigation.monte-carlo-samples:10000}")
    private int monteCarloSamples;

    @Value("${risk.stopping.probability-bound:0.8}")
    private double stoppingProbabilityBound;

    @Value("${risk.stopping.max-n:1000}")
    private int maxStoppingN;

    @Bean
    public SafetyConfiguration safetyConfiguration() {
        SafetyConfigurationLoader loader = new SafetyConfigurationLoader();
        return configPath == null || configPath.isBlank()
            ? loader.loadDefault()
            : loader.load(Path.of(configPath));
    }

    @Bean
    public EvidenceEngine evidenceEngine() {
        return new EvidenceEngine();
    }

    @Bean
    public ModelRegistry modelRegistry(EvidenceEngine evidenceEngine) {
        return ModelRegistry.withDefaults(evidenceEngine);
    }

    @Bean
    public MitigationCombiner mitigationCombiner(EvidenceEngine evidenceEngine) {
        return new MitigationCombiner(evidenceEngine);
    }

    @Bean
    public RiskDefaults riskDefaults() {
        return new RiskDefaults(heterogeneityPolicy, heterogeneityThreshold, monteCarloSamples,
            stoppingProbabilityBound, maxStoppingN);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
