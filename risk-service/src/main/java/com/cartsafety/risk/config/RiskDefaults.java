package com.cartsafety.risk.config;

import com.cartsafety.common.registry.HeterogeneityPolicy;

/**
 * Service-level defaults applied when a request leaves a field out.
 *
 * @param stoppingProbabilityBound posterior exceedance probability that triggers a pause
 */
public record RiskDefaults(
    HeterogeneityPolicy heterogeneityPolicy,
    double heterogeneityThreshold,
    int monteCarloSamples,
    double stoppingProbabilityBound,
    int maxStoppingN
) {}
