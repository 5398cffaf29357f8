package com.cartsafety.common.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Empirical-Bayes shrinkage of one pair's reporting ratio.
 *
 * @param firstComponentWeight posterior probability of the first prior component
 */
public record EbgmResult(
    @JsonProperty("ebgm")                 double ebgm,
    @JsonProperty("eb05")                 double eb05,
    @JsonProperty("eb95")                 double eb95,
    @JsonProperty("observed")             long observed,
    @JsonProperty("expected")             double expected,
    @JsonProperty("firstComponentWeight") double firstComponentWeight
) {}
