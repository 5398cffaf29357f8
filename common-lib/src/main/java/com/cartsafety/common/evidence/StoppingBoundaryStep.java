package com.cartsafety.common.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Largest cumulative event count at sample size {@code n} that keeps
 * P(rate &gt; clinical threshold) below the bound. {@code -1} means no count is
 * tolerable at that size (the prior alone already breaches the bound).
 */
public record StoppingBoundaryStep(
    @JsonProperty("n")                     int n,
    @JsonProperty("maxTolerableEvents")    int maxTolerableEvents,
    @JsonProperty("exceedanceProbability") double exceedanceProbability
) {}
