package com.cartsafety.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Conjugate Beta posterior derived from a prior and cumulative counts. Never stored;
 * recomputed on every query.
 */
public record PosteriorEstimate(
    @JsonProperty("prior")    PriorSpecification prior,
    @JsonProperty("events")   int events,
    @JsonProperty("n")        int n,
    @JsonProperty("alpha")    double alpha,
    @JsonProperty("beta")     double beta,
    @JsonProperty("mean")     double mean,
    @JsonProperty("interval") Interval interval
) {

    @JsonProperty("variance")
    public double variance() {
        double s = alpha + beta;
        return alpha * beta / (s * s * (s + 1.0));
    }

    @JsonProperty("approximated")
    public boolean approximated() {
        return !BetaIntervalMethod.EXACT.label().equals(interval.method());
    }
}
