package com.cartsafety.common.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Beta-Binomial predictive distribution of the event count in a future cohort.
 * {@code pmf.get(y)} is P(Y = y) for y = 0..futureN.
 */
public record PredictiveDistribution(
    @JsonProperty("futureN")         int futureN,
    @JsonProperty("alpha")           double alpha,
    @JsonProperty("beta")            double beta,
    @JsonProperty("pmf")             List<Double> pmf,
    @JsonProperty("meanEvents")      double meanEvents,
    @JsonProperty("sdEvents")        double sdEvents,
    @JsonProperty("lowerEvents")     int lowerEvents,
    @JsonProperty("upperEvents")     int upperEvents,
    @JsonProperty("level")           double level
) {

    @JsonProperty("meanRate")
    public double meanRate() {
        return meanEvents / futureN;
    }

    public double probabilityAtMost(int events) {
        double total = 0.0;
        for (int y = 0; y <= Math.min(events, futureN); y++) {
            total += pmf.get(y);
        }
        return total;
    }
}
