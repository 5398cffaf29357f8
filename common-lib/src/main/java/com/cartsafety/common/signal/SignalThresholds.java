package com.cartsafety.common.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Composite thresholds of the tiered classification (Evans 2001 for PRR/ROR,
 * Szarfman 2002 for EB05).
 */
public record SignalThresholds(
    @JsonProperty("prrMin")      double prrMin,
    @JsonProperty("prrWeakMin")  double prrWeakMin,
    @JsonProperty("minCases")    long minCases,
    @JsonProperty("eb05Strong")  double eb05Strong,
    @JsonProperty("eb05Weak")    double eb05Weak
) {

    public static final SignalThresholds DEFAULT = new SignalThresholds(2.0, 1.5, 3, 2.0, 1.0);
}
