package com.cartsafety.common.mitigation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mechanistic overlap between two strategies, in [0, 1].
 */
public record CorrelationEntry(
    @JsonProperty("first")      String first,
    @JsonProperty("second")     String second,
    @JsonProperty("rho")        double rho,
    @JsonProperty("provenance") String provenance
) {}
