package com.cartsafety.common.model;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Beta(alpha, beta) prior on an adverse-event rate, with the provenance that justifies it.
 * A changed prior is a new configuration version, never an in-place edit.
 */
public record PriorSpecification(
    @JsonProperty("alpha")      double alpha,
    @JsonProperty("beta")       double beta,
    @JsonProperty("provenance") String provenance
) {

    public PriorSpecification {
        InputValidationException.require(Double.isFinite(alpha) && alpha > 0.0,
            "PriorSpecification", "alpha must be positive, got " + alpha);
        InputValidationException.require(Double.isFinite(beta) && beta > 0.0,
            "PriorSpecification", "beta must be positive, got " + beta);
        provenance = provenance == null ? "unspecified" : provenance;
    }

    /** Jeffreys Beta(0.5, 0.5). */
    public static PriorSpecification jeffreys() {
        return new PriorSpecification(0.5, 0.5, "Jeffreys non-informative");
    }

    public double effectiveSampleSize() {
        return alpha + beta;
    }

    public double mean() {
        return alpha / (alpha + beta);
    }
}
