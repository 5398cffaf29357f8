package com.cartsafety.common.signal;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observed and expected report counts for one drug-event pair, the unit of the MGPS
 * prior fit.
 */
public record PairCount(
    @JsonProperty("drug")     String drug,
    @JsonProperty("event")    String event,
    @JsonProperty("observed") long observed,
    @JsonProperty("expected") double expected
) {

    public PairCount {
        InputValidationException.require(observed >= 0, "GammaPoissonShrinker",
            "observed count must be non-negative, got " + observed);
        InputValidationException.require(Double.isFinite(expected) && expected > 0.0, "GammaPoissonShrinker",
            "expected count must be positive, got " + expected);
    }

    public static PairCount of(String drug, String event, ContingencyTable table) {
        return new PairCount(drug, event, table.a(), table.expected());
    }
}
