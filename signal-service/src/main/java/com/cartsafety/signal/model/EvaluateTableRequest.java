package com.cartsafety.signal.model;

import com.cartsafety.common.signal.PairCount;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A contingency table supplied by the caller, scored without any external query.
 *
 * @param background other drug-event pairs of the same database for the MGPS prior fit;
 *                   the published default prior is used when absent
 */
public record EvaluateTableRequest(
    @JsonProperty("a")          long a,
    @JsonProperty("b")          long b,
    @JsonProperty("c")          long c,
    @JsonProperty("d")          long d,
    @JsonProperty("background") List<PairCount> background
) {}
