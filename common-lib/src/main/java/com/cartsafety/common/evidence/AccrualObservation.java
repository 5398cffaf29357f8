package com.cartsafety.common.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One readout in an evidence-accrual sequence. Counts are cumulative across all
 * readouts so far, not increments.
 */
public record AccrualObservation(
    @JsonProperty("timepoint")        String timepoint,
    @JsonProperty("cumulativeEvents") int cumulativeEvents,
    @JsonProperty("cumulativeN")      int cumulativeN
) {}
