package com.cartsafety.common.registry;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One patient's time to adverse-event onset, or to censoring when {@code event} is false.
 */
public record OnsetRecord(
    @JsonProperty("time")  double time,
    @JsonProperty("event") boolean event
) {

    public OnsetRecord {
        InputValidationException.require(Double.isFinite(time) && time >= 0.0,
            "KaplanMeier", "onset time must be finite and non-negative, got " + time);
    }
}
