package com.cartsafety.common.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A disproportionality ratio with its log-scale delta-method interval.
 * {@code continuityCorrected} is set when 0.5 was added to every cell.
 */
public record RatioEstimate(
    @JsonProperty("value")               double value,
    @JsonProperty("lower")               double lower,
    @JsonProperty("upper")               double upper,
    @JsonProperty("level")               double level,
    @JsonProperty("continuityCorrected") boolean continuityCorrected
) {

    @JsonProperty("excludesOne")
    public boolean excludesOne() {
        return lower > 1.0 || upper < 1.0;
    }
}
