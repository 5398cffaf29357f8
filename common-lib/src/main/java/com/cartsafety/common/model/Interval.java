package com.cartsafety.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Two-sided interval on a rate or ratio. {@code method} names how the bounds were
 * obtained so that every response says whether an approximation was used.
 */
public record Interval(
    @JsonProperty("lower")  double lower,
    @JsonProperty("upper")  double upper,
    @JsonProperty("level")  double level,
    @JsonProperty("method") String method
) {

    @JsonProperty("width")
    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    public boolean excludes(double value) {
        return !contains(value);
    }
}
