package com.cartsafety.risk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Envelope for every successful response: the configuration version the result was
 * computed under, and when.
 */
public record SafetyResponse<T>(
    @JsonProperty("configVersion") String configVersion,
    @JsonProperty("computedAt")    Instant computedAt,
    @JsonProperty("result")        T result
) {

    public static <T> SafetyResponse<T> of(String configVersion, T result) {
        return new SafetyResponse<>(configVersion, Instant.now(), result);
    }
}
