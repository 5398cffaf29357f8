package com.cartsafety.risk.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    @JsonProperty("code")      String code,
    @JsonProperty("message")   String message,
    @JsonProperty("component") String component,
    @JsonProperty("traceId")   String traceId
) {}
