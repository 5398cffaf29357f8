package com.cartsafety.signal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * @param approvalDate overrides the configured approval date of the product
 * @param timeoutMs    overall deadline for the external queries; service default when null
 */
public record SignalRequest(
    @JsonProperty("drug")         String drug,
    @JsonProperty("event")        String event,
    @JsonProperty("asOf")         LocalDate asOf,
    @JsonProperty("approvalDate") LocalDate approvalDate,
    @JsonProperty("timeoutMs")    Long timeoutMs
) {}
