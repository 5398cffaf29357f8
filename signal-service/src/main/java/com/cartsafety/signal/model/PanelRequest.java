package com.cartsafety.signal.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * @param products  brand or generic names; every configured product when null or empty
 * @param timeoutMs deadline per drug-event pair
 */
public record PanelRequest(
    @JsonProperty("products")  List<String> products,
    @JsonProperty("asOf")      LocalDate asOf,
    @JsonProperty("timeoutMs") Long timeoutMs
) {}
