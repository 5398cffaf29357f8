package com.cartsafety.signal.model;

import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.signal.MgpsPrior;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Every configured product against every target event, scored under one MGPS prior fit
 * over the whole panel. Results are ordered signals first, then by PRR descending.
 */
public record SignalPanel(
    @JsonProperty("products")        List<String> products,
    @JsonProperty("asOf")            LocalDate asOf,
    @JsonProperty("mgpsPrior")       MgpsPrior mgpsPrior,
    @JsonProperty("pairsEvaluated")  int pairsEvaluated,
    @JsonProperty("signalsDetected") int signalsDetected,
    @JsonProperty("strongSignals")   int strongSignals,
    @JsonProperty("unavailable")     int unavailable,
    @JsonProperty("results")         List<SignalResult> results,
    @JsonProperty("diagnostics")     Diagnostics diagnostics
) {}
