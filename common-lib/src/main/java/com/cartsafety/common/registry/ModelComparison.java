package com.cartsafety.common.registry;

import com.cartsafety.common.model.AdverseEventType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Several estimators run over the same request. A method that could not run is listed in
 * {@code errors} with its message; the others still report.
 */
public record ModelComparison(
    @JsonProperty("adverseEventType") AdverseEventType adverseEventType,
    @JsonProperty("results")          Map<EstimationMethod, RiskEstimate> results,
    @JsonProperty("errors")           Map<EstimationMethod, String> errors
) {

    public ModelComparison {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }
}
