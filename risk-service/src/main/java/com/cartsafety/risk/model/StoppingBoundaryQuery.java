package com.cartsafety.risk.model;

import com.cartsafety.common.model.AdverseEventType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param clinicalThreshold unacceptable event rate; the configured default for the type when absent
 * @param probabilityBound  posterior exceedance probability that triggers a pause
 */
public record StoppingBoundaryQuery(
    @JsonProperty("adverseEventType")  AdverseEventType adverseEventType,
    @JsonProperty("maxN")              int maxN,
    @JsonProperty("clinicalThreshold") Double clinicalThreshold,
    @JsonProperty("probabilityBound")  Double probabilityBound
) {}
