package com.cartsafety.common.registry;

import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Uniform estimator output. {@code point} and the interval bounds are proportions in [0, 1].
 *
 * @param patients patients contributing to the estimate
 * @param events   events contributing to the estimate
 * @param studies  number of distinct studies pooled
 */
public record RiskEstimate(
    @JsonProperty("method")           EstimationMethod method,
    @JsonProperty("methodName")       String methodName,
    @JsonProperty("adverseEventType") AdverseEventType adverseEventType,
    @JsonProperty("point")            double point,
    @JsonProperty("interval")         Interval interval,
    @JsonProperty("patients")         int patients,
    @JsonProperty("events")           int events,
    @JsonProperty("studies")          int studies,
    @JsonProperty("diagnostics")      Diagnostics diagnostics
) {}
