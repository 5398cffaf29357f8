package com.cartsafety.risk.model;

import com.cartsafety.common.evidence.StoppingBoundaryStep;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PriorSpecification;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Pause enrolment once cumulative events at sample size n exceed the step's
 * {@code maxTolerableEvents}.
 *
 * @param thresholdSource {@code request} or {@code configuration}
 */
public record StoppingRule(
    @JsonProperty("adverseEventType")  AdverseEventType adverseEventType,
    @JsonProperty("prior")             PriorSpecification prior,
    @JsonProperty("clinicalThreshold") double clinicalThreshold,
    @JsonProperty("thresholdSource")   String thresholdSource,
    @JsonProperty("probabilityBound")  double probabilityBound,
    @JsonProperty("steps")             List<StoppingBoundaryStep> steps
) {}
