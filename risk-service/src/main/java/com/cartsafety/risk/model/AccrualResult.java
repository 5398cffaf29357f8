package com.cartsafety.risk.model;

import com.cartsafety.common.evidence.EvidenceAccrualPoint;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PriorSpecification;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param studies number of studies whose cumulative readouts were summed per timepoint
 */
public record AccrualResult(
    @JsonProperty("adverseEventType") AdverseEventType adverseEventType,
    @JsonProperty("prior")            PriorSpecification prior,
    @JsonProperty("studies")          int studies,
    @JsonProperty("points")           List<EvidenceAccrualPoint> points
) {}
