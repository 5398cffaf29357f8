package com.cartsafety.risk.model;

import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AccrualQuery(
    @JsonProperty("adverseEventType")  AdverseEventType adverseEventType,
    @JsonProperty("observations")      List<AdverseEventObservation> observations,
    @JsonProperty("projectionHorizon") Integer projectionHorizon,
    @JsonProperty("level")             Double level
) {}
