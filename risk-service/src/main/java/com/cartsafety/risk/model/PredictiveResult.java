package com.cartsafety.risk.model;

import com.cartsafety.common.evidence.PredictiveDistribution;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PosteriorEstimate;
import com.fasterxml.jackson.annotation.JsonProperty;

public record PredictiveResult(
    @JsonProperty("adverseEventType") AdverseEventType adverseEventType,
    @JsonProperty("posterior")        PosteriorEstimate posterior,
    @JsonProperty("predictive")       PredictiveDistribution predictive
) {}
