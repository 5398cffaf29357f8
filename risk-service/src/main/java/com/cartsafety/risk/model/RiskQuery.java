package com.cartsafety.risk.model;

import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.HeterogeneityPolicy;
import com.cartsafety.common.registry.OnsetRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code /estimate} and {@code /compare}. {@code method} selects the estimator for
 * {@code /estimate}; {@code methods} restricts {@code /compare} (all models when empty).
 * Optional fields fall back to the service defaults.
 */
public record RiskQuery(
    @JsonProperty("adverseEventType")        AdverseEventType adverseEventType,
    @JsonProperty("method")                  EstimationMethod method,
    @JsonProperty("methods")                 List<EstimationMethod> methods,
    @JsonProperty("observations")            List<AdverseEventObservation> observations,
    @JsonProperty("level")                   Double level,
    @JsonProperty("futureCohortSize")        Integer futureCohortSize,
    @JsonProperty("onsetRecords")            List<OnsetRecord> onsetRecords,
    @JsonProperty("timeHorizon")             Double timeHorizon,
    @JsonProperty("shrinkageWeightOverride") Double shrinkageWeightOverride,
    @JsonProperty("continuityCorrection")    Boolean continuityCorrection,
    @JsonProperty("heterogeneityPolicy")     HeterogeneityPolicy heterogeneityPolicy
) {}
