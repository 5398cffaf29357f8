package com.cartsafety.risk.model;

import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param observations readouts feeding the baseline; only the target type is used
 * @param seed         fixes the Monte Carlo stream; reported back when generated
 */
public record MitigationQuery(
    @JsonProperty("strategyIds")        List<String> strategyIds,
    @JsonProperty("targetAdverseEvent") AdverseEventType targetAdverseEvent,
    @JsonProperty("observations")       List<AdverseEventObservation> observations,
    @JsonProperty("samples")            Integer samples,
    @JsonProperty("seed")               Long seed,
    @JsonProperty("level")              Double level
) {}
