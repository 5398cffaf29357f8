package com.cartsafety.common.mitigation;

import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Combined effect of the selected strategies on one adverse-event type.
 *
 * <p>{@code combinedRr} covers only strategies of confirmed benefit. Strategies whose CI
 * reaches 1.0 are listed in {@code uncertainBenefit} and only enter
 * {@code combinedRrIncludingUncertain}, which is null when there are none.
 */
public record MitigationResult(
    @JsonProperty("targetAdverseEvent")           AdverseEventType targetAdverseEvent,
    @JsonProperty("applied")                      List<String> applied,
    @JsonProperty("notApplicable")                List<String> notApplicable,
    @JsonProperty("uncertainBenefit")             List<String> uncertainBenefit,
    @JsonProperty("baselineMean")                 double baselineMean,
    @JsonProperty("baselineInterval")             Interval baselineInterval,
    @JsonProperty("combinedRr")                   double combinedRr,
    @JsonProperty("combinedRrInterval")           Interval combinedRrInterval,
    @JsonProperty("combinedRrIncludingUncertain") Double combinedRrIncludingUncertain,
    @JsonProperty("pairCorrections")              List<PairCorrection> pairCorrections,
    @JsonProperty("mitigatedRisk")                double mitigatedRisk,
    @JsonProperty("mitigatedRiskInterval")        Interval mitigatedRiskInterval,
    @JsonProperty("mitigatedRiskMedian")          double mitigatedRiskMedian,
    @JsonProperty("samples")                      int samples,
    @JsonProperty("seed")                         long seed,
    @JsonProperty("diagnostics")                  Diagnostics diagnostics
) {}
