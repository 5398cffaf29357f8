package com.cartsafety.common.mitigation;

import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PriorSpecification;

import java.util.List;

/**
 * @param observations cumulative readouts; only those of {@code targetAdverseEvent} feed the baseline
 * @param samples      Monte Carlo draws
 * @param seed         optional; a generated seed is reported when absent
 */
public record MitigationRequest(
    List<String> strategyIds,
    AdverseEventType targetAdverseEvent,
    PriorSpecification prior,
    List<AdverseEventObservation> observations,
    int samples,
    Long seed,
    double level
) {

    public static final int DEFAULT_SAMPLES = 10_000;

    public MitigationRequest {
        strategyIds = strategyIds == null ? List.of() : List.copyOf(strategyIds);
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static MitigationRequest of(List<String> strategyIds, AdverseEventType target, PriorSpecification prior,
                                       List<AdverseEventObservation> observations, Long seed) {
        return new MitigationRequest(strategyIds, target, prior, observations, DEFAULT_SAMPLES, seed, 0.95);
    }
}
