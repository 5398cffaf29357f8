package com.cartsafety.common.registry.estimator;

import com.cartsafety.common.evidence.BetaQuantileFunction;
import com.cartsafety.common.exception.SafetyEngineException;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.ObservationPool;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.common.registry.RiskEstimator;

import java.util.List;

/**
 * Exact binomial interval from Beta quantiles:
 * lower = B(tail; x, n-x+1), upper = B(1-tail; x+1, n-x), with 0 and 1 at the edges.
 */
public final class ClopperPearsonEstimator implements RiskEstimator {

    static final String METHOD_LABEL = "clopper-pearson-exact";

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.CLOPPER_PEARSON.id(),
        "Clopper-Pearson Exact",
        "Exact binomial CI with guaranteed coverage; conservative but widely accepted for regulatory submissions",
        List.of("small_sample", "regulatory", "exact_coverage"),
        List.of("observations"));

    private final BetaQuantileFunction quantiles;

    public ClopperPearsonEstimator(BetaQuantileFunction quantiles) {
        this.quantiles = quantiles;
    }

    @Override
    public EstimationMethod method() {
        return EstimationMethod.CLOPPER_PEARSON;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        ObservationPool pool = ObservationPool.of(request.adverseEventType(), request.observations());
        Interval interval = interval(pool.events(), pool.patients(), request.level());
        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            pool.rawRate(), interval, pool.patients(), pool.events(), pool.studies(),
            Diagnostics.builder().detail("alpha", 1.0 - request.level()).build());
    }

    Interval interval(int events, int n, double level) {
        double tail = (1.0 - level) / 2.0;
        try {
            double lower = events == 0 ? 0.0 : quantiles.inverse(tail, events, n - events + 1.0);
            double upper = events == n ? 1.0 : quantiles.inverse(1.0 - tail, events + 1.0, n - events);
            return new Interval(lower, upper, level, METHOD_LABEL);
        } catch (RuntimeException e) {
            throw new SafetyEngineException("ClopperPearson",
                "exact interval failed for " + events + "/" + n + ": " + e.getMessage(), e);
        }
    }
}
