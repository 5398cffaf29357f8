package com.cartsafety.common.registry.estimator;

import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.evidence.PredictiveDistribution;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.model.PosteriorEstimate;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.ObservationPool;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.common.registry.RiskEstimator;

import java.util.List;

/**
 * Event rate expected in the next cohort of {@code futureCohortSize} patients, from the
 * Beta-Binomial predictive distribution. The interval is the equal-tailed prediction
 * interval in events divided by the cohort size.
 */
public final class PredictivePosteriorEstimator implements RiskEstimator {

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.PREDICTIVE_POSTERIOR.id(),
        "Bayesian Predictive Posterior",
        "Predicts the AE rate in the NEXT study, accounting for both parameter uncertainty and sampling variability",
        List.of("prediction", "trial_planning", "sequential_updating"),
        List.of("observations", "prior", "futureCohortSize"));

    private final EvidenceEngine engine;

    public PredictivePosteriorEstimator(EvidenceEngine engine) {
        this.engine = engine;
    }

    @Override
    public EstimationMethod method() {
        return EstimationMethod.PREDICTIVE_POSTERIOR;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        InputValidationException.require(request.prior() != null, "PredictivePosterior",
            "a prior is required for " + request.adverseEventType());
        InputValidationException.require(request.futureCohortSize() != null, "PredictivePosterior",
            "futureCohortSize is required");

        ObservationPool pool = ObservationPool.of(request.adverseEventType(), request.observations());
        PosteriorEstimate posterior = engine.posterior(request.prior(), pool.events(), pool.patients(),
            request.level());
        PredictiveDistribution predictive = engine.predictive(posterior, request.futureCohortSize(),
            request.level());

        int m = predictive.futureN();
        Diagnostics.Builder diagnostics = Diagnostics.builder()
            .detail("posteriorAlpha", posterior.alpha())
            .detail("posteriorBeta", posterior.beta())
            .detail("posteriorMean", posterior.mean())
            .detail("futureCohortSize", m)
            .detail("predictiveMeanEvents", predictive.meanEvents())
            .detail("predictiveSdEvents", predictive.sdEvents())
            .detail("predictionIntervalEvents", List.of(predictive.lowerEvents(), predictive.upperEvents()))
            .detail("pmf", predictive.pmf());
        if (posterior.approximated()) {
            diagnostics.approximation("posterior interval from " + posterior.interval().method());
        }

        Interval interval = new Interval((double) predictive.lowerEvents() / m,
            (double) predictive.upperEvents() / m, request.level(), "beta-binomial-prediction");
        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            predictive.meanRate(), interval, pool.patients(), pool.events(), pool.studies(),
            diagnostics.build());
    }
}
