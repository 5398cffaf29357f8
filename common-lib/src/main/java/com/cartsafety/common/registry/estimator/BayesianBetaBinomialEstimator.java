package com.cartsafety.common.registry.estimator;

import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.PosteriorEstimate;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.ObservationPool;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.common.registry.RiskEstimator;

import java.util.List;

public final class BayesianBetaBinomialEstimator implements RiskEstimator {

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.BAYESIAN_BETA_BINOMIAL.id(),
        "Bayesian Beta-Binomial",
        "Conjugate Beta-Binomial model with informative priors for sequential updating as trial data accrues",
        List.of("small_sample", "sequential_updating", "informative_prior"),
        List.of("observations", "prior"));

    private final EvidenceEngine engine;

    public BayesianBetaBinomialEstimator(EvidenceEngine engine) {
        this.engine = engine;
    }

    @Override
    public EstimationMethod method() {
        return EstimationMethod.BAYESIAN_BETA_BINOMIAL;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        InputValidationException.require(request.prior() != null, "BayesianBetaBinomial",
            "a prior is required for " + request.adverseEventType());
        ObservationPool pool = ObservationPool.of(request.adverseEventType(), request.observations());
        PosteriorEstimate posterior = engine.posterior(request.prior(), pool.events(), pool.patients(),
            request.level());

        Diagnostics.Builder diagnostics = Diagnostics.builder()
            .detail("priorAlpha", request.prior().alpha())
            .detail("priorBeta", request.prior().beta())
            .detail("priorProvenance", request.prior().provenance())
            .detail("priorEffectiveSampleSize", request.prior().effectiveSampleSize())
            .detail("posteriorAlpha", posterior.alpha())
            .detail("posteriorBeta", posterior.beta());
        if (posterior.approximated()) {
            diagnostics.approximation("credible interval from " + posterior.interval().method());
        }

        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            posterior.mean(), posterior.interval(), pool.patients(), pool.events(), pool.studies(),
            diagnostics.build());
    }
}
