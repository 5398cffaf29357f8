package com.cartsafety.common.registry;

/**
 * Contract shared by every registered estimator.
 *
 * <p>Implementations are stateless and thread-safe. Missing method-specific inputs and
 * invalid counts raise {@link com.cartsafety.common.exception.InputValidationException}.
 */
public interface RiskEstimator {

    EstimationMethod method();

    ModelDescriptor descriptor();

    RiskEstimate estimate(EstimationRequest request);
}
