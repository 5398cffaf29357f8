package com.cartsafety.common.registry;

import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.evidence.ExactBetaQuantileFunction;
import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.exception.SafetyEngineException;
import com.cartsafety.common.registry.estimator.BayesianBetaBinomialEstimator;
import com.cartsafety.common.registry.estimator.ClopperPearsonEstimator;
import com.cartsafety.common.registry.estimator.EmpiricalBayesEstimator;
import com.cartsafety.common.registry.estimator.KaplanMeierEstimator;
import com.cartsafety.common.registry.estimator.PredictivePosteriorEstimator;
import com.cartsafety.common.registry.estimator.RandomEffectsMetaEstimator;
import com.cartsafety.common.registry.estimator.WilsonScoreEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches an {@link EstimationRequest} to the estimator the caller selected.
 * Registration rejects a second estimator for the same method.
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private static final String COMPONENT = "ModelRegistry";

    private final Map<EstimationMethod, RiskEstimator> estimators;

    public ModelRegistry(List<RiskEstimator> estimators) {
        Map<EstimationMethod, RiskEstimator> byMethod = new EnumMap<>(EstimationMethod.class);
        for (RiskEstimator estimator : estimators) {
            RiskEstimator existing = byMethod.putIfAbsent(estimator.method(), estimator);
            if (existing != null) {
                throw new DataInconsistencyException(COMPONENT, "duplicate estimator registered for "
                    + estimator.method() + ": " + existing.getClass().getSimpleName()
                    + " and " + estimator.getClass().getSimpleName());
            }
        }
        this.estimators = Collections.unmodifiableMap(byMethod);
    }

    /** All seven estimators wired to the given engine. */
    public static ModelRegistry withDefaults(EvidenceEngine engine) {
        ClopperPearsonEstimator exact = new ClopperPearsonEstimator(new ExactBetaQuantileFunction());
        return new ModelRegistry(List.of(
            new BayesianBetaBinomialEstimator(engine),
            exact,
            new WilsonScoreEstimator(),
            new RandomEffectsMetaEstimator(exact),
            new EmpiricalBayesEstimator(),
            new KaplanMeierEstimator(),
            new PredictivePosteriorEstimator(engine)));
    }

    public RiskEstimate estimate(EstimationMethod method, EstimationRequest request) {
        InputValidationException.require(method != null, COMPONENT, "method is required");
        InputValidationException.require(request != null && request.adverseEventType() != null, COMPONENT,
            "request with an adverseEventType is required");
        InputValidationException.require(request.level() > 0.0 && request.level() < 1.0, COMPONENT,
            "level must be in (0, 1), got " + request.level());
        RiskEstimator estimator = estimators.get(method);
        if (estimator == null) {
            throw new InputValidationException(COMPONENT, "no estimator registered for " + method.id());
        }
        RiskEstimate estimate = estimator.estimate(request);
        log.debug("ESTIMATE method={} type={} point={} degraded={}", method.id(),
            request.adverseEventType(), estimate.point(), estimate.diagnostics().degraded());
        return estimate;
    }

    /**
     * Runs every requested method (all registered ones when {@code methods} is empty).
     * Methods that reject the request are reported in the errors map.
     */
    public ModelComparison compare(EstimationRequest request, List<EstimationMethod> methods) {
        List<EstimationMethod> selected = methods == null || methods.isEmpty()
            ? new ArrayList<>(estimators.keySet())
            : methods;
        Map<EstimationMethod, RiskEstimate> results = new LinkedHashMap<>();
        Map<EstimationMethod, String> errors = new LinkedHashMap<>();
        for (EstimationMethod method : selected) {
            try {
                results.put(method, estimate(method, request));
            } catch (SafetyEngineException e) {
                log.warn("MODEL_FAILED method={} type={} reason={}", method.id(),
                    request.adverseEventType(), e.getMessage());
                errors.put(method, e.getMessage());
            }
        }
        return new ModelComparison(request.adverseEventType(), results, errors);
    }

    public List<ModelDescriptor> describe() {
        return estimators.values().stream().map(RiskEstimator::descriptor).toList();
    }

    public boolean supports(EstimationMethod method) {
        return estimators.containsKey(method);
    }

    public List<EstimationMethod> methods() {
        return List.copyOf(estimators.keySet());
    }
}
