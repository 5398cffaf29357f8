package com.cartsafety.risk.service;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.evidence.EvidenceAccrualPoint;
import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.evidence.PredictiveDistribution;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.PosteriorEstimate;
import com.cartsafety.common.model.PriorSpecification;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.ModelComparison;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.ModelRegistry;
import com.cartsafety.common.registry.ObservationPool;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.risk.config.RiskDefaults;
import com.cartsafety.risk.logger.RiskFlowLogger;
import com.cartsafety.risk.model.AccrualQuery;
import com.cartsafety.risk.model.AccrualResult;
import com.cartsafety.risk.model.PredictiveQuery;
import com.cartsafety.risk.model.PredictiveResult;
import com.cartsafety.risk.model.RiskQuery;
import com.cartsafety.risk.model.SafetyResponse;
import com.cartsafety.risk.model.StoppingBoundaryQuery;
import com.cartsafety.risk.model.StoppingRule;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Resolves priors and defaults from the versioned configuration and runs the
 * statistical core off the event loop.
 */
@Service
public class RiskEstimationService {

    private static final String COMPONENT = "RiskService";

    private final SafetyConfiguration configuration;
    private final ModelRegistry registry;
    private final EvidenceEngine engine;
    private final RiskDefaults defaults;
    private final RiskFlowLogger flowLogger;

    public RiskEstimationService(SafetyConfiguration configuration,
                                 ModelRegistry registry,
                                 EvidenceEngine engine,
                                 RiskDefaults defaults,
                                 RiskFlowLogger flowLogger) {
        this.configuration = configuration;
        this.registry = registry;
        this.engine = engine;
        this.defaults = defaults;
        this.flowLogger = flowLogger;
    }

    public Mono<SafetyResponse<RiskEstimate>> estimate(RiskQuery query) {
        return compute(RiskFlowLogger.ESTIMATE, () -> {
            InputValidationException.require(query.method() != null, COMPONENT, "method is required");
            return registry.estimate(query.method(), toRequest(query));
        });
    }

    public Mono<SafetyResponse<ModelComparison>> compare(RiskQuery query) {
        return compute(RiskFlowLogger.COMPARE, () -> {
            List<EstimationMethod> methods = query.methods() == null ? List.of() : query.methods();
            return registry.compare(toRequest(query), methods);
        });
    }

    public Mono<SafetyResponse<List<ModelDescriptor>>> models() {
        return compute(RiskFlowLogger.MODELS, registry::describe);
    }

    public Mono<SafetyResponse<AccrualResult>> accrual(AccrualQuery query) {
        return compute(RiskFlowLogger.ACCRUAL, () -> {
            InputValidationException.require(query.adverseEventType() != null, COMPONENT,
                "adverseEventType is required");
            PriorSpecification prior = configuration.prior(query.adverseEventType());
            AccrualSeries series = AccrualSeries.of(query.adverseEventType(), observations(query.observations()));
            List<EvidenceAccrualPoint> points = engine.accrual(prior, series.readouts(),
                query.projectionHorizon() == null ? 0 : query.projectionHorizon(),
                level(query.level()));
            return new AccrualResult(query.adverseEventType(), prior, series.studies(), points);
        });
    }

    public Mono<SafetyResponse<StoppingRule>> stoppingBoundary(StoppingBoundaryQuery query) {
        return compute(RiskFlowLogger.STOPPING_BOUNDARY, () -> {
            InputValidationException.require(query.adverseEventType() != null, COMPONENT,
                "adverseEventType is required");
            InputValidationException.require(query.maxN() <= defaults.maxStoppingN(), COMPONENT,
                "maxN must not exceed " + defaults.maxStoppingN() + ", got " + query.maxN());
            PriorSpecification prior = configuration.prior(query.adverseEventType());

            Optional<Double> configured = configuration.clinicalThreshold(query.adverseEventType());
            double threshold;
            String source;
            if (query.clinicalThreshold() != null) {
                threshold = query.clinicalThreshold();
                source = "request";
            } else {
                threshold = configured.orElseThrow(() -> new InputValidationException(COMPONENT,
                    "no clinicalThreshold supplied and none configured for " + query.adverseEventType()));
                source = "configuration";
            }
            double bound = query.probabilityBound() != null
                ? query.probabilityBound()
                : defaults.stoppingProbabilityBound();

            return new StoppingRule(query.adverseEventType(), prior, threshold, source, bound,
                engine.stoppingBoundary(prior, query.maxN(), threshold, bound));
        });
    }

    public Mono<SafetyResponse<PredictiveResult>> predictive(PredictiveQuery query) {
        return compute(RiskFlowLogger.PREDICTIVE, () -> {
            InputValidationException.require(query.adverseEventType() != null, COMPONENT,
                "adverseEventType is required");
            PriorSpecification prior = configuration.prior(query.adverseEventType());
            ObservationPool pool = ObservationPool.of(query.adverseEventType(), observations(query.observations()));
            double level = level(query.level());
            PosteriorEstimate posterior = engine.posterior(prior, pool.events(), pool.patients(), level);
            PredictiveDistribution predictive = engine.predictive(posterior, query.futureCohortSize(), level);
            return new PredictiveResult(query.adverseEventType(), posterior, predictive);
        });
    }

    EstimationRequest toRequest(RiskQuery query) {
        InputValidationException.require(query.adverseEventType() != null, COMPONENT,
            "adverseEventType is required");
        EstimationRequest.Builder builder = EstimationRequest.builder(query.adverseEventType())
            .observations(observations(query.observations()))
            .level(level(query.level()))
            .futureCohortSize(query.futureCohortSize())
            .timeHorizon(query.timeHorizon())
            .shrinkageWeightOverride(query.shrinkageWeightOverride())
            .continuityCorrection(Boolean.TRUE.equals(query.continuityCorrection()))
            .heterogeneity(
                query.heterogeneityPolicy() != null ? query.heterogeneityPolicy() : defaults.heterogeneityPolicy(),
                defaults.heterogeneityThreshold());
        if (query.onsetRecords() != null) {
            builder.onsetRecords(query.onsetRecords());
        }
        // Kaplan-Meier needs no prior, so a missing one is left for the estimator to reject
        PriorSpecification prior = configuration.priors().get(query.adverseEventType());
        if (prior != null) {
            builder.prior(prior);
        }
        return builder.build();
    }

    private <T> Mono<SafetyResponse<T>> compute(String operation, Callable<T> work) {
        return Mono.fromCallable(work)
            .subscribeOn(Schedulers.boundedElastic())
            .map(result -> SafetyResponse.of(configuration.version(), result))
            .doOnEach(flowLogger.completed(operation, configuration.version()))
            .doOnEach(flowLogger.failed(operation));
    }

    private static <T> List<T> observations(List<T> values) {
        return values == null ? List.of() : values;
    }

    private static double level(Double value) {
        return value == null ? EstimationRequest.DEFAULT_LEVEL : value;
    }
}
