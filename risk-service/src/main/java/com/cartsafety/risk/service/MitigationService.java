package com.cartsafety.risk.service;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.mitigation.MitigationCatalogue;
import com.cartsafety.common.mitigation.MitigationCombiner;
import com.cartsafety.common.mitigation.MitigationRequest;
import com.cartsafety.common.mitigation.MitigationResult;
import com.cartsafety.common.model.PriorSpecification;
import com.cartsafety.risk.config.RiskDefaults;
import com.cartsafety.risk.logger.RiskFlowLogger;
import com.cartsafety.risk.model.MitigationCatalogueView;
import com.cartsafety.risk.model.MitigationQuery;
import com.cartsafety.risk.model.SafetyResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@Service
public class MitigationService {

    private static final String COMPONENT = "MitigationService";

    private final SafetyConfiguration configuration;
    private final MitigationCombiner combiner;
    private final RiskDefaults defaults;
    private final RiskFlowLogger flowLogger;

    public MitigationService(SafetyConfiguration configuration,
                             MitigationCombiner combiner,
                             RiskDefaults defaults,
                             RiskFlowLogger flowLogger) {
        this.configuration = configuration;
        this.combiner = combiner;
        this.defaults = defaults;
        this.flowLogger = flowLogger;
    }

    /**
     * Combines the selected strategies from the configured catalogue. The baseline prior
     * is the configured prior of the target type.
     */
    public Mono<SafetyResponse<MitigationResult>> combine(MitigationQuery query) {
        return Mono.fromCallable(() -> {
                InputValidationException.require(query.targetAdverseEvent() != null, COMPONENT,
                    "targetAdverseEvent is required");
                PriorSpecification prior = configuration.prior(query.targetAdverseEvent());
                MitigationRequest request = new MitigationRequest(
                    query.strategyIds(),
                    query.targetAdverseEvent(),
                    prior,
                    query.observations() == null ? List.of() : query.observations(),
                    query.samples() != null ? query.samples() : defaults.monteCarloSamples(),
                    query.seed(),
                    query.level() != null ? query.level() : 0.95);
                return combiner.combine(request, configuration.mitigations());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(result -> SafetyResponse.of(configuration.version(), result))
            .doOnEach(flowLogger.completed(RiskFlowLogger.MITIGATION, configuration.version()))
            .doOnEach(flowLogger.failed(RiskFlowLogger.MITIGATION));
    }

    public Mono<SafetyResponse<MitigationCatalogueView>> catalogue() {
        MitigationCatalogue catalogue = configuration.mitigations();
        return Mono.just(SafetyResponse.of(configuration.version(), new MitigationCatalogueView(
                List.copyOf(catalogue.strategies().values()), catalogue.correlations().entries())))
            .doOnEach(flowLogger.completed(RiskFlowLogger.CATALOGUE, configuration.version()));
    }
}
