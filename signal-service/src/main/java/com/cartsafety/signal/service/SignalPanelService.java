package com.cartsafety.signal.service;

import com.cartsafety.common.config.ProductDefinition;
import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.signal.GammaPoissonShrinker;
import com.cartsafety.common.signal.MgpsPrior;
import com.cartsafety.common.signal.PairCount;
import com.cartsafety.common.signal.SignalTier;
import com.cartsafety.signal.logger.SignalFlowLogger;
import com.cartsafety.signal.model.SignalPanel;
import com.cartsafety.signal.model.SignalResult;
import com.cartsafety.signal.model.SignalStatus;
import com.cartsafety.signal.service.SignalDetectionService.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every selected product against every configured target event.
 *
 * <p>All tables are fetched first; the MGPS prior is then fit once over every scored pair
 * of the panel and each pair is scored under that shared prior. Pairs whose source query
 * failed are reported as unavailable and take no part in the fit.
 */
@Service
public class SignalPanelService {

    private static final Logger log = LoggerFactory.getLogger(SignalPanelService.class);

    private static final String COMPONENT = "SignalPanelService";

    private static final Comparator<SignalResult> SIGNALS_FIRST_THEN_PRR =
        Comparator.comparing((SignalResult r) -> !r.isSignal())
            .thenComparing(r -> Double.isNaN(r.prr()) ? Double.NEGATIVE_INFINITY : r.prr(), Comparator.reverseOrder());

    private final SafetyConfiguration configuration;
    private final SignalDetectionService detection;
    private final SignalFlowLogger flowLogger;

    public SignalPanelService(SafetyConfiguration configuration,
                              SignalDetectionService detection,
                              SignalFlowLogger flowLogger) {
        this.configuration = configuration;
        this.detection = detection;
        this.flowLogger = flowLogger;
    }

    /**
     * @param products brand or generic names; every configured product when null or empty
     * @param timeout  deadline per drug-event pair; null for the default
     */
    public Mono<SignalPanel> panel(List<String> products, LocalDate asOf, Duration timeout) {
        return Mono.defer(() -> {
                Diagnostics.Builder diagnostics = Diagnostics.builder();
                List<ProductDefinition> selected = select(products, diagnostics);
                Duration deadline = detection.deadline(timeout);

                List<SignalPair> pairs = new ArrayList<>();
                for (ProductDefinition product : selected) {
                    for (String event : configuration.targetEvents()) {
                        pairs.add(SignalPair.of(product, event, asOf));
                    }
                }
                log.info("PANEL_START products={} events={} pairs={}",
                    selected.size(), configuration.targetEvents().size(), pairs.size());

                return Flux.fromIterable(pairs)
                    .concatMap(pair -> detection.fetchOrUnavailable(pair, deadline))
                    .collectList()
                    .flatMap(outcomes -> Mono.fromCallable(() -> assemble(selected, asOf, outcomes, diagnostics))
                        .subscribeOn(Schedulers.boundedElastic()));
            })
            .doOnEach(flowLogger.completed(SignalFlowLogger.PANEL, configuration.version()))
            .doOnEach(flowLogger.failed(SignalFlowLogger.PANEL));
    }

    private List<ProductDefinition> select(List<String> requested, Diagnostics.Builder diagnostics) {
        if (requested == null || requested.isEmpty()) {
            return configuration.products();
        }
        Set<ProductDefinition> selected = new LinkedHashSet<>();
        for (String name : requested) {
            Optional<ProductDefinition> product = name == null ? Optional.empty() : configuration.product(name);
            if (product.isPresent()) {
                selected.add(product.get());
            } else {
                diagnostics.warning("unknown product '" + name + "' skipped");
            }
        }
        InputValidationException.require(!selected.isEmpty(), COMPONENT,
            "none of " + requested + " is a configured product");
        return List.copyOf(selected);
    }

    private SignalPanel assemble(List<ProductDefinition> selected, LocalDate asOf,
                                 List<FetchOutcome> outcomes, Diagnostics.Builder diagnostics) {
        List<PairCount> pairCounts = new ArrayList<>();
        for (FetchOutcome outcome : outcomes) {
            if (outcome.fetch() != null && outcome.fetch().table() != null) {
                pairCounts.add(PairCount.of(outcome.pair().drug(), outcome.pair().event(), outcome.fetch().table()));
            }
        }
        MgpsPrior prior = GammaPoissonShrinker.fit(pairCounts);
        if (!prior.fitted()) {
            diagnostics.approximation("MGPS prior not fit over " + pairCounts.size()
                + " pairs; using " + prior.source());
        }

        List<SignalResult> results = new ArrayList<>(outcomes.size());
        for (FetchOutcome outcome : outcomes) {
            results.add(outcome.result() != null
                ? outcome.result()
                : detection.score(outcome.pair(), outcome.fetch(), prior));
        }
        results.sort(SIGNALS_FIRST_THEN_PRR);

        int detected = (int) results.stream().filter(SignalResult::isSignal).count();
        int strong = (int) results.stream().filter(r -> r.isSignal() && r.tier() == SignalTier.STRONG).count();
        int unavailable = (int) results.stream().filter(r -> r.status() == SignalStatus.UNAVAILABLE).count();
        if (unavailable > 0) {
            diagnostics.warning(unavailable + " of " + results.size()
                + " pairs could not be queried and are not negative results");
        }
        diagnostics.detail("mgpsPairs", pairCounts.size());

        return new SignalPanel(selected.stream().map(ProductDefinition::brand).toList(), asOf, prior,
            results.size(), detected, strong, unavailable, results, diagnostics.build());
    }
}
