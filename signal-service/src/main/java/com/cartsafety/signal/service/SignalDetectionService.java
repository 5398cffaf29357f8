package com.cartsafety.signal.service;

import com.cartsafety.common.config.ProductDefinition;
import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.signal.ContingencyTable;
import com.cartsafety.common.signal.DisproportionalityDetector;
import com.cartsafety.common.signal.DisproportionalityMetrics;
import com.cartsafety.common.signal.GammaPoissonShrinker;
import com.cartsafety.common.signal.MgpsPrior;
import com.cartsafety.common.signal.SignalTier;
import com.cartsafety.signal.client.RateLimitedException;
import com.cartsafety.signal.client.ReportSourceException;
import com.cartsafety.signal.config.SignalDefaults;
import com.cartsafety.signal.logger.SignalFlowLogger;
import com.cartsafety.signal.model.EvaluateTableRequest;
import com.cartsafety.signal.model.RecentApprovalPolicy;
import com.cartsafety.signal.model.SignalResult;
import com.cartsafety.signal.model.SignalStatus;
import com.cartsafety.signal.model.UnavailableReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Detects disproportionality signals for single drug-event pairs against the external
 * reporting database, and scores caller-supplied tables offline.
 *
 * <p>External failures never surface as errors: a timed-out, rate-limited or failed
 * query becomes a {@link SignalStatus#UNAVAILABLE} result with its reason. Invalid input
 * and inconsistent counts still fail the call.
 */
@Service
public class SignalDetectionService {

    private static final Logger log = LoggerFactory.getLogger(SignalDetectionService.class);

    private static final String COMPONENT = "SignalDetectionService";

    private final SafetyConfiguration configuration;
    private final ContingencyTableFetcher fetcher;
    private final SignalDefaults defaults;
    private final Clock clock;
    private final SignalFlowLogger flowLogger;

    public SignalDetectionService(SafetyConfiguration configuration,
                                  ContingencyTableFetcher fetcher,
                                  SignalDefaults defaults,
                                  Clock clock,
                                  SignalFlowLogger flowLogger) {
        this.configuration = configuration;
        this.fetcher = fetcher;
        this.defaults = defaults;
        this.clock = clock;
        this.flowLogger = flowLogger;
    }

    /**
     * @param asOf         counts only reports received on or before this date; null for all
     * @param approvalDate overrides the configured approval date; null to use the configured one
     * @param timeout      deadline for all external queries of this pair; null for the default
     */
    public Mono<SignalResult> detectSignal(String drug, String event, LocalDate asOf,
                                           LocalDate approvalDate, Duration timeout) {
        return Mono.defer(() -> {
                SignalPair pair = resolve(drug, event, asOf, approvalDate);
                Duration deadline = deadline(timeout);
                return fetchOrUnavailable(pair, deadline)
                    .flatMap(outcome -> outcome.result() != null
                        ? Mono.just(outcome.result())
                        : Mono.fromCallable(() -> score(pair, outcome.fetch(), MgpsPrior.DEFAULT))
                            .subscribeOn(Schedulers.boundedElastic()));
            })
            .doOnEach(flowLogger.detected())
            .doOnEach(flowLogger.failed(SignalFlowLogger.DETECT));
    }

    /**
     * Scores a supplied table. The MGPS prior is fit over {@code background} when given,
     * otherwise the published default is used.
     */
    public Mono<DisproportionalityMetrics> evaluateTable(EvaluateTableRequest request) {
        return Mono.fromCallable(() -> {
                ContingencyTable table = new ContingencyTable(request.a(), request.b(), request.c(), request.d());
                MgpsPrior prior = request.background() == null || request.background().isEmpty()
                    ? MgpsPrior.DEFAULT
                    : GammaPoissonShrinker.fit(request.background());
                return DisproportionalityDetector.evaluate(table, prior, configuration.signalThresholds());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.completed(SignalFlowLogger.EVALUATE, configuration.version()))
            .doOnEach(flowLogger.failed(SignalFlowLogger.EVALUATE));
    }

    // ── shared with the panel ───────────────────────────────────────────────

    /** Either a fetched table or, when the source could not be queried, a finished result. */
    record FetchOutcome(SignalPair pair, TableFetch fetch, SignalResult result) {}

    Mono<FetchOutcome> fetchOrUnavailable(SignalPair pair, Duration deadline) {
        return fetcher.fetch(pair.searchTerms(), pair.event(), pair.asOf())
            .timeout(deadline)
            .map(fetch -> new FetchOutcome(pair, fetch, null))
            .onErrorResume(e -> reasonFor(e) != null,
                e -> Mono.just(new FetchOutcome(pair, null, unavailable(pair, reasonFor(e), e))));
    }

    SignalResult score(SignalPair pair, TableFetch fetch, MgpsPrior prior) {
        Diagnostics.Builder diagnostics = provenance(pair, fetch);
        if (fetch.table() == null) {
            diagnostics.warning(fetch.insufficiency());
            return new SignalResult(pair.drug(), pair.event(), pair.brand(), fetch.searchTerm(),
                SignalStatus.INSUFFICIENT_DATA, null, null, null, false, null, diagnostics.build());
        }

        DisproportionalityMetrics metrics =
            DisproportionalityDetector.evaluate(fetch.table(), prior, configuration.signalThresholds());
        metrics.diagnostics().approximations().forEach(diagnostics::approximation);
        SignalTier tier = metrics.tier();
        SignalTier suppressedTier = null;
        boolean recent = isRecentApproval(pair);
        if (recent) {
            String window = String.format("approved %s, within %d months of %s; early post-approval reporting is inflated",
                pair.approvalDate(), defaults.recentApprovalMonths(), referenceDate(pair));
            if (defaults.recentApprovalPolicy() == RecentApprovalPolicy.SUPPRESS && tier.isSignal()) {
                suppressedTier = tier;
                tier = SignalTier.NONE;
                diagnostics.warning("signal suppressed: " + window);
            } else {
                diagnostics.warning("recently approved product: " + window);
            }
        }
        return new SignalResult(pair.drug(), pair.event(), pair.brand(), fetch.searchTerm(),
            SignalStatus.OK, null, metrics, tier, recent, suppressedTier, diagnostics.build());
    }

    Duration deadline(Duration requested) {
        if (requested == null) {
            return defaults.queryTimeout();
        }
        InputValidationException.require(!requested.isNegative() && !requested.isZero(), COMPONENT,
            "timeout must be positive, got " + requested);
        return requested;
    }

    // ── internals ───────────────────────────────────────────────────────────

    private SignalPair resolve(String drug, String event, LocalDate asOf, LocalDate approvalDate) {
        InputValidationException.require(drug != null && !drug.isBlank(), COMPONENT, "drug is required");
        InputValidationException.require(event != null && !event.isBlank(), COMPONENT, "event is required");
        Optional<ProductDefinition> product = configuration.product(drug);
        List<String> terms = product.map(ProductDefinition::searchTerms).orElse(List.of(drug.trim()));
        LocalDate approval = approvalDate != null
            ? approvalDate
            : product.map(ProductDefinition::approvalDate).orElse(null);
        return new SignalPair(drug.trim(), event.trim(), product.orElse(null), terms, asOf, approval);
    }

    private boolean isRecentApproval(SignalPair pair) {
        return pair.approvalDate() != null
            && pair.approvalDate().plusMonths(defaults.recentApprovalMonths()).isAfter(referenceDate(pair));
    }

    private LocalDate referenceDate(SignalPair pair) {
        return pair.asOf() != null ? pair.asOf() : LocalDate.now(clock);
    }

    private Diagnostics.Builder provenance(SignalPair pair, TableFetch fetch) {
        return Diagnostics.builder()
            .detail("source", defaults.sourceName())
            .detail("asOf", pair.asOf() != null ? pair.asOf().toString() : "latest")
            .detail("searchTerm", fetch.searchTerm())
            .detail("queries", fetch.lookups().size())
            .detail("cacheHits", fetch.cacheHits())
            .detail("dataFetchedAt", fetch.oldestData());
    }

    private SignalResult unavailable(SignalPair pair, UnavailableReason reason, Throwable cause) {
        log.warn("SIGNAL_UNAVAILABLE drug={} event={} reason={} detail={}",
            pair.drug(), pair.event(), reason, cause.getMessage());
        Diagnostics diagnostics = Diagnostics.builder()
            .detail("source", defaults.sourceName())
            .detail("asOf", pair.asOf() != null ? pair.asOf().toString() : "latest")
            .warning("reporting source unavailable (" + reason + "): "
                + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()))
            .build();
        return new SignalResult(pair.drug(), pair.event(), pair.brand(), null,
            SignalStatus.UNAVAILABLE, reason, null, null, false, null, diagnostics);
    }

    private static UnavailableReason reasonFor(Throwable error) {
        if (error instanceof TimeoutException) {
            return UnavailableReason.TIMEOUT;
        }
        if (error instanceof RateLimitedException) {
            return UnavailableReason.RATE_LIMITED;
        }
        if (error instanceof ReportSourceException || error instanceof WebClientException) {
            return UnavailableReason.SOURCE_ERROR;
        }
        return null;
    }
}
