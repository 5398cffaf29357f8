package com.cartsafety.signal.model;

import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.signal.DisproportionalityMetrics;
import com.cartsafety.common.signal.SignalTier;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Disproportionality result for one drug-event pair.
 *
 * <p>{@code metrics} and {@code tier} are present only when {@code status} is
 * {@link SignalStatus#OK}. An unavailable source never produces a tier, so "no signal"
 * and "could not query" stay distinguishable.
 *
 * @param product        configured brand the drug resolved to, null for an unlisted drug
 * @param searchTerm     name variant that matched reports in the source
 * @param suppressedTier tier computed before the recent-approval policy suppressed it
 * @param diagnostics    provenance: queries issued, cache hits, data freshness
 */
public record SignalResult(
    @JsonProperty("drug")              String drug,
    @JsonProperty("event")             String event,
    @JsonProperty("product")           String product,
    @JsonProperty("searchTerm")        String searchTerm,
    @JsonProperty("status")            SignalStatus status,
    @JsonProperty("unavailableReason") UnavailableReason unavailableReason,
    @JsonProperty("metrics")           DisproportionalityMetrics metrics,
    @JsonProperty("tier")              SignalTier tier,
    @JsonProperty("recentApproval")    boolean recentApproval,
    @JsonProperty("suppressedTier")    SignalTier suppressedTier,
    @JsonProperty("diagnostics")       Diagnostics diagnostics
) {

    @JsonProperty("signal")
    public boolean isSignal() {
        return status == SignalStatus.OK && tier != null && tier.isSignal();
    }

    /** PRR point estimate, or NaN when nothing was scored. */
    public double prr() {
        return metrics == null ? Double.NaN : metrics.prr().value();
    }
}
