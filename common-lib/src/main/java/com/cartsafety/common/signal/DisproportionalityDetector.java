package com.cartsafety.common.signal;

import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.Diagnostics;

/**
 * Scores one contingency table: PRR, ROR, EBGM/EB05 under the given mixture prior,
 * and the tier. Pure; the external query lives in the signal service.
 */
public final class DisproportionalityDetector {

    private DisproportionalityDetector() {}

    public static DisproportionalityMetrics evaluate(ContingencyTable table, MgpsPrior prior,
                                                     SignalThresholds thresholds) {
        InputValidationException.require(table.drugTotal() > 0, "DisproportionalityDetector",
            "no reports for the drug; disproportionality is undefined");
        InputValidationException.require(table.eventTotal() > 0, "DisproportionalityDetector",
            "no reports for the event; disproportionality is undefined");

        RatioEstimate prr = DisproportionalityCalculator.prr(table);
        RatioEstimate ror = DisproportionalityCalculator.ror(table);
        EbgmResult ebgm = GammaPoissonShrinker.score(prior, table.a(), table.expected());
        SignalTier tier = SignalClassifier.classify(prr, ror, ebgm.eb05(), table.a(), thresholds);

        Diagnostics.Builder diagnostics = Diagnostics.builder()
            .detail("expected", table.expected())
            .detail("mgpsPriorSource", prior.source())
            .detail("mgpsPriorFitted", prior.fitted());
        if (!prior.fitted()) {
            diagnostics.approximation("MGPS prior not fit over the dataset; using " + prior.source());
        }
        if (table.hasZeroCell()) {
            diagnostics.approximation("Haldane-Anscombe correction: 0.5 added to every cell for PRR/ROR");
        }
        if (table.a() < thresholds.minCases()) {
            diagnostics.warning("fewer than " + thresholds.minCases() + " cases; ratios are unstable");
        }
        return new DisproportionalityMetrics(table, prr, ror, ebgm, tier, diagnostics.build());
    }
}
