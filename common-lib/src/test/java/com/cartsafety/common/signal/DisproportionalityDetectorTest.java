package com.cartsafety.common.signal;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of the disproportionality statistics against hand-computed
 * reference tables.
 */
class DisproportionalityDetectorTest {

    /** 10 cases, strong disproportion. */
    private static final ContingencyTable STRONG = new ContingencyTable(10, 990, 40, 98_920);

    /** 1 case, no disproportion. */
    private static final ContingencyTable NULL_PAIR = new ContingencyTable(1, 999, 100, 98_860);

    // ── PRR / ROR ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("PRR and ROR")
    class RatioTests {

        @Test
        @DisplayName("strong pair → PRR 24.74 and ROR 24.98, both excluding 1")
        void strongPair() {
            RatioEstimate prr = DisproportionalityCalculator.prr(STRONG);
            RatioEstimate ror = DisproportionalityCalculator.ror(STRONG);

            assertEquals(24.74, prr.value(), 1e-9);
            assertEquals(12.40718, prr.lower(), 1e-4);
            assertEquals(49.33174, prr.upper(), 1e-4);
            assertEquals(24.97980, ror.value(), 1e-4);
            assertEquals(12.45713, ror.lower(), 1e-4);
            assertEquals(50.09100, ror.upper(), 1e-4);
            assertTrue(prr.excludesOne());
            assertTrue(ror.excludesOne());
            assertFalse(prr.continuityCorrected());
        }

        @Test
        @DisplayName("null pair → ratios near 1 with intervals spanning 1")
        void nullPair() {
            RatioEstimate prr = DisproportionalityCalculator.prr(NULL_PAIR);
            RatioEstimate ror = DisproportionalityCalculator.ror(NULL_PAIR);

            assertEquals(0.9896, prr.value(), 1e-9);
            assertEquals(0.13818, prr.lower(), 1e-4);
            assertEquals(7.08727, prr.upper(), 1e-4);
            assertEquals(0.98959, ror.value(), 1e-4);
            assertFalse(prr.excludesOne());
            assertFalse(ror.excludesOne());
        }

        @Test
        @DisplayName("zero cell → Haldane-Anscombe 0.5 added, marked corrected")
        void zeroCell() {
            ContingencyTable table = new ContingencyTable(0, 50, 30, 1000);
            RatioEstimate prr = DisproportionalityCalculator.prr(table);

            assertTrue(prr.continuityCorrected());
            assertEquals(0.5 / 50.5 / (30.5 / 1030.5), prr.value(), 1e-12);
            assertTrue(Double.isFinite(prr.upper()));
        }

        @Test
        @DisplayName("marginals implying a negative cell fail loudly")
        void inconsistentMarginals() {
            assertThrows(DataInconsistencyException.class,
                () -> ContingencyTable.fromMarginals(12, 10, 50, 100_000));
            ContingencyTable table = ContingencyTable.fromMarginals(10, 1000, 50, 99_960);
            assertEquals(STRONG, table);
        }

        @Test
        @DisplayName("negative or empty tables rejected")
        void invalidTables() {
            assertThrows(InputValidationException.class, () -> new ContingencyTable(-1, 1, 1, 1));
            assertThrows(InputValidationException.class, () -> new ContingencyTable(0, 0, 0, 0));
        }
    }

    // ── MGPS ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Gamma-Poisson shrinker")
    class ShrinkerTests {

        @Test
        @DisplayName("EB05 ≤ EBGM ≤ EB95")
        void ordering() {
            EbgmResult result = GammaPoissonShrinker.score(MgpsPrior.DEFAULT, 10, STRONG.expected());

            assertTrue(result.eb05() <= result.ebgm());
            assertTrue(result.ebgm() <= result.eb95());
            assertTrue(result.eb05() > 2.0);
        }

        @Test
        @DisplayName("sparse pair is shrunk well below its raw O/E")
        void sparseShrinks() {
            EbgmResult result = GammaPoissonShrinker.score(MgpsPrior.DEFAULT, 1, 0.1);

            assertTrue(result.ebgm() < 10.0);
            assertTrue(result.eb05() < 1.0);
        }

        @Test
        @DisplayName("mixture quantile solves the mixture CDF between component quantiles")
        void mixtureQuantile() {
            double x = GammaPoissonShrinker.mixtureQuantile(0.5, 2.0, 1.0, 20.0, 1.0, 0.5);
            GammaDistribution g1 = new GammaDistribution(2.0, 1.0);
            GammaDistribution g2 = new GammaDistribution(20.0, 1.0);

            assertTrue(x > g1.inverseCumulativeProbability(0.5));
            assertTrue(x < g2.inverseCumulativeProbability(0.5));
            assertEquals(0.5, 0.5 * g1.cumulativeProbability(x) + 0.5 * g2.cumulativeProbability(x), 1e-8);
        }

        @Test
        @DisplayName("all weight on one component → that component's quantile")
        void degenerateMixture() {
            double x = GammaPoissonShrinker.mixtureQuantile(1.0, 3.0, 2.0, 20.0, 1.0, 0.05);
            double expected = new GammaDistribution(3.0, 0.5).inverseCumulativeProbability(0.05);
            assertEquals(expected, x, 1e-6);
        }

        @Test
        @DisplayName("fewer than five pairs → published default prior, not fitted")
        void tooFewPairs() {
            MgpsPrior prior = GammaPoissonShrinker.fit(List.of(
                new PairCount("D", "E1", 3, 1.0),
                new PairCount("D", "E2", 0, 0.5)));

            assertSame(MgpsPrior.DEFAULT, prior);
            assertFalse(prior.fitted());
        }

        @Test
        @DisplayName("fit over a panel yields a valid mixture prior")
        void fitPanel() {
            MgpsPrior prior = GammaPoissonShrinker.fit(List.of(
                new PairCount("D", "E1", 12, 2.0),
                new PairCount("D", "E2", 0, 0.8),
                new PairCount("D", "E3", 1, 1.1),
                new PairCount("D", "E4", 4, 3.5),
                new PairCount("D", "E5", 30, 5.0),
                new PairCount("D", "E6", 2, 2.2)));

            assertTrue(prior.p() > 0.0 && prior.p() < 1.0);
            assertTrue(prior.alpha1() > 0.0 && prior.beta2() > 0.0);
        }
    }

    // ── classification ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("signal tiers")
    class TierTests {

        private final SignalThresholds thresholds = SignalThresholds.DEFAULT;

        private RatioEstimate ratio(double value, double lower) {
            return new RatioEstimate(value, lower, value * 2, 0.95, false);
        }

        @Test
        @DisplayName("PRR ≥ 2, lower > 1, 3+ cases, EB05 ≥ 2 → STRONG")
        void strong() {
            assertEquals(SignalTier.STRONG,
                SignalClassifier.classify(ratio(3.0, 1.4), ratio(3.1, 1.3), 2.1, 5, thresholds));
        }

        @Test
        @DisplayName("EB05 below 2 but ROR lower > 1 → MODERATE")
        void moderate() {
            assertEquals(SignalTier.MODERATE,
                SignalClassifier.classify(ratio(2.5, 0.9), ratio(2.6, 1.1), 0.5, 3, thresholds));
        }

        @Test
        @DisplayName("too few cases caps at WEAK")
        void fewCases() {
            assertEquals(SignalTier.WEAK,
                SignalClassifier.classify(ratio(5.0, 1.5), ratio(5.0, 1.5), 3.0, 2, thresholds));
        }

        @Test
        @DisplayName("EB05 ≥ 1 alone → WEAK; nothing → NONE")
        void weakAndNone() {
            assertEquals(SignalTier.WEAK,
                SignalClassifier.classify(ratio(1.0, 0.5), ratio(1.0, 0.5), 1.2, 10, thresholds));
            assertEquals(SignalTier.NONE,
                SignalClassifier.classify(ratio(1.0, 0.5), ratio(1.0, 0.5), 0.4, 10, thresholds));
            assertFalse(SignalTier.NONE.isSignal());
            assertTrue(SignalTier.WEAK.isSignal());
        }
    }

    // ── detector ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("detector")
    class DetectorTests {

        @Test
        @DisplayName("strong table → STRONG with prior provenance in details")
        void strongTable() {
            DisproportionalityMetrics metrics =
                DisproportionalityDetector.evaluate(STRONG, MgpsPrior.DEFAULT, SignalThresholds.DEFAULT);

            assertEquals(SignalTier.STRONG, metrics.tier());
            assertEquals("DuMouchel 1999 default", metrics.diagnostics().details().get("mgpsPriorSource"));
            assertTrue(metrics.diagnostics().degraded());
            assertEquals(1, metrics.diagnostics().approximations().size());
            assertTrue(metrics.diagnostics().approximations().get(0).contains("not fit over the dataset"));
        }

        @Test
        @DisplayName("prior fit over the dataset → no prior approximation recorded")
        void fittedPriorNotFlagged() {
            MgpsPrior fitted = new MgpsPrior(0.2, 0.1, 2.0, 4.0, 1.0 / 3.0, true, "maximum-likelihood fit over 12 pairs");

            DisproportionalityMetrics metrics =
                DisproportionalityDetector.evaluate(STRONG, fitted, SignalThresholds.DEFAULT);

            assertFalse(metrics.diagnostics().degraded());
            assertEquals(true, metrics.diagnostics().details().get("mgpsPriorFitted"));
        }

        @Test
        @DisplayName("null pair → NONE with small-count warning")
        void nullTable() {
            DisproportionalityMetrics metrics =
                DisproportionalityDetector.evaluate(NULL_PAIR, MgpsPrior.DEFAULT, SignalThresholds.DEFAULT);

            assertEquals(SignalTier.NONE, metrics.tier());
            assertFalse(metrics.diagnostics().warnings().isEmpty());
        }

        @Test
        @DisplayName("zero cell → correction recorded as an approximation")
        void zeroCellNoted() {
            DisproportionalityMetrics metrics = DisproportionalityDetector.evaluate(
                new ContingencyTable(0, 50, 30, 1000), MgpsPrior.DEFAULT, SignalThresholds.DEFAULT);

            assertTrue(metrics.prr().continuityCorrected());
            assertTrue(metrics.diagnostics().approximations().stream()
                .anyMatch(note -> note.startsWith("Haldane-Anscombe")));
        }

        @Test
        @DisplayName("no drug reports → InputValidationException")
        void noDrugReports() {
            assertThrows(InputValidationException.class, () -> DisproportionalityDetector.evaluate(
                new ContingencyTable(0, 0, 5, 100), MgpsPrior.DEFAULT, SignalThresholds.DEFAULT));
        }
    }
}
