package com.cartsafety.common.evidence;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.BetaIntervalMethod;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.model.PosteriorEstimate;
import com.cartsafety.common.model.PriorSpecification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link EvidenceEngine}: conjugate update, interval
 * fallback, accrual, stopping boundary and predictive distribution.
 */
class EvidenceEngineTest {

    private static final PriorSpecification CRS_PRIOR =
        new PriorSpecification(0.21, 1.29, "Discounted oncology ~14%");

    private final EvidenceEngine engine = new EvidenceEngine();

    // ── posterior ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("posterior()")
    class PosteriorTests {

        @Test
        @DisplayName("Beta(0.21, 1.29) with 0/47 → Beta(0.21, 48.29), mean ≈ 0.43%")
        void zeroEventsScenario() {
            PosteriorEstimate post = engine.posterior(CRS_PRIOR, 0, 47);

            assertEquals(0.21, post.alpha(), 1e-12);
            assertEquals(48.29, post.beta(), 1e-12);
            assertEquals(0.21 / 48.5, post.mean(), 1e-12);
            assertEquals(0.0043, post.mean(), 5e-5);
            assertFalse(post.approximated());
            assertEquals(BetaIntervalMethod.EXACT.label(), post.interval().method());
        }

        @Test
        @DisplayName("zero events → posterior mean below prior mean")
        void zeroEventsLowersMean() {
            for (int n : new int[] {1, 5, 20, 100}) {
                assertTrue(engine.posterior(CRS_PRIOR, 0, n).mean() < CRS_PRIOR.mean(), "n=" + n);
            }
        }

        @Test
        @DisplayName("zero events → upper bound non-increasing as n grows")
        void upperBoundShrinksWithN() {
            double previous = 1.0;
            for (int n = 1; n <= 200; n += 7) {
                double upper = engine.posterior(CRS_PRIOR, 0, n).interval().upper();
                assertTrue(upper <= previous + 1e-12, "n=" + n);
                previous = upper;
            }
        }

        @Test
        @DisplayName("uniform prior with no data → interval equals the probability levels")
        void uniformPriorQuantiles() {
            Interval interval = engine.posterior(new PriorSpecification(1, 1, "uniform"), 0, 0).interval();
            assertEquals(0.025, interval.lower(), 1e-9);
            assertEquals(0.975, interval.upper(), 1e-9);
        }

        @Test
        @DisplayName("interval always within [0, 1] and brackets the mean")
        void intervalBracketsMean() {
            PosteriorEstimate post = engine.posterior(new PriorSpecification(0.14, 1.03, "icans"), 3, 12);
            assertTrue(post.interval().lower() >= 0.0);
            assertTrue(post.interval().upper() <= 1.0);
            assertTrue(post.interval().contains(post.mean()));
        }

        @Test
        @DisplayName("events > n is rejected")
        void eventsExceedN() {
            assertThrows(InputValidationException.class, () -> engine.posterior(CRS_PRIOR, 5, 4));
        }

        @Test
        @DisplayName("non-positive prior parameters are rejected")
        void invalidPrior() {
            assertThrows(InputValidationException.class, () -> new PriorSpecification(0.0, 1.0, "bad"));
            assertThrows(InputValidationException.class, () -> new PriorSpecification(1.0, -2.0, "bad"));
        }

        @Test
        @DisplayName("level outside (0, 1) is rejected")
        void invalidLevel() {
            assertThrows(InputValidationException.class, () -> engine.posterior(CRS_PRIOR, 0, 10, 1.0));
        }

        @Test
        @DisplayName("same inputs → identical output")
        void idempotent() {
            assertEquals(engine.posterior(CRS_PRIOR, 2, 30), engine.posterior(CRS_PRIOR, 2, 30));
        }
    }

    // ── fallback interval ───────────────────────────────────────────────────

    @Nested
    @DisplayName("quantile fallback")
    class FallbackTests {

        private final EvidenceEngine failing = new EvidenceEngine((p, a, b) -> {
            throw new ArithmeticException("no convergence");
        });

        @Test
        @DisplayName("failed quantile → logit-normal interval, labelled and flagged")
        void logitFallback() {
            PosteriorEstimate post = failing.posterior(CRS_PRIOR, 0, 47);

            assertTrue(post.approximated());
            assertEquals(BetaIntervalMethod.LOGIT_NORMAL.label(), post.interval().method());
        }

        @Test
        @DisplayName("skewed posterior (alpha < 1) never yields a negative lower bound")
        void noNegativeLowerBound() {
            for (int n : new int[] {0, 1, 3, 10, 47}) {
                Interval interval = failing.posterior(CRS_PRIOR, 0, n).interval();
                assertTrue(interval.lower() > 0.0, "n=" + n);
                assertTrue(interval.upper() < 1.0, "n=" + n);
                assertTrue(interval.lower() < interval.upper(), "n=" + n);
            }
        }
    }

    // ── accrual ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("accrual()")
    class AccrualTests {

        @Test
        @DisplayName("CI width non-increasing as cumulative n grows with events fixed")
        void widthMonotone() {
            List<AccrualObservation> sequence = List.of(
                new AccrualObservation("M3", 0, 5),
                new AccrualObservation("M6", 0, 12),
                new AccrualObservation("M9", 0, 25),
                new AccrualObservation("M12", 0, 47));

            List<EvidenceAccrualPoint> points = engine.accrual(CRS_PRIOR, sequence, 0, 0.95);

            assertEquals(4, points.size());
            for (int i = 1; i < points.size(); i++) {
                assertTrue(points.get(i).intervalWidth() <= points.get(i - 1).intervalWidth() + 1e-12);
            }
        }

        @Test
        @DisplayName("projection appended, labelled and marked projected")
        void projection() {
            List<EvidenceAccrualPoint> points = engine.accrual(CRS_PRIOR,
                List.of(new AccrualObservation("M6", 1, 20), new AccrualObservation("M12", 2, 40)), 60, 0.95);

            assertEquals(3, points.size());
            EvidenceAccrualPoint last = points.get(2);
            assertTrue(last.projected());
            assertFalse(points.get(1).projected());
            assertEquals(100, last.n());
            assertTrue(last.timepoint().contains("projected"));
            assertEquals(points.get(1).mean(), last.mean(), 1e-12);
            assertTrue(last.intervalWidth() < points.get(1).intervalWidth());
        }

        @Test
        @DisplayName("decreasing cumulative counts → DataInconsistencyException")
        void decreasingCounts() {
            List<AccrualObservation> sequence = List.of(
                new AccrualObservation("M6", 3, 20),
                new AccrualObservation("M12", 2, 30));
            assertThrows(DataInconsistencyException.class, () -> engine.accrual(CRS_PRIOR, sequence, 0, 0.95));
        }
    }

    // ── stopping boundary ───────────────────────────────────────────────────

    @Nested
    @DisplayName("stoppingBoundary()")
    class StoppingBoundaryTests {

        @Test
        @DisplayName("boundary is non-decreasing in n")
        void monotone() {
            List<StoppingBoundaryStep> steps = engine.stoppingBoundary(CRS_PRIOR, 60, 0.15, 0.8);

            assertEquals(60, steps.size());
            for (int i = 1; i < steps.size(); i++) {
                assertTrue(steps.get(i).maxTolerableEvents() >= steps.get(i - 1).maxTolerableEvents(),
                    "n=" + steps.get(i).n());
            }
        }

        @Test
        @DisplayName("every boundary k satisfies the bound and k+1 violates it")
        void boundaryIsTight() {
            for (StoppingBoundaryStep step : engine.stoppingBoundary(CRS_PRIOR, 40, 0.10, 0.9)) {
                int k = step.maxTolerableEvents();
                if (k >= 0) {
                    assertTrue(engine.exceedance(CRS_PRIOR, k, step.n(), 0.10) < 0.9);
                }
                if (k + 1 <= step.n()) {
                    assertTrue(engine.exceedance(CRS_PRIOR, k + 1, step.n(), 0.10) >= 0.9);
                }
            }
        }

        @Test
        @DisplayName("maxN outside [1, 100000] is rejected")
        void invalidMaxN() {
            assertThrows(InputValidationException.class, () -> engine.stoppingBoundary(CRS_PRIOR, 0, 0.1, 0.9));
        }
    }

    // ── predictive ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("predictive()")
    class PredictiveTests {

        @Test
        @DisplayName("pmf sums to 1 and mean matches m·a/(a+b)")
        void pmfNormalised() {
            PredictiveDistribution dist = engine.predictive(2.21, 45.29, 30, 0.95);

            assertEquals(31, dist.pmf().size());
            assertEquals(1.0, dist.pmf().stream().mapToDouble(Double::doubleValue).sum(), 1e-10);
            assertEquals(30 * 2.21 / 47.5, dist.meanEvents(), 1e-12);

            double mean = 0.0;
            for (int y = 0; y <= 30; y++) {
                mean += y * dist.pmf().get(y);
            }
            assertEquals(dist.meanEvents(), mean, 1e-9);
        }

        @Test
        @DisplayName("uniform posterior → Beta-Binomial is discrete uniform")
        void uniformCase() {
            PredictiveDistribution dist = engine.predictive(1.0, 1.0, 9, 0.95);
            for (double p : dist.pmf()) {
                assertEquals(0.1, p, 1e-12);
            }
        }

        @Test
        @DisplayName("prediction interval holds at least the requested mass")
        void intervalCoverage() {
            PredictiveDistribution dist = engine.predictive(3.0, 20.0, 50, 0.9);
            double mass = 0.0;
            for (int y = dist.lowerEvents(); y <= dist.upperEvents(); y++) {
                mass += dist.pmf().get(y);
            }
            assertTrue(mass >= 0.9 - 1e-12);
            assertTrue(dist.lowerEvents() <= dist.upperEvents());
        }
    }
}
