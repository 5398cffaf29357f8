package com.cartsafety.common.evidence;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.BetaIntervalMethod;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.model.PosteriorEstimate;
import com.cartsafety.common.model.PriorSpecification;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjugate Beta-Binomial evidence engine.
 *
 * <h3>Model</h3>
 * <pre>
 *   Prior:     Beta(alpha, beta)
 *   Posterior: Beta(alpha + events, beta + n - events)
 * </pre>
 *
 * <h3>Credible intervals</h3>
 * Equal-tailed, from the exact Beta inverse CDF. When the quantile function fails the
 * interval is taken on the logit scale, using the exact logit moments of a Beta variate
 * (digamma difference and trigamma sum), then mapped back through the expit. A symmetric
 * normal interval on the rate scale is never used: with alpha+beta below 5 or either
 * parameter below 1 it produces negative lower bounds. Every fallback is logged and
 * labelled on the returned {@link Interval}.
 *
 * <p>Stateless apart from the injected quantile function; safe to share across threads.
 */
public final class EvidenceEngine {

    private static final Logger log = LoggerFactory.getLogger(EvidenceEngine.class);

    private static final String COMPONENT = "EvidenceEngine";

    public static final double DEFAULT_LEVEL = 0.95;

    /** Upper bound on cohort sizes enumerated by the boundary and predictive computations. */
    public static final int MAX_ENUMERATED_N = 100_000;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private final BetaQuantileFunction quantiles;

    public EvidenceEngine() {
        this(new ExactBetaQuantileFunction());
    }

    public EvidenceEngine(BetaQuantileFunction quantiles) {
        this.quantiles = quantiles;
    }

    // ── posterior update ────────────────────────────────────────────────────

    public PosteriorEstimate posterior(PriorSpecification prior, int events, int n) {
        return posterior(prior, events, n, DEFAULT_LEVEL);
    }

    /**
     * Beta posterior for {@code events} out of {@code n} cumulative patients.
     *
     * @throws InputValidationException if counts are negative, events exceed n,
     *                                  or the level is outside (0, 1)
     */
    public PosteriorEstimate posterior(PriorSpecification prior, int events, int n, double level) {
        InputValidationException.require(prior != null, COMPONENT, "prior is required");
        validateCounts(events, n);
        validateLevel(level);

        double a = prior.alpha() + events;
        double b = prior.beta() + (n - events);
        return new PosteriorEstimate(prior, events, n, a, b, a / (a + b), credibleInterval(a, b, level));
    }

    /**
     * Equal-tailed credible interval of Beta(a, b).
     */
    public Interval credibleInterval(double a, double b, double level) {
        InputValidationException.require(a > 0.0 && b > 0.0, COMPONENT,
            "Beta parameters must be positive, got alpha=" + a + " beta=" + b);
        validateLevel(level);
        double tail = (1.0 - level) / 2.0;
        try {
            double lower = quantiles.inverse(tail, a, b);
            double upper = quantiles.inverse(1.0 - tail, a, b);
            if (!(lower <= upper)) {
                throw new ArithmeticException("inverted Beta quantiles lower=" + lower + " upper=" + upper);
            }
            return new Interval(lower, upper, level, BetaIntervalMethod.EXACT.label());
        } catch (RuntimeException e) {
            log.warn("BETA_QUANTILE_FALLBACK alpha={} beta={} level={} reason={} degraded precision, "
                + "using logit-normal interval", a, b, level, e.getMessage());
            return logitNormalInterval(a, b, level);
        }
    }

    static Interval logitNormalInterval(double a, double b, double level) {
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - level) / 2.0);
        double mu = Gamma.digamma(a) - Gamma.digamma(b);
        double sd = FastMath.sqrt(Gamma.trigamma(a) + Gamma.trigamma(b));
        return new Interval(expit(mu - z * sd), expit(mu + z * sd), level,
            BetaIntervalMethod.LOGIT_NORMAL.label());
    }

    private static double expit(double x) {
        return 1.0 / (1.0 + FastMath.exp(-x));
    }

    // ── evidence accrual ────────────────────────────────────────────────────

    /**
     * Posterior trajectory over an ordered sequence of cumulative readouts, optionally
     * followed by one projected point {@code projectionHorizon} patients beyond the last
     * readout.
     *
     * <p>The projection keeps the same prior and the latest cumulative counts, adding the
     * horizon's expected events at the current posterior mean. It is marked
     * {@code projected=true}.
     *
     * @throws DataInconsistencyException if cumulative events or n decrease
     */
    public List<EvidenceAccrualPoint> accrual(PriorSpecification prior,
                                              List<AccrualObservation> sequence,
                                              int projectionHorizon,
                                              double level) {
        InputValidationException.require(sequence != null && !sequence.isEmpty(), COMPONENT,
            "accrual sequence must contain at least one readout");
        InputValidationException.require(projectionHorizon >= 0, COMPONENT,
            "projectionHorizon must be non-negative, got " + projectionHorizon);

        List<EvidenceAccrualPoint> points = new ArrayList<>(sequence.size() + 1);
        AccrualObservation previous = null;
        PosteriorEstimate latest = null;

        for (AccrualObservation obs : sequence) {
            if (previous != null) {
                if (obs.cumulativeN() < previous.cumulativeN()
                        || obs.cumulativeEvents() < previous.cumulativeEvents()) {
                    throw new DataInconsistencyException(COMPONENT, String.format(
                        "cumulative counts decrease between '%s' (%d/%d) and '%s' (%d/%d)",
                        previous.timepoint(), previous.cumulativeEvents(), previous.cumulativeN(),
                        obs.timepoint(), obs.cumulativeEvents(), obs.cumulativeN()));
                }
            }
            latest = posterior(prior, obs.cumulativeEvents(), obs.cumulativeN(), level);
            points.add(new EvidenceAccrualPoint(obs.timepoint(), obs.cumulativeN(),
                obs.cumulativeEvents(), latest.mean(), latest.interval(), false));
            log.debug("ACCRUAL timepoint={} n={} events={} mean={} width={}",
                obs.timepoint(), obs.cumulativeN(), obs.cumulativeEvents(),
                latest.mean(), latest.interval().width());
            previous = obs;
        }

        if (projectionHorizon > 0) {
            double expectedNewEvents = projectionHorizon * latest.mean();
            double a = latest.alpha() + expectedNewEvents;
            double b = latest.beta() + (projectionHorizon - expectedNewEvents);
            points.add(new EvidenceAccrualPoint(
                "projected +" + projectionHorizon,
                previous.cumulativeN() + projectionHorizon,
                previous.cumulativeEvents() + expectedNewEvents,
                a / (a + b),
                credibleInterval(a, b, level),
                true));
        }
        return points;
    }

    // ── Bayesian stopping rule ──────────────────────────────────────────────

    /**
     * For every sample size 1..maxN, the largest cumulative event count k such that
     * P(rate &gt; clinicalThreshold | k, n) &lt; probabilityBound.
     *
     * <p>The exceedance probability decreases in n for fixed k, so the boundary is a
     * non-decreasing step function; each step starts its search from the previous
     * boundary, keeping the whole scan linear in maxN.
     */
    public List<StoppingBoundaryStep> stoppingBoundary(PriorSpecification prior,
                                                       int maxN,
                                                       double clinicalThreshold,
                                                       double probabilityBound) {
        InputValidationException.require(prior != null, COMPONENT, "prior is required");
        InputValidationException.require(maxN >= 1 && maxN <= MAX_ENUMERATED_N, COMPONENT,
            "maxN must be in [1, " + MAX_ENUMERATED_N + "], got " + maxN);
        InputValidationException.require(clinicalThreshold > 0.0 && clinicalThreshold < 1.0, COMPONENT,
            "clinicalThreshold must be in (0, 1), got " + clinicalThreshold);
        InputValidationException.require(probabilityBound > 0.0 && probabilityBound < 1.0, COMPONENT,
            "probabilityBound must be in (0, 1), got " + probabilityBound);

        List<StoppingBoundaryStep> steps = new ArrayList<>(maxN);
        int k = -1;
        for (int n = 1; n <= maxN; n++) {
            while (k >= 0 && exceedance(prior, k, n, clinicalThreshold) >= probabilityBound) {
                k--;
            }
            while (k + 1 <= n && exceedance(prior, k + 1, n, clinicalThreshold) < probabilityBound) {
                k++;
            }
            double atBoundary = k >= 0 ? exceedance(prior, k, n, clinicalThreshold) : Double.NaN;
            steps.add(new StoppingBoundaryStep(n, k, atBoundary));
        }
        return steps;
    }

    /**
     * P(rate &gt; threshold) under Beta(alpha + k, beta + n - k), via the complementary
     * regularized incomplete beta to keep precision in the upper tail.
     */
    public double exceedance(PriorSpecification prior, int events, int n, double threshold) {
        double a = prior.alpha() + events;
        double b = prior.beta() + (n - events);
        return Beta.regularizedBeta(1.0 - threshold, b, a);
    }

    // ── predictive posterior ────────────────────────────────────────────────

    public PredictiveDistribution predictive(PosteriorEstimate posterior, int futureN, double level) {
        return predictive(posterior.alpha(), posterior.beta(), futureN, level);
    }

    /**
     * Beta-Binomial(futureN, alpha, beta) probability mass function, computed in log space
     * and normalised with log-sum-exp, plus an equal-tailed prediction interval in events.
     */
    public PredictiveDistribution predictive(double alpha, double beta, int futureN, double level) {
        InputValidationException.require(alpha > 0.0 && beta > 0.0, COMPONENT,
            "posterior parameters must be positive, got alpha=" + alpha + " beta=" + beta);
        InputValidationException.require(futureN >= 1 && futureN <= MAX_ENUMERATED_N, COMPONENT,
            "futureN must be in [1, " + MAX_ENUMERATED_N + "], got " + futureN);
        validateLevel(level);

        double[] logPmf = new double[futureN + 1];
        double logNormaliser = Beta.logBeta(alpha, beta);
        double max = Double.NEGATIVE_INFINITY;
        for (int y = 0; y <= futureN; y++) {
            logPmf[y] = CombinatoricsUtils.binomialCoefficientLog(futureN, y)
                + Beta.logBeta(alpha + y, beta + futureN - y)
                - logNormaliser;
            max = Math.max(max, logPmf[y]);
        }
        double sum = 0.0;
        for (double lp : logPmf) {
            sum += FastMath.exp(lp - max);
        }
        double logSum = max + FastMath.log(sum);

        List<Double> pmf = new ArrayList<>(futureN + 1);
        for (double lp : logPmf) {
            pmf.add(FastMath.exp(lp - logSum));
        }

        double tail = (1.0 - level) / 2.0;
        int lower = -1;
        int upper = futureN;
        double cdf = 0.0;
        for (int y = 0; y <= futureN; y++) {
            cdf += pmf.get(y);
            if (lower < 0 && cdf >= tail) {
                lower = y;
            }
            if (cdf >= 1.0 - tail) {
                upper = y;
                break;
            }
        }

        double s = alpha + beta;
        double mean = futureN * alpha / s;
        double variance = futureN * alpha * beta * (s + futureN) / (s * s * (s + 1.0));
        return new PredictiveDistribution(futureN, alpha, beta, List.copyOf(pmf),
            mean, FastMath.sqrt(variance), Math.max(lower, 0), upper, level);
    }

    // ── validation ──────────────────────────────────────────────────────────

    private static void validateCounts(int events, int n) {
        InputValidationException.require(events >= 0, COMPONENT,
            "events must be non-negative, got " + events);
        InputValidationException.require(n >= 0, COMPONENT,
            "n must be non-negative, got " + n);
        InputValidationException.require(events <= n, COMPONENT,
            "events (" + events + ") cannot exceed n (" + n + ")");
    }

    private static void validateLevel(double level) {
        InputValidationException.require(level > 0.0 && level < 1.0, COMPONENT,
            "level must be in (0, 1), got " + level);
    }
}
