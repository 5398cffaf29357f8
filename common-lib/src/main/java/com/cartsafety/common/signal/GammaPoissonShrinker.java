package com.cartsafety.common.signal;

import com.cartsafety.common.exception.InputValidationException;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Multi-item Gamma-Poisson Shrinker (DuMouchel 1999).
 *
 * <h3>Model</h3>
 * <pre>
 *   n | lambda ~ Poisson(lambda * E)
 *   lambda     ~ p * Gamma(a1, b1) + (1 - p) * Gamma(a2, b2)
 *   lambda | n ~ Q * Gamma(a1 + n, b1 + E) + (1 - Q) * Gamma(a2 + n, b2 + E)
 * </pre>
 * The marginal of n under each component is negative binomial; Q is computed from the
 * two log marginals with log-sum-exp.
 *
 * <h3>Outputs</h3>
 * <ul>
 *   <li>EBGM = exp(E[ln lambda]) = exp(sum Q_k (digamma(a_k + n) - ln(b_k + E)))</li>
 *   <li>EB05 / EB95 = quantiles of the posterior mixture, by Brent root finding on
 *       the mixture CDF between the two components' own quantiles</li>
 * </ul>
 *
 * <h3>Prior fit</h3>
 * Maximum marginal likelihood over all supplied pairs by Nelder-Mead on
 * (ln a1, ln b1, ln a2, ln b2, logit p), starting from {@link MgpsPrior#DEFAULT}.
 */
public final class GammaPoissonShrinker {

    private static final Logger log = LoggerFactory.getLogger(GammaPoissonShrinker.class);

    private static final String COMPONENT = "GammaPoissonShrinker";

    public static final int MIN_PAIRS_FOR_FIT = 5;

    private static final double QUANTILE_ACCURACY = 1e-12;
    private static final int MAX_OPTIMIZER_EVALUATIONS = 20_000;
    private static final int MAX_SOLVER_EVALUATIONS = 500;

    private GammaPoissonShrinker() {}

    // ── scoring ─────────────────────────────────────────────────────────────

    public static EbgmResult score(MgpsPrior prior, long observed, double expected) {
        InputValidationException.require(observed >= 0, COMPONENT,
            "observed count must be non-negative, got " + observed);
        InputValidationException.require(Double.isFinite(expected) && expected > 0.0, COMPONENT,
            "expected count must be positive, got " + expected);

        double q = firstComponentWeight(prior, observed, expected);
        double shape1 = prior.alpha1() + observed;
        double rate1 = prior.beta1() + expected;
        double shape2 = prior.alpha2() + observed;
        double rate2 = prior.beta2() + expected;

        double expectedLog = q * (Gamma.digamma(shape1) - FastMath.log(rate1))
            + (1.0 - q) * (Gamma.digamma(shape2) - FastMath.log(rate2));

        return new EbgmResult(
            FastMath.exp(expectedLog),
            mixtureQuantile(q, shape1, rate1, shape2, rate2, 0.05),
            mixtureQuantile(q, shape1, rate1, shape2, rate2, 0.95),
            observed, expected, q);
    }

    /**
     * Posterior probability of the first component, from the negative-binomial log marginals.
     */
    static double firstComponentWeight(MgpsPrior prior, long observed, double expected) {
        double log1 = FastMath.log(prior.p()) + logMarginal(prior.alpha1(), prior.beta1(), observed, expected);
        double log2 = FastMath.log1p(-prior.p()) + logMarginal(prior.alpha2(), prior.beta2(), observed, expected);
        double max = Math.max(log1, log2);
        double denominator = max + FastMath.log(FastMath.exp(log1 - max) + FastMath.exp(log2 - max));
        return FastMath.exp(log1 - denominator);
    }

    /**
     * log P(n) when lambda ~ Gamma(alpha, beta) and n ~ Poisson(lambda E).
     */
    static double logMarginal(double alpha, double beta, long n, double expected) {
        return Gamma.logGamma(alpha + n) - Gamma.logGamma(alpha) - Gamma.logGamma(n + 1.0)
            + alpha * FastMath.log(beta / (beta + expected))
            + n * FastMath.log(expected / (beta + expected));
    }

    /**
     * Quantile of {@code w * Gamma(shape1, rate1) + (1 - w) * Gamma(shape2, rate2)}.
     * The mixture CDF crosses {@code probability} between the two component quantiles,
     * which bracket the root.
     */
    public static double mixtureQuantile(double w, double shape1, double rate1,
                                         double shape2, double rate2, double probability) {
        GammaDistribution g1 = new GammaDistribution(null, shape1, 1.0 / rate1, QUANTILE_ACCURACY);
        GammaDistribution g2 = new GammaDistribution(null, shape2, 1.0 / rate2, QUANTILE_ACCURACY);
        double q1 = g1.inverseCumulativeProbability(probability);
        double q2 = g2.inverseCumulativeProbability(probability);
        double lo = Math.min(q1, q2);
        double hi = Math.max(q1, q2);
        if (hi - lo <= QUANTILE_ACCURACY * Math.max(1.0, hi)) {
            return lo;
        }

        UnivariateFunction excess = x ->
            w * g1.cumulativeProbability(x) + (1.0 - w) * g2.cumulativeProbability(x) - probability;
        double fLo = excess.value(lo);
        double fHi = excess.value(hi);
        if (fLo >= 0.0) {
            return lo;
        }
        if (fHi <= 0.0) {
            return hi;
        }
        return new BrentSolver(QUANTILE_ACCURACY, QUANTILE_ACCURACY * Math.max(1.0, hi))
            .solve(MAX_SOLVER_EVALUATIONS, excess, lo, hi);
    }

    // ── prior fit ───────────────────────────────────────────────────────────

    /**
     * Maximum-likelihood mixture prior over {@code pairs}. Falls back to
     * {@link MgpsPrior#DEFAULT} (with {@code fitted=false}) when fewer than
     * {@link #MIN_PAIRS_FOR_FIT} pairs are given or the optimiser does not converge.
     */
    public static MgpsPrior fit(List<PairCount> pairs) {
        if (pairs.size() < MIN_PAIRS_FOR_FIT) {
            log.info("MGPS_PRIOR_DEFAULT pairs={} reason=too-few-pairs", pairs.size());
            return MgpsPrior.DEFAULT;
        }

        MultivariateFunction negativeLogLikelihood = theta -> {
            double a1 = FastMath.exp(theta[0]);
            double b1 = FastMath.exp(theta[1]);
            double a2 = FastMath.exp(theta[2]);
            double b2 = FastMath.exp(theta[3]);
            double p = 1.0 / (1.0 + FastMath.exp(-theta[4]));
            if (!(p > 0.0 && p < 1.0)) {
                return Double.MAX_VALUE;
            }
            double total = 0.0;
            for (PairCount pair : pairs) {
                double l1 = FastMath.log(p) + logMarginal(a1, b1, pair.observed(), pair.expected());
                double l2 = FastMath.log1p(-p) + logMarginal(a2, b2, pair.observed(), pair.expected());
                double max = Math.max(l1, l2);
                total += max + FastMath.log(FastMath.exp(l1 - max) + FastMath.exp(l2 - max));
            }
            return Double.isFinite(total) ? -total : Double.MAX_VALUE;
        };

        MgpsPrior start = MgpsPrior.DEFAULT;
        double[] guess = {
            FastMath.log(start.alpha1()), FastMath.log(start.beta1()),
            FastMath.log(start.alpha2()), FastMath.log(start.beta2()),
            FastMath.log(start.p() / (1.0 - start.p()))
        };

        try {
            PointValuePair optimum = new SimplexOptimizer(1e-10, 1e-12).optimize(
                new MaxEval(MAX_OPTIMIZER_EVALUATIONS),
                new MaxIter(MAX_OPTIMIZER_EVALUATIONS),
                new ObjectiveFunction(negativeLogLikelihood),
                GoalType.MINIMIZE,
                new InitialGuess(guess),
                new NelderMeadSimplex(guess.length));
            double[] theta = optimum.getPoint();
            MgpsPrior fitted = new MgpsPrior(
                FastMath.exp(theta[0]), FastMath.exp(theta[1]),
                FastMath.exp(theta[2]), FastMath.exp(theta[3]),
                1.0 / (1.0 + FastMath.exp(-theta[4])),
                true,
                "maximum-likelihood fit over " + pairs.size() + " pairs");
            log.info("MGPS_PRIOR_FIT pairs={} alpha1={} beta1={} alpha2={} beta2={} p={} logLik={}",
                pairs.size(), fitted.alpha1(), fitted.beta1(), fitted.alpha2(), fitted.beta2(),
                fitted.p(), -optimum.getValue());
            return fitted;
        } catch (RuntimeException e) {
            log.warn("MGPS_PRIOR_DEFAULT pairs={} reason={}", pairs.size(), e.getMessage());
            return MgpsPrior.DEFAULT;
        }
    }
}
