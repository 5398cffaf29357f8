package com.cartsafety.common.evidence;

/**
 * Inverse CDF of Beta(alpha, beta).
 *
 * <p>Implementations may throw any {@link RuntimeException} when they cannot produce
 * a finite quantile; {@link EvidenceEngine} then takes the logit-normal path and
 * flags the result as degraded.
 */
@FunctionalInterface
public interface BetaQuantileFunction {

    double inverse(double probability, double alpha, double beta);
}
