package com.cartsafety.common.signal;

/**
 * <ul>
 *   <li>STRONG: PRR &ge; 2, PRR lower bound &gt; 1, cases &ge; 3 and EB05 &ge; 2</li>
 *   <li>MODERATE: PRR &ge; 2, ROR lower bound &gt; 1 and cases &ge; 3</li>
 *   <li>WEAK: PRR &ge; 1.5 or EB05 &ge; 1</li>
 *   <li>NONE otherwise</li>
 * </ul>
 */
public final class SignalClassifier {

    private SignalClassifier() {}

    public static SignalTier classify(RatioEstimate prr, RatioEstimate ror, double eb05, long cases,
                                      SignalThresholds thresholds) {
        boolean enoughCases = cases >= thresholds.minCases();
        if (prr.value() >= thresholds.prrMin() && prr.lower() > 1.0 && enoughCases
                && eb05 >= thresholds.eb05Strong()) {
            return SignalTier.STRONG;
        }
        if (prr.value() >= thresholds.prrMin() && ror.lower() > 1.0 && enoughCases) {
            return SignalTier.MODERATE;
        }
        if (prr.value() >= thresholds.prrWeakMin() || eb05 >= thresholds.eb05Weak()) {
            return SignalTier.WEAK;
        }
        return SignalTier.NONE;
    }
}
