package com.cartsafety.common.signal;

import com.cartsafety.common.exception.InputValidationException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.util.FastMath;

/**
 * Frequentist disproportionality ratios.
 *
 * <pre>
 *   PRR = [a/(a+b)] / [c/(c+d)]     se(ln PRR) = sqrt(1/a - 1/(a+b) + 1/c - 1/(c+d))
 *   ROR = (a*d) / (b*c)             se(ln ROR) = sqrt(1/a + 1/b + 1/c + 1/d)
 * </pre>
 *
 * When any cell is zero, 0.5 is added to all four cells (Haldane-Anscombe) and the
 * result is marked as corrected.
 */
public final class DisproportionalityCalculator {

    public static final double DEFAULT_LEVEL = 0.95;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private DisproportionalityCalculator() {}

    public static RatioEstimate prr(ContingencyTable table) {
        return prr(table, DEFAULT_LEVEL);
    }

    public static RatioEstimate prr(ContingencyTable table, double level) {
        double[] cells = cells(table);
        double a = cells[0], b = cells[1], c = cells[2], d = cells[3];
        double value = (a / (a + b)) / (c / (c + d));
        double se = FastMath.sqrt(1.0 / a - 1.0 / (a + b) + 1.0 / c - 1.0 / (c + d));
        return logScale(value, se, level, table.hasZeroCell());
    }

    public static RatioEstimate ror(ContingencyTable table) {
        return ror(table, DEFAULT_LEVEL);
    }

    public static RatioEstimate ror(ContingencyTable table, double level) {
        double[] cells = cells(table);
        double a = cells[0], b = cells[1], c = cells[2], d = cells[3];
        double value = (a * d) / (b * c);
        double se = FastMath.sqrt(1.0 / a + 1.0 / b + 1.0 / c + 1.0 / d);
        return logScale(value, se, level, table.hasZeroCell());
    }

    private static double[] cells(ContingencyTable table) {
        double shift = table.hasZeroCell() ? 0.5 : 0.0;
        return new double[] {table.a() + shift, table.b() + shift, table.c() + shift, table.d() + shift};
    }

    private static RatioEstimate logScale(double value, double se, double level, boolean corrected) {
        InputValidationException.require(level > 0.0 && level < 1.0, "Disproportionality",
            "level must be in (0, 1), got " + level);
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - level) / 2.0);
        double logValue = FastMath.log(value);
        return new RatioEstimate(value, FastMath.exp(logValue - z * se), FastMath.exp(logValue + z * se),
            level, corrected);
    }
}
