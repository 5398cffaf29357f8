package com.cartsafety.common.signal;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 2x2 spontaneous-report table for one drug-event pair.
 *
 * <pre>
 *              event   not event
 *   drug         a         b
 *   not drug     c         d
 * </pre>
 */
public record ContingencyTable(
    @JsonProperty("a") long a,
    @JsonProperty("b") long b,
    @JsonProperty("c") long c,
    @JsonProperty("d") long d
) {

    private static final String COMPONENT = "ContingencyTable";

    public ContingencyTable {
        InputValidationException.require(a >= 0 && b >= 0 && c >= 0 && d >= 0, COMPONENT,
            String.format("cells must be non-negative, got a=%d b=%d c=%d d=%d", a, b, c, d));
        InputValidationException.require(a + b + c + d > 0, COMPONENT, "table is empty");
    }

    /**
     * Derives b, c and d from the marginal counts returned by the reporting source.
     *
     * @throws DataInconsistencyException if the marginals imply a negative cell
     */
    public static ContingencyTable fromMarginals(long cases, long drugTotal, long eventTotal, long databaseTotal) {
        long b = drugTotal - cases;
        long c = eventTotal - cases;
        long d = databaseTotal - cases - b - c;
        if (cases < 0 || b < 0 || c < 0 || d < 0) {
            throw new DataInconsistencyException(COMPONENT, String.format(
                "marginals are inconsistent: cases=%d drugTotal=%d eventTotal=%d databaseTotal=%d",
                cases, drugTotal, eventTotal, databaseTotal));
        }
        return new ContingencyTable(cases, b, c, d);
    }

    @JsonProperty("total")
    public long total() {
        return a + b + c + d;
    }

    public long drugTotal() {
        return a + b;
    }

    public long eventTotal() {
        return a + c;
    }

    /** Count expected under independence, (a+b)(a+c)/N. */
    @JsonProperty("expected")
    public double expected() {
        return (double) drugTotal() * (double) eventTotal() / total();
    }

    public boolean hasZeroCell() {
        return a == 0 || b == 0 || c == 0 || d == 0;
    }
}
