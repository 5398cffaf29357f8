package com.cartsafety.common.mitigation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One greedy merge step at the point relative risks.
 *
 * @param rhoSource {@code explicit} when the coefficient came from a matrix entry,
 *                  {@code independence-default} otherwise
 */
public record PairCorrection(
    @JsonProperty("first")              String first,
    @JsonProperty("second")             String second,
    @JsonProperty("rho")                double rho,
    @JsonProperty("rhoSource")          String rhoSource,
    @JsonProperty("firstRr")            double firstRr,
    @JsonProperty("secondRr")           double secondRr,
    @JsonProperty("independentProduct") double independentProduct,
    @JsonProperty("combinedRr")         double combinedRr
) {

    /** Amount by which overlap raised the combined RR above the independent product. */
    @JsonProperty("correction")
    public double correction() {
        return combinedRr - independentProduct;
    }
}
