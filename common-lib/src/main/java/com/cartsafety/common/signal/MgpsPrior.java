package com.cartsafety.common.signal;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Two-component Gamma mixture prior on the reporting ratio:
 * {@code p * Gamma(alpha1, beta1) + (1 - p) * Gamma(alpha2, beta2)}, rate parameterisation.
 */
public record MgpsPrior(
    @JsonProperty("alpha1") double alpha1,
    @JsonProperty("beta1")  double beta1,
    @JsonProperty("alpha2") double alpha2,
    @JsonProperty("beta2")  double beta2,
    @JsonProperty("p")      double p,
    @JsonProperty("fitted") boolean fitted,
    @JsonProperty("source") String source
) {

    /** DuMouchel (1999) published prior. */
    public static final MgpsPrior DEFAULT =
        new MgpsPrior(0.2, 0.1, 2.0, 4.0, 1.0 / 3.0, false, "DuMouchel 1999 default");

    public MgpsPrior {
        InputValidationException.require(alpha1 > 0 && beta1 > 0 && alpha2 > 0 && beta2 > 0,
            "MgpsPrior", "Gamma parameters must be positive");
        InputValidationException.require(p > 0.0 && p < 1.0, "MgpsPrior",
            "mixing weight must be in (0, 1), got " + p);
    }
}
