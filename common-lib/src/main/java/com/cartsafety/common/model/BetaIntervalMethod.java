package com.cartsafety.common.model;

/**
 * How a Beta credible interval was obtained.
 */
public enum BetaIntervalMethod {

    EXACT("exact-beta-quantile"),
    LOGIT_NORMAL("logit-normal-approximation");

    private final String label;

    BetaIntervalMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
