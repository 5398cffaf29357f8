package com.cartsafety.common.registry;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The seven registered estimators. Selection is always the caller's decision.
 */
public enum EstimationMethod {

    BAYESIAN_BETA_BINOMIAL("bayesian_beta_binomial"),
    CLOPPER_PEARSON("frequentist_exact"),
    WILSON_SCORE("wilson_score"),
    RANDOM_EFFECTS_META("random_effects_meta"),
    EMPIRICAL_BAYES("empirical_bayes"),
    KAPLAN_MEIER("kaplan_meier"),
    PREDICTIVE_POSTERIOR("predictive_posterior");

    private final String id;

    EstimationMethod(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static EstimationMethod fromId(String value) {
        for (EstimationMethod method : values()) {
            if (method.id.equalsIgnoreCase(value) || method.name().equalsIgnoreCase(value)) {
                return method;
            }
        }
        throw new InputValidationException("ModelRegistry", "Unknown model '" + value + "'");
    }
}
