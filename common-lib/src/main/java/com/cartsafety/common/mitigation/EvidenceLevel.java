package com.cartsafety.common.mitigation;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum EvidenceLevel {
    STRONG,
    MODERATE,
    LIMITED;

    @JsonCreator
    public static EvidenceLevel fromValue(String value) {
        for (EvidenceLevel level : values()) {
            if (level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new InputValidationException("MitigationCatalogue", "Unknown evidence level '" + value + "'");
    }
}
