package com.cartsafety.common.model;

import com.cartsafety.common.exception.InputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cumulative adverse-event count for one study at one timepoint.
 *
 * <p>{@code events} and {@code n} are cumulative within the study up to and including
 * {@code timepoint}. {@code productClass} is optional and only consulted by the
 * meta-analysis heterogeneity policy.
 */
public record AdverseEventObservation(
    @JsonProperty("studyId")          String studyId,
    @JsonProperty("adverseEventType") AdverseEventType adverseEventType,
    @JsonProperty("timepoint")        int timepoint,
    @JsonProperty("events")           int events,
    @JsonProperty("n")                int n,
    @JsonProperty("productClass")     String productClass
) {

    private static final String COMPONENT = "Observation";

    public AdverseEventObservation {
        InputValidationException.require(studyId != null && !studyId.isBlank(),
            COMPONENT, "studyId is required");
        InputValidationException.require(adverseEventType != null,
            COMPONENT, "adverseEventType is required for study " + studyId);
        InputValidationException.require(events >= 0,
            COMPONENT, "events must be non-negative, got " + events + " in study " + studyId);
        InputValidationException.require(n > 0,
            COMPONENT, "n must be positive, got " + n + " in study " + studyId);
        InputValidationException.require(events <= n,
            COMPONENT, "events (" + events + ") cannot exceed n (" + n + ") in study " + studyId);
    }

    public static AdverseEventObservation of(String studyId, AdverseEventType type,
                                             int timepoint, int events, int n) {
        return new AdverseEventObservation(studyId, type, timepoint, events, n, null);
    }
}
