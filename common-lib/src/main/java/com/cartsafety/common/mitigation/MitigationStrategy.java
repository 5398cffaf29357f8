package com.cartsafety.common.mitigation;

import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * A risk-mitigation intervention with its published relative risk.
 *
 * <p>{@code pathways} names the biological mechanisms the intervention acts on; two
 * strategies sharing a pathway are expected to have an explicit correlation entry.
 */
public record MitigationStrategy(
    @JsonProperty("id")                  String id,
    @JsonProperty("name")                String name,
    @JsonProperty("mechanism")           String mechanism,
    @JsonProperty("targetAdverseEvents") Set<AdverseEventType> targetAdverseEvents,
    @JsonProperty("relativeRisk")        double relativeRisk,
    @JsonProperty("ciLow")               double ciLow,
    @JsonProperty("ciHigh")              double ciHigh,
    @JsonProperty("evidenceLevel")       EvidenceLevel evidenceLevel,
    @JsonProperty("pathways")            Set<String> pathways
) {

    private static final String COMPONENT = "MitigationCatalogue";

    public MitigationStrategy {
        InputValidationException.require(id != null && !id.isBlank(), COMPONENT, "strategy id is required");
        InputValidationException.require(targetAdverseEvents != null && !targetAdverseEvents.isEmpty(),
            COMPONENT, "strategy " + id + " must target at least one adverse-event type");
        InputValidationException.require(Double.isFinite(relativeRisk) && relativeRisk > 0.0, COMPONENT,
            "strategy " + id + " relative risk must be positive, got " + relativeRisk);
        InputValidationException.require(ciLow > 0.0 && ciLow <= relativeRisk && relativeRisk <= ciHigh
                && Double.isFinite(ciHigh), COMPONENT,
            String.format("strategy %s CI (%s, %s) must be positive and bracket RR %s",
                id, ciLow, ciHigh, relativeRisk));
        InputValidationException.require(evidenceLevel != null, COMPONENT,
            "strategy " + id + " evidence level is required");
        targetAdverseEvents = Collections.unmodifiableSet(EnumSet.copyOf(targetAdverseEvents));
        pathways = pathways == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(pathways));
        name = name == null ? id : name;
    }

    /** True when the CI does not exclude a risk increase. */
    @JsonProperty("uncertainBenefit")
    public boolean uncertainBenefit() {
        return ciHigh >= 1.0;
    }

    public boolean targets(AdverseEventType type) {
        return targetAdverseEvents.contains(type);
    }

    /** Log-scale standard error implied by a 95% CI. */
    public double logStandardError() {
        return (Math.log(ciHigh) - Math.log(ciLow)) / (2.0 * 1.96);
    }
}
