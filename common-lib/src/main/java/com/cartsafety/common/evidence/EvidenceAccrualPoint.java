package com.cartsafety.common.evidence;

import com.cartsafety.common.model.Interval;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Posterior summary at one timepoint of the accrual trajectory.
 *
 * <p>For projected points {@code events} is the expected cumulative count under the
 * current posterior mean and may be fractional.
 */
public record EvidenceAccrualPoint(
    @JsonProperty("timepoint") String timepoint,
    @JsonProperty("n")         int n,
    @JsonProperty("events")    double events,
    @JsonProperty("mean")      double mean,
    @JsonProperty("interval")  Interval interval,
    @JsonProperty("projected") boolean projected
) {

    @JsonProperty("intervalWidth")
    public double intervalWidth() {
        return interval.width();
    }
}
