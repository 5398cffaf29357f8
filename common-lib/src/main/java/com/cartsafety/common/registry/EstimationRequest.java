package com.cartsafety.common.registry;

import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.PriorSpecification;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything any estimator may consume. Estimators read only the fields they need and
 * reject the request when one of those is missing.
 *
 * <ul>
 *   <li>{@code observations}: cumulative study readouts; may span several adverse-event
 *       types (empirical Bayes borrows across them, the others filter to the target)</li>
 *   <li>{@code prior}: resolved by the caller from the versioned configuration</li>
 *   <li>{@code futureCohortSize}: predictive posterior only</li>
 *   <li>{@code onsetRecords} / {@code timeHorizon}: Kaplan-Meier only</li>
 *   <li>{@code shrinkageWeightOverride}: empirical Bayes manual weight on the grand mean</li>
 * </ul>
 */
public record EstimationRequest(
    AdverseEventType adverseEventType,
    List<AdverseEventObservation> observations,
    PriorSpecification prior,
    double level,
    Integer futureCohortSize,
    List<OnsetRecord> onsetRecords,
    Double timeHorizon,
    Double shrinkageWeightOverride,
    boolean continuityCorrection,
    HeterogeneityPolicy heterogeneityPolicy,
    double heterogeneityThreshold
) {

    public static final double DEFAULT_LEVEL = 0.95;
    public static final double DEFAULT_I2_THRESHOLD = 0.5;

    public EstimationRequest {
        observations = observations == null ? List.of() : List.copyOf(observations);
        onsetRecords = onsetRecords == null ? List.of() : List.copyOf(onsetRecords);
        heterogeneityPolicy = heterogeneityPolicy == null ? HeterogeneityPolicy.ANNOTATE : heterogeneityPolicy;
    }

    public static Builder builder(AdverseEventType adverseEventType) {
        return new Builder(adverseEventType);
    }

    public Builder toBuilder() {
        return new Builder(adverseEventType)
            .observations(observations)
            .prior(prior)
            .level(level)
            .futureCohortSize(futureCohortSize)
            .onsetRecords(onsetRecords)
            .timeHorizon(timeHorizon)
            .shrinkageWeightOverride(shrinkageWeightOverride)
            .continuityCorrection(continuityCorrection)
            .heterogeneity(heterogeneityPolicy, heterogeneityThreshold);
    }

    public static final class Builder {
        private final AdverseEventType adverseEventType;
        private final List<AdverseEventObservation> observations = new ArrayList<>();
        private PriorSpecification prior;
        private double level = DEFAULT_LEVEL;
        private Integer futureCohortSize;
        private final List<OnsetRecord> onsetRecords = new ArrayList<>();
        private Double timeHorizon;
        private Double shrinkageWeightOverride;
        private boolean continuityCorrection;
        private HeterogeneityPolicy heterogeneityPolicy = HeterogeneityPolicy.ANNOTATE;
        private double heterogeneityThreshold = DEFAULT_I2_THRESHOLD;

        private Builder(AdverseEventType adverseEventType) {
            this.adverseEventType = adverseEventType;
        }

        public Builder observation(AdverseEventObservation observation) {
            observations.add(observation);
            return this;
        }

        public Builder observations(List<AdverseEventObservation> values) {
            observations.addAll(values);
            return this;
        }

        public Builder prior(PriorSpecification value) {
            this.prior = value;
            return this;
        }

        public Builder level(double value) {
            this.level = value;
            return this;
        }

        public Builder futureCohortSize(Integer value) {
            this.futureCohortSize = value;
            return this;
        }

        public Builder onset(double time, boolean event) {
            onsetRecords.add(new OnsetRecord(time, event));
            return this;
        }

        public Builder onsetRecords(List<OnsetRecord> values) {
            onsetRecords.addAll(values);
            return this;
        }

        public Builder timeHorizon(Double value) {
            this.timeHorizon = value;
            return this;
        }

        public Builder shrinkageWeightOverride(Double value) {
            this.shrinkageWeightOverride = value;
            return this;
        }

        public Builder continuityCorrection(boolean value) {
            this.continuityCorrection = value;
            return this;
        }

        public Builder heterogeneity(HeterogeneityPolicy policy, double i2Threshold) {
            this.heterogeneityPolicy = policy;
            this.heterogeneityThreshold = i2Threshold;
            return this;
        }

        public EstimationRequest build() {
            return new EstimationRequest(adverseEventType, observations, prior, level, futureCohortSize,
                onsetRecords, timeHorizon, shrinkageWeightOverride, continuityCorrection,
                heterogeneityPolicy, heterogeneityThreshold);
        }
    }
}
