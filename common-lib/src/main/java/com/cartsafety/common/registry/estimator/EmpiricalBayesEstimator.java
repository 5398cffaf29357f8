package com.cartsafety.common.registry.estimator;

import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.ObservationPool;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.common.registry.RiskEstimator;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.util.FastMath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shrinks the target type's raw rate toward the unweighted mean of all adverse-event
 * types present in the request.
 *
 * <pre>
 *   tau^2  = max(0, var(raw rates) - mean(v_i))         method of moments
 *   B      = v_target / (v_target + tau^2)              or the caller's override
 *   shrunk = (1 - B) * raw_target + B * grand_mean
 * </pre>
 *
 * Within-type variances use the smoothed rate (e + 0.5) / (n + 1), so a type with zero
 * events still has positive sampling variance and is not exempt from shrinkage.
 */
public final class EmpiricalBayesEstimator implements RiskEstimator {

    private static final String COMPONENT = "EmpiricalBayes";

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.EMPIRICAL_BAYES.id(),
        "Empirical Bayes Shrinkage",
        "Shrinkage estimator that borrows strength across AE types; stabilises estimates when some types have few events",
        List.of("multiple_ae_types", "small_sample", "borrowing_strength"),
        List.of("observations (several adverse-event types)"));

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    @Override
    public EstimationMethod method() {
        return EstimationMethod.EMPIRICAL_BAYES;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        Double override = request.shrinkageWeightOverride();
        if (override != null) {
            InputValidationException.require(Double.isFinite(override) && override >= 0.0 && override <= 1.0,
                COMPONENT, "shrinkage weight override must be in [0, 1], got " + override);
        }

        Map<AdverseEventType, ObservationPool> pools = ObservationPool.byType(request.observations());
        ObservationPool target = pools.get(request.adverseEventType());
        InputValidationException.require(target != null, COMPONENT,
            "target type " + request.adverseEventType() + " not present among " + pools.keySet());

        int k = pools.size();
        Map<String, Double> rawRates = new LinkedHashMap<>();
        double rateSum = 0.0;
        double withinSum = 0.0;
        for (ObservationPool pool : pools.values()) {
            rawRates.put(pool.type().name(), pool.rawRate());
            rateSum += pool.rawRate();
            withinSum += withinVariance(pool);
        }
        double grandMean = rateSum / k;

        double tau2 = 0.0;
        double varOfRates = 0.0;
        if (k > 1) {
            for (ObservationPool pool : pools.values()) {
                varOfRates += (pool.rawRate() - grandMean) * (pool.rawRate() - grandMean);
            }
            varOfRates /= (k - 1);
            tau2 = Math.max(0.0, varOfRates - withinSum / k);
        }

        double targetVar = withinVariance(target);
        double b = override != null ? override : targetVar / (targetVar + tau2);
        double shrunk = (1.0 - b) * target.rawRate() + b * grandMean;

        double varGrandMean = k > 1 ? varOfRates / k : targetVar;
        double shrunkSe = FastMath.sqrt((1.0 - b) * (1.0 - b) * targetVar + b * b * varGrandMean);
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - request.level()) / 2.0);

        Diagnostics.Builder diagnostics = Diagnostics.builder()
            .approximation("normal interval on the shrunken rate")
            .detail("rawRate", target.rawRate())
            .detail("grandMean", grandMean)
            .detail("shrinkageFactor", b)
            .detail("shrinkageSource", override != null ? "override" : "method-of-moments")
            .detail("tauSquared", tau2)
            .detail("adverseEventTypes", k)
            .detail("allRawRates", rawRates);
        if (k == 1) {
            diagnostics.warning("only one adverse-event type supplied; no strength borrowed");
        }

        double lower = shrunk - z * shrunkSe;
        double upper = shrunk + z * shrunkSe;
        if (lower < 0.0) {
            diagnostics.warning(String.format("normal lower bound %.6f truncated at 0", lower));
            lower = 0.0;
        }
        if (upper > 1.0) {
            diagnostics.warning(String.format("normal upper bound %.6f truncated at 1", upper));
            upper = 1.0;
        }

        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            shrunk, new Interval(lower, upper, request.level(), "empirical-bayes-normal"),
            target.patients(), target.events(), target.studies(), diagnostics.build());
    }

    private static double withinVariance(ObservationPool pool) {
        double smoothed = (pool.events() + 0.5) / (pool.patients() + 1.0);
        return smoothed * (1.0 - smoothed) / pool.patients();
    }
}
