package com.cartsafety.common.registry.estimator;

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

import java.util.List;

/**
 * Wilson score interval (Agresti and Coull 1998), optionally with Newcombe's continuity
 * correction. The point estimate is the raw proportion; the Wilson centre is reported
 * in the details.
 */
public final class WilsonScoreEstimator implements RiskEstimator {

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.WILSON_SCORE.id(),
        "Wilson Score Interval",
        "Wilson score CI with better coverage than Wald; recommended for small n and proportions near 0 or 1",
        List.of("small_sample", "routine_estimation", "near_boundary"),
        List.of("observations"));

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    @Override
    public EstimationMethod method() {
        return EstimationMethod.WILSON_SCORE;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        ObservationPool pool = ObservationPool.of(request.adverseEventType(), request.observations());
        int n = pool.patients();
        double p = pool.rawRate();
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - request.level()) / 2.0);
        double z2 = z * z;

        double denominator = 1.0 + z2 / n;
        double centre = (p + z2 / (2.0 * n)) / denominator;
        double margin = (z / denominator) * FastMath.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * n));
        if (request.continuityCorrection()) {
            margin += 1.0 / (2.0 * n * denominator);
        }

        Diagnostics.Builder diagnostics = Diagnostics.builder()
            .detail("zCritical", z)
            .detail("wilsonCentre", centre)
            .detail("continuityCorrection", request.continuityCorrection());

        double lower = centre - margin;
        double upper = centre + margin;
        // only the corrected interval can leave [0, 1] by more than rounding
        if (lower < -1e-12 || upper > 1.0 + 1e-12) {
            diagnostics.warning("continuity-corrected bounds truncated to [0, 1]");
        }
        lower = Math.max(0.0, lower);
        upper = Math.min(1.0, upper);

        String label = request.continuityCorrection() ? "wilson-score-cc" : "wilson-score";
        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            p, new Interval(lower, upper, request.level(), label),
            n, pool.events(), pool.studies(), diagnostics.build());
    }
}
