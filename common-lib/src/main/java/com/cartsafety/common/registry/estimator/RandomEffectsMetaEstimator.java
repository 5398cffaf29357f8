package com.cartsafety.common.registry.estimator;

import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.HeterogeneityPolicy;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.ObservationPool;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.common.registry.RiskEstimator;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * DerSimonian-Laird random-effects pooling on the Freeman-Tukey double-arcsine scale.
 *
 * <pre>
 *   y_i = asin(sqrt(x_i / (n_i + 1))) + asin(sqrt((x_i + 1) / (n_i + 1)))
 *   v_i = 1 / (n_i + 0.5)
 *   Q   = sum w_i (y_i - y_FE)^2,    tau^2 = max(0, (Q - (k - 1)) / C)
 *   I^2 = max(0, (Q - (k - 1)) / Q)
 *   p   = sin^2(t / 2),  t clipped to [0, pi]
 * </pre>
 *
 * A single study reduces to its own Clopper-Pearson interval.
 */
public final class RandomEffectsMetaEstimator implements RiskEstimator {

    private static final String COMPONENT = "RandomEffectsMeta";

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.RANDOM_EFFECTS_META.id(),
        "DerSimonian-Laird Random Effects",
        "Random-effects meta-analysis pooling across studies with between-study heterogeneity via DerSimonian-Laird",
        List.of("meta_analysis", "multi_study", "heterogeneity"),
        List.of("observations (one or more studies)"));

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private final ClopperPearsonEstimator singleStudy;

    public RandomEffectsMetaEstimator(ClopperPearsonEstimator singleStudy) {
        this.singleStudy = singleStudy;
    }

    @Override
    public EstimationMethod method() {
        return EstimationMethod.RANDOM_EFFECTS_META;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        ObservationPool pool = ObservationPool.of(request.adverseEventType(), request.observations());
        List<AdverseEventObservation> studies = pool.latestPerStudy();
        Diagnostics.Builder diagnostics = Diagnostics.builder();
        applyHeterogeneityPolicy(request, studies, diagnostics);

        int k = studies.size();
        if (k == 1) {
            AdverseEventObservation only = studies.get(0);
            Interval exact = singleStudy.interval(only.events(), only.n(), request.level());
            diagnostics.detail("studies", k)
                .detail("studyLabels", List.of(only.studyId()))
                .warning("single study: Clopper-Pearson interval reported, heterogeneity not estimable");
            return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
                pool.rawRate(), exact, pool.patients(), pool.events(), 1, diagnostics.build());
        }

        double[] y = new double[k];
        double[] w = new double[k];
        List<String> labels = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            AdverseEventObservation s = studies.get(i);
            y[i] = FastMath.asin(FastMath.sqrt(s.events() / (s.n() + 1.0)))
                + FastMath.asin(FastMath.sqrt((s.events() + 1.0) / (s.n() + 1.0)));
            w[i] = s.n() + 0.5;
            labels.add(s.studyId());
        }

        double wSum = 0.0;
        double wSquaredSum = 0.0;
        double weightedY = 0.0;
        for (int i = 0; i < k; i++) {
            wSum += w[i];
            wSquaredSum += w[i] * w[i];
            weightedY += w[i] * y[i];
        }
        double thetaFixed = weightedY / wSum;

        double q = 0.0;
        for (int i = 0; i < k; i++) {
            q += w[i] * (y[i] - thetaFixed) * (y[i] - thetaFixed);
        }
        double c = wSum - wSquaredSum / wSum;
        double tau2 = c > 0.0 ? Math.max(0.0, (q - (k - 1)) / c) : 0.0;
        double i2 = q > 0.0 ? Math.max(0.0, (q - (k - 1)) / q) : 0.0;

        double[] wRandom = new double[k];
        double wRandomSum = 0.0;
        double thetaNumerator = 0.0;
        for (int i = 0; i < k; i++) {
            wRandom[i] = 1.0 / (1.0 / w[i] + tau2);
            wRandomSum += wRandom[i];
            thetaNumerator += wRandom[i] * y[i];
        }
        double theta = thetaNumerator / wRandomSum;
        double se = FastMath.sqrt(1.0 / wRandomSum);
        double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - request.level()) / 2.0);

        List<Double> weights = new ArrayList<>(k);
        for (double wr : wRandom) {
            weights.add(wr / wRandomSum);
        }

        double lowT = theta - z * se;
        double highT = theta + z * se;
        if (lowT < 0.0 || highT > Math.PI) {
            diagnostics.warning(String.format(
                "double-arcsine interval [%.4f, %.4f] clipped to [0, pi] before back-transform", lowT, highT));
        }

        diagnostics.detail("studies", k)
            .detail("cochranQ", q)
            .detail("tauSquared", tau2)
            .detail("iSquared", i2)
            .detail("studyLabels", labels)
            .detail("studyWeights", weights)
            .detail("transformation", "Freeman-Tukey double arcsine");
        if (i2 >= request.heterogeneityThreshold()) {
            diagnostics.warning(String.format(
                "high between-study heterogeneity: I2=%.2f (threshold %.2f)", i2, request.heterogeneityThreshold()));
        }

        Interval interval = new Interval(backTransform(lowT), backTransform(highT), request.level(),
            "dersimonian-laird-freeman-tukey");
        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            backTransform(theta), interval, pool.patients(), pool.events(), k, diagnostics.build());
    }

    private static void applyHeterogeneityPolicy(EstimationRequest request,
                                                 List<AdverseEventObservation> studies,
                                                 Diagnostics.Builder diagnostics) {
        Set<String> classes = new TreeSet<>();
        studies.stream().map(AdverseEventObservation::productClass).filter(Objects::nonNull).forEach(classes::add);
        diagnostics.detail("heterogeneityPolicy", request.heterogeneityPolicy().name());
        if (!classes.isEmpty()) {
            diagnostics.detail("productClasses", List.copyOf(classes));
        }
        if (classes.size() > 1) {
            if (request.heterogeneityPolicy() == HeterogeneityPolicy.REJECT_MIXED_CLASSES) {
                throw new InputValidationException(COMPONENT,
                    "refusing to pool mixed product classes " + classes + " under REJECT_MIXED_CLASSES");
            }
            diagnostics.warning("pooling clinically heterogeneous product classes " + classes);
        }
    }

    private static double backTransform(double t) {
        double clipped = Math.max(0.0, Math.min(Math.PI, t));
        double s = FastMath.sin(clipped / 2.0);
        return s * s;
    }
}
