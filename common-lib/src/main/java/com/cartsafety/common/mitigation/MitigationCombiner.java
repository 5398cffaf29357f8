package com.cartsafety.common.mitigation;

import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.model.PosteriorEstimate;
import com.cartsafety.common.registry.ObservationPool;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Combines the relative risks of several mitigations on one adverse-event type.
 *
 * <h3>Pairwise rule</h3>
 * <pre>
 *   RR_ab = (RR_a * RR_b)^(1 - rho) * min(RR_a, RR_b)^rho
 * </pre>
 * rho = 0 gives the independent product, rho = 1 the stronger single effect.
 *
 * <h3>More than two strategies</h3>
 * Greedy: merge the most-correlated remaining pair, replace it with the merged group,
 * repeat. The correlation between two groups is the largest correlation between any of
 * their members. The merge order is fixed from the point estimates and replayed for
 * every Monte Carlo draw.
 *
 * <h3>Uncertainty</h3>
 * Each draw samples the baseline rate from the target type's Beta posterior and each
 * RR from a lognormal whose log-scale SE is implied by its 95% CI.
 */
public final class MitigationCombiner {

    private static final Logger log = LoggerFactory.getLogger(MitigationCombiner.class);

    private static final String COMPONENT = "MitigationCombiner";

    public static final int MIN_SAMPLES = 100;
    public static final int MAX_SAMPLES = 1_000_000;

    private final EvidenceEngine engine;

    public MitigationCombiner(EvidenceEngine engine) {
        this.engine = engine;
    }

    public static double combinePair(double rrA, double rrB, double rho) {
        InputValidationException.require(rrA > 0.0 && rrB > 0.0, COMPONENT,
            "relative risks must be positive, got " + rrA + " and " + rrB);
        InputValidationException.require(rho >= 0.0 && rho <= 1.0, COMPONENT,
            "rho must be in [0, 1], got " + rho);
        return FastMath.pow(rrA * rrB, 1.0 - rho) * FastMath.pow(Math.min(rrA, rrB), rho);
    }

    public MitigationResult combine(MitigationRequest request, MitigationCatalogue catalogue) {
        InputValidationException.require(request.targetAdverseEvent() != null, COMPONENT,
            "targetAdverseEvent is required");
        InputValidationException.require(request.prior() != null, COMPONENT,
            "a baseline prior is required for " + request.targetAdverseEvent());
        InputValidationException.require(!request.strategyIds().isEmpty(), COMPONENT,
            "at least one strategy must be selected");
        InputValidationException.require(request.samples() >= MIN_SAMPLES && request.samples() <= MAX_SAMPLES,
            COMPONENT, "samples must be in [" + MIN_SAMPLES + ", " + MAX_SAMPLES + "], got " + request.samples());
        InputValidationException.require(request.level() > 0.0 && request.level() < 1.0, COMPONENT,
            "level must be in (0, 1), got " + request.level());

        Set<String> seen = new LinkedHashSet<>();
        for (String id : request.strategyIds()) {
            InputValidationException.require(seen.add(id), COMPONENT, "strategy " + id + " selected twice");
        }

        List<MitigationStrategy> confirmed = new ArrayList<>();
        List<MitigationStrategy> uncertain = new ArrayList<>();
        List<String> notApplicable = new ArrayList<>();
        for (String id : request.strategyIds()) {
            MitigationStrategy strategy = catalogue.strategy(id);
            if (!strategy.targets(request.targetAdverseEvent())) {
                notApplicable.add(id);
            } else if (strategy.uncertainBenefit()) {
                uncertain.add(strategy);
            } else {
                confirmed.add(strategy);
            }
        }

        Diagnostics.Builder diagnostics = Diagnostics.builder();
        CorrelationMatrix matrix = catalogue.correlations();
        List<MitigationStrategy> applicable = new ArrayList<>(confirmed);
        applicable.addAll(uncertain);
        flagSharedPathways(applicable, matrix, diagnostics);
        if (!notApplicable.isEmpty()) {
            diagnostics.warning("strategies not targeting " + request.targetAdverseEvent() + " ignored: " + notApplicable);
        }
        for (MitigationStrategy s : uncertain) {
            diagnostics.warning(String.format(
                "uncertain benefit: %s CI (%.2f, %.2f) includes 1.0; excluded from the primary combined RR",
                s.id(), s.ciLow(), s.ciHigh()));
        }
        if (confirmed.isEmpty()) {
            diagnostics.warning("no strategy of confirmed benefit targets " + request.targetAdverseEvent()
                + "; combined RR is 1.0");
        }

        PosteriorEstimate baseline = baseline(request, diagnostics);

        MergePlan plan = MergePlan.of(ids(confirmed), matrix);
        List<PairCorrection> corrections = new ArrayList<>();
        double combinedRr = plan.replay(pointRrs(confirmed), corrections);

        Double includingUncertain = null;
        if (!uncertain.isEmpty()) {
            includingUncertain = MergePlan.of(ids(applicable), matrix).replay(pointRrs(applicable), null);
        }

        long seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextLong();
        RandomGenerator rng = new Well19937c(seed);
        BetaDistribution baselineDistribution = new BetaDistribution(rng, baseline.alpha(), baseline.beta());
        double[] logMeans = new double[confirmed.size()];
        double[] logSes = new double[confirmed.size()];
        for (int k = 0; k < confirmed.size(); k++) {
            logMeans[k] = FastMath.log(confirmed.get(k).relativeRisk());
            logSes[k] = confirmed.get(k).logStandardError();
        }

        DescriptiveStatistics risks = new DescriptiveStatistics(request.samples());
        DescriptiveStatistics rrs = new DescriptiveStatistics(request.samples());
        double[] draw = new double[confirmed.size()];
        int truncated = 0;
        for (int s = 0; s < request.samples(); s++) {
            double base = baselineDistribution.sample();
            for (int k = 0; k < draw.length; k++) {
                draw[k] = FastMath.exp(logMeans[k] + logSes[k] * rng.nextGaussian());
            }
            double rr = plan.replay(draw, null);
            double risk = base * rr;
            if (risk > 1.0) {
                truncated++;
                risk = 1.0;
            }
            risks.addValue(risk);
            rrs.addValue(rr);
        }
        if (truncated > 0) {
            diagnostics.warning(truncated + " of " + request.samples() + " draws exceeded risk 1.0 and were capped");
        }

        double lowerPct = 50.0 * (1.0 - request.level());
        double upperPct = 100.0 - lowerPct;
        String label = "monte-carlo-" + request.samples();
        diagnostics.detail("seed", seed)
            .detail("samples", request.samples())
            .detail("baselineAlpha", baseline.alpha())
            .detail("baselineBeta", baseline.beta())
            .detail("combinationOrder", "greedy most-correlated pair first")
            .detail("mitigatedRiskMean", risks.getMean());

        log.debug("MITIGATION_COMBINED target={} applied={} combinedRr={} seed={}",
            request.targetAdverseEvent(), ids(confirmed), combinedRr, seed);

        return new MitigationResult(
            request.targetAdverseEvent(),
            ids(confirmed),
            notApplicable,
            ids(uncertain),
            baseline.mean(),
            baseline.interval(),
            combinedRr,
            new Interval(rrs.getPercentile(lowerPct), rrs.getPercentile(upperPct), request.level(), label),
            includingUncertain,
            corrections,
            baseline.mean() * combinedRr,
            new Interval(risks.getPercentile(lowerPct), risks.getPercentile(upperPct), request.level(), label),
            risks.getPercentile(50.0),
            request.samples(),
            seed,
            diagnostics.build());
    }

    private PosteriorEstimate baseline(MitigationRequest request, Diagnostics.Builder diagnostics) {
        boolean observed = request.observations().stream()
            .map(AdverseEventObservation::adverseEventType)
            .anyMatch(t -> t == request.targetAdverseEvent());
        if (!observed) {
            diagnostics.warning("no observations for " + request.targetAdverseEvent() + "; baseline is the prior alone");
            return engine.posterior(request.prior(), 0, 0, request.level());
        }
        ObservationPool pool = ObservationPool.of(request.targetAdverseEvent(), request.observations());
        diagnostics.detail("baselineEvents", pool.events()).detail("baselinePatients", pool.patients());
        PosteriorEstimate posterior = engine.posterior(request.prior(), pool.events(), pool.patients(), request.level());
        if (posterior.approximated()) {
            diagnostics.approximation("baseline interval from " + posterior.interval().method());
        }
        return posterior;
    }

    private static void flagSharedPathways(List<MitigationStrategy> strategies, CorrelationMatrix matrix,
                                           Diagnostics.Builder diagnostics) {
        for (int i = 0; i < strategies.size(); i++) {
            for (int j = i + 1; j < strategies.size(); j++) {
                MitigationStrategy a = strategies.get(i);
                MitigationStrategy b = strategies.get(j);
                Set<String> shared = new LinkedHashSet<>(a.pathways());
                shared.retainAll(b.pathways());
                if (!shared.isEmpty() && !matrix.isExplicit(a.id(), b.id())) {
                    diagnostics.warning(String.format(
                        "%s and %s share pathway(s) %s but have no correlation entry; independence assumed",
                        a.id(), b.id(), shared));
                }
            }
        }
    }

    private static List<String> ids(List<MitigationStrategy> strategies) {
        return strategies.stream().map(MitigationStrategy::id).toList();
    }

    private static double[] pointRrs(List<MitigationStrategy> strategies) {
        return strategies.stream().mapToDouble(MitigationStrategy::relativeRisk).toArray();
    }

    /**
     * Greedy merge order over strategy ids. Indices refer to the working list at each
     * step; merged groups are appended at the end.
     */
    static final class MergePlan {

        private record Step(int first, int second, double rho, String rhoSource) {}

        private final List<String> labels;
        private final List<Step> steps;

        private MergePlan(List<String> labels, List<Step> steps) {
            this.labels = labels;
            this.steps = steps;
        }

        static MergePlan of(List<String> ids, CorrelationMatrix matrix) {
            List<List<String>> groups = new ArrayList<>();
            for (String id : ids) {
                groups.add(List.of(id));
            }
            List<Step> steps = new ArrayList<>();
            while (groups.size() > 1) {
                int bestI = 0;
                int bestJ = 1;
                double bestRho = groupRho(groups.get(0), groups.get(1), matrix);
                for (int i = 0; i < groups.size(); i++) {
                    for (int j = i + 1; j < groups.size(); j++) {
                        double rho = groupRho(groups.get(i), groups.get(j), matrix);
                        if (rho > bestRho) {
                            bestI = i;
                            bestJ = j;
                            bestRho = rho;
                        }
                    }
                }
                boolean explicit = anyExplicit(groups.get(bestI), groups.get(bestJ), matrix);
                steps.add(new Step(bestI, bestJ, bestRho, explicit ? "explicit" : "independence-default"));
                List<String> merged = new ArrayList<>(groups.get(bestI));
                merged.addAll(groups.get(bestJ));
                groups.remove(bestJ);
                groups.remove(bestI);
                groups.add(merged);
            }
            return new MergePlan(List.copyOf(ids), steps);
        }

        /**
         * Applies the merge order to {@code rrs} (parallel to the planned ids). When
         * {@code corrections} is non-null every step is recorded in it.
         */
        double replay(double[] rrs, List<PairCorrection> corrections) {
            if (rrs.length == 0) {
                return 1.0;
            }
            List<Double> values = new ArrayList<>(rrs.length);
            List<String> names = new ArrayList<>(rrs.length);
            for (int k = 0; k < rrs.length; k++) {
                values.add(rrs[k]);
                names.add(labels.get(k));
            }
            for (Step step : steps) {
                double a = values.get(step.first());
                double b = values.get(step.second());
                double combined = combinePair(a, b, step.rho());
                String nameA = names.get(step.first());
                String nameB = names.get(step.second());
                if (corrections != null) {
                    corrections.add(new PairCorrection(nameA, nameB, step.rho(), step.rhoSource(),
                        a, b, a * b, combined));
                }
                values.remove(step.second());
                values.remove(step.first());
                names.remove(step.second());
                names.remove(step.first());
                values.add(combined);
                names.add(nameA + "+" + nameB);
            }
            return values.get(0);
        }

        private static double groupRho(List<String> a, List<String> b, CorrelationMatrix matrix) {
            double max = 0.0;
            for (String x : a) {
                for (String y : b) {
                    max = Math.max(max, matrix.rho(x, y));
                }
            }
            return max;
        }

        private static boolean anyExplicit(List<String> a, List<String> b, CorrelationMatrix matrix) {
            for (String x : a) {
                for (String y : b) {
                    if (matrix.isExplicit(x, y)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
