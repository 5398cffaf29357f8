package com.cartsafety.common.registry.estimator;

import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.Diagnostics;
import com.cartsafety.common.model.Interval;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.EstimationRequest;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.OnsetRecord;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.common.registry.RiskEstimator;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Product-limit cumulative incidence of onset by a time horizon, with Greenwood variance
 * and a log(-log) interval on survival.
 *
 * <p>Records are sorted once; the at-risk count is decremented by the events and
 * censorings at each distinct time, so the scan is linear after the sort.
 */
public final class KaplanMeierEstimator implements RiskEstimator {

    private static final ModelDescriptor DESCRIPTOR = new ModelDescriptor(
        EstimationMethod.KAPLAN_MEIER.id(),
        "Kaplan-Meier Cumulative Incidence",
        "Non-parametric time-to-event estimator using the product-limit formula with Greenwood variance",
        List.of("time_to_event", "censored_data", "onset_timing"),
        List.of("onsetRecords", "timeHorizon (optional)"));

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    @Override
    public EstimationMethod method() {
        return EstimationMethod.KAPLAN_MEIER;
    }

    @Override
    public ModelDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public RiskEstimate estimate(EstimationRequest request) {
        List<OnsetRecord> records = new ArrayList<>(request.onsetRecords());
        InputValidationException.require(!records.isEmpty(), "KaplanMeier",
            "at least one onset record is required");
        records.sort(Comparator.comparingDouble(OnsetRecord::time));

        int total = records.size();
        double horizon = request.timeHorizon() != null
            ? request.timeHorizon()
            : records.get(total - 1).time();
        InputValidationException.require(Double.isFinite(horizon) && horizon >= 0.0, "KaplanMeier",
            "time horizon must be finite and non-negative, got " + horizon);

        int atRisk = total;
        int totalEvents = 0;
        double survival = 1.0;
        double greenwood = 0.0;
        double survivalAtHorizon = 1.0;
        double greenwoodAtHorizon = 0.0;
        Double median = null;
        List<Map<String, Object>> eventTable = new ArrayList<>();

        int i = 0;
        while (i < total) {
            double t = records.get(i).time();
            int deaths = 0;
            int censored = 0;
            while (i < total && records.get(i).time() == t) {
                if (records.get(i).event()) {
                    deaths++;
                } else {
                    censored++;
                }
                i++;
            }
            if (deaths > 0) {
                survival *= 1.0 - (double) deaths / atRisk;
                if (atRisk > deaths) {
                    greenwood += (double) deaths / ((double) atRisk * (atRisk - deaths));
                }
                totalEvents += deaths;
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("time", t);
                row.put("atRisk", atRisk);
                row.put("events", deaths);
                row.put("survival", survival);
                eventTable.add(row);
                if (median == null && survival <= 0.5) {
                    median = t;
                }
                if (t <= horizon) {
                    survivalAtHorizon = survival;
                    greenwoodAtHorizon = greenwood;
                }
            }
            atRisk -= deaths + censored;
        }

        double incidence = 1.0 - survivalAtHorizon;
        double greenwoodSe = survivalAtHorizon * FastMath.sqrt(greenwoodAtHorizon);
        Diagnostics.Builder diagnostics = Diagnostics.builder()
            .detail("timeHorizon", horizon)
            .detail("medianOnsetTime", median)
            .detail("censored", total - totalEvents)
            .detail("greenwoodSe", greenwoodSe)
            .detail("eventTable", eventTable);

        Interval interval;
        if (survivalAtHorizon >= 1.0) {
            diagnostics.warning("no events by the horizon; interval is degenerate at 0");
            interval = new Interval(0.0, 0.0, request.level(), "kaplan-meier-degenerate");
        } else if (survivalAtHorizon <= 0.0) {
            diagnostics.warning("every patient at risk had onset by the horizon; interval is degenerate at 1");
            interval = new Interval(1.0, 1.0, request.level(), "kaplan-meier-degenerate");
        } else {
            double z = STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - request.level()) / 2.0);
            double logSurvival = FastMath.log(survivalAtHorizon);
            double seLogLog = FastMath.sqrt(greenwoodAtHorizon) / Math.abs(logSurvival);
            double survivalLow = FastMath.pow(survivalAtHorizon, FastMath.exp(z * seLogLog));
            double survivalHigh = FastMath.pow(survivalAtHorizon, FastMath.exp(-z * seLogLog));
            interval = new Interval(1.0 - survivalHigh, 1.0 - survivalLow, request.level(),
                "kaplan-meier-greenwood-loglog");
        }

        return new RiskEstimate(method(), DESCRIPTOR.name(), request.adverseEventType(),
            incidence, interval, total, totalEvents, 1, diagnostics.build());
    }
}
