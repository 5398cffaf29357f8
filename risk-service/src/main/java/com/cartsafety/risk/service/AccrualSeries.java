package com.cartsafety.risk.service;

import com.cartsafety.common.evidence.AccrualObservation;
import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.registry.ObservationPool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns per-study cumulative readouts into one programme-level cumulative series.
 *
 * <p>At each distinct timepoint the series holds the sum, over studies, of each study's
 * latest readout at or before that timepoint. A study that has not reported yet
 * contributes nothing.
 */
final class AccrualSeries {

    private final List<AccrualObservation> readouts;
    private final int studies;

    private AccrualSeries(List<AccrualObservation> readouts, int studies) {
        this.readouts = readouts;
        this.studies = studies;
    }

    static AccrualSeries of(AdverseEventType type, List<AdverseEventObservation> observations) {
        // validates monotonicity and presence of the type
        int studies = ObservationPool.of(type, observations).studies();

        Map<String, List<AdverseEventObservation>> byStudy = new LinkedHashMap<>();
        TreeSet<Integer> timepoints = new TreeSet<>();
        for (AdverseEventObservation obs : observations) {
            if (obs.adverseEventType() == type) {
                byStudy.computeIfAbsent(obs.studyId(), k -> new ArrayList<>()).add(obs);
                timepoints.add(obs.timepoint());
            }
        }

        List<AccrualObservation> readouts = new ArrayList<>(timepoints.size());
        for (int t : timepoints) {
            int events = 0;
            int n = 0;
            for (List<AdverseEventObservation> study : byStudy.values()) {
                AdverseEventObservation latest = null;
                for (AdverseEventObservation obs : study) {
                    if (obs.timepoint() <= t && (latest == null || obs.timepoint() > latest.timepoint())) {
                        latest = obs;
                    }
                }
                if (latest != null) {
                    events += latest.events();
                    n += latest.n();
                }
            }
            readouts.add(new AccrualObservation(String.valueOf(t), events, n));
        }
        return new AccrualSeries(List.copyOf(readouts), studies);
    }

    List<AccrualObservation> readouts() {
        return readouts;
    }

    int studies() {
        return studies;
    }
}
