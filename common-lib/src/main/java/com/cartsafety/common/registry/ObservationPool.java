package com.cartsafety.common.registry;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces cumulative study readouts of one adverse-event type to the latest readout per
 * study, after checking that each study's counts never decrease.
 *
 * <p>Totals are sums over the per-study latest readouts, so a pooled count can never
 * contain events that no constituent study reported.
 */
public final class ObservationPool {

    private static final String COMPONENT = "ModelRegistry";

    private final AdverseEventType type;
    private final List<AdverseEventObservation> latestPerStudy;
    private final int events;
    private final int patients;

    private ObservationPool(AdverseEventType type, List<AdverseEventObservation> latestPerStudy) {
        this.type = type;
        this.latestPerStudy = List.copyOf(latestPerStudy);
        long e = 0;
        long n = 0;
        for (AdverseEventObservation obs : latestPerStudy) {
            e += obs.events();
            n += obs.n();
        }
        if (n > Integer.MAX_VALUE) {
            throw new InputValidationException(COMPONENT, "pooled n overflows: " + n);
        }
        this.events = (int) e;
        this.patients = (int) n;
    }

    /**
     * @throws InputValidationException   if no observation of {@code type} is present
     * @throws DataInconsistencyException if a study repeats a timepoint or its cumulative counts decrease
     */
    public static ObservationPool of(AdverseEventType type, List<AdverseEventObservation> observations) {
        InputValidationException.require(type != null, COMPONENT, "adverseEventType is required");
        Map<String, List<AdverseEventObservation>> byStudy = new LinkedHashMap<>();
        for (AdverseEventObservation obs : observations) {
            if (obs.adverseEventType() == type) {
                byStudy.computeIfAbsent(obs.studyId(), k -> new ArrayList<>()).add(obs);
            }
        }
        InputValidationException.require(!byStudy.isEmpty(), COMPONENT,
            "no observations recorded for " + type);

        List<AdverseEventObservation> latest = new ArrayList<>(byStudy.size());
        for (Map.Entry<String, List<AdverseEventObservation>> entry : byStudy.entrySet()) {
            List<AdverseEventObservation> readouts = new ArrayList<>(entry.getValue());
            readouts.sort(Comparator.comparingInt(AdverseEventObservation::timepoint));
            AdverseEventObservation previous = null;
            for (AdverseEventObservation current : readouts) {
                if (previous != null) {
                    if (current.timepoint() == previous.timepoint()) {
                        throw new DataInconsistencyException(COMPONENT, String.format(
                            "study %s reports timepoint %d twice for %s",
                            entry.getKey(), current.timepoint(), type));
                    }
                    if (current.events() < previous.events() || current.n() < previous.n()) {
                        throw new DataInconsistencyException(COMPONENT, String.format(
                            "study %s cumulative counts decrease from %d/%d at t=%d to %d/%d at t=%d",
                            entry.getKey(), previous.events(), previous.n(), previous.timepoint(),
                            current.events(), current.n(), current.timepoint()));
                    }
                }
                previous = current;
            }
            latest.add(previous);
        }
        return new ObservationPool(type, latest);
    }

    /** Pool every adverse-event type present in {@code observations}, in enum order. */
    public static Map<AdverseEventType, ObservationPool> byType(List<AdverseEventObservation> observations) {
        Map<AdverseEventType, ObservationPool> pools = new LinkedHashMap<>();
        for (AdverseEventType type : AdverseEventType.values()) {
            boolean present = observations.stream().anyMatch(o -> o.adverseEventType() == type);
            if (present) {
                pools.put(type, of(type, observations));
            }
        }
        return pools;
    }

    public AdverseEventType type() {
        return type;
    }

    public List<AdverseEventObservation> latestPerStudy() {
        return latestPerStudy;
    }

    public int events() {
        return events;
    }

    public int patients() {
        return patients;
    }

    public int studies() {
        return latestPerStudy.size();
    }

    public double rawRate() {
        return (double) events / patients;
    }
}
