package com.cartsafety.risk.service;

import com.cartsafety.common.evidence.AccrualObservation;
import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccrualSeriesTest {

    @Test
    @DisplayName("studies reporting at different times are summed at their latest readout")
    void staggeredStudies() {
        AccrualSeries series = AccrualSeries.of(AdverseEventType.CRS, List.of(
            AdverseEventObservation.of("A", AdverseEventType.CRS, 1, 1, 10),
            AdverseEventObservation.of("A", AdverseEventType.CRS, 2, 2, 20),
            AdverseEventObservation.of("B", AdverseEventType.CRS, 2, 0, 15),
            AdverseEventObservation.of("B", AdverseEventType.CRS, 3, 1, 30),
            AdverseEventObservation.of("B", AdverseEventType.ICANS, 3, 9, 30)));

        assertEquals(2, series.studies());
        assertEquals(List.of(
            new AccrualObservation("1", 1, 10),
            new AccrualObservation("2", 2, 35),
            new AccrualObservation("3", 3, 50)), series.readouts());
    }

    @Test
    @DisplayName("decreasing counts within a study → DataInconsistencyException")
    void decreasing() {
        assertThrows(DataInconsistencyException.class, () -> AccrualSeries.of(AdverseEventType.CRS, List.of(
            AdverseEventObservation.of("A", AdverseEventType.CRS, 1, 4, 10),
            AdverseEventObservation.of("A", AdverseEventType.CRS, 2, 3, 20))));
    }
}
