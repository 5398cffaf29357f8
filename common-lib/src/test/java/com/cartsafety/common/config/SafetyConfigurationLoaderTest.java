package com.cartsafety.common.config;

import com.cartsafety.common.exception.DataInconsistencyException;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.signal.SignalThresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loading and validation of versioned safety configuration documents.
 */
class SafetyConfigurationLoaderTest {

    private final SafetyConfigurationLoader loader = new SafetyConfigurationLoader();

    private SafetyConfiguration load(String fixture) {
        InputStream in = getClass().getClassLoader().getResourceAsStream("config/" + fixture);
        assertNotNull(in, fixture);
        return loader.load(in, fixture);
    }

    @Test
    @DisplayName("bundled configuration loads with all five priors and a version")
    void bundledDefault() {
        SafetyConfiguration config = loader.loadDefault();

        assertEquals("2026.10-default", config.version());
        assertEquals(AdverseEventType.values().length, config.priors().size());
        assertEquals(0.21, config.prior(AdverseEventType.CRS).alpha(), 0.0);
        assertEquals(0.15, config.clinicalThreshold(AdverseEventType.CRS).orElseThrow(), 0.0);
        assertEquals(5, config.mitigations().strategies().size());
        assertTrue(config.mitigations().strategy("lymphodepletion-modification").uncertainBenefit());
        assertEquals(0.5, config.mitigations().correlations().rho("tocilizumab", "corticosteroids"), 0.0);
        assertEquals(10, config.targetEvents().size());
    }

    @Test
    @DisplayName("products resolve by brand or generic name, case-insensitively")
    void productLookup() {
        SafetyConfiguration config = loader.loadDefault();

        assertEquals("YESCARTA", config.product("axicabtagene ciloleucel").orElseThrow().brand());
        assertEquals(LocalDate.of(2022, 2, 28), config.product("Carvykti").orElseThrow().approvalDate());
        assertEquals("BCMA bispecific", config.product("TECVAYLI").orElseThrow().productClass());
        assertTrue(config.product("NOT-A-PRODUCT").isEmpty());
    }

    @Test
    @DisplayName("minimal document: defaults for omitted sections, missing prior rejected")
    void minimal() {
        SafetyConfiguration config = load("minimal-config.json");

        assertEquals("test-1", config.version());
        assertEquals(SignalThresholds.DEFAULT, config.signalThresholds());
        assertTrue(config.clinicalThreshold(AdverseEventType.CRS).isEmpty());
        assertThrows(InputValidationException.class, () -> config.prior(AdverseEventType.HLH));
    }

    @Test
    @DisplayName("duplicate JSON key → DataInconsistencyException")
    void duplicateKey() {
        assertThrows(DataInconsistencyException.class, () -> load("duplicate-key.json"));
    }

    @Test
    @DisplayName("unknown property → DataInconsistencyException")
    void unknownField() {
        assertThrows(DataInconsistencyException.class, () -> load("unknown-field.json"));
    }

    @Test
    @DisplayName("correlation outside [0, 1] → InputValidationException")
    void rhoOutOfRange() {
        InputValidationException e = assertThrows(InputValidationException.class, () -> load("rho-out-of-range.json"));
        assertEquals("CorrelationMatrix", e.getComponent());
    }

    @Test
    @DisplayName("non-positive prior parameter → InputValidationException, not a parse error")
    void negativePrior() {
        assertThrows(InputValidationException.class, () -> load("negative-prior.json"));
    }
}
