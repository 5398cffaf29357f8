package com.cartsafety.signal.service;

import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.signal.SignalTier;
import com.cartsafety.signal.client.ReportQuery;
import com.cartsafety.signal.logger.SignalFlowLogger;
import com.cartsafety.signal.model.SignalResult;
import com.cartsafety.signal.model.SignalStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static com.cartsafety.signal.service.SignalFixtures.CRS;
import static com.cartsafety.signal.service.SignalFixtures.NEURO;
import static org.junit.jupiter.api.Assertions.*;

class SignalPanelServiceTest {

    private static StubReportSource panelSource() {
        return SignalFixtures.kymriah(new StubReportSource())
            .drug("CARVYKTI", 500)
            .cases("CARVYKTI", CRS, 8)
            .failing(ReportQuery.cases("CARVYKTI", NEURO, null));
    }

    private static SignalPanelService panelService(StubReportSource source) {
        return new SignalPanelService(SignalFixtures.CONFIG, SignalFixtures.detection(source), new SignalFlowLogger());
    }

    @Test
    @DisplayName("all products x events → signals first, then PRR descending, unavailable last")
    void ordering() {
        StepVerifier.create(panelService(panelSource()).panel(null, null, null))
            .assertNext(panel -> {
                assertEquals(List.of("KYMRIAH", "CARVYKTI"), panel.products());
                assertEquals(4, panel.pairsEvaluated());
                assertEquals(2, panel.signalsDetected());
                assertEquals(2, panel.strongSignals());
                assertEquals(1, panel.unavailable());

                List<SignalResult> results = panel.results();
                assertTrue(results.get(0).isSignal());
                assertTrue(results.get(1).isSignal());
                assertTrue(results.get(0).prr() >= results.get(1).prr());
                assertEquals("CARVYKTI", results.get(0).product());
                assertEquals(SignalTier.NONE, results.get(2).tier());
                assertEquals(SignalStatus.UNAVAILABLE, results.get(3).status());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("fewer than five scored pairs → published default prior, flagged")
    void defaultPrior() {
        StepVerifier.create(panelService(panelSource()).panel(null, null, null))
            .assertNext(panel -> {
                assertFalse(panel.mgpsPrior().fitted());
                assertTrue(panel.diagnostics().degraded());
                assertEquals(3, panel.diagnostics().details().get("mgpsPairs"));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("generic name selects its product; unknown names are skipped with a warning")
    void selection() {
        StepVerifier.create(panelService(panelSource()).panel(List.of("tisagenlecleucel", "NOT-A-PRODUCT"), null, null))
            .assertNext(panel -> {
                assertEquals(List.of("KYMRIAH"), panel.products());
                assertEquals(2, panel.pairsEvaluated());
                assertTrue(panel.diagnostics().warnings().stream().anyMatch(w -> w.contains("NOT-A-PRODUCT")));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("no configured product among the names → InputValidationException")
    void noneKnown() {
        StepVerifier.create(panelService(panelSource()).panel(List.of("NOT-A-PRODUCT"), null, null))
            .expectError(InputValidationException.class)
            .verify();
    }
}
