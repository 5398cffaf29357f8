package com.cartsafety.risk.service;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.config.SafetyConfigurationLoader;
import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.evidence.StoppingBoundaryStep;
import com.cartsafety.common.exception.InputValidationException;
import com.cartsafety.common.model.AdverseEventObservation;
import com.cartsafety.common.model.AdverseEventType;
import com.cartsafety.common.registry.EstimationMethod;
import com.cartsafety.common.registry.HeterogeneityPolicy;
import com.cartsafety.common.registry.ModelRegistry;
import com.cartsafety.risk.config.RiskDefaults;
import com.cartsafety.risk.logger.RiskFlowLogger;
import com.cartsafety.risk.model.AccrualQuery;
import com.cartsafety.risk.model.PredictiveQuery;
import com.cartsafety.risk.model.RiskQuery;
import com.cartsafety.risk.model.StoppingBoundaryQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskEstimationServiceTest {

    private static final SafetyConfiguration CONFIG = new SafetyConfigurationLoader().loadDefault();

    private static final List<AdverseEventObservation> ZERO_OF_47 = List.of(
        AdverseEventObservation.of("SLE-1", AdverseEventType.CRS, 1, 0, 47),
        AdverseEventObservation.of("SLE-1", AdverseEventType.ICANS, 1, 3, 47));

    private final EvidenceEngine engine = new EvidenceEngine();
    private final RiskEstimationService service = new RiskEstimationService(
        CONFIG, ModelRegistry.withDefaults(engine), engine,
        new RiskDefaults(HeterogeneityPolicy.ANNOTATE, 0.5, 10_000, 0.8, 1000),
        new RiskFlowLogger());

    private static RiskQuery query(AdverseEventType type, EstimationMethod method,
                                   List<AdverseEventObservation> observations) {
        return new RiskQuery(type, method, null, observations, null, null, null, null, null, null, null);
    }

    @Nested
    @DisplayName("estimate / compare")
    class EstimateTests {

        @Test
        @DisplayName("0/47 CRS with the configured prior → posterior mean 0.21/48.5, version echoed")
        void zeroEvents() {
            StepVerifier.create(service.estimate(query(AdverseEventType.CRS,
                    EstimationMethod.BAYESIAN_BETA_BINOMIAL, ZERO_OF_47)))
                .assertNext(response -> {
                    assertEquals(CONFIG.version(), response.configVersion());
                    assertEquals(0.21 / 48.5, response.result().point(), 1e-12);
                    assertEquals(0, response.result().events());
                    assertNotNull(response.computedAt());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("missing method → InputValidationException")
        void missingMethod() {
            StepVerifier.create(service.estimate(query(AdverseEventType.CRS, null, ZERO_OF_47)))
                .expectError(InputValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("compare runs every model and reports the ones lacking inputs")
        void compareAll() {
            StepVerifier.create(service.compare(query(AdverseEventType.CRS, null, ZERO_OF_47)))
                .assertNext(response -> {
                    assertEquals(7, response.result().results().size() + response.result().errors().size());
                    assertTrue(response.result().errors().containsKey(EstimationMethod.KAPLAN_MEIER));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("heterogeneity policy from the request overrides the service default")
        void policyOverride() {
            List<AdverseEventObservation> mixed = List.of(
                new AdverseEventObservation("A", AdverseEventType.CRS, 1, 3, 30, "CD19 CAR-T"),
                new AdverseEventObservation("B", AdverseEventType.CRS, 1, 5, 28, "BCMA CAR-T"));
            RiskQuery reject = new RiskQuery(AdverseEventType.CRS, EstimationMethod.RANDOM_EFFECTS_META, null,
                mixed, null, null, null, null, null, null, HeterogeneityPolicy.REJECT_MIXED_CLASSES);

            StepVerifier.create(service.estimate(reject))
                .expectError(InputValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("models lists all seven estimators")
        void models() {
            StepVerifier.create(service.models())
                .assertNext(response -> assertEquals(7, response.result().size()))
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("accrual / stopping boundary / predictive")
    class EvidenceTests {

        @Test
        @DisplayName("accrual sums studies per timepoint and appends the projection")
        void accrual() {
            AccrualQuery query = new AccrualQuery(AdverseEventType.CRS, List.of(
                AdverseEventObservation.of("A", AdverseEventType.CRS, 1, 0, 10),
                AdverseEventObservation.of("A", AdverseEventType.CRS, 2, 1, 25),
                AdverseEventObservation.of("B", AdverseEventType.CRS, 2, 0, 20)), 20, null);

            StepVerifier.create(service.accrual(query))
                .assertNext(response -> {
                    var points = response.result().points();
                    assertEquals(3, points.size());
                    assertEquals(45, points.get(1).n());
                    assertTrue(points.get(2).projected());
                    assertEquals(65, points.get(2).n());
                    assertEquals(2, response.result().studies());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("stopping boundary falls back to the configured clinical threshold")
        void configuredThreshold() {
            StepVerifier.create(service.stoppingBoundary(
                    new StoppingBoundaryQuery(AdverseEventType.CRS, 50, null, null)))
                .assertNext(response -> {
                    assertEquals(0.15, response.result().clinicalThreshold(), 0.0);
                    assertEquals("configuration", response.result().thresholdSource());
                    assertEquals(0.8, response.result().probabilityBound(), 0.0);
                    List<StoppingBoundaryStep> steps = response.result().steps();
                    assertEquals(50, steps.size());
                    for (int i = 1; i < steps.size(); i++) {
                        assertTrue(steps.get(i).maxTolerableEvents() >= steps.get(i - 1).maxTolerableEvents());
                    }
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("maxN above the service limit rejected")
        void maxNLimit() {
            StepVerifier.create(service.stoppingBoundary(
                    new StoppingBoundaryQuery(AdverseEventType.CRS, 5000, 0.1, 0.8)))
                .expectError(InputValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("predictive distribution for the next cohort sums to one")
        void predictive() {
            StepVerifier.create(service.predictive(new PredictiveQuery(AdverseEventType.ICANS, ZERO_OF_47, 30, null)))
                .assertNext(response -> {
                    double total = 0.0;
                    for (double p : response.result().predictive().pmf()) {
                        total += p;
                    }
                    assertEquals(1.0, total, 1e-9);
                    assertEquals(3, response.result().posterior().events());
                })
                .verifyComplete();
        }
    }
}
