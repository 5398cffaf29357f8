package com.cartsafety.risk.controller;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.config.SafetyConfigurationLoader;
import com.cartsafety.common.evidence.EvidenceEngine;
import com.cartsafety.common.mitigation.MitigationCombiner;
import com.cartsafety.common.registry.HeterogeneityPolicy;
import com.cartsafety.common.registry.ModelRegistry;
import com.cartsafety.common.trace.TraceContextUtil;
import com.cartsafety.risk.config.RiskDefaults;
import com.cartsafety.risk.logger.RiskFlowLogger;
import com.cartsafety.risk.service.MitigationService;
import com.cartsafety.risk.service.RiskEstimationService;
import com.cartsafety.risk.web.TraceIdWebFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

class RiskControllerTest {

    private static final SafetyConfiguration CONFIG = new SafetyConfigurationLoader().loadDefault();

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        EvidenceEngine engine = new EvidenceEngine();
        RiskDefaults defaults = new RiskDefaults(HeterogeneityPolicy.ANNOTATE, 0.5, 500, 0.8, 1000);
        RiskFlowLogger flowLogger = new RiskFlowLogger();
        RiskEstimationService riskService = new RiskEstimationService(
            CONFIG, ModelRegistry.withDefaults(engine), engine, defaults, flowLogger);
        MitigationService mitigationService = new MitigationService(
            CONFIG, new MitigationCombiner(engine), defaults, flowLogger);

        client = WebTestClient
            .bindToController(new RiskController(riskService), new MitigationController(mitigationService))
            .controllerAdvice(new ErrorHandler())
            .webFilter(new TraceIdWebFilter())
            .build();
    }

    private WebTestClient.ResponseSpec post(String uri, String body) {
        return client.post().uri(uri)
            .contentType(MediaType.APPLICATION_JSON)
            .header(TraceContextUtil.TRACE_ID_HEADER, "trace-123")
            .bodyValue(body)
            .exchange();
    }

    @Test
    @DisplayName("POST /estimate → 200 with config version and echoed trace id")
    void estimate() {
        post("/api/v1/risk/estimate", """
            {"adverseEventType":"CRS","method":"bayesian_beta_binomial",
             "observations":[{"studyId":"SLE-1","adverseEventType":"CRS","timepoint":1,"events":0,"n":47}]}
            """)
            .expectStatus().isOk()
            .expectHeader().valueEquals(TraceContextUtil.TRACE_ID_HEADER, "trace-123")
            .expectBody()
            .jsonPath("$.configVersion").isEqualTo(CONFIG.version())
            .jsonPath("$.result.method").isEqualTo("bayesian_beta_binomial")
            .jsonPath("$.result.events").isEqualTo(0)
            .jsonPath("$.result.patients").isEqualTo(47);
    }

    @Test
    @DisplayName("events exceeding n → 400 INVALID_INPUT naming the component")
    void eventsExceedN() {
        post("/api/v1/risk/estimate", """
            {"adverseEventType":"CRS","method":"wilson_score",
             "observations":[{"studyId":"SLE-1","adverseEventType":"CRS","timepoint":1,"events":9,"n":4}]}
            """)
            .expectStatus().isBadRequest()
            .expectHeader().valueEquals(TraceContextUtil.TRACE_ID_HEADER, "trace-123")
            .expectBody()
            .jsonPath("$.code").isEqualTo("INVALID_INPUT")
            .jsonPath("$.component").isEqualTo("Observation")
            .jsonPath("$.traceId").isEqualTo("trace-123");
    }

    @Test
    @DisplayName("unknown model id → 400 INVALID_INPUT")
    void unknownModel() {
        post("/api/v1/risk/estimate", """
            {"adverseEventType":"CRS","method":"bootstrap","observations":[]}
            """)
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("INVALID_INPUT")
            .jsonPath("$.component").isEqualTo("ModelRegistry");
    }

    @Test
    @DisplayName("decreasing cumulative counts → 422 DATA_INCONSISTENCY")
    void decreasingCounts() {
        post("/api/v1/risk/estimate", """
            {"adverseEventType":"CRS","method":"bayesian_beta_binomial",
             "observations":[
               {"studyId":"A","adverseEventType":"CRS","timepoint":1,"events":5,"n":20},
               {"studyId":"A","adverseEventType":"CRS","timepoint":2,"events":3,"n":25}]}
            """)
            .expectStatus().isEqualTo(422)
            .expectBody()
            .jsonPath("$.code").isEqualTo("DATA_INCONSISTENCY");
    }

    @Test
    @DisplayName("GET /models lists seven estimators")
    void models() {
        client.get().uri("/api/v1/risk/models")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.result.length()").isEqualTo(7);
    }

    @Test
    @DisplayName("POST /mitigations/combine → 200 with reported seed")
    void combine() {
        post("/api/v1/mitigations/combine", """
            {"strategyIds":["tocilizumab","anakinra"],"targetAdverseEvent":"CRS","seed":5,
             "observations":[{"studyId":"SLE-1","adverseEventType":"CRS","timepoint":1,"events":10,"n":50}]}
            """)
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.result.seed").isEqualTo(5)
            .jsonPath("$.result.applied.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("health → OK")
    void health() {
        client.get().uri("/api/v1/risk/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
