package com.cartsafety.signal.controller;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.config.SafetyConfigurationLoader;
import com.cartsafety.common.trace.TraceContextUtil;
import com.cartsafety.signal.cache.ReportCountCache;
import com.cartsafety.signal.client.ReportCountSource;
import com.cartsafety.signal.client.ReportSourceException;
import com.cartsafety.signal.config.SignalDefaults;
import com.cartsafety.signal.logger.SignalFlowLogger;
import com.cartsafety.signal.model.RecentApprovalPolicy;
import com.cartsafety.signal.ratelimit.RequestBudget;
import com.cartsafety.signal.service.ContingencyTableFetcher;
import com.cartsafety.signal.service.ReportCountGateway;
import com.cartsafety.signal.service.SignalDetectionService;
import com.cartsafety.signal.service.SignalPanelService;
import com.cartsafety.signal.web.TraceIdWebFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;

class SignalControllerTest {

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        InputStream in = getClass().getClassLoader().getResourceAsStream("config/signal-test-config.json");
        SafetyConfiguration config = new SafetyConfigurationLoader().load(in, "signal-test-config.json");

        ReportCountSource unreachable = query -> Mono.error(new ReportSourceException("connection refused"));
        ReportCountGateway gateway = new ReportCountGateway(unreachable,
            new ReportCountCache(Duration.ofHours(1), 100, Clock.systemUTC()),
            new RequestBudget(100, Duration.ofMinutes(1)), 0, Duration.ofMillis(1));
        SignalFlowLogger flowLogger = new SignalFlowLogger();
        SignalDetectionService detection = new SignalDetectionService(config, new ContingencyTableFetcher(gateway),
            new SignalDefaults(Duration.ofSeconds(5), RecentApprovalPolicy.ANNOTATE, 24, "unreachable"),
            Clock.systemUTC(), flowLogger);

        client = WebTestClient
            .bindToController(new SignalController(detection, new SignalPanelService(config, detection, flowLogger),
                config))
            .controllerAdvice(new ErrorHandler())
            .webFilter(new TraceIdWebFilter())
            .build();
    }

    private WebTestClient.ResponseSpec post(String uri, String body) {
        return client.post().uri(uri)
            .contentType(MediaType.APPLICATION_JSON)
            .header(TraceContextUtil.TRACE_ID_HEADER, "trace-sig")
            .bodyValue(body)
            .exchange();
    }

    @Test
    @DisplayName("POST /detect with the source down → 200 UNAVAILABLE, not an error")
    void detectUnavailable() {
        post("/api/v1/signals/detect", """
            {"drug":"KYMRIAH","event":"Cytokine release syndrome"}
            """)
            .expectStatus().isOk()
            .expectHeader().valueEquals(TraceContextUtil.TRACE_ID_HEADER, "trace-sig")
            .expectBody()
            .jsonPath("$.configVersion").isEqualTo("signal-test-1")
            .jsonPath("$.result.status").isEqualTo("UNAVAILABLE")
            .jsonPath("$.result.unavailableReason").isEqualTo("SOURCE_ERROR")
            .jsonPath("$.result.signal").isEqualTo(false);
    }

    @Test
    @DisplayName("POST /evaluate → PRR and tier without touching the source")
    void evaluate() {
        post("/api/v1/signals/evaluate", """
            {"a":10,"b":990,"c":40,"d":98920}
            """)
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.result.tier").isEqualTo("STRONG")
            .jsonPath("$.result.prr").exists();
    }

    @Test
    @DisplayName("negative cell → 400 INVALID_INPUT from ContingencyTable")
    void negativeCell() {
        post("/api/v1/signals/evaluate", """
            {"a":-1,"b":990,"c":40,"d":98920}
            """)
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("INVALID_INPUT")
            .jsonPath("$.component").isEqualTo("ContingencyTable")
            .jsonPath("$.traceId").isEqualTo("trace-sig");
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        client.get().uri("/api/v1/signals/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
