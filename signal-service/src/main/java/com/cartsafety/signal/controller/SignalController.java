package com.cartsafety.signal.controller;

import com.cartsafety.common.config.SafetyConfiguration;
import com.cartsafety.common.signal.DisproportionalityMetrics;
import com.cartsafety.signal.model.EvaluateTableRequest;
import com.cartsafety.signal.model.PanelRequest;
import com.cartsafety.signal.model.SafetyResponse;
import com.cartsafety.signal.model.SignalPanel;
import com.cartsafety.signal.model.SignalRequest;
import com.cartsafety.signal.model.SignalResult;
import com.cartsafety.signal.service.SignalDetectionService;
import com.cartsafety.signal.service.SignalPanelService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/signals")
public class SignalController {

    private final SignalDetectionService detectionService;
    private final SignalPanelService panelService;
    private final SafetyConfiguration configuration;

    public SignalController(SignalDetectionService detectionService,
                            SignalPanelService panelService,
                            SafetyConfiguration configuration) {
        this.detectionService = detectionService;
        this.panelService = panelService;
        this.configuration = configuration;
    }

    /** Always 200 once the input is valid; an unreachable source is reported in the body. */
    @PostMapping("/detect")
    public Mono<ResponseEntity<SafetyResponse<SignalResult>>> detect(@RequestBody SignalRequest request) {
        return detectionService.detectSignal(request.drug(), request.event(), request.asOf(),
                request.approvalDate(), timeout(request.timeoutMs()))
            .map(this::wrap)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/panel")
    public Mono<ResponseEntity<SafetyResponse<SignalPanel>>> panel(@RequestBody PanelRequest request) {
        return panelService.panel(request.products(), request.asOf(), timeout(request.timeoutMs()))
            .map(this::wrap)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<SafetyResponse<DisproportionalityMetrics>>> evaluate(
            @RequestBody EvaluateTableRequest request) {
        return detectionService.evaluateTable(request)
            .map(this::wrap)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> SafetyResponse<T> wrap(T result) {
        return SafetyResponse.of(configuration.version(), result);
    }

    private static Duration timeout(Long timeoutMs) {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
