package com.cartsafety.risk.controller;

import com.cartsafety.common.registry.ModelComparison;
import com.cartsafety.common.registry.ModelDescriptor;
import com.cartsafety.common.registry.RiskEstimate;
import com.cartsafety.risk.model.AccrualQuery;
import com.cartsafety.risk.model.AccrualResult;
import com.cartsafety.risk.model.PredictiveQuery;
import com.cartsafety.risk.model.PredictiveResult;
import com.cartsafety.risk.model.RiskQuery;
import com.cartsafety.risk.model.SafetyResponse;
import com.cartsafety.risk.model.StoppingBoundaryQuery;
import com.cartsafety.risk.model.StoppingRule;
import com.cartsafety.risk.service.RiskEstimationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/risk")
public class RiskController {

    private final RiskEstimationService riskService;

    public RiskController(RiskEstimationService riskService) {
        this.riskService = riskService;
    }

    @PostMapping("/estimate")
    public Mono<ResponseEntity<SafetyResponse<RiskEstimate>>> estimate(@RequestBody RiskQuery query) {
        return riskService.estimate(query).map(ResponseEntity::ok);
    }

    @PostMapping("/compare")
    public Mono<ResponseEntity<SafetyResponse<ModelComparison>>> compare(@RequestBody RiskQuery query) {
        return riskService.compare(query).map(ResponseEntity::ok);
    }

    @GetMapping("/models")
    public Mono<ResponseEntity<SafetyResponse<List<ModelDescriptor>>>> models() {
        return riskService.models().map(ResponseEntity::ok);
    }

    @PostMapping("/accrual")
    public Mono<ResponseEntity<SafetyResponse<AccrualResult>>> accrual(@RequestBody AccrualQuery query) {
        return riskService.accrual(query).map(ResponseEntity::ok);
    }

    @PostMapping("/stopping-boundary")
    public Mono<ResponseEntity<SafetyResponse<StoppingRule>>> stoppingBoundary(
            @RequestBody StoppingBoundaryQuery query) {
        return riskService.stoppingBoundary(query).map(ResponseEntity::ok);
    }

    @PostMapping("/predictive")
    public Mono<ResponseEntity<SafetyResponse<PredictiveResult>>> predictive(@RequestBody PredictiveQuery query) {
        return riskService.predictive(query).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
