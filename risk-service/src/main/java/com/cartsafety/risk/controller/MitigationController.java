package com.cartsafety.risk.controller;

import com.cartsafety.common.mitigation.MitigationResult;
import com.cartsafety.risk.model.MitigationCatalogueView;
import com.cartsafety.risk.model.MitigationQuery;
import com.cartsafety.risk.model.SafetyResponse;
import com.cartsafety.risk.service.MitigationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/mitigations")
public class MitigationController {

    private final MitigationService mitigationService;

    public MitigationController(MitigationService mitigationService) {
        this.mitigationService = mitigationService;
    }

    @PostMapping("/combine")
    public Mono<ResponseEntity<SafetyResponse<MitigationResult>>> combine(@RequestBody MitigationQuery query) {
        return mitigationService.combine(query).map(ResponseEntity::ok);
    }

    @GetMapping("/strategies")
    public Mono<ResponseEntity<SafetyResponse<MitigationCatalogueView>>> strategies() {
        return mitigationService.catalogue().map(ResponseEntity::ok);
    }
}
