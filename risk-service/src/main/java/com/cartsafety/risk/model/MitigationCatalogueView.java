package com.cartsafety.risk.model;

import com.cartsafety.common.mitigation.CorrelationEntry;
import com.cartsafety.common.mitigation.MitigationStrategy;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MitigationCatalogueView(
    @JsonProperty("strategies")   List<MitigationStrategy> strategies,
    @JsonProperty("correlations") List<CorrelationEntry> correlations
) {}
