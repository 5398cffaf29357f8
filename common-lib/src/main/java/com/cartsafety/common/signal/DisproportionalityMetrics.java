package com.cartsafety.common.signal;

import com.cartsafety.common.model.Diagnostics;
import com.fasterxml.jackson.annotation.JsonProperty;

public record DisproportionalityMetrics(
    @JsonProperty("table")       ContingencyTable table,
    @JsonProperty("prr")         RatioEstimate prr,
    @JsonProperty("ror")         RatioEstimate ror,
    @JsonProperty("ebgm")        EbgmResult ebgm,
    @JsonProperty("tier")        SignalTier tier,
    @JsonProperty("diagnostics") Diagnostics diagnostics
) {}
