package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MunicipalityIndicators(
        @JsonProperty("municipio") String municipality,
        @JsonProperty("uf") String stateCode,
        @JsonProperty("total_indicadores") int totalIndicators,
        @JsonProperty("indicadores") List<IndicatorView> indicators
) {}
