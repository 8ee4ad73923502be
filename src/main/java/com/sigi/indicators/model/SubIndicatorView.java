package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubIndicatorView(
        @JsonProperty("nome") String name,
        @JsonProperty("descricao") String description
) {}
