package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"status", "mensagem", "municipio", "uf", "edital", "ano_edital", "total_indicadores"})
public record ImportSummary(
        @JsonProperty("status") String status,
        @JsonProperty("mensagem") String message,
        @JsonProperty("municipio") String municipality,
        @JsonProperty("uf") String stateCode,
        @JsonProperty("edital") String tenderId,
        @JsonProperty("ano_edital") Integer tenderYear,
        @JsonProperty("total_indicadores") int totalIndicators
) {}
