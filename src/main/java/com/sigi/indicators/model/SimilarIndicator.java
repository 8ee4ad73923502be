package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SimilarIndicator(
        @JsonProperty("id") Long id,
        @JsonProperty("nome_indicador") String name,
        @JsonProperty("descricao") String description,
        @JsonProperty("municipio") String municipality,
        @JsonProperty("uf") String stateCode,
        @JsonProperty("formula") FormulaView formula
) {}
