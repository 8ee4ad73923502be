package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Indicator matched by a comparison, annotated with the municipality it belongs to.
 */
public record EquivalentIndicator(
        @JsonProperty("id") Long id,
        @JsonProperty("municipio") String municipality,
        @JsonProperty("uf") String stateCode,
        @JsonProperty("nome_indicador") String name,
        @JsonProperty("descricao") String description,
        @JsonProperty("unidade") String unit,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("observacoes") List<String> observations,
        @JsonProperty("inconsistencias") List<String> inconsistencies,
        @JsonProperty("formula") FormulaView formula,
        @JsonProperty("subindicadores") List<SubIndicatorView> subIndicators,
        @JsonProperty("condicoes") List<ConditionView> conditions
) {}
