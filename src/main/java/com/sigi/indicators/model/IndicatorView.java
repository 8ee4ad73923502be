package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Full indicator detail. The same shape is used by listings (with {@code id})
 * and by the export document (without it), so the export can be imported again.
 */
@JsonPropertyOrder({"id", "nome_indicador", "descricao", "unidade", "tags", "observacoes",
        "inconsistencias", "formula", "subindicadores", "condicoes"})
public record IndicatorView(
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("id") Long id,
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
