package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A municipality with its nested indicator set. Export documents leave {@code id} out.
 */
@JsonPropertyOrder({"id", "municipio", "uf", "edital", "ano_edital", "indicadores"})
public record MunicipalityView(
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("id") Long id,
        @JsonProperty("municipio") String name,
        @JsonProperty("uf") String stateCode,
        @JsonProperty("edital") String tenderId,
        @JsonProperty("ano_edital") Integer tenderYear,
        @JsonProperty("indicadores") List<IndicatorView> indicators
) {}
