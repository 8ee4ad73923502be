package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FormulaView(
        @JsonProperty("bruta") String rawText,
        @JsonProperty("normalizada") String normalizedText,
        @JsonProperty("hash") String hash
) {}
