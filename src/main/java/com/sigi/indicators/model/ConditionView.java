package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConditionView(
        @JsonProperty("regra") String rule,
        @JsonProperty("nota") Double score
) {}
