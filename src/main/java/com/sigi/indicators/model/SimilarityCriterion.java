package com.sigi.indicators.model;

import com.sigi.indicators.exception.InvalidRequestException;

/**
 * Key used to group formulas recurring across tenders.
 */
public enum SimilarityCriterion {

    HASH("hash"),
    NORMALIZED_FORMULA("formula");

    private final String param;

    SimilarityCriterion(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static SimilarityCriterion fromParam(String value) {
        for (SimilarityCriterion c : values()) {
            if (c.param.equals(value)) {
                return c;
            }
        }
        throw new InvalidRequestException("Critério inválido: '" + value + "'. Use 'hash' ou 'formula'.");
    }
}
