package com.sigi.indicators.model;

import com.sigi.indicators.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.List;

/**
 * Exactly one way of comparing indicators: by name fragment, by normalized
 * formula text, or by formula hash.
 */
public record ComparisonCriterion(Kind kind, String value) {

    public enum Kind { NAME, NORMALIZED_FORMULA, HASH }

    /**
     * Builds the criterion from the optional request parameters.
     *
     * @throws InvalidRequestException if none or more than one is supplied
     */
    public static ComparisonCriterion of(String name, String normalizedFormula, String hash) {
        List<ComparisonCriterion> supplied = new ArrayList<>();
        if (name != null) supplied.add(new ComparisonCriterion(Kind.NAME, name));
        if (normalizedFormula != null) supplied.add(new ComparisonCriterion(Kind.NORMALIZED_FORMULA, normalizedFormula));
        if (hash != null) supplied.add(new ComparisonCriterion(Kind.HASH, hash));

        if (supplied.isEmpty()) {
            throw new InvalidRequestException("Informe um critério de comparação (nome, fórmula ou hash).");
        }
        if (supplied.size() > 1) {
            throw new InvalidRequestException("Informe apenas um critério por vez (nome, fórmula ou hash).");
        }
        return supplied.get(0);
    }
}
