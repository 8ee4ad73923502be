package com.sigi.indicators.model;

import com.sigi.indicators.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparisonCriterionTest {

    @Test
    void singleParameter_selectsItsKind() {
        assertThat(ComparisonCriterion.of("Disponibilidade", null, null))
                .isEqualTo(new ComparisonCriterion(ComparisonCriterion.Kind.NAME, "Disponibilidade"));
        assertThat(ComparisonCriterion.of(null, "d=pf/pt", null).kind())
                .isEqualTo(ComparisonCriterion.Kind.NORMALIZED_FORMULA);
        assertThat(ComparisonCriterion.of(null, null, "abc").kind())
                .isEqualTo(ComparisonCriterion.Kind.HASH);
    }

    @Test
    void noParameter_isRejected() {
        assertThatThrownBy(() -> ComparisonCriterion.of(null, null, null))
                .isInstanceOfSatisfying(InvalidRequestException.class,
                        e -> assertThat(e.getBody().getDetail()).startsWith("Informe um critério"));
    }

    @Test
    void moreThanOneParameter_isRejected() {
        assertThatThrownBy(() -> ComparisonCriterion.of("a", null, "b"))
                .isInstanceOfSatisfying(InvalidRequestException.class,
                        e -> assertThat(e.getBody().getDetail()).contains("apenas um critério"));
        assertThatThrownBy(() -> ComparisonCriterion.of("a", "b", "c"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void similarityCriterion_acceptsOnlyKnownParams() {
        assertThat(SimilarityCriterion.fromParam("hash")).isEqualTo(SimilarityCriterion.HASH);
        assertThat(SimilarityCriterion.fromParam("formula")).isEqualTo(SimilarityCriterion.NORMALIZED_FORMULA);
        assertThatThrownBy(() -> SimilarityCriterion.fromParam("HASH"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> SimilarityCriterion.fromParam(null))
                .isInstanceOf(InvalidRequestException.class);
    }
}
