package com.sigi.indicators.service;

import com.sigi.indicators.entity.*;
import com.sigi.indicators.model.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns loaded entity graphs into response records. Must be called inside the
 * transaction that loaded the entities, since child collections are lazy.
 */
@Component
public class IndicatorViewMapper {

    public MunicipalityView toView(Municipality municipality) {
        return new MunicipalityView(
                municipality.getId(),
                municipality.getName(),
                municipality.getStateCode(),
                municipality.getTenderId(),
                municipality.getTenderYear(),
                municipality.getIndicators().stream().map(i -> toView(i, true)).toList());
    }

    /** Same shape as the import document: no database ids anywhere. */
    public MunicipalityView toExport(Municipality municipality) {
        return new MunicipalityView(
                null,
                municipality.getName(),
                municipality.getStateCode(),
                municipality.getTenderId(),
                municipality.getTenderYear(),
                municipality.getIndicators().stream().map(i -> toView(i, false)).toList());
    }

    /** Scalar fields only, for shallow updates. */
    public MunicipalityView toSummary(Municipality municipality) {
        return new MunicipalityView(
                municipality.getId(),
                municipality.getName(),
                municipality.getStateCode(),
                municipality.getTenderId(),
                municipality.getTenderYear(),
                List.of());
    }

    public IndicatorView toView(Indicator indicator, boolean withId) {
        return new IndicatorView(
                withId ? indicator.getId() : null,
                indicator.getName(),
                indicator.getDescription(),
                indicator.getUnit(),
                copy(indicator.getTags()),
                copy(indicator.getObservations()),
                copy(indicator.getInconsistencies()),
                toView(indicator.getFormula()),
                subIndicators(indicator),
                conditions(indicator));
    }

    public EquivalentIndicator toEquivalent(Municipality municipality, Indicator indicator) {
        return new EquivalentIndicator(
                indicator.getId(),
                municipality.getName(),
                municipality.getStateCode(),
                indicator.getName(),
                indicator.getDescription(),
                indicator.getUnit(),
                copy(indicator.getTags()),
                copy(indicator.getObservations()),
                copy(indicator.getInconsistencies()),
                toView(indicator.getFormula()),
                subIndicators(indicator),
                conditions(indicator));
    }

    public SimilarIndicator toSimilar(Formula formula) {
        Indicator indicator = formula.getIndicator();
        Municipality municipality = indicator.getMunicipality();
        return new SimilarIndicator(
                indicator.getId(),
                indicator.getName(),
                indicator.getDescription(),
                municipality.getName(),
                municipality.getStateCode(),
                toView(formula));
    }

    public FormulaView toView(Formula formula) {
        if (formula == null) return null;
        return new FormulaView(formula.getRawText(), formula.getNormalizedText(), formula.getHash());
    }

    private List<SubIndicatorView> subIndicators(Indicator indicator) {
        return indicator.getSubIndicators().stream()
                .map(s -> new SubIndicatorView(s.getName(), s.getDescription()))
                .toList();
    }

    private List<ConditionView> conditions(Indicator indicator) {
        return indicator.getConditions().stream()
                .map(c -> new ConditionView(c.getRule(), c.getScore()))
                .toList();
    }

    // Detach from the Hibernate-managed list
    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : new ArrayList<>(values);
    }
}
