package com.sigi.indicators.service;

import com.sigi.indicators.entity.Formula;
import com.sigi.indicators.entity.Indicator;
import com.sigi.indicators.entity.Municipality;
import com.sigi.indicators.model.ComparisonCriterion;
import com.sigi.indicators.model.EquivalentIndicator;
import com.sigi.indicators.model.SimilarIndicator;
import com.sigi.indicators.model.SimilarityCriterion;
import com.sigi.indicators.repository.FormulaRepository;
import com.sigi.indicators.repository.MunicipalityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds indicators that are equivalent across municipalities.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class IndicatorMatcherService {

    private final MunicipalityRepository municipalityRepo;
    private final FormulaRepository formulaRepo;
    private final IndicatorViewMapper mapper;

    public IndicatorMatcherService(MunicipalityRepository municipalityRepo,
                                   FormulaRepository formulaRepo,
                                   IndicatorViewMapper mapper) {
        this.municipalityRepo = municipalityRepo;
        this.formulaRepo = formulaRepo;
        this.mapper = mapper;
    }

    /**
     * Scans every indicator of every municipality and returns those matching the
     * criterion. An empty list means nothing matched.
     */
    public List<EquivalentIndicator> findEquivalent(ComparisonCriterion criterion) {
        List<EquivalentIndicator> matches = new ArrayList<>();
        int scanned = 0;

        for (Municipality municipality : municipalityRepo.findAllByOrderByIdAsc()) {
            for (Indicator indicator : municipality.getIndicators()) {
                scanned++;
                if (matches(criterion, indicator)) {
                    matches.add(mapper.toEquivalent(municipality, indicator));
                }
            }
        }

        log.debug("Compared {} indicators by {}: {} matches", scanned, criterion.kind(), matches.size());
        return matches;
    }

    /**
     * Groups formulas sharing the same hash or normalized text. Keys held by a single
     * formula and null keys are left out.
     */
    public Map<String, List<SimilarIndicator>> findSimilarGroups(SimilarityCriterion criterion) {
        List<Formula> formulas;
        Function<Formula, String> key;

        if (criterion == SimilarityCriterion.HASH) {
            formulas = formulaRepo.findWithSharedHash();
            key = Formula::getHash;
        } else {
            formulas = formulaRepo.findWithSharedNormalizedText();
            key = Formula::getNormalizedText;
        }

        Map<String, List<SimilarIndicator>> groups = formulas.stream()
                .collect(Collectors.groupingBy(
                        key,
                        LinkedHashMap::new,
                        Collectors.mapping(mapper::toSimilar, Collectors.toList())));

        log.debug("Found {} groups of similar formulas by {}", groups.size(), criterion.param());
        return groups;
    }

    static boolean matches(ComparisonCriterion criterion, Indicator indicator) {
        String value = criterion.value();
        if (value == null || value.isBlank()) {
            return false;
        }
        Formula formula = indicator.getFormula();

        return switch (criterion.kind()) {
            case NAME -> indicator.getName() != null
                    && containsEitherWay(canonical(indicator.getName()), canonical(value));
            case NORMALIZED_FORMULA -> formula != null
                    && formula.getNormalizedText() != null
                    && canonical(value).equals(canonical(formula.getNormalizedText()));
            case HASH -> formula != null && value.equals(formula.getHash());
        };
    }

    // Either side containing the other counts as a match
    private static boolean containsEitherWay(String name, String query) {
        return name.contains(query) || query.contains(name);
    }

    private static String canonical(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
