package com.sigi.indicators.service;

import com.sigi.indicators.entity.Formula;
import com.sigi.indicators.entity.Indicator;
import com.sigi.indicators.entity.Municipality;
import com.sigi.indicators.exception.InvalidRequestException;
import com.sigi.indicators.exception.ResourceNotFoundException;
import com.sigi.indicators.model.*;
import com.sigi.indicators.repository.IndicatorRepository;
import com.sigi.indicators.repository.MunicipalityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Listing, lookup, edits, deletion and export of stored indicator sets.
 */
@Service
@Slf4j
public class IndicatorCatalogService {

    private final MunicipalityRepository municipalityRepo;
    private final IndicatorRepository indicatorRepo;
    private final IndicatorViewMapper mapper;

    public IndicatorCatalogService(MunicipalityRepository municipalityRepo,
                                   IndicatorRepository indicatorRepo,
                                   IndicatorViewMapper mapper) {
        this.municipalityRepo = municipalityRepo;
        this.indicatorRepo = indicatorRepo;
        this.mapper = mapper;
    }

    // ─── QUERIES ───────────────────────────────────────────────────────

    /**
     * Lists the sets matching every supplied filter. Blank filters are ignored.
     *
     * @throws ResourceNotFoundException when nothing matches, instead of an empty list
     */
    @Transactional(readOnly = true)
    public List<MunicipalityView> list(String name, String stateCode, String tenderId, Integer tenderYear) {
        List<Municipality> found = municipalityRepo.search(
                blankToNull(name), blankToNull(stateCode), blankToNull(tenderId), tenderYear);

        if (found.isEmpty()) {
            Map<String, Object> filters = new LinkedHashMap<>();
            filters.put("municipio", name);
            filters.put("uf", stateCode);
            filters.put("edital", tenderId);
            filters.put("ano_edital", tenderYear);
            throw new ResourceNotFoundException(
                    "Nenhum conjunto de indicadores encontrado com os filtros fornecidos: " + filters);
        }
        return found.stream().map(mapper::toView).toList();
    }

    @Transactional(readOnly = true)
    public MunicipalityView get(Long id) {
        return mapper.toView(loadMunicipality(id));
    }

    /**
     * Indicators of the first municipality (lowest id) whose name contains the fragment,
     * ignoring case.
     */
    @Transactional(readOnly = true)
    public MunicipalityIndicators findByMunicipalityName(String fragment) {
        Municipality municipality = municipalityRepo.findFirstByNameContainingIgnoreCaseOrderByIdAsc(fragment)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Nenhum município encontrado contendo '" + fragment + "'."));

        List<IndicatorView> indicators = municipality.getIndicators().stream()
                .map(i -> mapper.toView(i, true))
                .toList();
        return new MunicipalityIndicators(
                municipality.getName(), municipality.getStateCode(), indicators.size(), indicators);
    }

    @Transactional(readOnly = true)
    public MunicipalityView export(Long id) {
        return mapper.toExport(loadMunicipality(id));
    }

    // ─── UPDATES ───────────────────────────────────────────────────────

    /**
     * Replaces the scalar fields of a municipality. Its indicators stay as they are.
     */
    @Transactional
    public OperationResult update(Long id, MunicipalityUpdateRequest request) {
        Municipality municipality = loadMunicipality(id);
        municipality.setName(request.name());
        municipality.setStateCode(request.stateCode());
        municipality.setTenderId(request.tenderId());
        municipality.setTenderYear(request.tenderYear());
        log.info("Updated municipality {} -> {}/{}", id, request.name(), request.stateCode());

        OperationResult result = OperationResult.success(
                "Conjunto de indicadores '" + municipality.getName() + "' (ID " + id + ") atualizado com sucesso.");
        result.setUpdatedData(mapper.toSummary(municipality));
        return result;
    }

    /**
     * Patches the supplied formula fields; null arguments leave the field untouched.
     */
    @Transactional
    public OperationResult patchFormula(Long indicatorId, String rawText, String normalizedText, String hash) {
        Indicator indicator = loadIndicator(indicatorId);
        Formula formula = indicator.getFormula();
        if (formula == null) {
            throw new InvalidRequestException(
                    "O indicador '" + indicator.getName() + "' não possui fórmula associada.");
        }

        checkLength("bruta", rawText, Formula.TEXT_LENGTH);
        checkLength("normalizada", normalizedText, Formula.TEXT_LENGTH);
        checkLength("hash", hash, Formula.HASH_LENGTH);

        if (rawText != null) formula.setRawText(rawText);
        if (normalizedText != null) formula.setNormalizedText(normalizedText);
        if (hash != null) formula.setHash(hash);
        log.info("Patched formula of indicator {}", indicatorId);

        return OperationResult.success(
                "Fórmula do indicador '" + indicator.getName() + "' (ID " + indicatorId + ") atualizada com sucesso.");
    }

    @Transactional
    public OperationResult replaceTags(Long indicatorId, List<String> tags) {
        Indicator indicator = loadIndicator(indicatorId);
        List<String> applied = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        indicator.setTags(applied);
        log.info("Replaced tags of indicator {} with {} entries", indicatorId, applied.size());

        OperationResult result = OperationResult.success(
                "Tags do indicador '" + indicator.getName() + "' (ID " + indicatorId + ") atualizadas com sucesso.");
        result.setAppliedTags(applied);
        return result;
    }

    // ─── DELETION ──────────────────────────────────────────────────────

    @Transactional
    public OperationResult delete(Long id) {
        Municipality municipality = loadMunicipality(id);
        String name = municipality.getName();
        int indicatorCount = municipality.getIndicators().size();
        municipalityRepo.delete(municipality);
        log.info("Deleted municipality {} ({}) with {} indicators", id, name, indicatorCount);
        return OperationResult.success("Conjunto de indicadores '" + name + "' (ID " + id + ") deletado com sucesso.");
    }

    @Transactional
    public OperationResult deleteAll() {
        List<Municipality> all = municipalityRepo.findAll();
        if (all.isEmpty()) {
            return OperationResult.noAction("Nenhum conjunto de indicadores encontrado para exclusão.");
        }
        // Entity-level delete so the cascade reaches every child table
        municipalityRepo.deleteAll(all);
        log.info("Deleted all {} indicator sets", all.size());

        OperationResult result = OperationResult.success(
                "Todos os " + all.size() + " conjuntos de indicadores foram deletados com sucesso.");
        result.setDeletedCount(all.size());
        return result;
    }

    // ─── HELPERS ───────────────────────────────────────────────────────

    private Municipality loadMunicipality(Long id) {
        return municipalityRepo.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Conjunto de indicadores com ID " + id + " não encontrado."));
    }

    private Indicator loadIndicator(Long id) {
        return indicatorRepo.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Indicador com ID " + id + " não encontrado."));
    }

    private static void checkLength(String param, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidRequestException(
                    "Parâmetro '" + param + "' excede o limite de " + maxLength + " caracteres.");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
