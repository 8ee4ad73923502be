package com.sigi.indicators.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.sigi.indicators.exception.InvalidRequestException;
import com.sigi.indicators.model.*;
import com.sigi.indicators.service.IndicatorCatalogService;
import com.sigi.indicators.service.IndicatorImportService;
import com.sigi.indicators.service.IndicatorMatcherService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Indicator sets of municipal public-lighting tenders.
 *
 * <p>Failures are mapped to status codes by
 * {@link com.sigi.indicators.exception.GlobalExceptionHandler}.</p>
 */
@RestController
@RequestMapping("/indicadores")
@Slf4j
public class IndicatorController {

    private final IndicatorImportService importService;
    private final IndicatorMatcherService matcherService;
    private final IndicatorCatalogService catalogService;

    public IndicatorController(IndicatorImportService importService,
                               IndicatorMatcherService matcherService,
                               IndicatorCatalogService catalogService) {
        this.importService = importService;
        this.matcherService = matcherService;
        this.catalogService = catalogService;
    }

    // ─── IMPORT ────────────────────────────────────────────────────────

    @PostMapping(value = "/importar", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ImportSummary> importJson(@RequestBody(required = false) JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw noImportInput();
        }
        return ResponseEntity.ok(importService.importDocument(payload));
    }

    /**
     * Same document as {@link #importJson}, uploaded as a .json file in field {@code file}.
     */
    @PostMapping(value = "/importar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImportSummary> importFile(
            @RequestParam(value = "file", required = false) MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw noImportInput();
        }
        log.info("Importing indicator file {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try (InputStream content = file.getInputStream()) {
            return ResponseEntity.ok(importService.importDocument(content));
        }
    }

    // ─── QUERIES ───────────────────────────────────────────────────────

    @GetMapping
    public List<MunicipalityView> list(
            @RequestParam(value = "municipio", required = false) String municipality,
            @RequestParam(value = "uf", required = false) String stateCode,
            @RequestParam(value = "edital", required = false) String tenderId,
            @RequestParam(value = "ano_edital", required = false) Integer tenderYear) {
        return catalogService.list(municipality, stateCode, tenderId, tenderYear);
    }

    /**
     * Compares by exactly one of name (similar), normalized formula or hash (equal).
     * No match is answered with a 404 body rather than an error.
     */
    @GetMapping("/comparar")
    public ResponseEntity<?> compare(
            @RequestParam(value = "nome", required = false) String name,
            @RequestParam(value = "formula", required = false) String formula,
            @RequestParam(value = "hash", required = false) String hash) {
        ComparisonCriterion criterion = ComparisonCriterion.of(name, formula, hash);
        List<EquivalentIndicator> matches = matcherService.findEquivalent(criterion);
        if (matches.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("mensagem", "Nenhum indicador corresponde à pesquisa."));
        }
        return ResponseEntity.ok(matches);
    }

    @GetMapping("/semelhantes")
    public Map<String, List<SimilarIndicator>> similar(@RequestParam("criterio") String criterion) {
        return matcherService.findSimilarGroups(SimilarityCriterion.fromParam(criterion));
    }

    @GetMapping("/por-municipio")
    public MunicipalityIndicators byMunicipality(@RequestParam("nome") String name) {
        return catalogService.findByMunicipalityName(name);
    }

    @GetMapping("/exportar/{id}")
    public MunicipalityView export(@PathVariable("id") Long id) {
        return catalogService.export(id);
    }

    @GetMapping("/{id}")
    public MunicipalityView get(@PathVariable("id") Long id) {
        return catalogService.get(id);
    }

    // ─── CRUD ──────────────────────────────────────────────────────────

    @PutMapping("/{id}")
    public OperationResult update(@PathVariable("id") Long id,
                                  @RequestBody @Valid MunicipalityUpdateRequest request) {
        return catalogService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public OperationResult delete(@PathVariable("id") Long id) {
        return catalogService.delete(id);
    }

    @DeleteMapping
    public OperationResult deleteAll() {
        return catalogService.deleteAll();
    }

    // ─── FIELD EDITS ───────────────────────────────────────────────────

    @PatchMapping("/{id}/formula")
    public OperationResult patchFormula(
            @PathVariable("id") Long indicatorId,
            @RequestParam(value = "bruta", required = false) String rawText,
            @RequestParam(value = "normalizada", required = false) String normalizedText,
            @RequestParam(value = "hash", required = false) String hash) {
        return catalogService.patchFormula(indicatorId, rawText, normalizedText, hash);
    }

    @PutMapping("/{id}/tags")
    public OperationResult replaceTags(@PathVariable("id") Long indicatorId,
                                       @RequestBody List<String> tags) {
        return catalogService.replaceTags(indicatorId, tags);
    }

    private static InvalidRequestException noImportInput() {
        return new InvalidRequestException(
                "Envie um arquivo .json (campo 'file') ou JSON no corpo da requisição.");
    }
}
