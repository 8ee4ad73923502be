package com.sigi.indicators.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sigi.indicators.entity.*;
import com.sigi.indicators.exception.DuplicateImportException;
import com.sigi.indicators.exception.InvalidRequestException;
import com.sigi.indicators.model.ImportSummary;
import com.sigi.indicators.model.OperationResult;
import com.sigi.indicators.repository.MunicipalityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Builds a municipality and its whole indicator subtree from an import document
 * and persists it in one write.
 *
 * Accepted shape:
 * <pre>
 *   { "municipio", "uf", "edital"?, "ano_edital"?,
 *     "indicadores": [ { "nome_indicador" | "nome", "descricao"?, "unidade"?,
 *                        "tags"?, "observacoes"?, "inconsistencias"?,
 *                        "formula"?: { "bruta", "normalizada", "hash" },
 *                        "subindicadores"?: [ { "nome", "descricao"? } ],
 *                        "condicoes"?: [ {"regra","nota"} ] | { "grupo": [ {"regra","nota"} ] } } ] }
 * </pre>
 */
@Service
@Slf4j
public class IndicatorImportService {

    private final MunicipalityRepository municipalityRepo;
    private final ObjectMapper objectMapper;

    public IndicatorImportService(MunicipalityRepository municipalityRepo, ObjectMapper objectMapper) {
        this.municipalityRepo = municipalityRepo;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads an uploaded UTF-8 JSON file and imports it.
     */
    @Transactional
    public ImportSummary importDocument(InputStream content) {
        JsonNode document;
        try {
            document = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("O arquivo não está em formato JSON válido ou está malformado.", e);
        } catch (IOException e) {
            throw new InvalidRequestException("Não foi possível ler o arquivo enviado: " + e.getMessage(), e);
        }
        return importDocument(document);
    }

    @Transactional
    public ImportSummary importDocument(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new InvalidRequestException("O documento deve ser um objeto JSON.");
        }

        String name = requiredText(document, "municipio", Municipality.NAME_LENGTH);
        String stateCode = requiredText(document, "uf");
        if (!stateCode.matches("[A-Za-z]{2}")) {
            throw new InvalidRequestException("Campo 'uf' deve conter a sigla de 2 letras do estado.");
        }
        String tenderId = optionalText(document, "edital", Municipality.TENDER_ID_LENGTH);
        Integer tenderYear = optionalInteger(document, "ano_edital");

        if (municipalityRepo.countIndicatorSets(name, stateCode, tenderId, tenderYear) > 0) {
            log.warn("Rejected duplicate import for {}/{} edital={} ano={}", name, stateCode, tenderId, tenderYear);
            throw new DuplicateImportException(name, stateCode);
        }

        Municipality municipality = Municipality.builder()
                .name(name)
                .stateCode(stateCode)
                .tenderId(tenderId)
                .tenderYear(tenderYear)
                .build();

        for (JsonNode entry : arrayOf(document, "indicadores")) {
            municipality.addIndicator(buildIndicator(entry));
        }

        Municipality saved = municipalityRepo.save(municipality);
        log.info("Imported {} indicators for {}/{} (id {})",
                saved.getIndicators().size(), saved.getName(), saved.getStateCode(), saved.getId());

        return new ImportSummary(
                OperationResult.SUCCESS,
                "Indicadores importados com sucesso.",
                saved.getName(),
                saved.getStateCode(),
                saved.getTenderId(),
                saved.getTenderYear(),
                saved.getIndicators().size());
    }

    // ─── INDICATOR SUBTREE ─────────────────────────────────────────────

    private Indicator buildIndicator(JsonNode entry) {
        if (!entry.isObject()) {
            throw new InvalidRequestException("Cada item de 'indicadores' deve ser um objeto JSON.");
        }

        String name = optionalText(entry, "nome_indicador", Indicator.NAME_LENGTH);
        if (name == null || name.isEmpty()) {
            name = optionalText(entry, "nome", Indicator.NAME_LENGTH);
        }
        if (name == null || name.isEmpty()) {
            throw InvalidRequestException.missingField("nome_indicador");
        }

        Indicator indicator = Indicator.builder()
                .name(name)
                .description(optionalText(entry, "descricao", Indicator.DESCRIPTION_LENGTH))
                .unit(optionalText(entry, "unidade", Indicator.UNIT_LENGTH))
                .tags(stringList(entry, "tags"))
                .observations(stringList(entry, "observacoes"))
                .inconsistencies(stringList(entry, "inconsistencias"))
                .build();

        JsonNode formula = entry.get("formula");
        if (formula != null && formula.isObject()) {
            indicator.attachFormula(Formula.builder()
                    .rawText(optionalText(formula, "bruta", Formula.TEXT_LENGTH))
                    .normalizedText(optionalText(formula, "normalizada", Formula.TEXT_LENGTH))
                    .hash(optionalText(formula, "hash", Formula.HASH_LENGTH))
                    .build());
        }

        for (JsonNode sub : arrayOf(entry, "subindicadores")) {
            if (!sub.isObject()) {
                throw new InvalidRequestException("Cada subindicador deve ser um objeto JSON.");
            }
            indicator.addSubIndicator(SubIndicator.builder()
                    .name(requiredText(sub, "nome", SubIndicator.NAME_LENGTH))
                    .description(optionalText(sub, "descricao", SubIndicator.DESCRIPTION_LENGTH))
                    .build());
        }

        for (JsonNode condition : flattenConditions(entry.get("condicoes"))) {
            indicator.addCondition(Condition.builder()
                    .rule(optionalText(condition, "regra", Condition.RULE_LENGTH))
                    .score(optionalDouble(condition, "nota"))
                    .build());
        }

        return indicator;
    }

    /**
     * Conditions come either as a flat list or grouped by name; both end up as
     * one list in document order.
     */
    private List<JsonNode> flattenConditions(JsonNode node) {
        List<JsonNode> flat = new ArrayList<>();
        if (node == null || node.isNull()) {
            return flat;
        }
        if (node.isArray()) {
            node.forEach(flat::add);
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> groups = node.fields();
            while (groups.hasNext()) {
                Map.Entry<String, JsonNode> group = groups.next();
                if (!group.getValue().isArray()) {
                    throw new InvalidRequestException(
                            "Grupo de condições '" + group.getKey() + "' deve ser uma lista.");
                }
                group.getValue().forEach(flat::add);
            }
        } else {
            throw new InvalidRequestException("Campo 'condicoes' deve ser uma lista ou um objeto de grupos.");
        }

        for (JsonNode condition : flat) {
            if (!condition.isObject()) {
                throw new InvalidRequestException("Cada condição deve ser um objeto com 'regra' e 'nota'.");
            }
        }
        return flat;
    }

    // ─── FIELD READERS ─────────────────────────────────────────────────

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw InvalidRequestException.missingField(field);
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field, int maxLength) {
        return checkLength(field, requiredText(node, field), maxLength);
    }

    private static String optionalText(JsonNode node, String field, int maxLength) {
        return checkLength(field, optionalText(node, field), maxLength);
    }

    private static String checkLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidRequestException(
                    "Campo '" + field + "' excede o limite de " + maxLength + " caracteres.");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isContainerNode()) {
            throw new InvalidRequestException("Campo '" + field + "' deve ser um texto.");
        }
        return value.asText();
    }

    private static Integer optionalInteger(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isIntegralNumber()) {
            if (!value.canConvertToInt()) {
                throw new InvalidRequestException("Campo '" + field + "' deve ser um número inteiro.");
            }
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidRequestException("Campo '" + field + "' deve ser um número inteiro.", e);
            }
        }
        throw new InvalidRequestException("Campo '" + field + "' deve ser um número inteiro.");
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.doubleValue();
        if (value.isTextual()) {
            try {
                return Double.valueOf(value.asText().trim().replace(',', '.'));
            } catch (NumberFormatException e) {
                throw new InvalidRequestException("Campo '" + field + "' deve ser numérico.", e);
            }
        }
        throw new InvalidRequestException("Campo '" + field + "' deve ser numérico.");
    }

    private static List<String> stringList(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : arrayOf(node, field)) {
            if (item.isContainerNode()) {
                throw new InvalidRequestException("Campo '" + field + "' deve ser uma lista de textos.");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static List<JsonNode> arrayOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<JsonNode> items = new ArrayList<>();
        if (value == null || value.isNull()) return items;
        if (!value.isArray()) {
            throw new InvalidRequestException("Campo '" + field + "' deve ser uma lista.");
        }
        value.forEach(items::add);
        return items;
    }
}
