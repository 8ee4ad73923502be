package com.sigi.indicators.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sigi.indicators.entity.Formula;
import com.sigi.indicators.entity.Indicator;
import com.sigi.indicators.exception.InvalidRequestException;
import com.sigi.indicators.exception.ResourceNotFoundException;
import com.sigi.indicators.model.*;
import com.sigi.indicators.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;

import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class IndicatorCatalogServiceTest {

    @Autowired
    private IndicatorCatalogService catalogService;

    @Autowired
    private IndicatorImportService importService;

    @Autowired
    private MunicipalityRepository municipalityRepository;

    @Autowired
    private IndicatorRepository indicatorRepository;

    @Autowired
    private FormulaRepository formulaRepository;

    @Autowired
    private SubIndicatorRepository subIndicatorRepository;

    @Autowired
    private ConditionRepository conditionRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void cleanStore() {
        municipalityRepository.deleteAll();
    }

    // ─── LIST / GET ────────────────────────────────────────────────────

    @Test
    void listWithUnmatchedFilter_isNotFound_notEmpty() throws Exception {
        importService.importDocument(json("""
                { "municipio": "Uberlandia", "uf": "MG", "indicadores": [ { "nome": "A" } ] }
                """));

        assertThatThrownBy(() -> catalogService.list(null, "SP", null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listFilters_areAnded() throws Exception {
        importService.importDocument(json("""
                { "municipio": "Campinas", "uf": "SP", "edital": "E1", "ano_edital": 2023, "indicadores": [] }
                """));
        importService.importDocument(json("""
                { "municipio": "Campinas", "uf": "SP", "edital": "E2", "ano_edital": 2024, "indicadores": [] }
                """));
        importService.importDocument(json("""
                { "municipio": "Santos", "uf": "SP", "edital": "E2", "ano_edital": 2024, "indicadores": [] }
                """));

        assertThat(catalogService.list(null, "SP", null, null)).hasSize(3);
        assertThat(catalogService.list("Campinas", null, null, null)).hasSize(2);
        assertThat(catalogService.list("Campinas", "SP", "E2", 2024))
                .singleElement()
                .satisfies(m -> assertThat(m.tenderYear()).isEqualTo(2024));
        assertThatThrownBy(() -> catalogService.list("Santos", null, null, 2023))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void getReturnsNestedSubtree() throws Exception {
        Long id = importFixture();

        MunicipalityView view = catalogService.get(id);

        assertThat(view.id()).isEqualTo(id);
        assertThat(view.indicators()).hasSize(2);
        IndicatorView first = view.indicators().get(0);
        assertThat(first.id()).isNotNull();
        assertThat(first.tags()).containsExactly("disponibilidade", "operacao");
        assertThat(first.formula().normalizedText()).isEqualTo("id=(pf/pt)*100");
        assertThat(first.subIndicators()).extracting(SubIndicatorView::name).containsExactly("PF", "PT");
        assertThat(view.indicators().get(1).formula()).isNull();
    }

    @Test
    void getUnknownId_isNotFound() {
        assertThatThrownBy(() -> catalogService.get(424242L)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void byMunicipalityName_matchesFragmentIgnoringCase() throws Exception {
        importFixture();

        MunicipalityIndicators result = catalogService.findByMunicipalityName("campi");

        assertThat(result.municipality()).isEqualTo("Campinas");
        assertThat(result.totalIndicators()).isEqualTo(2);
        assertThatThrownBy(() -> catalogService.findByMunicipalityName("Recife"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ─── EXPORT ────────────────────────────────────────────────────────

    @Test
    void exportOfImportedDocument_reproducesIt() throws Exception {
        JsonNode imported = fixture();
        importService.importDocument(imported);
        Long id = municipalityRepository.findAll().get(0).getId();

        JsonNode exported = objectMapper.valueToTree(catalogService.export(id));

        assertThat(exported).isEqualTo(imported);
    }

    @Test
    void exportedDocument_canBeImportedAgainAfterDelete() throws Exception {
        Long id = importFixture();
        JsonNode exported = objectMapper.valueToTree(catalogService.export(id));
        catalogService.delete(id);

        ImportSummary summary = importService.importDocument(exported);

        assertThat(summary.totalIndicators()).isEqualTo(2);
    }

    // ─── UPDATE / EDITS ────────────────────────────────────────────────

    @Test
    void update_replacesScalarFieldsOnly() throws Exception {
        Long id = importFixture();

        OperationResult result = catalogService.update(id,
                new MunicipalityUpdateRequest("Campinas (revisado)", "SP", "CP-002/2024", 2025));

        assertThat(result.getStatus()).isEqualTo("sucesso");
        assertThat(result.getUpdatedData().name()).isEqualTo("Campinas (revisado)");
        MunicipalityView stored = catalogService.get(id);
        assertThat(stored.tenderId()).isEqualTo("CP-002/2024");
        assertThat(stored.tenderYear()).isEqualTo(2025);
        assertThat(stored.indicators()).hasSize(2);
    }

    @Test
    void patchFormula_changesOnlySuppliedFields() throws Exception {
        Long id = importFixture();
        Long indicatorId = catalogService.get(id).indicators().get(0).id();

        catalogService.patchFormula(indicatorId, null, null, "novo-hash");

        FormulaView formula = catalogService.get(id).indicators().get(0).formula();
        assertThat(formula.hash()).isEqualTo("novo-hash");
        assertThat(formula.rawText()).isEqualTo("ID = (PF / PT) x 100");
        assertThat(formula.normalizedText()).isEqualTo("id=(pf/pt)*100");
    }

    @Test
    void patchFormula_withoutFormula_isAnInputError() throws Exception {
        Long id = importFixture();
        Long withoutFormula = catalogService.get(id).indicators().get(1).id();

        assertThatThrownBy(() -> catalogService.patchFormula(withoutFormula, "x", null, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> catalogService.patchFormula(999_999L, "x", null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void patchFormula_beyondColumnLimit_isAnInputError() throws Exception {
        Long id = importFixture();
        Long indicatorId = catalogService.get(id).indicators().get(0).id();
        String tooLong = "h".repeat(Formula.HASH_LENGTH + 1);

        assertThatThrownBy(() -> catalogService.patchFormula(indicatorId, null, null, tooLong))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(catalogService.get(id).indicators().get(0).formula().hash()).isEqualTo("5f1c2a9e");
    }

    @Test
    void replaceTags_replacesWholeList() throws Exception {
        Long id = importFixture();
        Long indicatorId = catalogService.get(id).indicators().get(0).id();

        OperationResult result = catalogService.replaceTags(indicatorId, List.of("iluminacao", "led"));

        assertThat(result.getAppliedTags()).containsExactly("iluminacao", "led");
        assertThat(catalogService.get(id).indicators().get(0).tags()).containsExactly("iluminacao", "led");
    }

    // ─── DELETE ────────────────────────────────────────────────────────

    @Test
    void deletingMunicipality_cascadesToEveryChild() throws Exception {
        importService.importDocument(json("""
                { "municipio": "Piracicaba", "uf": "SP", "indicadores": [
                  { "nome": "I1", "formula": { "hash": "a" }, "subindicadores": [ { "nome": "s1" } ],
                    "condicoes": [ { "regra": "r1", "nota": 1.0 } ] },
                  { "nome": "I2", "formula": { "hash": "b" }, "subindicadores": [ { "nome": "s2" } ],
                    "condicoes": { "g": [ { "regra": "r2", "nota": 2.0 } ] } },
                  { "nome": "I3", "formula": { "hash": "c" } }
                ] }
                """));
        Long id = municipalityRepository.findAll().get(0).getId();
        importService.importDocument(json("""
                { "municipio": "Americana", "uf": "SP", "indicadores": [ { "nome": "Outro", "formula": { "hash": "z" } } ] }
                """));

        List<Long> formulaIds = formulaRepository.findAll().stream()
                .filter(f -> !"z".equals(f.getHash()))
                .map(Formula::getId)
                .toList();
        List<Long> indicatorIds = catalogService.get(id).indicators().stream().map(IndicatorView::id).toList();
        assertThat(formulaIds).hasSize(3);

        OperationResult result = catalogService.delete(id);

        assertThat(result.getStatus()).isEqualTo("sucesso");
        formulaIds.forEach(fid -> assertThat(formulaRepository.findById(fid)).isEmpty());
        indicatorIds.forEach(iid -> assertThat(indicatorRepository.findById(iid)).isEmpty());
        assertThat(subIndicatorRepository.count()).isZero();
        assertThat(conditionRepository.count()).isZero();
        assertThatThrownBy(() -> catalogService.get(id)).isInstanceOf(ResourceNotFoundException.class);

        // The other municipality is untouched
        assertThat(indicatorRepository.findAll()).extracting(Indicator::getName).containsExactly("Outro");
        assertThat(formulaRepository.count()).isEqualTo(1);
    }

    @Test
    void deleteAll_reportsCount_andIsNoOpOnEmptyStore() throws Exception {
        importFixture();
        importService.importDocument(json("""
                { "municipio": "Santos", "uf": "SP", "indicadores": [ { "nome": "X" } ] }
                """));

        OperationResult result = catalogService.deleteAll();

        assertThat(result.getDeletedCount()).isEqualTo(2);
        assertThat(indicatorRepository.count()).isZero();
        assertThat(formulaRepository.count()).isZero();

        OperationResult second = catalogService.deleteAll();
        assertThat(second.getStatus()).isEqualTo("nenhuma ação");
        assertThat(second.getDeletedCount()).isZero();
    }

    @Test
    void deleteUnknownId_isNotFound() {
        assertThatThrownBy(() -> catalogService.delete(31337L)).isInstanceOf(ResourceNotFoundException.class);
    }

    private Long importFixture() throws Exception {
        importService.importDocument(fixture());
        return municipalityRepository.findAll().stream()
                .filter(m -> "Campinas".equals(m.getName()))
                .findFirst()
                .orElseThrow()
                .getId();
    }

    private JsonNode fixture() throws Exception {
        try (InputStream in = new ClassPathResource("fixtures/campinas-2024.json").getInputStream()) {
            return objectMapper.readTree(in);
        }
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
