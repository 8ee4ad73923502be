package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

/**
 * Outcome of a state-changing call. Only the fields relevant to the
 * operation are serialized.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResult {

    public static final String SUCCESS = "sucesso";
    public static final String NO_ACTION = "nenhuma ação";

    @JsonProperty("status")
    private String status;

    @JsonProperty("mensagem")
    private String message;

    @JsonProperty("dados_atualizados")
    private MunicipalityView updatedData;

    @JsonProperty("tags_aplicadas")
    private List<String> appliedTags;

    @JsonProperty("total_excluidos")
    private Integer deletedCount;

    public static OperationResult success(String message) {
        OperationResult r = new OperationResult();
        r.status = SUCCESS;
        r.message = message;
        return r;
    }

    public static OperationResult noAction(String message) {
        OperationResult r = new OperationResult();
        r.status = NO_ACTION;
        r.message = message;
        r.deletedCount = 0;
        return r;
    }
}
