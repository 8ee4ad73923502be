package com.sigi.indicators.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sigi.indicators.entity.Municipality;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Replacement scalar fields of a municipality. Indicators are not part of the update.
 *
 * @param name       municipality name; must not be blank
 * @param stateCode  two-letter state code
 * @param tenderId   tender identifier, may be null
 * @param tenderYear tender year, may be null
 */
public record MunicipalityUpdateRequest(
        @JsonProperty("municipio") @NotBlank @Size(max = Municipality.NAME_LENGTH) String name,
        @JsonProperty("uf") @NotBlank @Pattern(regexp = "[A-Za-z]{2}") String stateCode,
        @JsonProperty("edital") @Size(max = Municipality.TENDER_ID_LENGTH) String tenderId,
        @JsonProperty("ano_edital") Integer tenderYear
) {}
