package com.flagship.general_ledger.numbering.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.numbering.DateFormatToken;
import com.flagship.general_ledger.numbering.NumberingScheme;
import com.flagship.general_ledger.numbering.ResetFrequency;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class NumberingSchemeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("scheme_name")
    String schemeName;

    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("scope")
    String scope;

    @JsonProperty("prefix")
    String prefix;

    @JsonProperty("date_format")
    DateFormatToken dateFormat;

    @JsonProperty("padding")
    int padding;

    @JsonProperty("suffix")
    String suffix;

    @JsonProperty("separator")
    String separator;

    @JsonProperty("next_number")
    long nextNumber;

    @JsonProperty("reset_frequency")
    ResetFrequency resetFrequency;

    @JsonProperty("last_reset_date")
    LocalDate lastResetDate;

    @JsonProperty("is_active")
    boolean active;

    public static NumberingSchemeResponse from(NumberingScheme scheme) {
        return NumberingSchemeResponse.builder()
            .id(scheme.getId())
            .schemeName(scheme.getSchemeName())
            .documentType(scheme.getDocumentType())
            .scope(scheme.getScope())
            .prefix(scheme.getPrefix())
            .dateFormat(scheme.getDateFormat())
            .padding(scheme.getPadding())
            .suffix(scheme.getSuffix())
            .separator(scheme.getSeparator())
            .nextNumber(scheme.getNextNumber())
            .resetFrequency(scheme.getResetFrequency())
            .lastResetDate(scheme.getLastResetDate())
            .active(scheme.isActive())
            .build();
    }
}
