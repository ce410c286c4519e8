package com.flagship.general_ledger.numbering.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.numbering.DateFormatToken;
import com.flagship.general_ledger.numbering.ResetFrequency;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateNumberingSchemeRequest {

    @NotBlank(message = "Scheme name is required")
    @JsonProperty("scheme_name")
    String schemeName;

    @NotBlank(message = "Document type is required")
    @Size(max = 50)
    @JsonProperty("document_type")
    String documentType;

    @Size(max = 50)
    @JsonProperty("scope")
    String scope;

    @Size(max = 20)
    @JsonProperty("prefix")
    String prefix;

    @JsonProperty("date_format")
    DateFormatToken dateFormat;

    @Min(1)
    @Max(10)
    @Builder.Default
    @JsonProperty("padding")
    int padding = 4;

    @Size(max = 20)
    @JsonProperty("suffix")
    String suffix;

    @Size(max = 5)
    @Builder.Default
    @JsonProperty("separator")
    String separator = "-";

    @Min(1)
    @Builder.Default
    @JsonProperty("next_number")
    long nextNumber = 1;

    @Builder.Default
    @JsonProperty("reset_frequency")
    ResetFrequency resetFrequency = ResetFrequency.NEVER;
}
