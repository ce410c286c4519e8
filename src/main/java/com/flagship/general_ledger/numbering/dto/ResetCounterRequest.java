package com.flagship.general_ledger.numbering.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ResetCounterRequest {

    @NotBlank(message = "Document type is required")
    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("scope")
    String scope;

    @Min(value = 1, message = "Counter can only be reset to 1 or higher")
    @Builder.Default
    @JsonProperty("reset_to")
    long resetTo = 1;
}
