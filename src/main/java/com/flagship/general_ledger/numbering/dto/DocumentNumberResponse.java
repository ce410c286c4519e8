package com.flagship.general_ledger.numbering.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class DocumentNumberResponse {

    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("scope")
    String scope;

    @JsonProperty("number")
    String number;
}
