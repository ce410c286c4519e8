package com.flagship.general_ledger.posting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ReverseVoucherRequest {

    @Size(max = 500)
    @JsonProperty("reason")
    String reason;
}
