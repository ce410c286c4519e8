package com.flagship.general_ledger.posting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ReplaceEntriesRequest {

    @NotEmpty(message = "At least one entry is required")
    @Valid
    @JsonProperty("entries")
    List<EntryRequest> entries;
}
