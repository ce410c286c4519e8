package com.flagship.general_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.approval.ApprovalLevel;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class ApprovalLevelRequest {

    @Min(1)
    @JsonProperty("level_number")
    int levelNumber;

    @NotBlank(message = "Approver is required")
    @JsonProperty("approver")
    String approver;

    @NotNull
    @DecimalMin(value = "0")
    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @NotNull
    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @Builder.Default
    @JsonProperty("is_mandatory")
    boolean mandatory = true;

    public ApprovalLevel toLevel() {
        return ApprovalLevel.of(levelNumber, approver, minAmount, maxAmount, mandatory);
    }
}
