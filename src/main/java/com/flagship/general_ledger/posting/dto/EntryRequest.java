package com.flagship.general_ledger.posting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.ledger.NewEntry;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class EntryRequest {

    @NotBlank(message = "Account code is required")
    @Size(max = 50)
    @JsonProperty("account_code")
    String accountCode;

    @DecimalMin(value = "0", message = "Debit amount cannot be negative")
    @JsonProperty("debit_amount")
    BigDecimal debitAmount;

    @DecimalMin(value = "0", message = "Credit amount cannot be negative")
    @JsonProperty("credit_amount")
    BigDecimal creditAmount;

    @Size(max = 50)
    @JsonProperty("cost_center")
    String costCenter;

    @Size(max = 50)
    @JsonProperty("department")
    String department;

    @Size(max = 500)
    @JsonProperty("description")
    String description;

    public NewEntry toNewEntry() {
        return new NewEntry(accountCode, debitAmount, creditAmount, costCenter, department, description);
    }
}
