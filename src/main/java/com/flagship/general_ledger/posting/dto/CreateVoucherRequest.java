package com.flagship.general_ledger.posting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.ledger.NewVoucher;
import com.flagship.general_ledger.ledger.VoucherType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class CreateVoucherRequest {

    @NotNull(message = "Voucher type is required")
    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @NotNull(message = "Voucher date is required")
    @JsonProperty("voucher_date")
    LocalDate voucherDate;

    @Size(max = 100)
    @JsonProperty("reference_number")
    String referenceNumber;

    @Size(max = 100)
    @JsonProperty("party_reference")
    String partyReference;

    @Builder.Default
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter code")
    @JsonProperty("currency")
    String currency = "PKR";

    @Builder.Default
    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be positive")
    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate = BigDecimal.ONE;

    @Size(max = 1000)
    @JsonProperty("narration")
    String narration;

    /**
     * Optional numbering scope (entity code).
     */
    @Size(max = 50)
    @JsonProperty("scope")
    String scope;

    @NotEmpty(message = "At least one entry is required")
    @Valid
    @JsonProperty("entries")
    List<EntryRequest> entries;

    public NewVoucher toNewVoucher(String idempotencyKey) {
        return NewVoucher.builder()
            .voucherType(voucherType)
            .voucherDate(voucherDate)
            .referenceNumber(referenceNumber)
            .partyReference(partyReference)
            .currency(currency)
            .exchangeRate(exchangeRate)
            .narration(narration)
            .entries(entries.stream().map(EntryRequest::toNewEntry).toList())
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
