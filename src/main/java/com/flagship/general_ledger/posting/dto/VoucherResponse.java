package com.flagship.general_ledger.posting.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.ledger.Voucher;
import com.flagship.general_ledger.ledger.VoucherEntry;
import com.flagship.general_ledger.ledger.VoucherStatus;
import com.flagship.general_ledger.ledger.VoucherType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoucherResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("voucher_number")
    String voucherNumber;

    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @JsonProperty("voucher_date")
    LocalDate voucherDate;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("party_reference")
    String partyReference;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("status")
    VoucherStatus status;

    @JsonProperty("approval_request_id")
    UUID approvalRequestId;

    @JsonProperty("reversal_of_id")
    UUID reversalOfId;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("approved_by")
    String approvedBy;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("cancelled_by")
    String cancelledBy;

    @JsonProperty("cancelled_at")
    Instant cancelledAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("entries")
    List<Entry> entries;

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("debit_amount")
        BigDecimal debitAmount;

        @JsonProperty("credit_amount")
        BigDecimal creditAmount;

        @JsonProperty("cost_center")
        String costCenter;

        @JsonProperty("department")
        String department;

        @JsonProperty("description")
        String description;

        static Entry from(VoucherEntry entry) {
            return new Entry(entry.getLineNumber(), entry.getAccountCode(), entry.getDebitAmount(),
                entry.getCreditAmount(), entry.getCostCenter(), entry.getDepartment(), entry.getDescription());
        }
    }

    public static VoucherResponse from(Voucher voucher) {
        return VoucherResponse.builder()
            .id(voucher.getId())
            .voucherNumber(voucher.getVoucherNumber())
            .voucherType(voucher.getVoucherType())
            .voucherDate(voucher.getVoucherDate())
            .referenceNumber(voucher.getReferenceNumber())
            .partyReference(voucher.getPartyReference())
            .totalAmount(voucher.getTotalAmount())
            .currency(voucher.getCurrency())
            .exchangeRate(voucher.getExchangeRate())
            .narration(voucher.getNarration())
            .status(voucher.getStatus())
            .approvalRequestId(voucher.getApprovalRequestId())
            .reversalOfId(voucher.getReversalOfId())
            .createdBy(voucher.getCreatedBy())
            .approvedBy(voucher.getApprovedBy())
            .postedAt(voucher.getPostedAt())
            .cancelledBy(voucher.getCancelledBy())
            .cancelledAt(voucher.getCancelledAt())
            .createdAt(voucher.getCreatedAt())
            .entries(voucher.getEntries().stream().map(Entry::from).toList())
            .build();
    }
}
