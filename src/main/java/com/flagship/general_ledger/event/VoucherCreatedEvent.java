package com.flagship.general_ledger.event;

import com.flagship.general_ledger.ledger.Voucher;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class VoucherCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    LocalDate voucherDate;
    BigDecimal totalAmount;
    String currency;
    String createdBy;
    UUID reversalOfId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherCreated";

    @Override
    public UUID getAggregateId() {
        return voucherId;
    }

    @Override
    public String getAggregateType() {
        return VoucherEvents.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static VoucherCreatedEvent fromVoucher(Voucher voucher) {
        return new VoucherCreatedEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getVoucherType().getCode(),
            voucher.getVoucherDate(),
            voucher.getTotalAmount(),
            voucher.getCurrency(),
            voucher.getCreatedBy(),
            voucher.getReversalOfId(),
            Instant.now()
        );
    }
}
