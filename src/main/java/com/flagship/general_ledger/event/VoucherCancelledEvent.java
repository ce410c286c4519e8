package com.flagship.general_ledger.event;

import com.flagship.general_ledger.ledger.Voucher;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class VoucherCancelledEvent implements LedgerEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    String cancelledBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherCancelled";

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

    public static VoucherCancelledEvent fromVoucher(Voucher voucher) {
        return new VoucherCancelledEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getVoucherType().getCode(),
            voucher.getCancelledBy(),
            voucher.getCancelledAt()
        );
    }
}
