package com.flagship.general_ledger.event;

import com.flagship.general_ledger.ledger.Voucher;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class VoucherPostedEvent implements LedgerEvent {
    UUID eventId;
    UUID voucherId;
    String voucherNumber;
    String voucherType;
    BigDecimal totalAmount;
    String currency;
    String approvedBy;
    UUID approvalRequestId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VoucherPosted";

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

    public static VoucherPostedEvent fromVoucher(Voucher voucher) {
        return new VoucherPostedEvent(
            UUID.randomUUID(),
            voucher.getId(),
            voucher.getVoucherNumber(),
            voucher.getVoucherType().getCode(),
            voucher.getTotalAmount(),
            voucher.getCurrency(),
            voucher.getApprovedBy(),
            voucher.getApprovalRequestId(),
            voucher.getPostedAt()
        );
    }
}
