package com.flagship.general_ledger.event;

final class VoucherEvents {

    static final String AGGREGATE_TYPE = "Voucher";

    private VoucherEvents() {
    }
}
