package com.flagship.general_ledger.ledger;

/**
 * Voucher lifecycle: DRAFT -> POSTED -> CANCELLED.
 * Only drafts are editable; posted entries are frozen.
 */
public enum VoucherStatus {
    DRAFT,
    POSTED,
    CANCELLED
}
