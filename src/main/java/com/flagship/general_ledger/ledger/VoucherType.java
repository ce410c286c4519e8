package com.flagship.general_ledger.ledger;

/**
 * Voucher types. The code doubles as the numbering document type,
 * so each type has its own numbering sequence.
 */
public enum VoucherType {
    JE("Journal Entry"),
    SI("Sales Invoice"),
    PI("Purchase Invoice"),
    CRV("Cash Receipt Voucher"),
    CPV("Cash Payment Voucher"),
    BRV("Bank Receipt Voucher"),
    BPV("Bank Payment Voucher"),
    DN("Debit Note"),
    CN("Credit Note"),
    CE("Contra Entry");

    private final String displayName;

    VoucherType(String displayName) {
        this.displayName = displayName;
    }

    public String getCode() {
        return name();
    }

    public String getDisplayName() {
        return displayName;
    }
}
