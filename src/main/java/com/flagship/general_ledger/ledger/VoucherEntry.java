package com.flagship.general_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A persisted line of a voucher. Exactly one of debit and credit is positive.
 */
@Value
public class VoucherEntry {
    UUID id;
    UUID voucherId;
    int lineNumber;
    String accountCode;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    String costCenter;
    String department;
    String description;

    public boolean isDebit() {
        return debitAmount.signum() > 0;
    }

    /**
     * The same line with debit and credit swapped, for a reversing voucher.
     */
    public NewEntry reversed() {
        return new NewEntry(accountCode, creditAmount, debitAmount, costCenter, department, description);
    }
}
