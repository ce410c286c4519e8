package com.flagship.general_ledger.exception;

import java.math.BigDecimal;

/**
 * Thrown when a voucher's debits do not equal its credits.
 */
public class InvariantViolationException extends LedgerException {

    public static final String ERROR_CODE = "INVARIANT_VIOLATION";

    private final String voucherNumber;
    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;

    public InvariantViolationException(String voucherNumber, BigDecimal totalDebits, BigDecimal totalCredits) {
        super(ERROR_CODE, String.format("Voucher %s is not balanced: debits=%s, credits=%s, difference=%s",
            voucherNumber, totalDebits, totalCredits, totalDebits.subtract(totalCredits)));
        this.voucherNumber = voucherNumber;
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
    }

    public String getVoucherNumber() {
        return voucherNumber;
    }

    public BigDecimal getTotalDebits() {
        return totalDebits;
    }

    public BigDecimal getTotalCredits() {
        return totalCredits;
    }

    public BigDecimal getDifference() {
        return totalDebits.subtract(totalCredits);
    }
}
