package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An entry line that has not been persisted yet.
 */
@Value
public class NewEntry {
    String accountCode;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    String costCenter;
    String department;
    String description;

    public NewEntry(String accountCode, BigDecimal debitAmount, BigDecimal creditAmount,
                    String costCenter, String department, String description) {
        this.accountCode = accountCode;
        this.debitAmount = debitAmount != null ? debitAmount : BigDecimal.ZERO;
        this.creditAmount = creditAmount != null ? creditAmount : BigDecimal.ZERO;
        this.costCenter = costCenter;
        this.department = department;
        this.description = description;
    }

    public static NewEntry debit(String accountCode, BigDecimal amount, String description) {
        return new NewEntry(accountCode, amount, BigDecimal.ZERO, null, null, description);
    }

    public static NewEntry credit(String accountCode, BigDecimal amount, String description) {
        return new NewEntry(accountCode, BigDecimal.ZERO, amount, null, null, description);
    }

    /**
     * @param lineNumber 1-based line number, used in error messages
     * @throws ValidationException if the line is malformed
     */
    void validate(int lineNumber) {
        if (accountCode == null || accountCode.isBlank()) {
            throw new ValidationException("Line " + lineNumber + ": account code is required");
        }
        if (debitAmount.signum() < 0 || creditAmount.signum() < 0) {
            throw new ValidationException("Line " + lineNumber + ": amounts cannot be negative");
        }
        boolean debit = debitAmount.signum() > 0;
        boolean credit = creditAmount.signum() > 0;
        if (debit == credit) {
            throw new ValidationException("Line " + lineNumber
                + ": exactly one of debit and credit must be positive (debit=" + debitAmount
                + ", credit=" + creditAmount + ")");
        }
    }
}
