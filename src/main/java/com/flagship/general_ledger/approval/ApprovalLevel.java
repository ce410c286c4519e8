package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A monetary authority band with one designated approver.
 */
@Value
public class ApprovalLevel {
    UUID id;
    int levelNumber;
    String approver;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    boolean mandatory;

    public static ApprovalLevel of(int levelNumber, String approver, BigDecimal minAmount,
                                   BigDecimal maxAmount, boolean mandatory) {
        return new ApprovalLevel(UUID.randomUUID(), levelNumber, approver, minAmount, maxAmount, mandatory);
    }

    /**
     * Inclusive on both ends.
     */
    public boolean covers(BigDecimal amount) {
        return minAmount.compareTo(amount) <= 0 && maxAmount.compareTo(amount) >= 0;
    }

    void validate() {
        if (levelNumber < 1) {
            throw new ValidationException("Level numbers start at 1, got " + levelNumber);
        }
        if (approver == null || approver.isBlank()) {
            throw new ValidationException("Level " + levelNumber + ": approver is required");
        }
        if (minAmount == null || maxAmount == null) {
            throw new ValidationException("Level " + levelNumber + ": amount band is required");
        }
        if (minAmount.signum() < 0) {
            throw new ValidationException("Level " + levelNumber + ": minimum amount cannot be negative");
        }
        if (minAmount.compareTo(maxAmount) > 0) {
            throw new ValidationException(String.format(
                "Level %d: minimum amount %s is above maximum amount %s", levelNumber, minAmount, maxAmount));
        }
    }
}
