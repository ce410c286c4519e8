package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.exception.InvariantViolationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * A voucher with its entry lines, ordered by line number.
 *
 * Invariant: a POSTED voucher has equal debit and credit totals.
 */
@Value
public class Voucher {
    UUID id;
    String voucherNumber;
    VoucherType voucherType;
    LocalDate voucherDate;
    String referenceNumber;
    String partyReference;
    BigDecimal totalAmount;
    String currency;
    BigDecimal exchangeRate;
    String narration;
    VoucherStatus status;
    UUID approvalRequestId;
    UUID reversalOfId;
    String idempotencyKey;
    String createdBy;
    String approvedBy;
    Instant postedAt;
    String cancelledBy;
    Instant cancelledAt;
    Instant createdAt;
    List<VoucherEntry> entries;

    public BigDecimal getTotalDebits() {
        return sum(entries.stream().map(VoucherEntry::getDebitAmount));
    }

    public BigDecimal getTotalCredits() {
        return sum(entries.stream().map(VoucherEntry::getCreditAmount));
    }

    public boolean isBalanced() {
        return getTotalDebits().compareTo(getTotalCredits()) == 0;
    }

    /**
     * Exact comparison, no tolerance.
     *
     * @throws InvariantViolationException if debits and credits differ
     */
    public void validateDoubleEntry() {
        BigDecimal debits = getTotalDebits();
        BigDecimal credits = getTotalCredits();
        if (debits.compareTo(credits) != 0) {
            throw new InvariantViolationException(voucherNumber, debits, credits);
        }
    }

    public boolean isDraft() {
        return status == VoucherStatus.DRAFT;
    }

    static BigDecimal sum(Stream<BigDecimal> amounts) {
        return amounts.reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
