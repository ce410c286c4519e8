package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Input for creating a draft voucher. Balance is not required at this point;
 * it is enforced on submission and on posting.
 */
@Value
@Builder(toBuilder = true)
public class NewVoucher {
    VoucherType voucherType;
    LocalDate voucherDate;
    String referenceNumber;
    String partyReference;
    @Builder.Default
    String currency = "PKR";
    @Builder.Default
    BigDecimal exchangeRate = BigDecimal.ONE;
    String narration;
    @Singular
    List<NewEntry> entries;
    String idempotencyKey;
    UUID reversalOfId;

    /**
     * @throws ValidationException if the voucher or any of its lines is malformed
     */
    public void validate() {
        if (voucherType == null) {
            throw new ValidationException("Voucher type is required");
        }
        if (voucherDate == null) {
            throw new ValidationException("Voucher date is required");
        }
        if (currency == null || currency.length() != 3) {
            throw new ValidationException("Currency must be a 3-letter code, got " + currency);
        }
        if (exchangeRate == null || exchangeRate.signum() <= 0) {
            throw new ValidationException("Exchange rate must be positive");
        }
        validateEntries(entries);
    }

    public BigDecimal getTotalDebits() {
        return Voucher.sum(entries.stream().map(NewEntry::getDebitAmount));
    }

    static void validateEntries(List<NewEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new ValidationException("A voucher needs at least one entry");
        }
        for (int i = 0; i < entries.size(); i++) {
            NewEntry entry = entries.get(i);
            if (entry == null) {
                throw new ValidationException("Line " + (i + 1) + " is empty");
            }
            entry.validate(i + 1);
        }
    }
}
