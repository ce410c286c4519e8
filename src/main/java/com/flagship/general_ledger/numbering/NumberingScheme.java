package com.flagship.general_ledger.numbering;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Configuration for one sequence of human-readable document numbers,
 * e.g. {@code INV-2025-0001} or {@code VCH/202501/00001}.
 *
 * Immutable: counter changes produce a new instance that the caller persists
 * while holding the row lock.
 */
@Value
public class NumberingScheme {

    public static final int MIN_PADDING = 1;
    public static final int MAX_PADDING = 10;
    public static final int MAX_SEPARATOR_LENGTH = 5;

    UUID id;
    String schemeName;
    String documentType;
    String scope;
    String prefix;
    DateFormatToken dateFormat;
    int padding;
    String suffix;
    String separator;
    long nextNumber;
    ResetFrequency resetFrequency;
    LocalDate lastResetDate;
    boolean active;
    String createdBy;
    Instant createdAt;

    /**
     * Creates a new active scheme after validating its format settings.
     *
     * @throws ValidationException if the configuration cannot produce valid numbers
     */
    public static NumberingScheme create(String schemeName, String documentType, String scope,
                                         String prefix, DateFormatToken dateFormat, int padding,
                                         String suffix, String separator, long nextNumber,
                                         ResetFrequency resetFrequency, LocalDate today, String createdBy) {
        NumberingScheme scheme = new NumberingScheme(
            UUID.randomUUID(),
            schemeName,
            documentType,
            blankToNull(scope),
            blankToNull(prefix),
            dateFormat,
            padding,
            blankToNull(suffix),
            separator == null ? "" : separator,
            nextNumber,
            resetFrequency == null ? ResetFrequency.NEVER : resetFrequency,
            today,
            true,
            createdBy,
            Instant.now()
        );
        scheme.validate();
        return scheme;
    }

    void validate() {
        if (documentType == null || documentType.isBlank()) {
            throw new ValidationException("Document type is required");
        }
        if (schemeName == null || schemeName.isBlank()) {
            throw new ValidationException("Scheme name is required");
        }
        if (padding < MIN_PADDING || padding > MAX_PADDING) {
            throw new ValidationException(String.format(
                "Padding must be between %d and %d, got %d", MIN_PADDING, MAX_PADDING, padding));
        }
        if (nextNumber < 1) {
            throw new ValidationException("Next number must be at least 1, got " + nextNumber);
        }
        if (prefix == null && dateFormat == null && suffix == null) {
            throw new ValidationException("At least one of prefix, date format or suffix is required");
        }
        if (separator.length() > MAX_SEPARATOR_LENGTH) {
            throw new ValidationException("Separator must be at most " + MAX_SEPARATOR_LENGTH + " characters");
        }
    }

    /**
     * Whether the counter must restart before issuing a number dated {@code asOfDate}.
     */
    public boolean shouldReset(LocalDate asOfDate) {
        if (lastResetDate == null) {
            return false;
        }
        return resetFrequency.isBoundaryCrossed(lastResetDate, asOfDate);
    }

    /**
     * Refuses a document dated in a period before the one the counter was last reset for.
     * The counter has already restarted for the later period, so numbering such a
     * document would repeat a number issued in its own period.
     *
     * @throws ValidationException if {@code asOfDate} precedes the current counter period
     */
    public void checkNotBeforeCurrentPeriod(LocalDate asOfDate) {
        if (lastResetDate != null && resetFrequency.isBoundaryCrossed(asOfDate, lastResetDate)) {
            throw new ValidationException(String.format(
                "Scheme %s was reset for the period of %s (%s); a document dated %s belongs to an earlier period",
                schemeName, lastResetDate, resetFrequency.name().toLowerCase(), asOfDate));
        }
    }

    /**
     * Formats the current {@code nextNumber} as of the given date.
     * Components are prefix, date, zero-padded sequence and suffix, joined by the separator.
     */
    public String format(LocalDate asOfDate) {
        List<String> components = new ArrayList<>(4);
        if (prefix != null) {
            components.add(prefix);
        }
        if (dateFormat != null) {
            components.add(dateFormat.render(asOfDate));
        }
        components.add(String.format("%0" + padding + "d", nextNumber));
        if (suffix != null) {
            components.add(suffix);
        }
        return String.join(separator, components);
    }

    /**
     * Applies a pending reset, if any, as of the given date.
     * A scheme that was never reset only gets its reset date stamped.
     */
    public NumberingScheme applyReset(LocalDate asOfDate) {
        if (lastResetDate == null) {
            return withCounter(nextNumber, asOfDate);
        }
        if (shouldReset(asOfDate)) {
            return withCounter(1, asOfDate);
        }
        return this;
    }

    /**
     * The scheme after issuing its current number.
     */
    public NumberingScheme advance() {
        return withCounter(nextNumber + 1, lastResetDate);
    }

    public NumberingScheme withCounter(long newNextNumber, LocalDate newLastResetDate) {
        if (newNextNumber < 1) {
            throw new ValidationException("Next number must be at least 1, got " + newNextNumber);
        }
        return new NumberingScheme(id, schemeName, documentType, scope, prefix, dateFormat, padding,
            suffix, separator, newNextNumber, resetFrequency, newLastResetDate, active, createdBy, createdAt);
    }

    /**
     * Key that is unique among active schemes: one per (document type, scope).
     */
    public String activeKey() {
        return documentType + ":" + (scope == null ? "" : scope);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
