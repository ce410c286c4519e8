package com.flagship.general_ledger.numbering;

import com.flagship.general_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class NumberingSchemeTest {

    private static final LocalDate JAN_15_2025 = LocalDate.of(2025, 1, 15);

    private static NumberingScheme scheme(String prefix, DateFormatToken dateFormat, int padding, String suffix,
                                          String separator, long nextNumber, ResetFrequency frequency) {
        return NumberingScheme.create("Test scheme", "INV", null, prefix, dateFormat, padding, suffix,
            separator, nextNumber, frequency, JAN_15_2025, "admin");
    }

    @Nested
    @DisplayName("Formatting")
    class Formatting {

        @Test
        @DisplayName("prefix, year and padded sequence joined by dash")
        void formatsInvoiceNumber() {
            NumberingScheme scheme = scheme("INV", DateFormatToken.YYYY, 4, null, "-", 1, ResetFrequency.YEARLY);

            assertEquals("INV-2025-0001", scheme.format(JAN_15_2025));
        }

        @Test
        @DisplayName("year-month token with slash separator")
        void formatsYearMonthWithSlash() {
            NumberingScheme scheme = scheme("VCH", DateFormatToken.YYYYMM, 5, null, "/", 1, ResetFrequency.MONTHLY);

            assertEquals("VCH/202501/00001", scheme.format(JAN_15_2025));
        }

        @Test
        @DisplayName("components that are not configured are skipped")
        void skipsMissingComponents() {
            NumberingScheme scheme = scheme("PO", null, 3, "END", "-", 5, ResetFrequency.NEVER);

            assertEquals("PO-005-END", scheme.format(JAN_15_2025));
        }

        @Test
        @DisplayName("sequence longer than padding is not truncated")
        void doesNotTruncateLongSequence() {
            NumberingScheme scheme = scheme("JE", null, 2, null, "-", 1234, ResetFrequency.NEVER);

            assertEquals("JE-1234", scheme.format(JAN_15_2025));
        }

        @Test
        @DisplayName("empty separator concatenates components")
        void emptySeparator() {
            NumberingScheme scheme = scheme("SI", DateFormatToken.YYMMDD, 4, null, "", 7, ResetFrequency.DAILY);

            assertEquals("SI2501150007", scheme.format(JAN_15_2025));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void rejectsPaddingOutOfRange() {
            assertThrows(ValidationException.class,
                () -> scheme("INV", null, 0, null, "-", 1, ResetFrequency.NEVER));
            assertThrows(ValidationException.class,
                () -> scheme("INV", null, 11, null, "-", 1, ResetFrequency.NEVER));
        }

        @Test
        void rejectsNextNumberBelowOne() {
            assertThrows(ValidationException.class,
                () -> scheme("INV", null, 4, null, "-", 0, ResetFrequency.NEVER));
        }

        @Test
        void requiresAtLeastOneFixedComponent() {
            ValidationException e = assertThrows(ValidationException.class,
                () -> scheme(null, null, 4, null, "-", 1, ResetFrequency.NEVER));
            assertTrue(e.getMessage().contains("prefix"));
        }

        @Test
        void rejectsLongSeparator() {
            assertThrows(ValidationException.class,
                () -> scheme("INV", null, 4, null, "------", 1, ResetFrequency.NEVER));
        }

        @Test
        void rejectsBlankDocumentType() {
            assertThrows(ValidationException.class, () -> NumberingScheme.create("Name", " ", null, "X",
                null, 4, null, "-", 1, ResetFrequency.NEVER, JAN_15_2025, "admin"));
        }
    }

    @Nested
    @DisplayName("Counter reset")
    class Reset {

        @Test
        @DisplayName("yearly scheme restarts at 1 in a new year")
        void yearlyResetAcrossYearBoundary() {
            NumberingScheme scheme = scheme("INV", DateFormatToken.YYYY, 4, null, "-", 42, ResetFrequency.YEARLY)
                .withCounter(42, LocalDate.of(2024, 12, 31));

            NumberingScheme current = scheme.applyReset(JAN_15_2025);

            assertEquals(1, current.getNextNumber());
            assertEquals(JAN_15_2025, current.getLastResetDate());
            assertEquals("INV-2025-0001", current.format(JAN_15_2025));
        }

        @Test
        @DisplayName("monthly scheme keeps counting within the same month")
        void monthlyNoResetWithinMonth() {
            NumberingScheme scheme = scheme("VCH", DateFormatToken.YYYYMM, 5, null, "/", 9, ResetFrequency.MONTHLY)
                .withCounter(9, LocalDate.of(2025, 1, 1));

            assertFalse(scheme.shouldReset(LocalDate.of(2025, 1, 31)));
            assertSame(scheme, scheme.applyReset(LocalDate.of(2025, 1, 31)));
        }

        @Test
        @DisplayName("back-dated document does not reset the counter")
        void backDatedDocumentDoesNotReset() {
            NumberingScheme scheme = scheme("INV", DateFormatToken.YYYY, 4, null, "-", 12, ResetFrequency.YEARLY);

            assertFalse(scheme.shouldReset(LocalDate.of(2024, 6, 1)));
        }

        @Test
        @DisplayName("document dated before the current counter period is refused")
        void documentBeforeCurrentPeriodIsRefused() {
            NumberingScheme yearly = scheme("JE", DateFormatToken.YYYY, 4, null, "-", 2, ResetFrequency.YEARLY)
                .withCounter(2, LocalDate.of(2026, 1, 2));
            NumberingScheme monthly = scheme("VCH", DateFormatToken.YYYYMM, 5, null, "/", 2, ResetFrequency.MONTHLY)
                .withCounter(2, LocalDate.of(2025, 2, 1));
            NumberingScheme daily = scheme("SI", DateFormatToken.YYMMDD, 4, null, "", 2, ResetFrequency.DAILY)
                .withCounter(2, JAN_15_2025);

            assertThrows(ValidationException.class, () -> yearly.checkNotBeforeCurrentPeriod(LocalDate.of(2025, 12, 31)));
            assertThrows(ValidationException.class, () -> monthly.checkNotBeforeCurrentPeriod(LocalDate.of(2025, 1, 31)));
            assertThrows(ValidationException.class, () -> daily.checkNotBeforeCurrentPeriod(LocalDate.of(2025, 1, 14)));
        }

        @Test
        @DisplayName("earlier date inside the current period is still numbered")
        void earlierDateInSamePeriodIsAllowed() {
            NumberingScheme yearly = scheme("JE", DateFormatToken.YYYY, 4, null, "-", 5, ResetFrequency.YEARLY)
                .withCounter(5, LocalDate.of(2025, 6, 1));
            NumberingScheme never = scheme("JE", DateFormatToken.YYYY, 4, null, "-", 5, ResetFrequency.NEVER)
                .withCounter(5, LocalDate.of(2026, 1, 2));

            assertDoesNotThrow(() -> yearly.checkNotBeforeCurrentPeriod(LocalDate.of(2025, 1, 3)));
            assertDoesNotThrow(() -> never.checkNotBeforeCurrentPeriod(LocalDate.of(2024, 12, 31)));
            assertDoesNotThrow(() -> yearly.withCounter(5, null).checkNotBeforeCurrentPeriod(LocalDate.of(2020, 1, 1)));
        }

        @Test
        @DisplayName("scheme never reset only gets its reset date stamped")
        void neverResetSchemeKeepsAdministrativeCounter() {
            NumberingScheme scheme = scheme("INV", DateFormatToken.YYYY, 4, null, "-", 500, ResetFrequency.YEARLY)
                .withCounter(500, null);

            NumberingScheme current = scheme.applyReset(JAN_15_2025);

            assertEquals(500, current.getNextNumber());
            assertEquals(JAN_15_2025, current.getLastResetDate());
        }

        @Test
        void advanceIncrementsCounter() {
            NumberingScheme scheme = scheme("INV", null, 4, null, "-", 3, ResetFrequency.NEVER);

            assertEquals(4, scheme.advance().getNextNumber());
            assertEquals(3, scheme.getNextNumber());
        }
    }

    @Test
    void activeKeyDistinguishesScopes() {
        NumberingScheme defaultScheme = scheme("INV", null, 4, null, "-", 1, ResetFrequency.NEVER);
        NumberingScheme scoped = NumberingScheme.create("Scoped", "INV", "KHI", "INV", null, 4, null, "-", 1,
            ResetFrequency.NEVER, JAN_15_2025, "admin");

        assertEquals("INV:", defaultScheme.activeKey());
        assertEquals("INV:KHI", scoped.activeKey());
    }
}
