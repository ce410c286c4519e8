package com.flagship.general_ledger.numbering;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResetFrequencyTest {

    @ParameterizedTest(name = "{0}: last reset {1}, as of {2} -> {3}")
    @CsvSource({
        "NEVER,   2024-01-01, 2030-01-01, false",
        "YEARLY,  2024-12-31, 2025-01-01, true",
        "YEARLY,  2025-01-01, 2025-12-31, false",
        "MONTHLY, 2025-01-31, 2025-02-01, true",
        "MONTHLY, 2025-01-01, 2025-01-31, false",
        "MONTHLY, 2024-12-15, 2025-01-10, true",
        "DAILY,   2025-01-15, 2025-01-16, true",
        "DAILY,   2025-01-15, 2025-01-15, false",
        "DAILY,   2025-01-15, 2025-01-14, false"
    })
    void detectsPeriodBoundaries(ResetFrequency frequency, LocalDate lastReset, LocalDate asOf, boolean expected) {
        assertEquals(expected, frequency.isBoundaryCrossed(lastReset, asOf));
    }
}
