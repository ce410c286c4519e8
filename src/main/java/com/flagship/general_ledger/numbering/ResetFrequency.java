package com.flagship.general_ledger.numbering;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * How often a numbering scheme restarts its sequence at 1.
 */
public enum ResetFrequency {
    NEVER {
        @Override
        public boolean isBoundaryCrossed(LocalDate lastResetDate, LocalDate asOfDate) {
            return false;
        }
    },
    YEARLY {
        @Override
        public boolean isBoundaryCrossed(LocalDate lastResetDate, LocalDate asOfDate) {
            return asOfDate.getYear() > lastResetDate.getYear();
        }
    },
    MONTHLY {
        @Override
        public boolean isBoundaryCrossed(LocalDate lastResetDate, LocalDate asOfDate) {
            return YearMonth.from(asOfDate).isAfter(YearMonth.from(lastResetDate));
        }
    },
    DAILY {
        @Override
        public boolean isBoundaryCrossed(LocalDate lastResetDate, LocalDate asOfDate) {
            return asOfDate.isAfter(lastResetDate);
        }
    };

    /**
     * True when {@code asOfDate} falls in a later period than {@code lastResetDate}.
     * Back-dated documents never trigger a reset.
     */
    public abstract boolean isBoundaryCrossed(LocalDate lastResetDate, LocalDate asOfDate);
}
