package com.flagship.general_ledger.numbering;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Date component of a document number.
 */
public enum DateFormatToken {
    YYYY("yyyy"),
    YY("yy"),
    YYMM("yyMM"),
    YYYYMM("yyyyMM"),
    YYMMDD("yyMMdd"),
    YYYYMMDD("yyyyMMdd");

    private final DateTimeFormatter formatter;

    DateFormatToken(String pattern) {
        this.formatter = DateTimeFormatter.ofPattern(pattern);
    }

    public String render(LocalDate date) {
        return formatter.format(date);
    }
}
