package com.flagship.general_ledger.numbering;

import lombok.Value;

import java.time.LocalDate;

/**
 * Read-only summary of the active scheme for a document type.
 */
@Value
public class NumberingSchemeInfo {
    String schemeName;
    String documentType;
    String scope;
    String formatPreview;
    long nextNumber;
    ResetFrequency resetFrequency;
    LocalDate lastResetDate;
}
