package com.flagship.general_ledger.exception;

/**
 * Malformed input or configuration.
 */
public class ValidationException extends LedgerException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
