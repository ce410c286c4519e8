package com.flagship.general_ledger.exception;

/**
 * An approval request (or an active configuration record) already exists
 * for the same key. Bulk tooling treats this as a skip condition.
 */
public class DuplicateRequestException extends LedgerException {

    public static final String ERROR_CODE = "DUPLICATE_REQUEST";

    public DuplicateRequestException(String message) {
        super(ERROR_CODE, message);
    }

    public DuplicateRequestException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
