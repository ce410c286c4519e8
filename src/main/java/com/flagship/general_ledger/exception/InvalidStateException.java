package com.flagship.general_ledger.exception;

/**
 * The operation is not allowed for the record's current status,
 * e.g. posting a voucher that is already posted.
 */
public class InvalidStateException extends LedgerException {

    public static final String ERROR_CODE = "INVALID_STATE";

    public InvalidStateException(String message) {
        super(ERROR_CODE, message);
    }
}
