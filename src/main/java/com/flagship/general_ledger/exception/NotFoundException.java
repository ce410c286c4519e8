package com.flagship.general_ledger.exception;

/**
 * Missing scheme, workflow, level, request or voucher.
 */
public class NotFoundException extends LedgerException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(ERROR_CODE, message);
    }

    public static NotFoundException of(String what, Object id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
