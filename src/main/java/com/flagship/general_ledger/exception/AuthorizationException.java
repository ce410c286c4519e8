package com.flagship.general_ledger.exception;

/**
 * Wrong approver, self-approval, or an invalid delegation target.
 */
public class AuthorizationException extends LedgerException {

    public static final String ERROR_CODE = "AUTHORIZATION_ERROR";

    public AuthorizationException(String message) {
        super(ERROR_CODE, message);
    }
}
