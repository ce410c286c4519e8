package com.flagship.general_ledger.exception;

/**
 * Lock-wait timeout or deadlock reported by the database.
 * The only error a caller is expected to retry.
 */
public class ConcurrencyConflictException extends LedgerException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
