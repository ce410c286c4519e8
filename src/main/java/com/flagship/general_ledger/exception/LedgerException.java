package com.flagship.general_ledger.exception;

/**
 * Base exception for every business-rule failure raised by the ledger.
 *
 * All subclasses are unchecked so that they roll back the enclosing
 * transaction. Only {@link ConcurrencyConflictException} is retryable.
 */
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may retry the same call unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}
