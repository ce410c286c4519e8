package com.flagship.general_ledger.approval;

/**
 * PENDING is the only non-terminal status.
 * PENDING and APPROVED requests are "open": at most one per document.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED;

    public boolean isOpen() {
        return this == PENDING || this == APPROVED;
    }
}
