package com.flagship.general_ledger.approval;

public enum ApprovalActionType {
    APPROVED,
    REJECTED,
    DELEGATED,
    RETURNED
}
