package com.flagship.general_ledger.approval;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record of one approver decision.
 */
@Value
public class ApprovalAction {

    static final String UNKNOWN_ORIGIN = "0.0.0.0";

    UUID id;
    UUID requestId;
    int levelNumber;
    String approver;
    ApprovalActionType action;
    String comments;
    Instant actedAt;
    String originAddress;
    String delegatedTo;

    static ApprovalAction record(ApprovalRequest request, String approver, ApprovalActionType action,
                                 String comments, String originAddress, String delegatedTo, Instant now) {
        return new ApprovalAction(UUID.randomUUID(), request.getId(), request.getCurrentLevel(), approver, action,
            comments != null ? comments : "",
            now,
            originAddress != null && !originAddress.isBlank() ? originAddress : UNKNOWN_ORIGIN,
            delegatedTo);
    }
}
