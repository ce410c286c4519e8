package com.flagship.general_ledger.approval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of an approval: either complete, or advanced to the next level.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalResult {

    @JsonProperty("request_id")
    UUID requestId;

    @JsonProperty("approved")
    boolean approved;

    @JsonProperty("status")
    ApprovalStatus status;

    @JsonProperty("next_level")
    Integer nextLevel;

    @JsonProperty("next_approver")
    String nextApprover;

    @JsonProperty("message")
    String message;

    static ApprovalResult completed(UUID requestId) {
        return new ApprovalResult(requestId, true, ApprovalStatus.APPROVED, null, null,
            "Approval request fully approved");
    }

    static ApprovalResult advanced(UUID requestId, int fromLevel, ApprovalLevel next) {
        return new ApprovalResult(requestId, false, ApprovalStatus.PENDING, next.getLevelNumber(),
            next.getApprover(),
            "Approved at level " + fromLevel + ". Moved to level " + next.getLevelNumber() + ".");
    }
}
