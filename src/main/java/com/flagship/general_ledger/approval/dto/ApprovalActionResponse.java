package com.flagship.general_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.approval.ApprovalAction;
import com.flagship.general_ledger.approval.ApprovalActionType;
import lombok.Value;

import java.time.Instant;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalActionResponse {

    @JsonProperty("level_number")
    int levelNumber;

    @JsonProperty("approver")
    String approver;

    @JsonProperty("action")
    ApprovalActionType action;

    @JsonProperty("comments")
    String comments;

    @JsonProperty("acted_at")
    Instant actedAt;

    @JsonProperty("origin_address")
    String originAddress;

    @JsonProperty("delegated_to")
    String delegatedTo;

    public static ApprovalActionResponse from(ApprovalAction action) {
        return new ApprovalActionResponse(action.getLevelNumber(), action.getApprover(), action.getAction(),
            action.getComments(), action.getActedAt(), action.getOriginAddress(), action.getDelegatedTo());
    }
}
