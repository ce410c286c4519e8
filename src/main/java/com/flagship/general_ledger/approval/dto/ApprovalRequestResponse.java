package com.flagship.general_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.approval.ApprovalRequest;
import com.flagship.general_ledger.approval.ApprovalStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ApprovalRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("document_id")
    UUID documentId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("current_level")
    int currentLevel;

    @JsonProperty("current_approver")
    String currentApprover;

    @JsonProperty("status")
    ApprovalStatus status;

    @JsonProperty("requester")
    String requester;

    @JsonProperty("requested_at")
    Instant requestedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static ApprovalRequestResponse from(ApprovalRequest request) {
        return ApprovalRequestResponse.builder()
            .id(request.getId())
            .documentType(request.getDocumentType())
            .documentId(request.getDocumentId())
            .amount(request.getAmount())
            .currentLevel(request.getCurrentLevel())
            .currentApprover(request.getCurrentApprover())
            .status(request.getStatus())
            .requester(request.getRequester())
            .requestedAt(request.getRequestedAt())
            .completedAt(request.getCompletedAt())
            .build();
    }
}
