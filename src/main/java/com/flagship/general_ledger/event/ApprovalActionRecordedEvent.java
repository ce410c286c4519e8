package com.flagship.general_ledger.event;

import com.flagship.general_ledger.approval.ApprovalAction;
import com.flagship.general_ledger.approval.ApprovalRequest;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An approver acted on a request. Carries the request state after the action,
 * so consumers can notify the next approver or the requester.
 */
@Value
public class ApprovalActionRecordedEvent implements LedgerEvent {
    UUID eventId;
    UUID requestId;
    String documentType;
    UUID documentId;
    String action;
    int levelNumber;
    String actedBy;
    String delegatedTo;
    String requestStatus;
    String nextApprover;
    String requester;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ApprovalActionRecorded";

    @Override
    public UUID getAggregateId() {
        return requestId;
    }

    @Override
    public String getAggregateType() {
        return ApprovalRequestedEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ApprovalActionRecordedEvent of(ApprovalRequest request, ApprovalAction action) {
        return new ApprovalActionRecordedEvent(
            UUID.randomUUID(),
            request.getId(),
            request.getDocumentType(),
            request.getDocumentId(),
            action.getAction().name(),
            action.getLevelNumber(),
            action.getApprover(),
            action.getDelegatedTo(),
            request.getStatus().name(),
            request.isPending() ? request.getCurrentApprover() : null,
            request.getRequester(),
            action.getActedAt()
        );
    }
}
