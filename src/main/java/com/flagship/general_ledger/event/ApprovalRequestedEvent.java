package com.flagship.general_ledger.event;

import com.flagship.general_ledger.approval.ApprovalRequest;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A document entered approval. Notifies the level 1 approver.
 */
@Value
public class ApprovalRequestedEvent implements LedgerEvent {
    UUID eventId;
    UUID requestId;
    String documentType;
    UUID documentId;
    BigDecimal amount;
    String requester;
    int currentLevel;
    String currentApprover;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ApprovalRequested";
    public static final String AGGREGATE_TYPE = "ApprovalRequest";

    @Override
    public UUID getAggregateId() {
        return requestId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ApprovalRequestedEvent fromRequest(ApprovalRequest request) {
        return new ApprovalRequestedEvent(
            UUID.randomUUID(),
            request.getId(),
            request.getDocumentType(),
            request.getDocumentId(),
            request.getAmount(),
            request.getRequester(),
            request.getCurrentLevel(),
            request.getCurrentApprover(),
            request.getRequestedAt()
        );
    }
}
