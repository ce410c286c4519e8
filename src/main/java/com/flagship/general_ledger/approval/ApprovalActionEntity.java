package com.flagship.general_ledger.approval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row. Hibernate never issues an UPDATE for it, and the database
 * trigger on {@code approval_actions} rejects UPDATE and DELETE from any client.
 */
@Entity
@Immutable
@Table(
    name = "approval_actions",
    indexes = @Index(name = "idx_approval_actions_request", columnList = "request_id, sequence_number")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalActionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "request_id", nullable = false, updatable = false)
    private UUID requestId;

    @Column(name = "level_number", nullable = false, updatable = false)
    private int levelNumber;

    @Column(name = "approver", nullable = false, updatable = false, length = 100)
    private String approver;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 20)
    private ApprovalActionType action;

    @Column(name = "comments", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String comments;

    @Column(name = "acted_at", nullable = false, updatable = false)
    private Instant actedAt;

    @Column(name = "origin_address", nullable = false, updatable = false, length = 45)
    private String originAddress;

    @Column(name = "delegated_to", updatable = false, length = 100)
    private String delegatedTo;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static ApprovalActionEntity fromDomain(ApprovalAction action) {
        ApprovalActionEntity entity = new ApprovalActionEntity();
        entity.id = action.getId();
        entity.requestId = action.getRequestId();
        entity.levelNumber = action.getLevelNumber();
        entity.approver = action.getApprover();
        entity.action = action.getAction();
        entity.comments = action.getComments();
        entity.actedAt = action.getActedAt();
        entity.originAddress = action.getOriginAddress();
        entity.delegatedTo = action.getDelegatedTo();
        return entity;
    }

    ApprovalAction toDomain() {
        return new ApprovalAction(id, requestId, levelNumber, approver, action, comments,
            actedAt, originAddress, delegatedTo);
    }
}
