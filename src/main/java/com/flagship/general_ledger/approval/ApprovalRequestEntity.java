package com.flagship.general_ledger.approval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for approval requests.
 *
 * Identity, document and amount are fixed at creation. Routing state changes only
 * through {@link #updateFromDomain}, called by the engine while it holds the row lock.
 */
@Entity
@Table(
    name = "approval_requests",
    indexes = {
        @Index(name = "idx_approval_requests_approver_status", columnList = "current_approver, status"),
        @Index(name = "idx_approval_requests_document", columnList = "document_type, document_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workflow_id", nullable = false, updatable = false)
    private UUID workflowId;

    @Column(name = "document_type", nullable = false, updatable = false, length = 50)
    private String documentType;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "current_level", nullable = false)
    private int currentLevel;

    @Column(name = "current_approver", nullable = false, length = 100)
    private String currentApprover;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApprovalStatus status;

    @Column(name = "open_key", unique = true, length = 100)
    private String openKey;

    @Column(name = "requester", nullable = false, updatable = false, length = 100)
    private String requester;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        updatedAt = requestedAt != null ? requestedAt : Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    static ApprovalRequestEntity fromDomain(ApprovalRequest request) {
        ApprovalRequestEntity entity = new ApprovalRequestEntity();
        entity.id = request.getId();
        entity.workflowId = request.getWorkflowId();
        entity.documentType = request.getDocumentType();
        entity.documentId = request.getDocumentId();
        entity.amount = request.getAmount();
        entity.requester = request.getRequester();
        entity.requestedAt = request.getRequestedAt();
        entity.updateFromDomain(request);
        return entity;
    }

    ApprovalRequest toDomain() {
        return new ApprovalRequest(id, workflowId, documentType, documentId, amount, currentLevel,
            currentApprover, status, requester, requestedAt, completedAt, version);
    }

    void updateFromDomain(ApprovalRequest request) {
        if (id != null && !id.equals(request.getId())) {
            throw new IllegalArgumentException("Request id mismatch: " + request.getId() + " != " + id);
        }
        this.currentLevel = request.getCurrentLevel();
        this.currentApprover = request.getCurrentApprover();
        this.status = request.getStatus();
        this.openKey = request.openKey();
        this.completedAt = request.getCompletedAt();
    }
}
