package com.flagship.general_ledger.approval;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for approval workflows and, through the cascade, their levels.
 *
 * {@code activeDocumentType} is unique and only set while the workflow is active,
 * which allows a single active workflow per document type.
 */
@Entity
@Table(name = "approval_workflows")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalWorkflowEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "workflow_name", nullable = false, length = 100)
    private String workflowName;

    @Column(name = "document_type", nullable = false, updatable = false, length = 50)
    private String documentType;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "active_document_type", unique = true, length = 50)
    private String activeDocumentType;

    @OneToMany(mappedBy = "workflow", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("levelNumber ASC")
    private List<ApprovalLevelEntity> levels = new ArrayList<>();

    @Column(name = "created_by", updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    static ApprovalWorkflowEntity fromDomain(ApprovalWorkflow workflow) {
        ApprovalWorkflowEntity entity = new ApprovalWorkflowEntity();
        entity.id = workflow.getId();
        entity.workflowName = workflow.getWorkflowName();
        entity.documentType = workflow.getDocumentType();
        entity.active = workflow.isActive();
        entity.activeDocumentType = workflow.isActive() ? workflow.getDocumentType() : null;
        entity.createdBy = workflow.getCreatedBy();
        entity.createdAt = workflow.getCreatedAt();
        for (ApprovalLevel level : workflow.getLevels()) {
            entity.levels.add(ApprovalLevelEntity.fromDomain(level, entity));
        }
        return entity;
    }

    ApprovalWorkflow toDomain() {
        return new ApprovalWorkflow(
            id,
            workflowName,
            documentType,
            active,
            levels.stream().map(ApprovalLevelEntity::toDomain).toList(),
            createdBy,
            createdAt
        );
    }

    void deactivate() {
        this.active = false;
        this.activeDocumentType = null;
    }
}
