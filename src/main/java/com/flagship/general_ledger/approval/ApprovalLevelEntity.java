package com.flagship.general_ledger.approval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(
    name = "approval_levels",
    uniqueConstraints = @UniqueConstraint(name = "uk_approval_levels_workflow_level",
        columnNames = {"workflow_id", "level_number"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApprovalLevelEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false, updatable = false)
    private ApprovalWorkflowEntity workflow;

    @Column(name = "level_number", nullable = false, updatable = false)
    private int levelNumber;

    @Column(name = "approver", nullable = false, length = 100)
    private String approver;

    @Column(name = "min_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal minAmount;

    @Column(name = "max_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal maxAmount;

    @Column(name = "is_mandatory", nullable = false)
    private boolean mandatory;

    static ApprovalLevelEntity fromDomain(ApprovalLevel level, ApprovalWorkflowEntity workflow) {
        ApprovalLevelEntity entity = new ApprovalLevelEntity();
        entity.id = level.getId();
        entity.workflow = workflow;
        entity.levelNumber = level.getLevelNumber();
        entity.approver = level.getApprover();
        entity.minAmount = level.getMinAmount();
        entity.maxAmount = level.getMaxAmount();
        entity.mandatory = level.isMandatory();
        return entity;
    }

    ApprovalLevel toDomain() {
        return new ApprovalLevel(id, levelNumber, approver, minAmount, maxAmount, mandatory);
    }
}
