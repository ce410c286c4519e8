package com.flagship.general_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.approval.ApprovalLevel;
import com.flagship.general_ledger.approval.ApprovalWorkflow;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class WorkflowResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("workflow_name")
    String workflowName;

    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("levels")
    List<Level> levels;

    @Value
    public static class Level {
        @JsonProperty("level_number")
        int levelNumber;

        @JsonProperty("approver")
        String approver;

        @JsonProperty("min_amount")
        BigDecimal minAmount;

        @JsonProperty("max_amount")
        BigDecimal maxAmount;

        @JsonProperty("is_mandatory")
        boolean mandatory;

        static Level from(ApprovalLevel level) {
            return new Level(level.getLevelNumber(), level.getApprover(), level.getMinAmount(),
                level.getMaxAmount(), level.isMandatory());
        }
    }

    public static WorkflowResponse from(ApprovalWorkflow workflow) {
        return new WorkflowResponse(workflow.getId(), workflow.getWorkflowName(), workflow.getDocumentType(),
            workflow.isActive(), workflow.getLevels().stream().map(Level::from).toList());
    }
}
