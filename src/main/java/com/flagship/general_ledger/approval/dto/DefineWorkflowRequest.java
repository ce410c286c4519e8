package com.flagship.general_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class DefineWorkflowRequest {

    @NotBlank(message = "Workflow name is required")
    @JsonProperty("workflow_name")
    String workflowName;

    @NotBlank(message = "Document type is required")
    @JsonProperty("document_type")
    String documentType;

    @NotEmpty(message = "At least one level is required")
    @Valid
    @JsonProperty("levels")
    List<ApprovalLevelRequest> levels;

    @Builder.Default
    @JsonProperty("is_active")
    boolean active = true;
}
