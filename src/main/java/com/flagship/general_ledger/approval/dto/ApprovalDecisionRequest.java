package com.flagship.general_ledger.approval.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Body of approve, reject, return and delegate calls. {@code delegateTo} is only read by delegate.
 */
@Value
@Builder
@Jacksonized
public class ApprovalDecisionRequest {

    @Size(max = 2000)
    @JsonProperty("comments")
    String comments;

    @JsonProperty("delegate_to")
    String delegateTo;

    public static ApprovalDecisionRequest empty() {
        return ApprovalDecisionRequest.builder().build();
    }
}
