package com.flagship.general_ledger.posting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.approval.ApprovalResult;
import com.flagship.general_ledger.posting.ApprovalPostingResult;
import lombok.Value;

@Value
public class ApprovalPostingResponse {

    @JsonProperty("approval")
    ApprovalResult approval;

    @JsonProperty("posted")
    boolean posted;

    @JsonProperty("voucher")
    VoucherResponse voucher;

    public static ApprovalPostingResponse from(ApprovalPostingResult result) {
        return new ApprovalPostingResponse(result.getApproval(), result.isPosted(),
            VoucherResponse.from(result.getVoucher()));
    }
}
