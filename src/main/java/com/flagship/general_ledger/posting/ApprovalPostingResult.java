package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.approval.ApprovalResult;
import com.flagship.general_ledger.ledger.Voucher;
import lombok.Value;

/**
 * An approval of a voucher and, when it completed the request, the posted voucher.
 */
@Value
public class ApprovalPostingResult {
    ApprovalResult approval;
    Voucher voucher;

    public boolean isPosted() {
        return approval.isApproved();
    }
}
