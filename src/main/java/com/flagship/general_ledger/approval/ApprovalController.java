package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.approval.dto.ApprovalActionResponse;
import com.flagship.general_ledger.approval.dto.ApprovalDecisionRequest;
import com.flagship.general_ledger.approval.dto.ApprovalRequestResponse;
import com.flagship.general_ledger.web.RequestOrigin;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Approver actions on approval requests. The acting user comes from {@code X-User}.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalEngine approvalEngine;

    @PostMapping("/{id}/approve")
    public ApprovalResult approve(@PathVariable("id") UUID requestId,
                                  @RequestHeader(RequestOrigin.USER_HEADER) String user,
                                  @Valid @RequestBody(required = false) ApprovalDecisionRequest body,
                                  HttpServletRequest servletRequest) {
        ApprovalDecisionRequest decision = body != null ? body : ApprovalDecisionRequest.empty();
        return approvalEngine.approve(requestId, user, decision.getComments(), RequestOrigin.addressOf(servletRequest));
    }

    @PostMapping("/{id}/reject")
    public ApprovalRequestResponse reject(@PathVariable("id") UUID requestId,
                                          @RequestHeader(RequestOrigin.USER_HEADER) String user,
                                          @Valid @RequestBody(required = false) ApprovalDecisionRequest body,
                                          HttpServletRequest servletRequest) {
        ApprovalDecisionRequest decision = body != null ? body : ApprovalDecisionRequest.empty();
        return ApprovalRequestResponse.from(approvalEngine.reject(
            requestId, user, decision.getComments(), RequestOrigin.addressOf(servletRequest)));
    }

    @PostMapping("/{id}/return")
    public ApprovalRequestResponse returnToRequester(@PathVariable("id") UUID requestId,
                                                     @RequestHeader(RequestOrigin.USER_HEADER) String user,
                                                     @Valid @RequestBody(required = false) ApprovalDecisionRequest body,
                                                     HttpServletRequest servletRequest) {
        ApprovalDecisionRequest decision = body != null ? body : ApprovalDecisionRequest.empty();
        return ApprovalRequestResponse.from(approvalEngine.returnToRequester(
            requestId, user, decision.getComments(), RequestOrigin.addressOf(servletRequest)));
    }

    @PostMapping("/{id}/delegate")
    public ApprovalRequestResponse delegate(@PathVariable("id") UUID requestId,
                                            @RequestHeader(RequestOrigin.USER_HEADER) String user,
                                            @Valid @RequestBody ApprovalDecisionRequest body,
                                            HttpServletRequest servletRequest) {
        return ApprovalRequestResponse.from(approvalEngine.delegate(
            requestId, user, body.getDelegateTo(), body.getComments(), RequestOrigin.addressOf(servletRequest)));
    }

    @GetMapping("/pending")
    public List<ApprovalRequestResponse> pending(@RequestParam("approver") String approver) {
        return approvalEngine.getPendingApprovals(approver).stream()
            .map(ApprovalRequestResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public ApprovalRequestResponse getRequest(@PathVariable("id") UUID requestId) {
        return ApprovalRequestResponse.from(approvalEngine.getRequest(requestId));
    }

    @GetMapping("/{id}/actions")
    public List<ApprovalActionResponse> actions(@PathVariable("id") UUID requestId) {
        return approvalEngine.getActionHistory(requestId).stream()
            .map(ApprovalActionResponse::from)
            .toList();
    }
}
