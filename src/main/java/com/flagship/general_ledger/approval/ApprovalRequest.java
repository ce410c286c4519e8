package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.exception.AuthorizationException;
import com.flagship.general_ledger.exception.InvalidStateException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One document's passage through an approval workflow.
 *
 * Transitions return new instances; the engine persists them under the row lock.
 */
@Value
public class ApprovalRequest {
    UUID id;
    UUID workflowId;
    String documentType;
    UUID documentId;
    BigDecimal amount;
    int currentLevel;
    String currentApprover;
    ApprovalStatus status;
    String requester;
    Instant requestedAt;
    Instant completedAt;
    Long version;

    static ApprovalRequest start(ApprovalWorkflow workflow, ApprovalLevel firstLevel, UUID documentId,
                                 BigDecimal amount, String requester, Instant now) {
        return new ApprovalRequest(UUID.randomUUID(), workflow.getId(), workflow.getDocumentType(), documentId,
            amount, firstLevel.getLevelNumber(), firstLevel.getApprover(), ApprovalStatus.PENDING,
            requester, now, null, null);
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    /**
     * Key shared by all open requests of the same document; null once the request is closed.
     */
    public String openKey() {
        return status.isOpen() ? openKey(documentType, documentId) : null;
    }

    static String openKey(String documentType, UUID documentId) {
        return documentType + ":" + documentId;
    }

    /**
     * @throws InvalidStateException unless the request is pending
     * @throws AuthorizationException unless {@code approver} is the current approver
     */
    void checkActionableBy(String approver) {
        if (!isPending()) {
            throw new InvalidStateException("Approval request " + id + " is already " + status);
        }
        if (!currentApprover.equals(approver)) {
            throw new AuthorizationException(String.format(
                "%s is not the assigned approver for request %s. Current approver: %s",
                approver, id, currentApprover));
        }
    }

    /**
     * Segregation of duties: the requester may never approve their own document.
     */
    void checkNotRequester(String approver) {
        if (requester.equals(approver)) {
            throw new AuthorizationException(
                "Segregation of duties violation: the requester cannot approve their own request");
        }
    }

    ApprovalRequest advanceTo(ApprovalLevel level) {
        return new ApprovalRequest(id, workflowId, documentType, documentId, amount, level.getLevelNumber(),
            level.getApprover(), status, requester, requestedAt, completedAt, version);
    }

    ApprovalRequest reassignTo(String delegate) {
        return new ApprovalRequest(id, workflowId, documentType, documentId, amount, currentLevel,
            delegate, status, requester, requestedAt, completedAt, version);
    }

    ApprovalRequest close(ApprovalStatus finalStatus, Instant now) {
        return new ApprovalRequest(id, workflowId, documentType, documentId, amount, currentLevel,
            currentApprover, finalStatus, requester, requestedAt, now, version);
    }
}
