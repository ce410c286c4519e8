package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.event.ApprovalActionRecordedEvent;
import com.flagship.general_ledger.event.ApprovalRequestedEvent;
import com.flagship.general_ledger.exception.AuthorizationException;
import com.flagship.general_ledger.exception.ConcurrencyConflictException;
import com.flagship.general_ledger.exception.DuplicateRequestException;
import com.flagship.general_ledger.exception.InvalidStateException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Multi-level approval of monetary documents.
 *
 * <pre>
 * PENDING --approve (last level)--> APPROVED
 * PENDING --approve (more levels)--> PENDING, next level
 * PENDING --reject--> REJECTED
 * PENDING --delegate--> PENDING, new approver
 * PENDING --return--> CANCELLED
 * </pre>
 *
 * Every action locks the request row, re-checks status and approver under the lock,
 * and writes the state change, its audit action and its event in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalEngine {

    private final ApprovalWorkflowRepository workflowRepository;
    private final ApprovalRequestRepository requestRepository;
    private final ApprovalActionRepository actionRepository;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Starts approval of a document at level 1 of the active workflow for its type.
     *
     * @throws NotFoundException if there is no active workflow or no mandatory level 1
     * @throws DuplicateRequestException if the document already has a pending or approved request
     * @throws ValidationException if no level covers the amount and gaps are not tolerated
     */
    @Transactional
    public ApprovalRequest initiate(String documentType, UUID documentId, BigDecimal amount, String requester) {
        requireText(documentType, "Document type");
        requireText(requester, "Requester");
        if (documentId == null) {
            throw new ValidationException("Document id is required");
        }
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException("Amount must be zero or positive");
        }

        ApprovalWorkflow workflow = workflowRepository.findByActiveDocumentType(documentType)
            .map(ApprovalWorkflowEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(
                "No active approval workflow found for document type: " + documentType));

        if (requestRepository.existsByOpenKey(ApprovalRequest.openKey(documentType, documentId))) {
            throw new DuplicateRequestException(
                "Approval request already exists for " + documentType + " " + documentId);
        }

        ApprovalLevel firstLevel = workflow.firstLevel()
            .orElseThrow(() -> new NotFoundException(
                "Workflow " + workflow.getWorkflowName() + " has no mandatory level 1"));

        if (properties.getApproval().getBandGapPolicy() == BandGapPolicy.REQUIRE_COVERING_LEVEL) {
            BigDecimal ceiling = workflow.highestMandatoryMaxAmount().orElse(BigDecimal.ZERO);
            if (amount.compareTo(ceiling) > 0) {
                throw new ValidationException(String.format(
                    "Amount %s exceeds the highest approval band (%s) of workflow %s",
                    amount, ceiling, workflow.getWorkflowName()));
            }
        }

        ApprovalRequest request = ApprovalRequest.start(workflow, firstLevel, documentId, amount, requester,
            Instant.now(clock));
        ApprovalRequest saved;
        try {
            saved = requestRepository.saveAndFlush(ApprovalRequestEntity.fromDomain(request)).toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateRequestException(
                "Approval request already exists for " + documentType + " " + documentId, e);
        }

        outboxService.saveEvent(ApprovalRequestedEvent.fromRequest(saved));
        log.info("Approval initiated: requestId={}, documentType={}, documentId={}, amount={}, approver={}",
            saved.getId(), documentType, documentId, amount, saved.getCurrentApprover());
        return saved;
    }

    /**
     * Approves at the current level and routes to the next level whose band covers
     * the amount, or completes the request.
     *
     * @throws InvalidStateException unless the request is pending
     * @throws AuthorizationException if {@code approver} is not the current approver or is the requester
     * @throws ValidationException if no higher level covers an amount above one of their bands and gaps are not tolerated
     */
    @Transactional
    public ApprovalResult approve(UUID requestId, String approver, String comments, String originAddress) {
        requireText(approver, "Approver");
        MDC.put(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY, requestId.toString());
        try {
            ApprovalRequestEntity entity = lock(requestId);
            ApprovalRequest request = entity.toDomain();
            try {
                request.checkActionableBy(approver);
                request.checkNotRequester(approver);
            } catch (InvalidStateException | AuthorizationException e) {
                metrics.recordApprovalAction(ApprovalActionType.APPROVED.name(), "refused");
                throw e;
            }

            ApprovalWorkflow workflow = loadWorkflow(request.getWorkflowId());
            int fromLevel = request.getCurrentLevel();
            Optional<ApprovalLevel> next = workflow.nextLevel(fromLevel, request.getAmount());
            boolean bandGap = next.isEmpty() && workflow.missesHigherBand(fromLevel, request.getAmount());

            if (bandGap && properties.getApproval().getBandGapPolicy() == BandGapPolicy.REQUIRE_COVERING_LEVEL) {
                throw new ValidationException(String.format(
                    "Amount %s is not covered by any level above level %d in workflow %s",
                    request.getAmount(), fromLevel, workflow.getWorkflowName()));
            }

            ApprovalAction action = ApprovalAction.record(request, approver, ApprovalActionType.APPROVED,
                comments, originAddress, null, Instant.now(clock));

            ApprovalRequest updated;
            ApprovalResult result;
            if (next.isPresent()) {
                updated = request.advanceTo(next.get());
                result = ApprovalResult.advanced(requestId, fromLevel, next.get());
                log.info("Approved at level {}, moved to level {}: approver={}, nextApprover={}",
                    fromLevel, next.get().getLevelNumber(), approver, next.get().getApprover());
            } else {
                if (bandGap) {
                    log.warn("Amount {} is not covered by any level above level {} in workflow {}, completing approval",
                        request.getAmount(), fromLevel, workflow.getWorkflowName());
                }
                updated = request.close(ApprovalStatus.APPROVED, action.getActedAt());
                result = ApprovalResult.completed(requestId);
                log.info("Approval request fully approved at level {}: approver={}", fromLevel, approver);
            }

            persist(entity, updated, action);
            return result;
        } finally {
            MDC.remove(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * Rejects the request. Terminal.
     */
    @Transactional
    public ApprovalRequest reject(UUID requestId, String approver, String comments, String originAddress) {
        return close(requestId, approver, comments, originAddress, ApprovalActionType.REJECTED,
            ApprovalStatus.REJECTED);
    }

    /**
     * Sends the document back to the requester for correction. The request is cancelled,
     * so a corrected document can be submitted again.
     */
    @Transactional
    public ApprovalRequest returnToRequester(UUID requestId, String approver, String comments, String originAddress) {
        return close(requestId, approver, comments, originAddress, ApprovalActionType.RETURNED,
            ApprovalStatus.CANCELLED);
    }

    /**
     * Hands the current level over to another approver. Level and status are unchanged.
     *
     * @throws ValidationException if {@code delegateTo} is blank
     * @throws AuthorizationException if delegating to oneself or to the requester
     */
    @Transactional
    public ApprovalRequest delegate(UUID requestId, String approver, String delegateTo, String comments,
                                    String originAddress) {
        requireText(approver, "Approver");
        MDC.put(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY, requestId.toString());
        try {
            ApprovalRequestEntity entity = lock(requestId);
            ApprovalRequest request = entity.toDomain();
            request.checkActionableBy(approver);

            if (delegateTo == null || delegateTo.isBlank()) {
                throw new ValidationException("Delegate is required");
            }
            if (delegateTo.equals(approver)) {
                throw new AuthorizationException("Cannot delegate to yourself");
            }
            if (delegateTo.equals(request.getRequester())) {
                throw new AuthorizationException(
                    "Cannot delegate to the requester: segregation of duties would block the request");
            }

            ApprovalAction action = ApprovalAction.record(request, approver, ApprovalActionType.DELEGATED,
                comments, originAddress, delegateTo, Instant.now(clock));
            ApprovalRequest updated = request.reassignTo(delegateTo);
            persist(entity, updated, action);

            log.info("Approval delegated at level {}: from={}, to={}", request.getCurrentLevel(), approver, delegateTo);
            return updated;
        } finally {
            MDC.remove(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<ApprovalRequest> getPendingApprovals(String approver) {
        return requestRepository.findByCurrentApproverAndStatusOrderByRequestedAtDesc(approver, ApprovalStatus.PENDING)
            .stream()
            .map(ApprovalRequestEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public ApprovalRequest getRequest(UUID requestId) {
        return requestRepository.findById(requestId)
            .map(ApprovalRequestEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Approval request", requestId));
    }

    @Transactional(readOnly = true)
    public Optional<ApprovalRequest> findLatestForDocument(String documentType, UUID documentId) {
        return requestRepository.findFirstByDocumentTypeAndDocumentIdOrderByRequestedAtDesc(documentType, documentId)
            .map(ApprovalRequestEntity::toDomain);
    }

    /**
     * Audit trail of a request, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ApprovalAction> getActionHistory(UUID requestId) {
        if (!requestRepository.existsById(requestId)) {
            throw NotFoundException.of("Approval request", requestId);
        }
        return actionRepository.findByRequestIdOrderBySequenceNumberAsc(requestId)
            .stream()
            .map(ApprovalActionEntity::toDomain)
            .toList();
    }

    private ApprovalRequest close(UUID requestId, String approver, String comments, String originAddress,
                                  ApprovalActionType actionType, ApprovalStatus finalStatus) {
        requireText(approver, "Approver");
        MDC.put(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY, requestId.toString());
        try {
            ApprovalRequestEntity entity = lock(requestId);
            ApprovalRequest request = entity.toDomain();
            request.checkActionableBy(approver);

            ApprovalAction action = ApprovalAction.record(request, approver, actionType,
                comments, originAddress, null, Instant.now(clock));
            ApprovalRequest updated = request.close(finalStatus, action.getActedAt());
            persist(entity, updated, action);

            log.info("Approval request {} at level {}: approver={}, status={}",
                actionType.name().toLowerCase(), request.getCurrentLevel(), approver, finalStatus);
            return updated;
        } finally {
            MDC.remove(CorrelationContext.APPROVAL_REQUEST_ID_MDC_KEY);
        }
    }

    private void persist(ApprovalRequestEntity entity, ApprovalRequest updated, ApprovalAction action) {
        actionRepository.save(ApprovalActionEntity.fromDomain(action));
        entity.updateFromDomain(updated);
        requestRepository.save(entity);
        outboxService.saveEvent(ApprovalActionRecordedEvent.of(updated, action));
        metrics.recordApprovalAction(action.getAction().name(), "success");
    }

    private ApprovalRequestEntity lock(UUID requestId) {
        try {
            return requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> NotFoundException.of("Approval request", requestId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(
                "Timed out waiting for the lock on approval request " + requestId, e);
        }
    }

    private ApprovalWorkflow loadWorkflow(UUID workflowId) {
        return workflowRepository.findById(workflowId)
            .map(ApprovalWorkflowEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Approval workflow", workflowId));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
