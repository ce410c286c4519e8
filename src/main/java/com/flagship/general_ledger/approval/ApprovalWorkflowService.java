package com.flagship.general_ledger.approval;

import com.flagship.general_ledger.exception.ConcurrencyConflictException;
import com.flagship.general_ledger.exception.DuplicateRequestException;
import com.flagship.general_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Administration of approval workflows. In-flight requests keep routing through
 * the workflow they were started with, even after it is deactivated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalWorkflowService {

    private final ApprovalWorkflowRepository repository;

    /**
     * @throws com.flagship.general_ledger.exception.ValidationException if the levels are malformed
     * @throws DuplicateRequestException if {@code active} and another workflow is active for the document type
     */
    @Transactional
    public ApprovalWorkflow defineWorkflow(String workflowName, String documentType, List<ApprovalLevel> levels,
                                           boolean active, String createdBy) {
        ApprovalWorkflow workflow = ApprovalWorkflow.define(workflowName, documentType, levels, active, createdBy);
        try {
            ApprovalWorkflowEntity saved = repository.saveAndFlush(ApprovalWorkflowEntity.fromDomain(workflow));
            log.info("Defined approval workflow: name={}, documentType={}, levels={}, active={}",
                workflowName, documentType, levels.size(), active);
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateRequestException(
                "An active approval workflow already exists for document type " + documentType, e);
        }
    }

    @Transactional
    public ApprovalWorkflow deactivateWorkflow(UUID workflowId) {
        ApprovalWorkflowEntity entity;
        try {
            entity = repository.findByIdForUpdate(workflowId)
                .orElseThrow(() -> NotFoundException.of("Approval workflow", workflowId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(
                "Timed out waiting for the lock on approval workflow " + workflowId, e);
        }
        entity.deactivate();
        repository.save(entity);
        log.info("Deactivated approval workflow: id={}, documentType={}", workflowId, entity.getDocumentType());
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<ApprovalWorkflow> getActiveWorkflow(String documentType) {
        return repository.findByActiveDocumentType(documentType).map(ApprovalWorkflowEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ApprovalWorkflow> listWorkflows(String documentType) {
        return repository.findByDocumentTypeOrderByCreatedAtDesc(documentType)
            .stream()
            .map(ApprovalWorkflowEntity::toDomain)
            .toList();
    }
}
