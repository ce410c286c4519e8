package com.flagship.general_ledger.approval;

import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Insert and read only. Extends the bare {@link org.springframework.data.repository.Repository}
 * so that no update or delete method exists.
 */
@Repository
public interface ApprovalActionRepository extends org.springframework.data.repository.Repository<ApprovalActionEntity, UUID> {

    ApprovalActionEntity save(ApprovalActionEntity action);

    List<ApprovalActionEntity> findByRequestIdOrderBySequenceNumberAsc(UUID requestId);

    long countByRequestId(UUID requestId);
}
