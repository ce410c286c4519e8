package com.flagship.general_ledger.approval;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApprovalWorkflowRepository extends JpaRepository<ApprovalWorkflowEntity, UUID> {

    Optional<ApprovalWorkflowEntity> findByActiveDocumentType(String documentType);

    List<ApprovalWorkflowEntity> findByDocumentTypeOrderByCreatedAtDesc(String documentType);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM ApprovalWorkflowEntity w WHERE w.id = :id")
    Optional<ApprovalWorkflowEntity> findByIdForUpdate(@Param("id") UUID id);
}
