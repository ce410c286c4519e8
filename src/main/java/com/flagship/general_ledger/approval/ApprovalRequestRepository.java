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
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequestEntity, UUID> {

    /**
     * Loads a request with an exclusive row lock ({@code SELECT ... FOR UPDATE})
     * held until the surrounding transaction ends. Every state change goes through here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ApprovalRequestEntity r WHERE r.id = :id")
    Optional<ApprovalRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByOpenKey(String openKey);

    List<ApprovalRequestEntity> findByCurrentApproverAndStatusOrderByRequestedAtDesc(
        String currentApprover, ApprovalStatus status);

    Optional<ApprovalRequestEntity> findFirstByDocumentTypeAndDocumentIdOrderByRequestedAtDesc(
        String documentType, UUID documentId);
}
