package com.flagship.general_ledger.numbering;

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
public interface NumberingSchemeRepository extends JpaRepository<NumberingSchemeEntity, UUID> {

    @Query("""
        SELECT s FROM NumberingSchemeEntity s
        WHERE s.documentType = :documentType AND s.scope = :scope AND s.active = true
        """)
    Optional<NumberingSchemeEntity> findActiveForScope(@Param("documentType") String documentType,
                                                       @Param("scope") String scope);

    @Query("""
        SELECT s FROM NumberingSchemeEntity s
        WHERE s.documentType = :documentType AND s.scope IS NULL AND s.active = true
        """)
    Optional<NumberingSchemeEntity> findActiveDefault(@Param("documentType") String documentType);

    /**
     * Id-only lookups used before locking, so that no stale managed instance of the
     * scheme sits in the persistence context when the locked row is read.
     */
    @Query("""
        SELECT s.id FROM NumberingSchemeEntity s
        WHERE s.documentType = :documentType AND s.scope = :scope AND s.active = true
        """)
    Optional<UUID> findActiveIdForScope(@Param("documentType") String documentType,
                                        @Param("scope") String scope);

    @Query("""
        SELECT s.id FROM NumberingSchemeEntity s
        WHERE s.documentType = :documentType AND s.scope IS NULL AND s.active = true
        """)
    Optional<UUID> findActiveDefaultId(@Param("documentType") String documentType);

    /**
     * Loads a scheme with an exclusive row lock ({@code SELECT ... FOR UPDATE})
     * held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM NumberingSchemeEntity s WHERE s.id = :id")
    Optional<NumberingSchemeEntity> findByIdForUpdate(@Param("id") UUID id);

    List<NumberingSchemeEntity> findByDocumentTypeOrderByCreatedAtDesc(String documentType);
}
