package com.flagship.general_ledger.numbering;

import com.flagship.general_ledger.exception.ConcurrencyConflictException;
import com.flagship.general_ledger.exception.DuplicateRequestException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.numbering.dto.CreateNumberingSchemeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Administration of numbering schemes. Counter changes belong to {@link NumberGenerator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NumberingSchemeService {

    private final NumberingSchemeRepository repository;
    private final Clock clock;

    /**
     * Creates a new active scheme.
     *
     * @throws DuplicateRequestException if an active scheme already exists for the same document type and scope
     */
    @Transactional
    public NumberingScheme createScheme(CreateNumberingSchemeRequest request, String createdBy) {
        NumberingScheme scheme = NumberingScheme.create(
            request.getSchemeName(),
            request.getDocumentType(),
            request.getScope(),
            request.getPrefix(),
            request.getDateFormat(),
            request.getPadding(),
            request.getSuffix(),
            request.getSeparator(),
            request.getNextNumber(),
            request.getResetFrequency(),
            LocalDate.now(clock),
            createdBy
        );

        try {
            NumberingSchemeEntity saved = repository.saveAndFlush(NumberingSchemeEntity.fromDomain(scheme));
            log.info("Created numbering scheme: name={}, documentType={}, scope={}, preview={}",
                scheme.getSchemeName(), scheme.getDocumentType(), scheme.getScope(),
                scheme.format(LocalDate.now(clock)));
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateRequestException(String.format(
                "An active numbering scheme already exists for document type %s%s",
                scheme.getDocumentType(), scheme.getScope() != null ? " and scope " + scheme.getScope() : ""), e);
        }
    }

    @Transactional
    public NumberingScheme deactivateScheme(UUID schemeId) {
        NumberingSchemeEntity entity;
        try {
            entity = repository.findByIdForUpdate(schemeId)
                .orElseThrow(() -> NotFoundException.of("Numbering scheme", schemeId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(
                "Timed out waiting for the lock on numbering scheme " + schemeId, e);
        }
        entity.deactivate();
        repository.save(entity);
        log.info("Deactivated numbering scheme: id={}, documentType={}", schemeId, entity.getDocumentType());
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public List<NumberingScheme> listSchemes(String documentType) {
        return repository.findByDocumentTypeOrderByCreatedAtDesc(documentType)
            .stream()
            .map(NumberingSchemeEntity::toDomain)
            .toList();
    }
}
