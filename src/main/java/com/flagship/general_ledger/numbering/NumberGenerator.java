package com.flagship.general_ledger.numbering;

import com.flagship.general_ledger.exception.ConcurrencyConflictException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues sequential document numbers.
 *
 * Correctness under concurrency rests entirely on the exclusive row lock taken on
 * the scheme: the counter is re-read under the lock on every call and never cached.
 * The lock is released when the caller's transaction commits, so a number allocated
 * inside a larger unit of work (e.g. voucher creation) is returned to the sequence if
 * that unit rolls back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NumberGenerator {

    private final NumberingSchemeRepository repository;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public String generateNumber(String documentType) {
        return generateNumber(documentType, null, null);
    }

    @Transactional
    public String generateNumber(String documentType, String scope) {
        return generateNumber(documentType, scope, null);
    }

    /**
     * Generates the next number for a document type.
     *
     * @param documentType document type, e.g. "JE" or "invoice"
     * @param scope optional scope (entity code); a scope-specific scheme wins over the default
     * @param asOfDate document date used for the date component and reset check; today if null
     * @return the formatted number, e.g. "INV-2025-0001"
     * @throws NotFoundException if no active scheme exists
     * @throws ValidationException if {@code asOfDate} falls in a period before the counter's current one
     * @throws ConcurrencyConflictException if the scheme row could not be locked in time
     */
    @Transactional
    public String generateNumber(String documentType, String scope, LocalDate asOfDate) {
        LocalDate date = asOfDate != null ? asOfDate : LocalDate.now(clock);
        NumberingSchemeEntity entity = lockScheme(resolveActiveId(documentType, scope));

        if (!entity.isActive()) {
            throw new NotFoundException("Numbering scheme " + entity.getId()
                + " was deactivated while waiting for its lock");
        }

        NumberingScheme scheme = entity.toDomain();
        scheme.checkNotBeforeCurrentPeriod(date);
        NumberingScheme current = scheme.applyReset(date);
        if (current.getNextNumber() != scheme.getNextNumber()) {
            log.info("Numbering scheme reset: scheme={}, frequency={}, lastReset={}, asOf={}",
                scheme.getSchemeName(), scheme.getResetFrequency(), scheme.getLastResetDate(), date);
        }

        String number = current.format(date);

        entity.updateCounter(current.advance());
        repository.save(entity);

        metrics.recordNumberGenerated(documentType);
        log.debug("Generated document number: documentType={}, scope={}, number={}", documentType, scope, number);
        return number;
    }

    /**
     * Shows the number the next call would issue today, without taking a lock or mutating anything.
     */
    @Transactional(readOnly = true)
    public Optional<String> previewNextNumber(String documentType, String scope) {
        LocalDate today = LocalDate.now(clock);
        return findActive(documentType, scope)
            .map(NumberingSchemeEntity::toDomain)
            .map(scheme -> scheme.applyReset(today).format(today));
    }

    /**
     * Administrative override of the counter.
     *
     * @throws NotFoundException if no active scheme exists
     * @throws ValidationException if {@code resetTo} is below 1
     */
    @Transactional
    public NumberingScheme resetCounter(String documentType, String scope, long resetTo) {
        if (resetTo < 1) {
            throw new ValidationException("Counter can only be reset to 1 or higher, got " + resetTo);
        }
        NumberingSchemeEntity entity = lockScheme(resolveActiveId(documentType, scope));
        NumberingScheme reset = entity.toDomain().withCounter(resetTo, LocalDate.now(clock));
        entity.updateCounter(reset);
        repository.save(entity);

        log.info("Numbering counter reset manually: documentType={}, scope={}, resetTo={}",
            documentType, scope, resetTo);
        return reset;
    }

    @Transactional(readOnly = true)
    public Optional<NumberingSchemeInfo> getSchemeInfo(String documentType, String scope) {
        LocalDate today = LocalDate.now(clock);
        return findActive(documentType, scope)
            .map(NumberingSchemeEntity::toDomain)
            .map(scheme -> new NumberingSchemeInfo(
                scheme.getSchemeName(),
                scheme.getDocumentType(),
                scheme.getScope(),
                scheme.applyReset(today).format(today),
                scheme.getNextNumber(),
                scheme.getResetFrequency(),
                scheme.getLastResetDate()));
    }

    private UUID resolveActiveId(String documentType, String scope) {
        requireDocumentType(documentType);
        Optional<UUID> id = Optional.empty();
        if (hasScope(scope)) {
            id = repository.findActiveIdForScope(documentType, scope);
        }
        return id.or(() -> repository.findActiveDefaultId(documentType))
            .orElseThrow(() -> new NotFoundException(
                "No active numbering scheme found for document type: " + documentType
                    + (hasScope(scope) ? " (scope " + scope + ")" : "")));
    }

    private Optional<NumberingSchemeEntity> findActive(String documentType, String scope) {
        requireDocumentType(documentType);
        if (hasScope(scope)) {
            Optional<NumberingSchemeEntity> scoped = repository.findActiveForScope(documentType, scope);
            if (scoped.isPresent()) {
                return scoped;
            }
        }
        return repository.findActiveDefault(documentType);
    }

    private static void requireDocumentType(String documentType) {
        if (documentType == null || documentType.isBlank()) {
            throw new ValidationException("Document type is required");
        }
    }

    private static boolean hasScope(String scope) {
        return scope != null && !scope.isBlank();
    }

    private NumberingSchemeEntity lockScheme(UUID schemeId) {
        try {
            return repository.findByIdForUpdate(schemeId)
                .orElseThrow(() -> NotFoundException.of("Numbering scheme", schemeId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(
                "Timed out waiting for the lock on numbering scheme " + schemeId, e);
        }
    }
}
