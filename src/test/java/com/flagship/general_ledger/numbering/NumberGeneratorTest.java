package com.flagship.general_ledger.numbering;

import com.flagship.general_ledger.exception.ConcurrencyConflictException;
import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.exception.ValidationException;
import com.flagship.general_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NumberGeneratorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    @Mock
    private NumberingSchemeRepository repository;

    private NumberGenerator generator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T08:00:00Z"), ZoneOffset.UTC);
        generator = new NumberGenerator(repository, new LedgerMetrics(new SimpleMeterRegistry()), clock);
    }

    private NumberingSchemeEntity givenDefaultScheme(String documentType, long nextNumber, LocalDate lastReset) {
        NumberingScheme scheme = NumberingScheme.create("Invoices", documentType, null, "INV",
                DateFormatToken.YYYY, 4, null, "-", 1, ResetFrequency.YEARLY, TODAY, "admin")
            .withCounter(nextNumber, lastReset);
        NumberingSchemeEntity entity = NumberingSchemeEntity.fromDomain(scheme);
        when(repository.findActiveDefaultId(documentType)).thenReturn(Optional.of(entity.getId()));
        when(repository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));
        return entity;
    }

    @Test
    @DisplayName("issues the current number and advances the counter under the lock")
    void generatesAndIncrements() {
        NumberingSchemeEntity entity = givenDefaultScheme("INV", 7, TODAY);

        String number = generator.generateNumber("INV");

        assertEquals("INV-2025-0007", number);
        assertEquals(8, entity.getNextNumber());
        verify(repository).save(entity);
    }

    @Test
    @DisplayName("document date drives the date component and reset check")
    void usesDocumentDate() {
        NumberingSchemeEntity entity = givenDefaultScheme("INV", 321, LocalDate.of(2024, 5, 1));

        String number = generator.generateNumber("INV", null, LocalDate.of(2025, 1, 2));

        assertEquals("INV-2025-0001", number);
        assertEquals(2, entity.getNextNumber());
        assertEquals(LocalDate.of(2025, 1, 2), entity.getLastResetDate());
    }

    @Test
    @DisplayName("document dated before the period the counter restarted for is refused untouched")
    void backDatedAcrossResetIsRefused() {
        NumberingSchemeEntity entity = givenDefaultScheme("INV", 2, LocalDate.of(2025, 1, 2));

        assertThrows(ValidationException.class,
            () -> generator.generateNumber("INV", null, LocalDate.of(2024, 12, 31)));

        assertEquals(2, entity.getNextNumber());
        assertEquals(LocalDate.of(2025, 1, 2), entity.getLastResetDate());
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("scope-specific scheme wins over the default")
    void scopedSchemeTakesPrecedence() {
        NumberingScheme scoped = NumberingScheme.create("Karachi invoices", "INV", "KHI", "KHI-INV",
            null, 3, null, "-", 4, ResetFrequency.NEVER, TODAY, "admin");
        NumberingSchemeEntity entity = NumberingSchemeEntity.fromDomain(scoped);
        when(repository.findActiveIdForScope("INV", "KHI")).thenReturn(Optional.of(entity.getId()));
        when(repository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));

        assertEquals("KHI-INV-004", generator.generateNumber("INV", "KHI"));
        verify(repository, never()).findActiveDefaultId(any());
    }

    @Test
    @DisplayName("unknown scope falls back to the default scheme")
    void unknownScopeFallsBack() {
        givenDefaultScheme("INV", 1, TODAY);
        when(repository.findActiveIdForScope("INV", "LHE")).thenReturn(Optional.empty());

        assertEquals("INV-2025-0001", generator.generateNumber("INV", "LHE"));
    }

    @Test
    void missingSchemeIsNotFound() {
        when(repository.findActiveDefaultId("PO")).thenReturn(Optional.empty());

        NotFoundException e = assertThrows(NotFoundException.class, () -> generator.generateNumber("PO"));
        assertTrue(e.getMessage().contains("PO"));
    }

    @Test
    void lockTimeoutBecomesConcurrencyConflict() {
        UUID schemeId = UUID.randomUUID();
        when(repository.findActiveDefaultId("INV")).thenReturn(Optional.of(schemeId));
        when(repository.findByIdForUpdate(schemeId)).thenThrow(new CannotAcquireLockException("lock timeout"));

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
            () -> generator.generateNumber("INV"));
        assertTrue(e.isRetryable());
    }

    @Test
    @DisplayName("preview shows the next number without saving")
    void previewDoesNotMutate() {
        NumberingScheme scheme = NumberingScheme.create("Invoices", "INV", null, "INV",
            DateFormatToken.YYYY, 4, null, "-", 12, ResetFrequency.YEARLY, TODAY, "admin");
        when(repository.findActiveDefault("INV")).thenReturn(Optional.of(NumberingSchemeEntity.fromDomain(scheme)));

        assertEquals(Optional.of("INV-2025-0012"), generator.previewNextNumber("INV", null));
        verify(repository, never()).save(any());
        verify(repository, never()).findByIdForUpdate(any());
    }

    @Test
    @DisplayName("preview after a reset boundary shows sequence 1")
    void previewAppliesPendingReset() {
        NumberingScheme scheme = NumberingScheme.create("Invoices", "INV", null, "INV",
                DateFormatToken.YYYY, 4, null, "-", 1, ResetFrequency.YEARLY, TODAY, "admin")
            .withCounter(88, LocalDate.of(2024, 11, 30));
        when(repository.findActiveDefault("INV")).thenReturn(Optional.of(NumberingSchemeEntity.fromDomain(scheme)));

        assertEquals(Optional.of("INV-2025-0001"), generator.previewNextNumber("INV", null));
    }

    @Test
    void resetCounterOverridesNextNumber() {
        NumberingSchemeEntity entity = givenDefaultScheme("INV", 40, TODAY);

        NumberingScheme reset = generator.resetCounter("INV", null, 100);

        assertEquals(100, reset.getNextNumber());
        assertEquals(100, entity.getNextNumber());
        verify(repository).save(entity);
    }

    @Test
    void resetCounterRejectsValuesBelowOne() {
        assertThrows(ValidationException.class, () -> generator.resetCounter("INV", null, 0));
        verify(repository, never()).findByIdForUpdate(any());
    }

    @Test
    void schemeInfoReportsCurrentState() {
        NumberingScheme scheme = NumberingScheme.create("Invoices", "INV", null, "INV",
            DateFormatToken.YYYY, 4, null, "-", 3, ResetFrequency.YEARLY, TODAY, "admin");
        when(repository.findActiveDefault("INV")).thenReturn(Optional.of(NumberingSchemeEntity.fromDomain(scheme)));

        NumberingSchemeInfo info = generator.getSchemeInfo("INV", null).orElseThrow();

        assertEquals("INV-2025-0003", info.getFormatPreview());
        assertEquals(3, info.getNextNumber());
        assertEquals(ResetFrequency.YEARLY, info.getResetFrequency());
    }
}
