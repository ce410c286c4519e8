package com.flagship.general_ledger.numbering;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for numbering schemes.
 *
 * No setters: the counter is only changed through {@link #updateCounter} by the
 * generator while it holds the row lock. {@code activeKey} carries the
 * one-active-scheme-per-(type, scope) rule as a unique column that is NULL
 * for inactive schemes.
 */
@Entity
@Table(
    name = "numbering_schemes",
    indexes = {
        @Index(name = "idx_numbering_schemes_document_type", columnList = "document_type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NumberingSchemeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "scheme_name", nullable = false, length = 100)
    private String schemeName;

    @Column(name = "document_type", nullable = false, updatable = false, length = 50)
    private String documentType;

    @Column(name = "scope", updatable = false, length = 50)
    private String scope;

    @Column(name = "prefix", updatable = false, length = 20)
    private String prefix;

    @Enumerated(EnumType.STRING)
    @Column(name = "date_format", updatable = false, length = 10)
    private DateFormatToken dateFormat;

    @Column(name = "padding", nullable = false, updatable = false)
    private int padding;

    @Column(name = "suffix", updatable = false, length = 20)
    private String suffix;

    @Column(name = "separator", nullable = false, updatable = false, length = 5)
    private String separator;

    @Column(name = "next_number", nullable = false)
    private long nextNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "reset_frequency", nullable = false, updatable = false, length = 10)
    private ResetFrequency resetFrequency;

    @Column(name = "last_reset_date")
    private LocalDate lastResetDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "active_key", unique = true, length = 110)
    private String activeKey;

    @Column(name = "created_by", updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static NumberingSchemeEntity fromDomain(NumberingScheme scheme) {
        return new NumberingSchemeEntity(
            scheme.getId(),
            scheme.getSchemeName(),
            scheme.getDocumentType(),
            scheme.getScope(),
            scheme.getPrefix(),
            scheme.getDateFormat(),
            scheme.getPadding(),
            scheme.getSuffix(),
            scheme.getSeparator(),
            scheme.getNextNumber(),
            scheme.getResetFrequency(),
            scheme.getLastResetDate(),
            scheme.isActive(),
            scheme.isActive() ? scheme.activeKey() : null,
            scheme.getCreatedBy(),
            scheme.getCreatedAt(),
            null  // updatedAt - set by @PrePersist
        );
    }

    public NumberingScheme toDomain() {
        return new NumberingScheme(
            id,
            schemeName,
            documentType,
            scope,
            prefix,
            dateFormat,
            padding,
            suffix,
            separator,
            nextNumber,
            resetFrequency,
            lastResetDate,
            active,
            createdBy,
            createdAt
        );
    }

    /**
     * Copies the counter state of the given scheme. Format settings are immutable.
     */
    void updateCounter(NumberingScheme scheme) {
        if (!scheme.getId().equals(this.id)) {
            throw new IllegalArgumentException("Scheme id mismatch: " + scheme.getId() + " != " + this.id);
        }
        this.nextNumber = scheme.getNextNumber();
        this.lastResetDate = scheme.getLastResetDate();
    }

    void deactivate() {
        this.active = false;
        this.activeKey = null;
    }
}
