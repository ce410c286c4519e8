package com.flagship.general_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.numbers.generated: document numbers issued, by document type
 * - ledger.vouchers.created / posted / cancelled: voucher lifecycle, by type and outcome
 * - ledger.approvals.actions: approval actions, by action and outcome
 * - ledger.latency: operation latency
 * - idempotency.cache: idempotency-key lookups (hit/miss)
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordNumberGenerated(String documentType) {
        registry.counter("ledger.numbers.generated",
                "document_type", sanitizeTag(documentType)
        ).increment();
    }

    public void recordVoucherCreated(String voucherType, String outcome) {
        registry.counter("ledger.vouchers.created",
                "voucher_type", sanitizeTag(voucherType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordVoucherPosted(String voucherType, String outcome) {
        registry.counter("ledger.vouchers.posted",
                "voucher_type", sanitizeTag(voucherType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordVoucherCancelled(String voucherType) {
        registry.counter("ledger.vouchers.cancelled",
                "voucher_type", sanitizeTag(voucherType)
        ).increment();
    }

    public void recordApprovalAction(String action, String outcome) {
        registry.counter("ledger.approvals.actions",
                "action", sanitizeTag(action),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
