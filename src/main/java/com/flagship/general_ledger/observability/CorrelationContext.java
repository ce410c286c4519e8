package com.flagship.general_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the ledger.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String VOUCHER_ID_MDC_KEY = "voucherId";
    public static final String APPROVAL_REQUEST_ID_MDC_KEY = "approvalRequestId";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id; generates one if none was set on this thread.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Sets the id for this thread. Blank values are replaced by a generated id,
     * over-long client-supplied values are truncated.
     */
    public static void setCorrelationId(String id) {
        if (id == null || id.isBlank()) {
            correlationId.set(generateCorrelationId());
        } else if (id.length() > MAX_CORRELATION_ID_LENGTH) {
            correlationId.set(id.substring(0, MAX_CORRELATION_ID_LENGTH));
        } else {
            correlationId.set(id);
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
