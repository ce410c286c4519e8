package com.flagship.general_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a voucher or an approval request, written to the outbox in the
 * transaction that caused it and published to Kafka afterwards.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance. Consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Kafka key, so all events of one aggregate land on the same partition in order.
     */
    UUID getAggregateId();

    @JsonIgnore
    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
