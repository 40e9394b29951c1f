package com.flagship.lending_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events published through the outbox.
 *
 * All ledger events share:
 * - Event ID for deduplication by consumers
 * - Aggregate ID used as the Kafka key
 * - Timestamp of when the fact occurred
 */
public interface LedgerEvent {

    UUID getEventId();

    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
