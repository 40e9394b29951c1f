package com.flagship.lending_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in, or already published from, the outbox.
 *
 * Written in the same transaction as the posting it describes, so an event
 * exists exactly when its posting committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // JournalEntry, FinancialPeriod, Loan
    UUID aggregateId;
    String eventType;          // JournalEntryPosted, ...
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
