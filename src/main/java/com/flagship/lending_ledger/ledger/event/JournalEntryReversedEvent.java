package com.flagship.lending_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a posted entry has been neutralised by a reversal entry.
 */
@Value
public class JournalEntryReversedEvent implements LedgerEvent {
    UUID eventId;
    UUID entryId;
    UUID reversalEntryId;
    String reason;
    LocalDate effectiveDate;
    String reversedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryReversed";

    @Override
    public UUID getAggregateId() {
        return entryId;
    }

    @Override
    public String getAggregateType() {
        return JournalEntryPostedEvent.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
