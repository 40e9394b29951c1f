package com.flagship.lending_ledger.ledger.event;

import com.flagship.lending_ledger.ledger.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a journal entry reaches POSTED and its balances have been applied.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {
    UUID eventId;
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    String entryType;
    BigDecimal amount;
    String sourceType;
    String sourceId;
    String approvedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";
    public static final String AGGREGATE_TYPE = "JournalEntry";

    @Override
    public UUID getAggregateId() {
        return entryId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JournalEntryPostedEvent of(JournalEntry entry, String approvedBy, Instant postedAt) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getEntryDate(),
            entry.getEntryType().name(),
            entry.getTotalDebit(),
            entry.getSourceType(),
            entry.getSourceId(),
            approvedBy,
            postedAt
        );
    }
}
