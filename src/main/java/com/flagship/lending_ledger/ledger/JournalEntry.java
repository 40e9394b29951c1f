package com.flagship.lending_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A journal entry as stored, with its lines.
 *
 * Instances are snapshots. State changes happen in the posting engine and
 * are re-read from the database afterwards.
 */
@Value
public class JournalEntry {
    UUID id;
    String entryNumber;
    LocalDate entryDate;
    EntryType entryType;
    String description;
    JournalStatus status;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    String sourceModule;
    String sourceType;
    String sourceId;
    String externalReference;
    boolean reversed;
    UUID reversalEntryId;
    UUID reversesEntryId;
    String reversalReason;
    String createdBy;
    String approvedBy;
    Instant createdAt;
    Instant postedAt;
    List<JournalLine> lines;

    public boolean isPosted() {
        return status == JournalStatus.POSTED;
    }

    public boolean isReversal() {
        return entryType == EntryType.REVERSAL;
    }

    JournalEntry withLines(List<JournalLine> entryLines) {
        return new JournalEntry(id, entryNumber, entryDate, entryType, description, status,
            totalDebit, totalCredit, sourceModule, sourceType, sourceId, externalReference,
            reversed, reversalEntryId, reversesEntryId, reversalReason, createdBy, approvedBy,
            createdAt, postedAt, entryLines);
    }
}
