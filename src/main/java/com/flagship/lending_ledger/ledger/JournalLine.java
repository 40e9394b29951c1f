package com.flagship.lending_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A persisted journal line. Never updated or deleted once written.
 */
@Value
public class JournalLine {
    UUID id;
    UUID journalEntryId;
    int lineNumber;
    UUID accountId;
    String accountCode;
    BigDecimal debit;
    BigDecimal credit;
    String description;
    String customerId;
    String referenceType;
    String referenceId;

    public JournalEntryRequest.Line toRequestLine() {
        return JournalEntryRequest.Line.builder()
            .accountCode(accountCode)
            .debit(debit)
            .credit(credit)
            .description(description)
            .customerId(customerId)
            .referenceType(referenceType)
            .referenceId(referenceId)
            .build();
    }
}
