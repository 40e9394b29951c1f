package com.flagship.lending_ledger.savings;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class SavingsTransaction {
    UUID id;
    UUID savingsAccountId;
    String transactionRef;
    SavingsTransactionType transactionType;
    BigDecimal amount;
    BigDecimal balanceBefore;
    BigDecimal balanceAfter;
    UUID journalEntryId;
    String processedBy;
    Instant processedAt;
}
