package com.flagship.lending_ledger.savings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "savings_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SavingsTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "savings_account_id", nullable = false, updatable = false)
    private UUID savingsAccountId;

    @Column(name = "transaction_ref", nullable = false, updatable = false, unique = true, length = 30)
    private String transactionRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 20)
    private SavingsTransactionType transactionType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "balance_before", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal balanceBefore;

    @Column(name = "balance_after", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal balanceAfter;

    @Column(name = "journal_entry_id", nullable = false, updatable = false)
    private UUID journalEntryId;

    @Column(name = "processed_by", nullable = false, updatable = false, length = 64)
    private String processedBy;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static SavingsTransactionEntity record(UUID savingsAccountId, String transactionRef, SavingsTransactionType type,
                                           BigDecimal amount, BigDecimal balanceBefore, BigDecimal balanceAfter,
                                           UUID journalEntryId, String processedBy, Instant processedAt) {
        SavingsTransactionEntity entity = new SavingsTransactionEntity();
        entity.id = UUID.randomUUID();
        entity.savingsAccountId = savingsAccountId;
        entity.transactionRef = transactionRef;
        entity.transactionType = type;
        entity.amount = amount;
        entity.balanceBefore = balanceBefore;
        entity.balanceAfter = balanceAfter;
        entity.journalEntryId = journalEntryId;
        entity.processedBy = processedBy;
        entity.processedAt = processedAt;
        return entity;
    }

    public SavingsTransaction toDomain() {
        return new SavingsTransaction(id, savingsAccountId, transactionRef, transactionType, amount,
            balanceBefore, balanceAfter, journalEntryId, processedBy, processedAt);
    }
}
