package com.flagship.lending_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A recorded repayment. Written once, in the same transaction as its journal entry.
 */
@Entity
@Table(name = "loan_repayments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanRepaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "receipt_number", nullable = false, updatable = false, unique = true, length = 30)
    private String receiptNumber;

    @Column(name = "payment_reference", updatable = false, unique = true, length = 100)
    private String paymentReference;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "principal_portion", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principalPortion;

    @Column(name = "interest_portion", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal interestPortion;

    @Column(name = "journal_entry_id", nullable = false, updatable = false)
    private UUID journalEntryId;

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate paymentDate;

    @Column(name = "collected_by", nullable = false, updatable = false, length = 64)
    private String collectedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static LoanRepaymentEntity record(UUID loanId, String receiptNumber, String paymentReference,
                                      RepaymentAllocation allocation, UUID journalEntryId,
                                      LocalDate paymentDate, String collectedBy) {
        LoanRepaymentEntity entity = new LoanRepaymentEntity();
        entity.id = UUID.randomUUID();
        entity.loanId = loanId;
        entity.receiptNumber = receiptNumber;
        entity.paymentReference = paymentReference;
        entity.amount = allocation.getAmount();
        entity.principalPortion = allocation.getPrincipalPortion();
        entity.interestPortion = allocation.getInterestPortion();
        entity.journalEntryId = journalEntryId;
        entity.paymentDate = paymentDate;
        entity.collectedBy = collectedBy;
        return entity;
    }
}
