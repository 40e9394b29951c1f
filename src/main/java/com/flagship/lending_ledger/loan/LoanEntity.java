package com.flagship.lending_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of the loans table.
 *
 * No setters: terms are fixed at creation, and the status moves only through
 * the transition methods below, each of which checks where it starts from.
 */
@Entity
@Table(name = "loans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_number", nullable = false, updatable = false, unique = true, length = 30)
    private String loanNumber;

    @Column(name = "customer_id", nullable = false, updatable = false, length = 64)
    private String customerId;

    @Column(name = "principal_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "interest_rate", nullable = false, updatable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "tenure_months", nullable = false, updatable = false)
    private int tenureMonths;

    @Enumerated(EnumType.STRING)
    @Column(name = "amortization_method", nullable = false, updatable = false, length = 20)
    private AmortizationMethod amortizationMethod;

    @Column(name = "processing_fee", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal processingFee;

    @Column(name = "total_interest", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalInterest;

    @Column(name = "total_repayment", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalRepayment;

    @Column(name = "installment_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal installmentAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private LoanStatus status;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "maturity_date", nullable = false, updatable = false)
    private LocalDate maturityDate;

    @Column(name = "disbursement_entry_id")
    private UUID disbursementEntryId;

    @Column(name = "disbursed_at")
    private Instant disbursedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "created_by", nullable = false, updatable = false, length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static LoanEntity create(UUID id, String loanNumber, String customerId, BigDecimal processingFee,
                             LocalDate startDate, AmortizationSchedule schedule, String createdBy) {
        LoanEntity entity = new LoanEntity();
        entity.id = id;
        entity.loanNumber = loanNumber;
        entity.customerId = customerId;
        entity.principalAmount = schedule.getPrincipal();
        entity.interestRate = schedule.getAnnualRate();
        entity.tenureMonths = schedule.getTenureMonths();
        entity.amortizationMethod = schedule.getMethod();
        entity.processingFee = processingFee;
        entity.totalInterest = schedule.getTotalInterest();
        entity.totalRepayment = schedule.getTotalRepayment();
        entity.installmentAmount = schedule.getInstallmentAmount();
        entity.status = LoanStatus.PENDING_DISBURSEMENT;
        entity.startDate = startDate;
        entity.maturityDate = schedule.getLastInstallment().getDueDate();
        entity.createdBy = createdBy;
        return entity;
    }

    public Loan toDomain() {
        return new Loan(id, loanNumber, customerId, principalAmount, interestRate, tenureMonths,
            amortizationMethod, processingFee, totalInterest, totalRepayment, installmentAmount,
            status, startDate, maturityDate, disbursementEntryId, disbursedAt, closedAt);
    }

    void markDisbursed(UUID entryId, Instant at) {
        requireStatus(LoanStatus.PENDING_DISBURSEMENT);
        this.disbursementEntryId = entryId;
        this.disbursedAt = at;
        this.status = LoanStatus.ACTIVE;
    }

    void markOverdue() {
        requireStatus(LoanStatus.ACTIVE);
        this.status = LoanStatus.OVERDUE;
    }

    void markCurrent() {
        requireStatus(LoanStatus.OVERDUE);
        this.status = LoanStatus.ACTIVE;
    }

    void close(Instant at) {
        if (!status.acceptsRepayment()) {
            throw new IllegalStateException("Loan " + loanNumber + " cannot be closed from " + status);
        }
        this.status = LoanStatus.CLOSED;
        this.closedAt = at;
    }

    private void requireStatus(LoanStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                "Loan " + loanNumber + " is " + status + ", expected " + expected);
        }
    }
}
