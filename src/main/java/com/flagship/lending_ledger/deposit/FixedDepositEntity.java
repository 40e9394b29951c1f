package com.flagship.lending_ledger.deposit;

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
 * JPA mapping of a fixed deposit.
 *
 * Terms are fixed at creation. Accrued interest only grows, never past the
 * contracted interest amount. Every terminal transition starts from ACTIVE
 * or MATURED and is final.
 */
@Entity
@Table(name = "fixed_deposits")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FixedDepositEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "certificate_number", nullable = false, updatable = false, unique = true, length = 30)
    private String certificateNumber;

    @Column(name = "customer_id", nullable = false, updatable = false, length = 64)
    private String customerId;

    @Column(name = "principal_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principalAmount;

    @Column(name = "interest_rate", nullable = false, updatable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "tenure_days", nullable = false, updatable = false)
    private int tenureDays;

    @Column(name = "interest_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal interestAmount;

    @Column(name = "maturity_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal maturityAmount;

    @Column(name = "accrued_interest", nullable = false, precision = 19, scale = 2)
    private BigDecimal accruedInterest;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "maturity_date", nullable = false, updatable = false)
    private LocalDate maturityDate;

    @Column(name = "last_accrual_date")
    private LocalDate lastAccrualDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "maturity_instruction", nullable = false, updatable = false, length = 40)
    private MaturityInstruction maturityInstruction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FixedDepositStatus status;

    @Column(name = "rolled_over_to_id")
    private UUID rolledOverToId;

    @Column(name = "penalty_amount", precision = 19, scale = 2)
    private BigDecimal penaltyAmount;

    @Column(name = "amount_paid", precision = 19, scale = 2)
    private BigDecimal amountPaid;

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

    static FixedDepositEntity create(String certificateNumber, String customerId, BigDecimal principal,
                                     BigDecimal annualRate, int tenureDays, LocalDate startDate,
                                     MaturityInstruction instruction, String createdBy) {
        FixedDepositEntity entity = new FixedDepositEntity();
        entity.id = UUID.randomUUID();
        entity.certificateNumber = certificateNumber;
        entity.customerId = customerId;
        entity.principalAmount = principal;
        entity.interestRate = annualRate;
        entity.tenureDays = tenureDays;
        entity.interestAmount = FixedDepositCalculator.interest(principal, annualRate, tenureDays);
        entity.maturityAmount = principal.add(entity.interestAmount);
        entity.accruedInterest = BigDecimal.ZERO;
        entity.startDate = startDate;
        entity.maturityDate = startDate.plusDays(tenureDays);
        entity.maturityInstruction = instruction;
        entity.status = FixedDepositStatus.ACTIVE;
        entity.createdBy = createdBy;
        return entity;
    }

    public FixedDeposit toDomain() {
        return new FixedDeposit(id, certificateNumber, customerId, principalAmount, interestRate, tenureDays,
            interestAmount, maturityAmount, accruedInterest, startDate, maturityDate, lastAccrualDate,
            maturityInstruction, status, rolledOverToId, penaltyAmount, amountPaid, closedAt);
    }

    boolean isMaturedOn(LocalDate date) {
        return !date.isBefore(maturityDate);
    }

    void accrue(BigDecimal amount, LocalDate asOf) {
        requireStatus(FixedDepositStatus.ACTIVE);
        BigDecimal total = accruedInterest.add(amount);
        if (amount.signum() < 0 || total.compareTo(interestAmount) > 0) {
            throw new IllegalStateException("Invalid accrual of " + amount + " on " + certificateNumber);
        }
        this.accruedInterest = total;
        if (lastAccrualDate == null || asOf.isAfter(lastAccrualDate)) {
            this.lastAccrualDate = asOf;
        }
    }

    void closePremature(BigDecimal penalty, BigDecimal paid, Instant at) {
        requireStatus(FixedDepositStatus.ACTIVE);
        this.status = FixedDepositStatus.PREMATURE_CLOSED;
        this.penaltyAmount = penalty;
        this.amountPaid = paid;
        this.closedAt = at;
    }

    void mature() {
        requireStatus(FixedDepositStatus.ACTIVE);
        this.status = FixedDepositStatus.MATURED;
    }

    void rollOver(UUID successorId, Instant at) {
        requireStatus(FixedDepositStatus.ACTIVE);
        this.status = FixedDepositStatus.ROLLED_OVER;
        this.rolledOverToId = successorId;
        this.closedAt = at;
    }

    void payOut(BigDecimal paid, Instant at) {
        requireStatus(FixedDepositStatus.MATURED);
        this.status = FixedDepositStatus.PAID_OUT;
        this.amountPaid = paid;
        this.closedAt = at;
    }

    private void requireStatus(FixedDepositStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                "Fixed deposit " + certificateNumber + " is " + status + ", expected " + expected);
        }
    }
}
