package com.flagship.lending_ledger.savings;

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
 * JPA mapping of a customer savings account. The balance moves only through
 * {@link #credit} and {@link #debit}, each paired with a ledger posting.
 * Interest is credited at most once per calendar month.
 */
@Entity
@Table(name = "savings_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SavingsAccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_number", nullable = false, updatable = false, unique = true, length = 30)
    private String accountNumber;

    @Column(name = "customer_id", nullable = false, updatable = false, length = 64)
    private String customerId;

    @Column(name = "current_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal currentBalance;

    @Column(name = "minimum_balance", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal minimumBalance;

    @Column(name = "interest_rate", nullable = false, updatable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SavingsAccountStatus status;

    @Column(name = "opened_on", nullable = false, updatable = false)
    private LocalDate openedOn;

    @Column(name = "last_interest_date")
    private LocalDate lastInterestDate;

    @Column(name = "last_transaction_at")
    private Instant lastTransactionAt;

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

    static SavingsAccountEntity open(String accountNumber, String customerId, BigDecimal minimumBalance,
                                     BigDecimal interestRate, LocalDate openedOn) {
        SavingsAccountEntity entity = new SavingsAccountEntity();
        entity.id = UUID.randomUUID();
        entity.accountNumber = accountNumber;
        entity.customerId = customerId;
        entity.currentBalance = BigDecimal.ZERO;
        entity.minimumBalance = minimumBalance;
        entity.interestRate = interestRate;
        entity.status = SavingsAccountStatus.ACTIVE;
        entity.openedOn = openedOn;
        return entity;
    }

    public SavingsAccount toDomain() {
        return new SavingsAccount(id, accountNumber, customerId, currentBalance, minimumBalance, interestRate, status,
            openedOn, lastInterestDate, lastTransactionAt);
    }

    void credit(BigDecimal amount, Instant at) {
        this.currentBalance = currentBalance.add(amount);
        this.lastTransactionAt = at;
    }

    /**
     * True when no interest has been credited for any month from {@code monthStart} on.
     */
    boolean isDueForInterest(LocalDate monthStart) {
        return interestRate.signum() > 0 && openedOn.isBefore(monthStart)
            && (lastInterestDate == null || lastInterestDate.isBefore(monthStart));
    }

    void markInterestCredited(LocalDate processDate) {
        this.lastInterestDate = processDate;
    }

    void debit(BigDecimal amount, Instant at) {
        BigDecimal after = currentBalance.subtract(amount);
        if (after.compareTo(minimumBalance) < 0) {
            throw new IllegalStateException("Debit of " + amount + " would take account " + accountNumber
                + " below its minimum balance");
        }
        this.currentBalance = after;
        this.lastTransactionAt = at;
    }
}
