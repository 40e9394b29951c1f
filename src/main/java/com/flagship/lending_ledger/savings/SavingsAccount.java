package com.flagship.lending_ledger.savings;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class SavingsAccount {
    UUID id;
    String accountNumber;
    String customerId;
    BigDecimal currentBalance;
    BigDecimal minimumBalance;
    /** Yearly rate in percent; zero for a non-interest-bearing account. */
    BigDecimal interestRate;
    SavingsAccountStatus status;
    LocalDate openedOn;
    LocalDate lastInterestDate;
    Instant lastTransactionAt;

    /**
     * What can be withdrawn without going below the minimum balance.
     */
    public BigDecimal getAvailableBalance() {
        return currentBalance.subtract(minimumBalance).max(BigDecimal.ZERO);
    }
}
