package com.flagship.lending_ledger.deposit;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class FixedDeposit {
    UUID id;
    String certificateNumber;
    String customerId;
    BigDecimal principalAmount;
    BigDecimal interestRate;
    int tenureDays;
    BigDecimal interestAmount;
    BigDecimal maturityAmount;
    BigDecimal accruedInterest;
    LocalDate startDate;
    LocalDate maturityDate;
    LocalDate lastAccrualDate;
    MaturityInstruction maturityInstruction;
    FixedDepositStatus status;
    UUID rolledOverToId;
    BigDecimal penaltyAmount;
    BigDecimal amountPaid;
    Instant closedAt;
}
