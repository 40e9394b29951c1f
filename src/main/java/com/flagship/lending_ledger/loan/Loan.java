package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read model of a loan.
 */
@Value
public class Loan {
    UUID id;
    String loanNumber;
    String customerId;
    BigDecimal principalAmount;
    BigDecimal interestRate;
    int tenureMonths;
    AmortizationMethod amortizationMethod;
    BigDecimal processingFee;
    BigDecimal totalInterest;
    BigDecimal totalRepayment;
    BigDecimal installmentAmount;
    LoanStatus status;
    LocalDate startDate;
    LocalDate maturityDate;
    UUID disbursementEntryId;
    Instant disbursedAt;
    Instant closedAt;
}
