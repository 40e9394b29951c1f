package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One computed installment. {@code outstandingBalance} is the principal still
 * owed after this installment's principal is repaid.
 */
@Value
public class Installment {
    int installmentNumber;
    LocalDate dueDate;
    BigDecimal principalDue;
    BigDecimal interestDue;
    BigDecimal totalDue;
    BigDecimal outstandingBalance;
}
