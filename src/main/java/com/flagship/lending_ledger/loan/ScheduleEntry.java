package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read model of one persisted installment.
 */
@Value
public class ScheduleEntry {
    UUID id;
    UUID loanId;
    int installmentNumber;
    LocalDate dueDate;
    BigDecimal principalDue;
    BigDecimal interestDue;
    BigDecimal totalDue;
    BigDecimal outstandingBalance;
    BigDecimal principalPaid;
    BigDecimal interestPaid;
    ScheduleStatus status;
    LocalDate paidDate;
}
