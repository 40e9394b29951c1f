package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Allocator's view of an installment: what was due and what has been paid so far.
 */
@Value
public class OutstandingInstallment {
    UUID scheduleId;
    int installmentNumber;
    LocalDate dueDate;
    BigDecimal principalDue;
    BigDecimal interestDue;
    BigDecimal principalPaid;
    BigDecimal interestPaid;
    ScheduleStatus status;

    public BigDecimal getInterestOutstanding() {
        return interestDue.subtract(interestPaid);
    }

    public BigDecimal getPrincipalOutstanding() {
        return principalDue.subtract(principalPaid);
    }

    public BigDecimal getTotalOutstanding() {
        return getInterestOutstanding().add(getPrincipalOutstanding());
    }
}
