package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The share of one payment applied to one installment, and the status it leaves behind.
 */
@Value
public class InstallmentAllocation {
    UUID scheduleId;
    int installmentNumber;
    BigDecimal interestApplied;
    BigDecimal principalApplied;
    ScheduleStatus resultingStatus;

    public BigDecimal getTotalApplied() {
        return interestApplied.add(principalApplied);
    }
}
