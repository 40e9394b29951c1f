package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class RepaymentReceipt {
    UUID repaymentId;
    String receiptNumber;
    UUID loanId;
    LocalDate paymentDate;
    BigDecimal amount;
    BigDecimal principalPortion;
    BigDecimal interestPortion;
    UUID journalEntryId;
    String journalEntryNumber;
    LoanStatus loanStatus;
    RepaymentAllocation allocation;
}
