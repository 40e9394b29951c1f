package com.flagship.lending_ledger.loan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class RepaymentRequest {
    UUID loanId;
    BigDecimal amount;
    /** Defaults to the business date. */
    LocalDate paymentDate;
    /** Caller's reference for the payment; a second repayment with the same one is rejected. */
    String paymentReference;
}
