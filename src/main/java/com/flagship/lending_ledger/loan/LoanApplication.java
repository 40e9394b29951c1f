package com.flagship.lending_ledger.loan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class LoanApplication {
    String customerId;
    BigDecimal principal;
    /** Yearly rate in percent. */
    BigDecimal annualRate;
    int tenureMonths;
    @Builder.Default
    AmortizationMethod method = AmortizationMethod.REDUCING_BALANCE;
    @Builder.Default
    BigDecimal processingFee = BigDecimal.ZERO;
    /** Defaults to the business date. */
    LocalDate startDate;
}
