package com.flagship.lending_ledger.deposit;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class FixedDepositApplication {
    String customerId;
    BigDecimal principal;
    /** Yearly rate in percent. */
    BigDecimal annualRate;
    int tenureDays;
    @Builder.Default
    MaturityInstruction maturityInstruction = MaturityInstruction.PAY_OUT;
    /** Defaults to the business date. */
    LocalDate startDate;
}
