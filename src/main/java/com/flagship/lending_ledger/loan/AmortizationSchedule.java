package com.flagship.lending_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class AmortizationSchedule {
    AmortizationMethod method;
    BigDecimal principal;
    BigDecimal annualRate;
    int tenureMonths;
    /** Regular installment; the last one may differ by the rounding remainder. */
    BigDecimal installmentAmount;
    BigDecimal totalInterest;
    BigDecimal totalRepayment;
    List<Installment> installments;

    public Installment getLastInstallment() {
        return installments.get(installments.size() - 1);
    }
}
