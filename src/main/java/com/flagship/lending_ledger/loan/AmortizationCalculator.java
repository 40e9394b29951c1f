package com.flagship.lending_ledger.loan;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes installment schedules. Pure, no I/O.
 *
 * Key principles:
 * - Intermediate values use {@link MathContext#DECIMAL128}, never floating point
 * - Every monetary output is rounded half-up to 2 decimal places
 * - The last installment repays exactly the remaining principal, so the
 *   principal column sums to the loan principal and the final balance is zero
 */
public final class AmortizationCalculator {

    public static final int MAX_TENURE_MONTHS = 360;

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final int MONEY_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private AmortizationCalculator() {
    }

    /**
     * @param principal       amount lent, positive
     * @param annualRate      yearly rate in percent, e.g. 24 for 24%; zero allowed
     * @param tenureMonths    number of monthly installments, 1 to {@value #MAX_TENURE_MONTHS}
     * @param startDate       the first installment falls due one month after this date
     * @throws IllegalArgumentException on out-of-range input
     */
    public static AmortizationSchedule calculate(BigDecimal principal, BigDecimal annualRate, int tenureMonths,
                                                 LocalDate startDate, AmortizationMethod method) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(annualRate, "annualRate");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(method, "method");
        if (principal.signum() <= 0) {
            throw new IllegalArgumentException("Principal must be positive: " + principal);
        }
        if (annualRate.signum() < 0) {
            throw new IllegalArgumentException("Interest rate must not be negative: " + annualRate);
        }
        if (tenureMonths < 1 || tenureMonths > MAX_TENURE_MONTHS) {
            throw new IllegalArgumentException("Tenure must be between 1 and " + MAX_TENURE_MONTHS + " months: " + tenureMonths);
        }

        BigDecimal amount = money(principal);
        List<Installment> installments = method == AmortizationMethod.REDUCING_BALANCE
            ? reducingBalance(amount, annualRate, tenureMonths, startDate)
            : flatRate(amount, annualRate, tenureMonths, startDate);

        BigDecimal totalInterest = installments.stream()
            .map(Installment::getInterestDue)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new AmortizationSchedule(method, amount, annualRate, tenureMonths,
            installments.get(0).getTotalDue(), totalInterest, amount.add(totalInterest), List.copyOf(installments));
    }

    /**
     * EMI = P·r·(1+r)^n / ((1+r)^n − 1), rounded to cents; P/n when the rate is zero.
     */
    public static BigDecimal monthlyInstallment(BigDecimal principal, BigDecimal annualRate, int tenureMonths) {
        BigDecimal r = monthlyRate(annualRate);
        if (r.signum() == 0) {
            return money(principal.divide(BigDecimal.valueOf(tenureMonths), MC));
        }
        BigDecimal growth = BigDecimal.ONE.add(r, MC).pow(tenureMonths, MC);
        BigDecimal emi = principal.multiply(r, MC).multiply(growth, MC)
            .divide(growth.subtract(BigDecimal.ONE, MC), MC);
        return money(emi);
    }

    static BigDecimal monthlyRate(BigDecimal annualRate) {
        return annualRate.divide(HUNDRED, MC).divide(MONTHS_PER_YEAR, MC);
    }

    private static List<Installment> reducingBalance(BigDecimal principal, BigDecimal annualRate,
                                                     int tenureMonths, LocalDate startDate) {
        BigDecimal r = monthlyRate(annualRate);
        BigDecimal emi = monthlyInstallment(principal, annualRate, tenureMonths);

        List<Installment> installments = new ArrayList<>(tenureMonths);
        BigDecimal balance = principal;
        for (int i = 1; i <= tenureMonths; i++) {
            BigDecimal interest = money(balance.multiply(r, MC));
            BigDecimal principalDue;
            if (i == tenureMonths) {
                principalDue = balance;
            } else {
                principalDue = emi.subtract(interest).min(balance).max(BigDecimal.ZERO.setScale(MONEY_SCALE));
            }
            balance = balance.subtract(principalDue);
            installments.add(new Installment(i, startDate.plusMonths(i), principalDue, interest,
                principalDue.add(interest), balance));
        }
        return installments;
    }

    /**
     * Total interest = P·(rate/100)·(n/12), split evenly; the last installment
     * absorbs the rounding remainder of both principal and interest. Regular
     * shares are truncated so that remainder is never negative.
     */
    private static List<Installment> flatRate(BigDecimal principal, BigDecimal annualRate,
                                              int tenureMonths, LocalDate startDate) {
        BigDecimal months = BigDecimal.valueOf(tenureMonths);
        BigDecimal totalInterest = money(principal.multiply(annualRate, MC).divide(HUNDRED, MC)
            .multiply(months, MC).divide(MONTHS_PER_YEAR, MC));
        BigDecimal principalPer = principal.divide(months, MC).setScale(MONEY_SCALE, RoundingMode.DOWN);
        BigDecimal interestPer = totalInterest.divide(months, MC).setScale(MONEY_SCALE, RoundingMode.DOWN);
        BigDecimal regularCount = BigDecimal.valueOf(tenureMonths - 1L);

        List<Installment> installments = new ArrayList<>(tenureMonths);
        BigDecimal balance = principal;
        for (int i = 1; i <= tenureMonths; i++) {
            BigDecimal principalDue = principalPer;
            BigDecimal interestDue = interestPer;
            if (i == tenureMonths) {
                principalDue = principal.subtract(principalPer.multiply(regularCount));
                interestDue = totalInterest.subtract(interestPer.multiply(regularCount));
            }
            balance = balance.subtract(principalDue);
            installments.add(new Installment(i, startDate.plusMonths(i), principalDue, interestDue,
                principalDue.add(interestDue), balance));
        }
        return installments;
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
