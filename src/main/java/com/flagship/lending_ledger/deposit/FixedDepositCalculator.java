package com.flagship.lending_ledger.deposit;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Simple-interest arithmetic for fixed deposits: P·(R/100)·days/365,
 * rounded half-up to cents. Pure, no I/O.
 */
public final class FixedDepositCalculator {

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

    private FixedDepositCalculator() {
    }

    public static BigDecimal interest(BigDecimal principal, BigDecimal annualRate, long days) {
        if (days <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return principal.multiply(annualRate, MC)
            .divide(HUNDRED, MC)
            .multiply(BigDecimal.valueOf(days), MC)
            .divide(DAYS_PER_YEAR, MC)
            .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Interest earned from {@code startDate} up to {@code asOf}, capped at the tenure.
     * Accrual posts the difference between this and what is already accrued, so
     * repeated or late runs converge on the same total.
     */
    public static BigDecimal accruedTarget(BigDecimal principal, BigDecimal annualRate, LocalDate startDate,
                                           int tenureDays, LocalDate asOf) {
        long elapsed = Math.min(daysBetween(startDate, asOf), tenureDays);
        return interest(principal, annualRate, elapsed);
    }

    public static BigDecimal penalty(BigDecimal principal, BigDecimal penaltyRatePercent) {
        return principal.multiply(penaltyRatePercent, MC).divide(HUNDRED, MC).setScale(2, RoundingMode.HALF_UP);
    }

    public static long daysBetween(LocalDate from, LocalDate to) {
        return Math.max(0, ChronoUnit.DAYS.between(from, to));
    }
}
