package com.flagship.lending_ledger.period;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * A calendar month of the ledger and its close status.
 *
 * A month with no stored row is OPEN.
 */
@Value
public class FinancialPeriod {
    int year;
    int month;
    LocalDate startDate;
    LocalDate endDate;
    PeriodStatus status;
    String closedBy;
    Instant closedAt;
    String closingNotes;

    public static FinancialPeriod open(YearMonth yearMonth) {
        return new FinancialPeriod(
            yearMonth.getYear(),
            yearMonth.getMonthValue(),
            yearMonth.atDay(1),
            yearMonth.atEndOfMonth(),
            PeriodStatus.OPEN,
            null,
            null,
            null
        );
    }

    public YearMonth getYearMonth() {
        return YearMonth.of(year, month);
    }

    /**
     * Moves this period forward to the given close status.
     *
     * @throws IllegalStateException if the transition is not forward
     */
    public FinancialPeriod close(PeriodStatus target, String actorId, Instant at, String notes) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move period %d-%02d from %s to %s", year, month, status, target));
        }
        return new FinancialPeriod(year, month, startDate, endDate, target, actorId, at, notes);
    }
}
