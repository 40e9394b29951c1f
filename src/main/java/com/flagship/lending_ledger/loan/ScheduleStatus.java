package com.flagship.lending_ledger.loan;

/**
 * Installment state. Moves forward only: PENDING -> PARTIAL -> PAID, with
 * OVERDUE entered from PENDING or PARTIAL once the due date has passed unpaid.
 */
public enum ScheduleStatus {
    PENDING,
    PARTIAL,
    OVERDUE,
    PAID;

    public boolean isOpen() {
        return this != PAID;
    }

    public boolean canTransitionTo(ScheduleStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> true;
            case PARTIAL -> target == OVERDUE || target == PAID;
            case OVERDUE -> target == PAID;
            case PAID -> false;
        };
    }
}
