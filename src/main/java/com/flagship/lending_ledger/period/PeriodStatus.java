package com.flagship.lending_ledger.period;

/**
 * Status of a financial period. Transitions only move forward:
 * OPEN -> SOFT_CLOSE -> HARD_CLOSE (OPEN -> HARD_CLOSE directly is allowed).
 *
 * SOFT_CLOSE still accepts adjusting postings; HARD_CLOSE accepts nothing.
 */
public enum PeriodStatus {
    OPEN,
    SOFT_CLOSE,
    HARD_CLOSE;

    public boolean canTransitionTo(PeriodStatus target) {
        return target.ordinal() > this.ordinal();
    }

    public boolean acceptsPostings() {
        return this != HARD_CLOSE;
    }
}
