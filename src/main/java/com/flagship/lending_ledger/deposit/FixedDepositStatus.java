package com.flagship.lending_ledger.deposit;

public enum FixedDepositStatus {
    ACTIVE,
    /** Reached maturity with a pay-out instruction; waiting for {@code payOut}. */
    MATURED,
    PAID_OUT,
    ROLLED_OVER,
    PREMATURE_CLOSED
}
