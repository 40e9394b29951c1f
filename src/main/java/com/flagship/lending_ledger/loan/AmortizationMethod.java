package com.flagship.lending_ledger.loan;

/**
 * How installment interest is computed over the life of a loan.
 */
public enum AmortizationMethod {
    /** Interest on the outstanding balance each month, equal installments (EMI). */
    REDUCING_BALANCE,
    /** Interest on the original principal for the whole tenure, spread evenly. */
    FLAT_RATE
}
